package me.golemcore.argon.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered entries of one injection position. An empty segment is still a
 * segment: callers can always address all four positions.
 */
public record PromptSegment(InjectionPosition position, List<PromptEntry> entries) {

    static final String ENTRY_SEPARATOR = "\n\n";

    public PromptSegment {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static PromptSegment empty(InjectionPosition position) {
        return new PromptSegment(position, List.of());
    }

    public boolean isEmpty() {
        return entries.stream().allMatch(PromptEntry::isBlank);
    }

    /**
     * Non-blank entry contents joined by a blank line.
     */
    public String text() {
        return entries.stream()
                .filter(entry -> !entry.isBlank())
                .map(PromptEntry::content)
                .collect(Collectors.joining(ENTRY_SEPARATOR));
    }

    /**
     * Inserts caller text so that it never follows an entry that forbids
     * overrides: before the first such entry, or at the end when there is none.
     */
    public PromptSegment withInstruction(String role, String content) {
        int insertAt = entries.size();
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).forbidOverrides()) {
                insertAt = i;
                break;
            }
        }
        List<PromptEntry> updated = new ArrayList<>(entries);
        updated.add(insertAt, PromptEntry.instruction(role, content));
        return new PromptSegment(position, updated);
    }
}
