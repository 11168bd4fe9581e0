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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of prompt assembly for one service: exactly one segment per injection
 * position, empty positions included.
 */
public record AssembledPrompt(LlmServiceType service, Map<InjectionPosition, PromptSegment> segments) {

    public AssembledPrompt {
        Map<InjectionPosition, PromptSegment> complete = new EnumMap<>(InjectionPosition.class);
        for (InjectionPosition position : InjectionPosition.values()) {
            PromptSegment segment = segments != null ? segments.get(position) : null;
            complete.put(position, segment != null ? segment : PromptSegment.empty(position));
        }
        segments = Collections.unmodifiableMap(complete);
    }

    public static AssembledPrompt empty(LlmServiceType service) {
        return new AssembledPrompt(service, Map.of());
    }

    public PromptSegment segment(InjectionPosition position) {
        return segments.get(position);
    }

    /**
     * Segments in {@link InjectionPosition} declaration order.
     */
    public List<PromptSegment> orderedSegments() {
        return Arrays.stream(InjectionPosition.values())
                .map(segments::get)
                .toList();
    }

    public boolean isEmpty() {
        return segments.values().stream().allMatch(PromptSegment::isEmpty);
    }

    /**
     * Returns a copy with session-specific text spliced into one position,
     * respecting {@code forbid_overrides}. Blank text leaves the prompt as is.
     */
    public AssembledPrompt spliceInstruction(InjectionPosition position, String role, String text) {
        if (text == null || text.isBlank()) {
            return this;
        }
        Map<InjectionPosition, PromptSegment> copy = new EnumMap<>(segments);
        copy.put(position, segments.get(position).withInstruction(role, text));
        return new AssembledPrompt(service, copy);
    }
}
