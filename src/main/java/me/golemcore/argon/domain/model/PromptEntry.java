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

/**
 * Rendered content of one module inside an assembled segment, tagged with the
 * role it should be sent as.
 */
public record PromptEntry(String moduleIdentifier, String role, String content, boolean forbidOverrides,
        int servicePriority) {

    public static final String INSTRUCTION_IDENTIFIER = "session_instruction";

    public static PromptEntry instruction(String role, String content) {
        return new PromptEntry(INSTRUCTION_IDENTIFIER, role, content, false, 0);
    }

    public boolean isBlank() {
        return content == null || content.isBlank();
    }
}
