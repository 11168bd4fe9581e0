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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A role-tagged message sent to an LLM.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptMessage {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role;
    private String content;

    public static PromptMessage system(String content) {
        return new PromptMessage(ROLE_SYSTEM, content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage(ROLE_USER, content);
    }

    public static PromptMessage assistant(String content) {
        return new PromptMessage(ROLE_ASSISTANT, content);
    }
}
