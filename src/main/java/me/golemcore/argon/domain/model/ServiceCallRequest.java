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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a service call needs besides what is stored for the user.
 */
@Data
@Builder
public class ServiceCallRequest {

    private String userId;
    private LlmServiceType service;

    @Builder.Default
    private List<PromptMessage> conversation = new ArrayList<>();

    @Builder.Default
    private Map<String, String> variables = new HashMap<>();

    @Builder.Default
    private Map<String, Boolean> moduleOverrides = new HashMap<>();

    private ServiceOverrides parameterOverrides;

    /**
     * Optional text spliced into the system-suffix segment.
     */
    private String sessionInstruction;
}
