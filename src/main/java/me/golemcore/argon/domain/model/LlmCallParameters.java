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
import lombok.ToString;

import java.time.Duration;

/**
 * Complete, resolved parameter set for one call to one service. Sampling
 * fields that are {@code null} are left to the provider's own default.
 */
@Data
@Builder(toBuilder = true)
public class LlmCallParameters {

    private LlmServiceType service;
    private String provider;
    private String model;

    @ToString.Exclude
    private String apiKey;

    private String baseUrl;
    private Double temperature;
    private Double topP;
    private Integer topK;
    private Double topA;
    private Double minP;
    private Integer maxTokens;
    private Double frequencyPenalty;
    private Double presencePenalty;
    private Double repetitionPenalty;
    private String reasoningEffort;
    private Integer contextSize;
    private Duration timeout;
    private String systemPrompt;
}
