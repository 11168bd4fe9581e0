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

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A user's prompt configuration: the active preset (absent means the system
 * default preset) and default sampling parameters. One row per user, created
 * lazily on first read.
 */
@Entity
@Table(name = "user_prompt_configurations", uniqueConstraints = @UniqueConstraint(name = "uq_prompt_config_user", columnNames = "user_id"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPromptConfiguration {

    public static final double DEFAULT_TEMPERATURE = 1.0;
    public static final double DEFAULT_TOP_P = 1.0;
    public static final double DEFAULT_FREQUENCY_PENALTY = 0.0;
    public static final double DEFAULT_PRESENCE_PENALTY = 0.0;
    public static final double DEFAULT_REPETITION_PENALTY = 1.0;
    public static final String DEFAULT_REASONING_EFFORT = "Medium";
    public static final int DEFAULT_CONTEXT_SIZE = 20;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "active_preset_id", length = 36)
    private String activePresetId;

    private Double temperature;

    @Column(name = "top_p")
    private Double topP;

    @Column(name = "top_k")
    private Integer topK;

    @Column(name = "top_a")
    private Double topA;

    @Column(name = "min_p")
    private Double minP;

    @Column(name = "max_tokens")
    private Integer maxTokens;

    @Column(name = "frequency_penalty")
    private Double frequencyPenalty;

    @Column(name = "presence_penalty")
    private Double presencePenalty;

    @Column(name = "repetition_penalty")
    private Double repetitionPenalty;

    @Column(name = "reasoning_effort", length = 20)
    private String reasoningEffort;

    @Column(name = "context_size")
    private Integer contextSize;

    /**
     * Row with schema defaults for a user who has never saved a configuration.
     */
    public static UserPromptConfiguration defaults(String userId) {
        return UserPromptConfiguration.builder()
                .userId(userId)
                .temperature(DEFAULT_TEMPERATURE)
                .topP(DEFAULT_TOP_P)
                .frequencyPenalty(DEFAULT_FREQUENCY_PENALTY)
                .presencePenalty(DEFAULT_PRESENCE_PENALTY)
                .repetitionPenalty(DEFAULT_REPETITION_PENALTY)
                .reasoningEffort(DEFAULT_REASONING_EFFORT)
                .contextSize(DEFAULT_CONTEXT_SIZE)
                .build();
    }
}
