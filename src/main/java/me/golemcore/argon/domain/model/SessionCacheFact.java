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
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import me.golemcore.argon.infrastructure.persistence.StringListConverter;

import java.util.ArrayList;
import java.util.List;

/**
 * A fact extracted from a session and cached for prompt grounding.
 */
@Entity
@Table(name = "session_cache_facts")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCacheFact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_session_id", nullable = false, length = 36)
    private String chatSessionId;

    @Column(name = "fact_text", length = 10_000)
    private String text;

    @Column(name = "fact_key", length = 300)
    private String key;

    @Column(name = "fact_value", length = 10_000)
    private String value;

    @Column(name = "relevance_score")
    private Double relevanceScore;

    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
