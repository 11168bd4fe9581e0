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
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import me.golemcore.argon.infrastructure.persistence.JsonMapConverter;
import me.golemcore.argon.infrastructure.persistence.JsonMapListConverter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The analysis run for one variant. At most one per variant; owned by it.
 */
@Entity
@Table(name = "temp_variant_analysis", uniqueConstraints = @UniqueConstraint(name = "uq_variant_analysis_variant", columnNames = "variant_id"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TempVariantAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "variant_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private TempMessageVariant variant;

    @Column(name = "chat_session_id", nullable = false, length = 36)
    private String chatSessionId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "analysis_data", length = 1_000_000)
    @Builder.Default
    private Map<String, Object> analysisData = new LinkedHashMap<>();

    @Column(name = "user_message_content", length = 65535)
    private String userMessageContent;

    @Column(name = "ai_response_content", length = 65535)
    private String aiResponseContent;

    @Convert(converter = JsonMapListConverter.class)
    @Column(name = "rag_results", length = 1_000_000)
    @Builder.Default
    private List<Map<String, Object>> ragResults = new ArrayList<>();

    @Column(name = "created_at")
    private Instant createdAt;
}
