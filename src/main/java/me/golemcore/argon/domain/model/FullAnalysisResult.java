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
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Snapshot of a session's derived state as of the message that triggered a
 * full analysis. Written once, never updated. The payload is a
 * {@link SessionStateSnapshot} serialized as JSON.
 */
@Entity
@Immutable
@Table(name = "full_analysis_results", uniqueConstraints = @UniqueConstraint(name = "uq_analysis_source_message", columnNames = "source_message_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FullAnalysisResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_session_id", nullable = false, length = 36)
    private String chatSessionId;

    @Column(name = "source_message_id", nullable = false, length = 36)
    private String sourceMessageId;

    @Column(name = "analysis_data", nullable = false, length = 1_000_000)
    private String analysisData;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
