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
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import me.golemcore.argon.infrastructure.persistence.StringListConverter;

import java.util.ArrayList;
import java.util.List;

/**
 * Relationship between two entities of a session, tracked as trust, affection
 * and rivalry scores. One row per ordered entity pair.
 */
@Entity
@Table(name = "session_relationships", uniqueConstraints = @UniqueConstraint(name = "uq_session_relationship_pair", columnNames = {
        "chat_session_id", "entity1_id", "entity1_type", "entity2_id", "entity2_type" }))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRelationship {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_session_id", nullable = false, length = 36)
    private String chatSessionId;

    @Column(name = "entity1_id", nullable = false, length = 100)
    private String entity1Id;

    @Column(name = "entity1_type", nullable = false, length = 50)
    private String entity1Type;

    @Column(name = "entity2_id", nullable = false, length = 100)
    private String entity2Id;

    @Column(name = "entity2_type", nullable = false, length = 50)
    private String entity2Type;

    @Column(name = "trust_score")
    @Builder.Default
    private int trustScore = 0;

    @Column(name = "affection_score")
    @Builder.Default
    private int affectionScore = 0;

    @Column(name = "rivalry_score")
    @Builder.Default
    private int rivalryScore = 0;

    @Convert(converter = StringListConverter.class)
    @Column(name = "status_tags", length = 2000)
    @Builder.Default
    private List<String> statusTags = new ArrayList<>();
}
