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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured payload of a full-analysis snapshot: the session-scoped derived
 * state (cached facts, relationships, lore modifications and active events) as
 * of one message. Serialized with snake_case keys; absent arrays read back as
 * empty, unknown keys are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionStateSnapshot {

    @Builder.Default
    private List<CachedFact> cachedFacts = new ArrayList<>();

    @Builder.Default
    private List<Relationship> relationships = new ArrayList<>();

    @Builder.Default
    private List<LoreModification> loreModifications = new ArrayList<>();

    @Builder.Default
    private List<ActiveEvent> activeEvents = new ArrayList<>();

    public static SessionStateSnapshot empty() {
        return new SessionStateSnapshot();
    }

    /**
     * Lists are never null, even when the JSON carried an explicit null.
     */
    public SessionStateSnapshot normalized() {
        if (cachedFacts == null) {
            cachedFacts = new ArrayList<>();
        }
        if (relationships == null) {
            relationships = new ArrayList<>();
        }
        if (loreModifications == null) {
            loreModifications = new ArrayList<>();
        }
        if (activeEvents == null) {
            activeEvents = new ArrayList<>();
        }
        return this;
    }

    public boolean isEmpty() {
        return cachedFacts.isEmpty() && relationships.isEmpty()
                && loreModifications.isEmpty() && activeEvents.isEmpty();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CachedFact {
        private String text;
        private String key;
        private String value;
        private Double relevanceScore;
        @Builder.Default
        private List<String> tags = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Relationship {
        private String entity1Id;
        private String entity1Type;
        private String entity2Id;
        private String entity2Type;
        private int trustScore;
        private int affectionScore;
        private int rivalryScore;
        @Builder.Default
        private List<String> statusTags = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LoreModification {
        private String baseLoreEntryId;
        private String fieldToUpdate;
        private String newContentSegment;
        private String changeReason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ActiveEvent {
        private String eventId;
        private String currentPhaseId;
        private String status;
        private String eventType;
        @Builder.Default
        private Map<String, Object> dynamicEventData = new LinkedHashMap<>();
    }
}
