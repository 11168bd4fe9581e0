package me.golemcore.argon.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.argon.domain.model.ActiveSessionEvent;
import me.golemcore.argon.domain.model.SessionCacheFact;
import me.golemcore.argon.domain.model.SessionLoreModification;
import me.golemcore.argon.domain.model.SessionRelationship;
import me.golemcore.argon.domain.model.SessionStateSnapshot;
import me.golemcore.argon.port.outbound.persistence.ActiveSessionEventRepository;
import me.golemcore.argon.port.outbound.persistence.SessionCacheFactRepository;
import me.golemcore.argon.port.outbound.persistence.SessionLoreModificationRepository;
import me.golemcore.argon.port.outbound.persistence.SessionRelationshipRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads and replaces the session-scoped derived state: cached facts,
 * relationships, lore modifications and active events.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionStateService {

    private final SessionCacheFactRepository factRepository;
    private final SessionRelationshipRepository relationshipRepository;
    private final SessionLoreModificationRepository loreRepository;
    private final ActiveSessionEventRepository eventRepository;

    /**
     * Makes the snapshot the session's entire derived state. Whatever the
     * session held before is deleted first; nothing is merged.
     */
    @Transactional
    public void replaceState(String sessionId, SessionStateSnapshot snapshot) {
        SessionStateSnapshot state = snapshot != null ? snapshot.normalized() : SessionStateSnapshot.empty();

        int removed = factRepository.deleteAllForSession(sessionId)
                + relationshipRepository.deleteAllForSession(sessionId)
                + loreRepository.deleteAllForSession(sessionId)
                + eventRepository.deleteAllForSession(sessionId);

        factRepository.saveAll(state.getCachedFacts().stream()
                .map(fact -> SessionCacheFact.builder()
                        .chatSessionId(sessionId)
                        .text(fact.getText())
                        .key(fact.getKey())
                        .value(fact.getValue())
                        .relevanceScore(fact.getRelevanceScore())
                        .tags(copy(fact.getTags()))
                        .build())
                .toList());
        relationshipRepository.saveAll(state.getRelationships().stream()
                .map(rel -> SessionRelationship.builder()
                        .chatSessionId(sessionId)
                        .entity1Id(rel.getEntity1Id())
                        .entity1Type(rel.getEntity1Type())
                        .entity2Id(rel.getEntity2Id())
                        .entity2Type(rel.getEntity2Type())
                        .trustScore(rel.getTrustScore())
                        .affectionScore(rel.getAffectionScore())
                        .rivalryScore(rel.getRivalryScore())
                        .statusTags(copy(rel.getStatusTags()))
                        .build())
                .toList());
        loreRepository.saveAll(state.getLoreModifications().stream()
                .map(mod -> SessionLoreModification.builder()
                        .chatSessionId(sessionId)
                        .baseLoreEntryId(mod.getBaseLoreEntryId())
                        .fieldToUpdate(mod.getFieldToUpdate())
                        .newContentSegment(mod.getNewContentSegment())
                        .changeReason(mod.getChangeReason())
                        .build())
                .toList());
        eventRepository.saveAll(state.getActiveEvents().stream()
                .map(event -> ActiveSessionEvent.builder()
                        .chatSessionId(sessionId)
                        .eventId(event.getEventId())
                        .currentPhaseId(event.getCurrentPhaseId())
                        .status(event.getStatus() != null ? event.getStatus() : ActiveSessionEvent.STATUS_ACTIVE)
                        .eventType(event.getEventType())
                        .dynamicEventData(event.getDynamicEventData() != null
                                ? new LinkedHashMap<>(event.getDynamicEventData())
                                : new LinkedHashMap<>())
                        .build())
                .toList());

        log.debug("[Branch] Replaced state of session {}: removed {}, inserted {} facts, {} relationships, "
                + "{} lore modifications, {} events", sessionId, removed, state.getCachedFacts().size(),
                state.getRelationships().size(), state.getLoreModifications().size(),
                state.getActiveEvents().size());
    }

    @Transactional(readOnly = true)
    public SessionStateSnapshot currentState(String sessionId) {
        return SessionStateSnapshot.builder()
                .cachedFacts(factRepository.findByChatSessionId(sessionId).stream()
                        .map(fact -> SessionStateSnapshot.CachedFact.builder()
                                .text(fact.getText())
                                .key(fact.getKey())
                                .value(fact.getValue())
                                .relevanceScore(fact.getRelevanceScore())
                                .tags(copy(fact.getTags()))
                                .build())
                        .toList())
                .relationships(relationshipRepository.findByChatSessionId(sessionId).stream()
                        .map(rel -> SessionStateSnapshot.Relationship.builder()
                                .entity1Id(rel.getEntity1Id())
                                .entity1Type(rel.getEntity1Type())
                                .entity2Id(rel.getEntity2Id())
                                .entity2Type(rel.getEntity2Type())
                                .trustScore(rel.getTrustScore())
                                .affectionScore(rel.getAffectionScore())
                                .rivalryScore(rel.getRivalryScore())
                                .statusTags(copy(rel.getStatusTags()))
                                .build())
                        .toList())
                .loreModifications(loreRepository.findByChatSessionId(sessionId).stream()
                        .map(mod -> SessionStateSnapshot.LoreModification.builder()
                                .baseLoreEntryId(mod.getBaseLoreEntryId())
                                .fieldToUpdate(mod.getFieldToUpdate())
                                .newContentSegment(mod.getNewContentSegment())
                                .changeReason(mod.getChangeReason())
                                .build())
                        .toList())
                .activeEvents(eventRepository.findByChatSessionId(sessionId).stream()
                        .map(event -> SessionStateSnapshot.ActiveEvent.builder()
                                .eventId(event.getEventId())
                                .currentPhaseId(event.getCurrentPhaseId())
                                .status(event.getStatus())
                                .eventType(event.getEventType())
                                .dynamicEventData(new LinkedHashMap<>(event.getDynamicEventData()))
                                .build())
                        .toList())
                .build();
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
