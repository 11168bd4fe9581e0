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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.argon.domain.exception.ConflictOnCreateException;
import me.golemcore.argon.domain.exception.IntegrityViolationException;
import me.golemcore.argon.domain.exception.InvalidArgumentException;
import me.golemcore.argon.domain.exception.NotFoundException;
import me.golemcore.argon.domain.model.ChatMessage;
import me.golemcore.argon.domain.model.FullAnalysisResult;
import me.golemcore.argon.domain.model.SessionStateSnapshot;
import me.golemcore.argon.port.outbound.persistence.ChatMessageRepository;
import me.golemcore.argon.port.outbound.persistence.FullAnalysisResultRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Writes and reads full-analysis snapshots. A snapshot is keyed one-to-one by
 * the message that triggered it and is never changed once written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisSnapshotService {

    private final FullAnalysisResultRepository analysisRepository;
    private final ChatMessageRepository messageRepository;
    private final SessionStateService sessionStateService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Stores a snapshot for a message of the session.
     *
     * @throws NotFoundException
     *             if the message does not exist
     * @throws InvalidArgumentException
     *             if the message belongs to another session
     * @throws ConflictOnCreateException
     *             if the message already has a snapshot
     */
    @Transactional
    public FullAnalysisResult recordSnapshot(String sessionId, String sourceMessageId, SessionStateSnapshot payload) {
        ChatMessage message = messageRepository.findById(sourceMessageId)
                .orElseThrow(() -> new NotFoundException("message", sourceMessageId));
        if (!message.getChatSessionId().equals(sessionId)) {
            throw new InvalidArgumentException(
                    "Message " + sourceMessageId + " does not belong to session " + sessionId);
        }
        if (analysisRepository.existsBySourceMessageId(sourceMessageId)) {
            throw new ConflictOnCreateException("Message " + sourceMessageId + " already has an analysis snapshot");
        }

        FullAnalysisResult snapshot = FullAnalysisResult.builder()
                .chatSessionId(sessionId)
                .sourceMessageId(sourceMessageId)
                .analysisData(writePayload(payload != null ? payload : SessionStateSnapshot.empty()))
                .createdAt(Instant.now(clock))
                .build();
        try {
            FullAnalysisResult saved = analysisRepository.saveAndFlush(snapshot);
            log.info("[Branch] Recorded analysis snapshot {} for message {}", saved.getId(), sourceMessageId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new ConflictOnCreateException(
                    "Message " + sourceMessageId + " already has an analysis snapshot", e);
        }
    }

    /**
     * Snapshots the session's current derived state at the given message.
     */
    @Transactional
    public FullAnalysisResult captureSnapshot(String sessionId, String sourceMessageId) {
        return recordSnapshot(sessionId, sourceMessageId, sessionStateService.currentState(sessionId));
    }

    @Transactional(readOnly = true)
    public Optional<FullAnalysisResult> findForMessage(String messageId) {
        return analysisRepository.findBySourceMessageId(messageId);
    }

    /**
     * Parses the stored payload.
     *
     * @throws IntegrityViolationException
     *             if the stored JSON cannot be read
     */
    public SessionStateSnapshot readPayload(FullAnalysisResult snapshot) {
        String data = snapshot.getAnalysisData();
        if (data == null || data.isBlank()) {
            return SessionStateSnapshot.empty();
        }
        try {
            SessionStateSnapshot payload = objectMapper.readValue(data, SessionStateSnapshot.class);
            return payload != null ? payload.normalized() : SessionStateSnapshot.empty();
        } catch (JsonProcessingException e) {
            log.error("[Branch] Analysis snapshot {} has an unreadable payload", snapshot.getId());
            throw new IntegrityViolationException("Analysis snapshot " + snapshot.getId() + " is unreadable", e);
        }
    }

    private String writePayload(SessionStateSnapshot payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("Analysis payload cannot be serialized", e);
        }
    }
}
