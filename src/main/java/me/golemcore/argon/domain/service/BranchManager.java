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
import me.golemcore.argon.domain.exception.IntegrityViolationException;
import me.golemcore.argon.domain.exception.NotFoundException;
import me.golemcore.argon.domain.model.ChatMessage;
import me.golemcore.argon.domain.model.ChatSession;
import me.golemcore.argon.domain.model.FullAnalysisResult;
import me.golemcore.argon.infrastructure.config.ArgonProperties;
import me.golemcore.argon.port.outbound.persistence.ChatMessageRepository;
import me.golemcore.argon.port.outbound.persistence.ChatSessionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Creates a new session from a historical message: the new session holds a
 * copy of every message up to and including the branch point and the derived
 * state recorded by the branch point's analysis snapshot.
 *
 * <p>
 * The whole operation is one transaction. When any step fails, the new session
 * and every row written for it are rolled back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BranchManager {

    private final ChatSessionRepository sessionRepository;
    private final ChatMessageRepository messageRepository;
    private final AnalysisSnapshotService snapshotService;
    private final SessionStateService sessionStateService;
    private final ArgonProperties properties;
    private final Clock clock;

    /**
     * Branches the conversation at the given message.
     *
     * @return identifier of the new session
     * @throws NotFoundException
     *             if the message does not exist, or it has no analysis snapshot
     * @throws IntegrityViolationException
     *             if the message's owning session is missing
     */
    @Transactional
    public String createBranch(String messageId) {
        ChatMessage branchPoint = messageRepository.findById(messageId)
                .orElseThrow(() -> new NotFoundException("message", messageId));

        ChatSession original = sessionRepository.findById(branchPoint.getChatSessionId())
                .orElseThrow(() -> {
                    log.error("[Branch] Message {} references missing session {}", messageId,
                            branchPoint.getChatSessionId());
                    return new IntegrityViolationException("Session " + branchPoint.getChatSessionId()
                            + " of message " + messageId + " does not exist");
                });

        Instant now = Instant.now(clock);
        ChatSession branch = sessionRepository.save(ChatSession.builder()
                .title(branchTitle(original.getTitle()))
                .cardType(original.getCardType())
                .cardId(original.getCardId())
                .userPersonaId(original.getUserPersonaId())
                .worldId(original.getWorldId())
                .parentSessionId(original.getId())
                .branchedFromMessageId(messageId)
                .createdAt(now)
                .lastActiveAt(now)
                .build());
        String branchId = branch.getId();

        List<ChatMessage> prefix = messageRepository.findByChatSessionIdAndTimestampLessThanEqualOrderByTimestampAsc(
                original.getId(), branchPoint.getTimestamp());
        messageRepository.saveAll(prefix.stream()
                .map(message -> message.copyForSession(branchId))
                .toList());

        FullAnalysisResult snapshot = snapshotService.findForMessage(messageId)
                .orElseThrow(() -> new NotFoundException("analysis snapshot for message", messageId));
        sessionStateService.replaceState(branchId, snapshotService.readPayload(snapshot));

        log.info("[Branch] Created session {} from message {} of session {} ({} messages copied)", branchId,
                messageId, original.getId(), prefix.size());
        return branchId;
    }

    private String branchTitle(String originalTitle) {
        ArgonProperties.BranchProperties branch = properties.getBranch();
        String base = originalTitle != null && !originalTitle.isBlank() ? originalTitle : branch.getDefaultTitle();
        return base + branch.getTitleSuffix();
    }
}
