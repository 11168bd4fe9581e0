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
import me.golemcore.argon.domain.exception.InvalidArgumentException;
import me.golemcore.argon.domain.exception.NotFoundException;
import me.golemcore.argon.domain.model.ChatMessage;
import me.golemcore.argon.domain.model.RetrievedEntry;
import me.golemcore.argon.domain.model.TempMessageVariant;
import me.golemcore.argon.domain.model.TempVariantAnalysis;
import me.golemcore.argon.domain.model.TempVariantMemory;
import me.golemcore.argon.port.outbound.VectorIndexPort;
import me.golemcore.argon.port.outbound.persistence.ChatMessageRepository;
import me.golemcore.argon.port.outbound.persistence.TempMessageVariantRepository;
import me.golemcore.argon.port.outbound.persistence.TempVariantAnalysisRepository;
import me.golemcore.argon.port.outbound.persistence.TempVariantMemoryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Lifecycle of regenerated response variants and the retrieval context and
 * analysis scoped to each of them.
 *
 * <p>
 * A variant exclusively owns its memory and analysis rows: discarding it
 * removes them in the same transaction, and the foreign keys cascade as well.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VariantMemoryLedger {

    private final TempMessageVariantRepository variantRepository;
    private final TempVariantMemoryRepository memoryRepository;
    private final TempVariantAnalysisRepository analysisRepository;
    private final ChatMessageRepository messageRepository;
    private final VectorIndexPort vectorIndex;
    private final Clock clock;

    /**
     * Adds a variant for a message. The first call for a message also stores the
     * original response as variant 0.
     *
     * @throws NotFoundException
     *             if the message does not exist
     */
    @Transactional
    public TempMessageVariant createVariant(String originalMessageId, String content, Map<String, Object> metadata) {
        ChatMessage original = messageRepository.findById(originalMessageId)
                .orElseThrow(() -> new NotFoundException("message", originalMessageId));

        int maxIndex = variantRepository.findMaxVariantIndex(originalMessageId);
        if (maxIndex < 0) {
            variantRepository.save(newVariant(original, 0, original.getContent(), original.getMetadata()));
            maxIndex = 0;
        }
        TempMessageVariant variant = variantRepository.save(newVariant(original, maxIndex + 1, content, metadata));
        log.debug("[VariantLedger] Created variant {} (index {}) for message {}", variant.getId(),
                variant.getVariantIndex(), originalMessageId);
        return variant;
    }

    @Transactional(readOnly = true)
    public List<TempMessageVariant> listVariants(String originalMessageId) {
        return variantRepository.findByOriginalMessageIdOrderByVariantIndexAsc(originalMessageId);
    }

    /**
     * Records retrieved content that grounded the variant.
     *
     * @throws NotFoundException
     *             if the variant does not exist
     * @throws InvalidArgumentException
     *             if the variant belongs to another session
     */
    @Transactional
    public TempVariantMemory attachMemory(String variantId, String sessionId, String vectorRef, String content,
            Map<String, Object> metadata) {
        TempMessageVariant variant = requireVariant(variantId, sessionId);
        return memoryRepository.save(TempVariantMemory.builder()
                .variant(variant)
                .chatSessionId(sessionId)
                .vectorRef(vectorRef)
                .content(content)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .createdAt(Instant.now(clock))
                .build());
    }

    /**
     * Records the analysis run for the variant. A variant has at most one
     * analysis; attaching again replaces its content.
     */
    @Transactional
    public TempVariantAnalysis attachAnalysis(String variantId, String sessionId, Map<String, Object> analysisPayload,
            String userMessage, String aiResponse, List<Map<String, Object>> ragResults) {
        TempMessageVariant variant = requireVariant(variantId, sessionId);
        TempVariantAnalysis analysis = analysisRepository.findByVariant_Id(variantId)
                .orElseGet(() -> TempVariantAnalysis.builder()
                        .variant(variant)
                        .chatSessionId(sessionId)
                        .build());
        analysis.setAnalysisData(analysisPayload != null ? new LinkedHashMap<>(analysisPayload)
                : new LinkedHashMap<>());
        analysis.setUserMessageContent(userMessage);
        analysis.setAiResponseContent(aiResponse);
        analysis.setRagResults(ragResults != null ? new ArrayList<>(ragResults) : new ArrayList<>());
        analysis.setCreatedAt(Instant.now(clock));
        return analysisRepository.save(analysis);
    }

    /**
     * Queries the vector index and attaches every hit to the variant as memory.
     */
    @Transactional
    public List<TempVariantMemory> groundFromIndex(String variantId, String sessionId, String query, int topK) {
        requireVariant(variantId, sessionId);
        if (!vectorIndex.isAvailable()) {
            log.debug("[VariantLedger] Vector index unavailable, variant {} stays ungrounded", variantId);
            return List.of();
        }
        List<RetrievedEntry> hits;
        try {
            hits = vectorIndex.search(sessionId, query, topK).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Vector index search failed for variant " + variantId,
                    e.getCause() != null ? e.getCause() : e);
        }
        List<TempVariantMemory> attached = new ArrayList<>();
        for (RetrievedEntry hit : hits) {
            Map<String, Object> metadata = new LinkedHashMap<>(hit.metadata());
            metadata.put("score", hit.score());
            attached.add(attachMemory(variantId, sessionId, hit.vectorRef(), hit.content(), metadata));
        }
        log.debug("[VariantLedger] Grounded variant {} with {} entries", variantId, attached.size());
        return attached;
    }

    @Transactional(readOnly = true)
    public List<TempVariantMemory> memories(String variantId) {
        return memoryRepository.findByVariant_IdOrderByCreatedAtAsc(variantId);
    }

    @Transactional(readOnly = true)
    public Optional<TempVariantAnalysis> analysis(String variantId) {
        return analysisRepository.findByVariant_Id(variantId);
    }

    /**
     * Deletes the variant together with its memory and analysis rows. Unknown
     * ids are a no-op.
     *
     * @return {@code true} if a variant was deleted
     */
    @Transactional
    public boolean discard(String variantId) {
        if (!variantRepository.existsById(variantId)) {
            log.debug("[VariantLedger] Variant {} already gone", variantId);
            return false;
        }
        int memories = memoryRepository.deleteAllForVariant(variantId);
        int analyses = analysisRepository.deleteAllForVariant(variantId);
        variantRepository.deleteById(variantId);
        log.info("[VariantLedger] Discarded variant {} ({} memories, {} analyses)", variantId, memories, analyses);
        return true;
    }

    /**
     * Discards every variant of a session, e.g. once the user sends a new
     * message and the candidates are settled.
     *
     * @return number of variants discarded
     */
    @Transactional
    public int discardForSession(String sessionId) {
        int discarded = 0;
        for (TempMessageVariant variant : variantRepository.findByChatSessionId(sessionId)) {
            if (discard(variant.getId())) {
                discarded++;
            }
        }
        if (discarded > 0) {
            log.info("[VariantLedger] Discarded {} variants of session {}", discarded, sessionId);
        }
        return discarded;
    }

    private TempMessageVariant requireVariant(String variantId, String sessionId) {
        TempMessageVariant variant = variantRepository.findById(variantId)
                .orElseThrow(() -> new NotFoundException("variant", variantId));
        if (!variant.getChatSessionId().equals(sessionId)) {
            throw new InvalidArgumentException("Variant " + variantId + " belongs to session "
                    + variant.getChatSessionId() + ", not " + sessionId);
        }
        return variant;
    }

    private TempMessageVariant newVariant(ChatMessage original, int index, String content,
            Map<String, Object> metadata) {
        return TempMessageVariant.builder()
                .originalMessageId(original.getId())
                .chatSessionId(original.getChatSessionId())
                .variantIndex(index)
                .content(content)
                .senderType(original.getSenderType())
                .activePersonaName(original.getActivePersonaName())
                .activePersonaImageUrl(original.getActivePersonaImageUrl())
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .createdAt(Instant.now(clock))
                .build();
    }
}
