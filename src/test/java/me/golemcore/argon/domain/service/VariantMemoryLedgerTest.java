package me.golemcore.argon.domain.service;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VariantMemoryLedgerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SESSION = "session-1";
    private static final String VARIANT = "variant-1";

    private TempMessageVariantRepository variantRepository;
    private TempVariantMemoryRepository memoryRepository;
    private TempVariantAnalysisRepository analysisRepository;
    private ChatMessageRepository messageRepository;
    private VectorIndexPort vectorIndex;
    private VariantMemoryLedger ledger;
    private TempMessageVariant variant;

    @BeforeEach
    void setUp() {
        variantRepository = mock(TempMessageVariantRepository.class);
        memoryRepository = mock(TempVariantMemoryRepository.class);
        analysisRepository = mock(TempVariantAnalysisRepository.class);
        messageRepository = mock(ChatMessageRepository.class);
        vectorIndex = mock(VectorIndexPort.class);
        ledger = new VariantMemoryLedger(variantRepository, memoryRepository, analysisRepository,
                messageRepository, vectorIndex, Clock.fixed(NOW, ZoneOffset.UTC));

        variant = TempMessageVariant.builder()
                .id(VARIANT)
                .originalMessageId("m1")
                .chatSessionId(SESSION)
                .variantIndex(1)
                .senderType(ChatMessage.SENDER_AI)
                .build();
        when(variantRepository.findById(VARIANT)).thenReturn(Optional.of(variant));
        when(variantRepository.save(any(TempMessageVariant.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(memoryRepository.save(any(TempVariantMemory.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(analysisRepository.save(any(TempVariantAnalysis.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    // ===== Variants =====

    @Test
    void shouldStoreOriginalAsVariantZeroOnFirstRegeneration() {
        when(messageRepository.findById("m1")).thenReturn(Optional.of(ChatMessage.builder()
                .id("m1")
                .chatSessionId(SESSION)
                .senderType(ChatMessage.SENDER_AI)
                .content("original")
                .timestamp(NOW)
                .build()));
        when(variantRepository.findMaxVariantIndex("m1")).thenReturn(-1);

        TempMessageVariant created = ledger.createVariant("m1", "regenerated", Map.of("model", "gpt-4o"));

        ArgumentCaptor<TempMessageVariant> saved = ArgumentCaptor.forClass(TempMessageVariant.class);
        verify(variantRepository, times(2)).save(saved.capture());
        assertEquals(0, saved.getAllValues().get(0).getVariantIndex());
        assertEquals("original", saved.getAllValues().get(0).getContent());
        assertEquals(1, created.getVariantIndex());
        assertEquals("regenerated", created.getContent());
        assertEquals(SESSION, created.getChatSessionId());
        assertEquals("gpt-4o", created.getMetadata().get("model"));
    }

    @Test
    void shouldAppendAfterHighestExistingIndex() {
        when(messageRepository.findById("m1")).thenReturn(Optional.of(ChatMessage.builder()
                .id("m1").chatSessionId(SESSION).senderType(ChatMessage.SENDER_AI).timestamp(NOW).build()));
        when(variantRepository.findMaxVariantIndex("m1")).thenReturn(3);

        TempMessageVariant created = ledger.createVariant("m1", "again", null);

        assertEquals(4, created.getVariantIndex());
        verify(variantRepository, times(1)).save(any());
    }

    @Test
    void shouldRejectVariantForUnknownMessage() {
        when(messageRepository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> ledger.createVariant("nope", "x", null));
    }

    // ===== Attachments =====

    @Test
    void shouldAttachMemoryToVariantOfSameSession() {
        TempVariantMemory memory = ledger.attachMemory(VARIANT, SESSION, "vec-1", "The gate", Map.of("kind", "lore"));

        assertSame(variant, memory.getVariant());
        assertEquals("vec-1", memory.getVectorRef());
        assertEquals(NOW, memory.getCreatedAt());
    }

    @Test
    void shouldRejectAttachmentAcrossSessions() {
        assertThrows(InvalidArgumentException.class,
                () -> ledger.attachMemory(VARIANT, "other", "vec-1", "x", Map.of()));
        verify(memoryRepository, never()).save(any());
    }

    @Test
    void shouldRejectAttachmentToUnknownVariant() {
        when(variantRepository.findById("gone")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> ledger.attachAnalysis("gone", SESSION, Map.of(), "u", "a", List.of()));
    }

    @Test
    void shouldReplaceExistingAnalysisInPlace() {
        TempVariantAnalysis existing = TempVariantAnalysis.builder()
                .id("an-1")
                .variant(variant)
                .chatSessionId(SESSION)
                .userMessageContent("old")
                .build();
        when(analysisRepository.findByVariant_Id(VARIANT)).thenReturn(Optional.of(existing));

        TempVariantAnalysis updated = ledger.attachAnalysis(VARIANT, SESSION, Map.of("mood", "calm"), "hi",
                "hello", List.of(Map.of("ref", "vec-1")));

        assertSame(existing, updated);
        assertEquals("an-1", updated.getId());
        assertEquals("hi", updated.getUserMessageContent());
        assertEquals("calm", updated.getAnalysisData().get("mood"));
        assertEquals(1, updated.getRagResults().size());
    }

    // ===== Grounding =====

    @Test
    void shouldAttachEveryIndexHitWithItsScore() {
        when(vectorIndex.isAvailable()).thenReturn(true);
        when(vectorIndex.search(SESSION, "gate", 2)).thenReturn(CompletableFuture.completedFuture(List.of(
                new RetrievedEntry("vec-1", "The gate is sealed", Map.of("source", "lore"), 0.91),
                new RetrievedEntry("vec-2", "Mira guards it", null, 0.75))));

        List<TempVariantMemory> attached = ledger.groundFromIndex(VARIANT, SESSION, "gate", 2);

        assertEquals(2, attached.size());
        assertEquals(0.91, attached.get(0).getMetadata().get("score"));
        assertEquals("lore", attached.get(0).getMetadata().get("source"));
        assertEquals("vec-2", attached.get(1).getVectorRef());
    }

    @Test
    void shouldSkipGroundingWhenIndexUnavailable() {
        when(vectorIndex.isAvailable()).thenReturn(false);

        assertTrue(ledger.groundFromIndex(VARIANT, SESSION, "gate", 5).isEmpty());
        verify(vectorIndex, never()).search(anyString(), anyString(), anyInt());
    }

    // ===== Discard =====

    @Test
    void shouldDeleteChildrenBeforeVariant() {
        when(variantRepository.existsById(VARIANT)).thenReturn(true);
        when(memoryRepository.deleteAllForVariant(VARIANT)).thenReturn(3);
        when(analysisRepository.deleteAllForVariant(VARIANT)).thenReturn(1);

        assertTrue(ledger.discard(VARIANT));

        InOrder order = inOrder(memoryRepository, analysisRepository, variantRepository);
        order.verify(memoryRepository).deleteAllForVariant(VARIANT);
        order.verify(analysisRepository).deleteAllForVariant(VARIANT);
        order.verify(variantRepository).deleteById(VARIANT);
    }

    @Test
    void shouldTreatSecondDiscardAsNoOp() {
        when(variantRepository.existsById(VARIANT)).thenReturn(false);

        assertFalse(ledger.discard(VARIANT));
        verify(memoryRepository, never()).deleteAllForVariant(anyString());
        verify(variantRepository, never()).deleteById(anyString());
    }

    @Test
    void shouldDiscardAllVariantsOfSession() {
        TempMessageVariant other = TempMessageVariant.builder().id("variant-2").chatSessionId(SESSION).build();
        when(variantRepository.findByChatSessionId(SESSION)).thenReturn(List.of(variant, other));
        when(variantRepository.existsById(anyString())).thenReturn(true);

        assertEquals(2, ledger.discardForSession(SESSION));
        verify(variantRepository).deleteById("variant-2");
    }
}
