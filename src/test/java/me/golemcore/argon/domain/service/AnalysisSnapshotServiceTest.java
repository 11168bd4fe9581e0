package me.golemcore.argon.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.argon.domain.exception.ConflictOnCreateException;
import me.golemcore.argon.domain.exception.IntegrityViolationException;
import me.golemcore.argon.domain.exception.InvalidArgumentException;
import me.golemcore.argon.domain.exception.NotFoundException;
import me.golemcore.argon.domain.model.ChatMessage;
import me.golemcore.argon.domain.model.FullAnalysisResult;
import me.golemcore.argon.domain.model.SessionStateSnapshot;
import me.golemcore.argon.port.outbound.persistence.ChatMessageRepository;
import me.golemcore.argon.port.outbound.persistence.FullAnalysisResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalysisSnapshotServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SESSION = "session-1";
    private static final String MESSAGE = "message-1";

    private FullAnalysisResultRepository analysisRepository;
    private ChatMessageRepository messageRepository;
    private SessionStateService sessionStateService;
    private AnalysisSnapshotService service;

    @BeforeEach
    void setUp() {
        analysisRepository = mock(FullAnalysisResultRepository.class);
        messageRepository = mock(ChatMessageRepository.class);
        sessionStateService = mock(SessionStateService.class);
        service = new AnalysisSnapshotService(analysisRepository, messageRepository, sessionStateService,
                new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

        when(messageRepository.findById(MESSAGE)).thenReturn(Optional.of(ChatMessage.builder()
                .id(MESSAGE)
                .chatSessionId(SESSION)
                .senderType(ChatMessage.SENDER_AI)
                .timestamp(NOW)
                .build()));
        when(analysisRepository.saveAndFlush(any(FullAnalysisResult.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void shouldStoreSnakeCasePayload() {
        SessionStateSnapshot payload = SessionStateSnapshot.builder()
                .cachedFacts(List.of(SessionStateSnapshot.CachedFact.builder()
                        .text("Mira owns a sword")
                        .relevanceScore(0.8)
                        .build()))
                .build();

        FullAnalysisResult saved = service.recordSnapshot(SESSION, MESSAGE, payload);

        assertEquals(MESSAGE, saved.getSourceMessageId());
        assertEquals(NOW, saved.getCreatedAt());
        assertTrue(saved.getAnalysisData().contains("\"cached_facts\""));
        assertTrue(saved.getAnalysisData().contains("\"relevance_score\":0.8"));
    }

    @Test
    void shouldRejectMessageOfAnotherSession() {
        assertThrows(InvalidArgumentException.class,
                () -> service.recordSnapshot("other-session", MESSAGE, SessionStateSnapshot.empty()));
    }

    @Test
    void shouldRejectUnknownMessage() {
        when(messageRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> service.recordSnapshot(SESSION, "missing", SessionStateSnapshot.empty()));
    }

    @Test
    void shouldNeverOverwriteExistingSnapshot() {
        when(analysisRepository.existsBySourceMessageId(MESSAGE)).thenReturn(true);

        assertThrows(ConflictOnCreateException.class,
                () -> service.recordSnapshot(SESSION, MESSAGE, SessionStateSnapshot.empty()));
        verify(analysisRepository, never()).saveAndFlush(any());
    }

    @Test
    void shouldTranslateUniqueViolationToConflict() {
        when(analysisRepository.saveAndFlush(any(FullAnalysisResult.class)))
                .thenThrow(new DataIntegrityViolationException("uq_analysis_source_message"));

        assertThrows(ConflictOnCreateException.class,
                () -> service.recordSnapshot(SESSION, MESSAGE, SessionStateSnapshot.empty()));
    }

    @Test
    void shouldCaptureCurrentSessionState() {
        when(sessionStateService.currentState(SESSION)).thenReturn(SessionStateSnapshot.builder()
                .relationships(List.of(SessionStateSnapshot.Relationship.builder()
                        .entity1Id("mira")
                        .entity2Id("user")
                        .affectionScore(3)
                        .build()))
                .build());

        FullAnalysisResult saved = service.captureSnapshot(SESSION, MESSAGE);

        assertTrue(saved.getAnalysisData().contains("\"affection_score\":3"));
    }

    // ===== Payload parsing =====

    @Test
    void shouldReadPayloadIgnoringUnknownKeysAndNullArrays() {
        FullAnalysisResult snapshot = FullAnalysisResult.builder()
                .id("a1")
                .analysisData("{\"cached_facts\":[{\"text\":\"t\",\"key\":\"k\"}],\"relationships\":null,"
                        + "\"mood\":\"tense\"}")
                .build();

        SessionStateSnapshot payload = service.readPayload(snapshot);

        assertEquals("k", payload.getCachedFacts().get(0).getKey());
        assertTrue(payload.getRelationships().isEmpty());
        assertTrue(payload.getActiveEvents().isEmpty());
    }

    @Test
    void shouldTreatBlankPayloadAsEmptyState() {
        assertTrue(service.readPayload(FullAnalysisResult.builder().analysisData("").build()).isEmpty());
    }

    @Test
    void shouldFailOnUnreadablePayload() {
        FullAnalysisResult snapshot = FullAnalysisResult.builder().id("a2").analysisData("{oops").build();

        assertThrows(IntegrityViolationException.class, () -> service.readPayload(snapshot));
    }
}
