package me.golemcore.argon.domain.service;

import me.golemcore.argon.domain.exception.IntegrityViolationException;
import me.golemcore.argon.domain.exception.NotFoundException;
import me.golemcore.argon.domain.model.ChatMessage;
import me.golemcore.argon.domain.model.ChatSession;
import me.golemcore.argon.domain.model.FullAnalysisResult;
import me.golemcore.argon.domain.model.SessionStateSnapshot;
import me.golemcore.argon.infrastructure.config.ArgonProperties;
import me.golemcore.argon.port.outbound.persistence.ChatMessageRepository;
import me.golemcore.argon.port.outbound.persistence.ChatSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BranchManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2026-02-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2026-02-01T10:01:00Z");

    private ChatSessionRepository sessionRepository;
    private ChatMessageRepository messageRepository;
    private AnalysisSnapshotService snapshotService;
    private SessionStateService sessionStateService;
    private BranchManager branchManager;

    private ChatSession original;
    private ChatMessage first;
    private ChatMessage branchPoint;

    @BeforeEach
    void setUp() {
        sessionRepository = mock(ChatSessionRepository.class);
        messageRepository = mock(ChatMessageRepository.class);
        snapshotService = mock(AnalysisSnapshotService.class);
        sessionStateService = mock(SessionStateService.class);
        branchManager = new BranchManager(sessionRepository, messageRepository, snapshotService,
                sessionStateService, new ArgonProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

        original = ChatSession.builder()
                .id("s1")
                .title("Tavern")
                .cardType("character")
                .cardId("card-1")
                .userPersonaId("persona-1")
                .worldId("world-1")
                .build();
        first = ChatMessage.builder().id("m1").chatSessionId("s1").senderType(ChatMessage.SENDER_USER)
                .content("Hello").timestamp(T1).build();
        branchPoint = ChatMessage.builder().id("m2").chatSessionId("s1").senderType(ChatMessage.SENDER_AI)
                .content("Welcome").timestamp(T2).build();

        when(messageRepository.findById("m2")).thenReturn(Optional.of(branchPoint));
        when(sessionRepository.findById("s1")).thenReturn(Optional.of(original));
        when(sessionRepository.save(any(ChatSession.class))).thenAnswer(invocation -> {
            ChatSession session = invocation.getArgument(0);
            session.setId("branch-1");
            return session;
        });
        when(messageRepository.findByChatSessionIdAndTimestampLessThanEqualOrderByTimestampAsc("s1", T2))
                .thenReturn(List.of(first, branchPoint));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCopyPrefixAndRestoreSnapshotState() {
        FullAnalysisResult snapshot = FullAnalysisResult.builder().id("a1").analysisData("{}").build();
        SessionStateSnapshot state = SessionStateSnapshot.empty();
        when(snapshotService.findForMessage("m2")).thenReturn(Optional.of(snapshot));
        when(snapshotService.readPayload(snapshot)).thenReturn(state);

        String branchId = branchManager.createBranch("m2");

        assertEquals("branch-1", branchId);

        ArgumentCaptor<ChatSession> session = ArgumentCaptor.forClass(ChatSession.class);
        verify(sessionRepository).save(session.capture());
        assertEquals("Tavern (branch)", session.getValue().getTitle());
        assertEquals("s1", session.getValue().getParentSessionId());
        assertEquals("m2", session.getValue().getBranchedFromMessageId());
        assertEquals("world-1", session.getValue().getWorldId());
        assertEquals(NOW, session.getValue().getCreatedAt());

        ArgumentCaptor<List<ChatMessage>> copies = ArgumentCaptor.forClass(List.class);
        verify(messageRepository).saveAll(copies.capture());
        assertEquals(2, copies.getValue().size());
        assertEquals(List.of("Hello", "Welcome"), copies.getValue().stream().map(ChatMessage::getContent).toList());
        assertEquals(List.of(T1, T2), copies.getValue().stream().map(ChatMessage::getTimestamp).toList());
        copies.getValue().forEach(copy -> {
            assertEquals("branch-1", copy.getChatSessionId());
            assertNull(copy.getId());
        });

        verify(sessionStateService).replaceState("branch-1", state);
    }

    @Test
    void shouldUseDefaultTitleWhenOriginalHasNone() {
        original.setTitle(null);
        FullAnalysisResult snapshot = FullAnalysisResult.builder().id("a1").analysisData("{}").build();
        when(snapshotService.findForMessage("m2")).thenReturn(Optional.of(snapshot));
        when(snapshotService.readPayload(snapshot)).thenReturn(SessionStateSnapshot.empty());

        branchManager.createBranch("m2");

        ArgumentCaptor<ChatSession> session = ArgumentCaptor.forClass(ChatSession.class);
        verify(sessionRepository).save(session.capture());
        assertEquals("Chat (branch)", session.getValue().getTitle());
    }

    @Test
    void shouldFailWithoutSnapshotAndNotRestoreState() {
        when(snapshotService.findForMessage("m2")).thenReturn(Optional.empty());

        NotFoundException error = assertThrows(NotFoundException.class, () -> branchManager.createBranch("m2"));

        assertEquals("m2", error.getEntityId());
        verify(sessionStateService, never()).replaceState(anyString(), any());
    }

    @Test
    void shouldFailForUnknownMessage() {
        when(messageRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> branchManager.createBranch("missing"));
        verify(sessionRepository, never()).save(any());
    }

    @Test
    void shouldReportMissingOwningSessionAsIntegrityViolation() {
        when(sessionRepository.findById("s1")).thenReturn(Optional.empty());

        assertThrows(IntegrityViolationException.class, () -> branchManager.createBranch("m2"));
        verify(sessionRepository, never()).save(any());
    }
}
