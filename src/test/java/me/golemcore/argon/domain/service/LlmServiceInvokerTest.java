package me.golemcore.argon.domain.service;

import me.golemcore.argon.domain.exception.InvalidArgumentException;
import me.golemcore.argon.domain.model.AssembledPrompt;
import me.golemcore.argon.domain.model.InjectionPosition;
import me.golemcore.argon.domain.model.LlmCallParameters;
import me.golemcore.argon.domain.model.LlmRequest;
import me.golemcore.argon.domain.model.LlmResponse;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.model.PromptEntry;
import me.golemcore.argon.domain.model.PromptMessage;
import me.golemcore.argon.domain.model.PromptSegment;
import me.golemcore.argon.domain.model.ServiceCallRequest;
import me.golemcore.argon.infrastructure.config.ArgonProperties;
import me.golemcore.argon.port.outbound.EmbeddingPort;
import me.golemcore.argon.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmServiceInvokerTest {

    private static final String USER = "user-1";

    private UserConfigResolver configResolver;
    private PromptAssembler promptAssembler;
    private LlmPort llmPort;
    private EmbeddingPort embeddingPort;
    private SlowCallMonitor slowCallMonitor;
    private LlmServiceInvoker invoker;

    @BeforeEach
    void setUp() {
        configResolver = mock(UserConfigResolver.class);
        promptAssembler = mock(PromptAssembler.class);
        llmPort = mock(LlmPort.class);
        embeddingPort = mock(EmbeddingPort.class);
        slowCallMonitor = new SlowCallMonitor(new ArgonProperties());
        invoker = new LlmServiceInvoker(configResolver, promptAssembler, llmPort, embeddingPort, slowCallMonitor);
    }

    private static PromptSegment segment(InjectionPosition position, String role, String content) {
        return new PromptSegment(position, List.of(new PromptEntry(position.getId(), role, content, false, 0)));
    }

    private static List<String> contents(List<PromptMessage> messages) {
        return messages.stream().map(PromptMessage::getContent).toList();
    }

    // ===== Message order =====

    @Test
    void shouldOrderSegmentsAroundConversation() {
        AssembledPrompt prompt = new AssembledPrompt(LlmServiceType.GENERATION, Map.of(
                InjectionPosition.SYSTEM_PREFIX, segment(InjectionPosition.SYSTEM_PREFIX, "system", "prefix"),
                InjectionPosition.SYSTEM_SUFFIX, segment(InjectionPosition.SYSTEM_SUFFIX, "system", "suffix"),
                InjectionPosition.CHAT_PREFIX, segment(InjectionPosition.CHAT_PREFIX, "user", "chat-prefix"),
                InjectionPosition.CHAT_SUFFIX, segment(InjectionPosition.CHAT_SUFFIX, "system", "chat-suffix")));
        LlmCallParameters parameters = LlmCallParameters.builder().systemPrompt("built-in").build();

        List<PromptMessage> messages = LlmServiceInvoker.buildMessages(prompt, parameters,
                List.of(PromptMessage.user("hi"), PromptMessage.assistant("hello")));

        assertEquals(List.of("prefix", "suffix", "chat-prefix", "hi", "hello", "chat-suffix"), contents(messages));
        assertEquals("user", messages.get(2).getRole());
    }

    @Test
    void shouldLeadWithBuiltInSystemPromptWhenNoSystemEntry() {
        LlmCallParameters parameters = LlmCallParameters.builder().systemPrompt("built-in").build();

        List<PromptMessage> messages = LlmServiceInvoker.buildMessages(
                AssembledPrompt.empty(LlmServiceType.ANALYSIS), parameters, List.of(PromptMessage.user("turn")));

        assertEquals(List.of("built-in", "turn"), contents(messages));
        assertEquals(PromptMessage.ROLE_SYSTEM, messages.get(0).getRole());
    }

    // ===== Invocation =====

    @Test
    void shouldResolveAssembleAndCallProvider() {
        LlmCallParameters parameters = LlmCallParameters.builder()
                .service(LlmServiceType.ANALYSIS)
                .provider("openai")
                .model("gpt-4o-mini")
                .build();
        when(configResolver.resolve(eq(USER), eq(LlmServiceType.ANALYSIS), any())).thenReturn(parameters);
        when(promptAssembler.assembleForUser(eq(USER), eq(LlmServiceType.ANALYSIS), anyMap(), anyMap()))
                .thenReturn(new AssembledPrompt(LlmServiceType.ANALYSIS, Map.of(InjectionPosition.SYSTEM_PREFIX,
                        segment(InjectionPosition.SYSTEM_PREFIX, "system", "Analyze."))));
        LlmResponse response = LlmResponse.builder().content("{\"events\":[]}").build();
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(response));

        LlmResponse result = invoker.invoke(ServiceCallRequest.builder()
                .userId(USER)
                .service(LlmServiceType.ANALYSIS)
                .conversation(List.of(PromptMessage.user("I open the gate")))
                .sessionInstruction("Focus on the gate.")
                .build());

        assertSame(response, result);
        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        assertSame(parameters, request.getValue().getParameters());
        assertEquals(List.of("Analyze.", "Focus on the gate.", "I open the gate"),
                contents(request.getValue().getMessages()));
    }

    @Test
    void shouldRecordProviderFailureAndRethrowCause() {
        when(configResolver.resolve(eq(USER), eq(LlmServiceType.GENERATION), any()))
                .thenReturn(LlmCallParameters.builder().service(LlmServiceType.GENERATION).build());
        when(promptAssembler.assembleForUser(eq(USER), eq(LlmServiceType.GENERATION), any(), any()))
                .thenReturn(AssembledPrompt.empty(LlmServiceType.GENERATION));
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("provider down")));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> invoker.invoke(USER, LlmServiceType.GENERATION, List.of(PromptMessage.user("hi")), null,
                        null));

        assertEquals("provider down", error.getMessage());
        assertEquals(1, slowCallMonitor.getFailedCallCount());
    }

    @Test
    void shouldRejectEmbeddingAsChatService() {
        assertThrows(InvalidArgumentException.class,
                () -> invoker.invoke(USER, LlmServiceType.EMBEDDING, List.of(), Map.of(), null));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldEmbedWithResolvedEmbeddingParameters() {
        LlmCallParameters parameters = LlmCallParameters.builder()
                .service(LlmServiceType.EMBEDDING)
                .model("text-embedding-3-small")
                .build();
        when(configResolver.resolve(USER, LlmServiceType.EMBEDDING)).thenReturn(parameters);
        when(embeddingPort.embed(parameters, "gate"))
                .thenReturn(CompletableFuture.completedFuture(new float[] { 0.1f, 0.2f }));

        assertArrayEquals(new float[] { 0.1f, 0.2f }, invoker.embed(USER, "gate"));
    }
}
