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
import me.golemcore.argon.domain.model.AssembledPrompt;
import me.golemcore.argon.domain.model.InjectionPosition;
import me.golemcore.argon.domain.model.LlmCallParameters;
import me.golemcore.argon.domain.model.LlmRequest;
import me.golemcore.argon.domain.model.LlmResponse;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.model.PromptEntry;
import me.golemcore.argon.domain.model.PromptMessage;
import me.golemcore.argon.domain.model.ServiceCallRequest;
import me.golemcore.argon.domain.model.ServiceOverrides;
import me.golemcore.argon.port.outbound.EmbeddingPort;
import me.golemcore.argon.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs one service call end to end: resolve parameters, assemble the user's
 * preset for the service, order the messages, call the provider and time the
 * call.
 *
 * <p>
 * Message order: system-prefix, system-suffix, chat-prefix, the conversation,
 * chat-suffix. When no entry is a system message, the service's built-in
 * system prompt leads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmServiceInvoker {

    private final UserConfigResolver configResolver;
    private final PromptAssembler promptAssembler;
    private final LlmPort llmPort;
    private final EmbeddingPort embeddingPort;
    private final SlowCallMonitor slowCallMonitor;

    public LlmResponse invoke(String userId, LlmServiceType service, List<PromptMessage> conversation,
            Map<String, String> variables, ServiceOverrides overrides) {
        return invoke(ServiceCallRequest.builder()
                .userId(userId)
                .service(service)
                .conversation(conversation != null ? conversation : List.of())
                .variables(variables != null ? variables : Map.of())
                .parameterOverrides(overrides)
                .build());
    }

    /**
     * @throws InvalidArgumentException
     *             for the embedding service, which has no chat interface
     */
    public LlmResponse invoke(ServiceCallRequest request) {
        LlmServiceType service = request.getService();
        if (service == null || !service.isChat()) {
            throw new InvalidArgumentException("Service " + service + " cannot be invoked as chat");
        }
        String userId = request.getUserId();
        LlmCallParameters parameters = configResolver.resolve(userId, service, request.getParameterOverrides());
        AssembledPrompt prompt = promptAssembler
                .assembleForUser(userId, service, request.getModuleOverrides(), request.getVariables())
                .spliceInstruction(InjectionPosition.SYSTEM_SUFFIX, PromptMessage.ROLE_SYSTEM,
                        request.getSessionInstruction());

        LlmRequest llmRequest = LlmRequest.builder()
                .parameters(parameters)
                .messages(buildMessages(prompt, parameters, request.getConversation()))
                .build();

        log.debug("[LLM] {} call for user {}: {}/{}, {} messages", service, userId, parameters.getProvider(),
                parameters.getModel(), llmRequest.getMessages().size());
        try (CallTimer timer = slowCallMonitor.start(service.getId() + " call")) {
            LlmResponse response = await(llmPort.chat(llmRequest), timer);
            timer.recordSuccess();
            return response;
        }
    }

    /**
     * Embeds text with the user's resolved embedding parameters.
     */
    public float[] embed(String userId, String text) {
        LlmCallParameters parameters = configResolver.resolve(userId, LlmServiceType.EMBEDDING);
        try (CallTimer timer = slowCallMonitor.start("embedding call")) {
            float[] vector = await(embeddingPort.embed(parameters, text), timer);
            timer.recordSuccess();
            return vector;
        }
    }

    static List<PromptMessage> buildMessages(AssembledPrompt prompt, LlmCallParameters parameters,
            List<PromptMessage> conversation) {
        List<PromptMessage> messages = new ArrayList<>();
        appendSegment(messages, prompt, InjectionPosition.SYSTEM_PREFIX);
        appendSegment(messages, prompt, InjectionPosition.SYSTEM_SUFFIX);
        appendSegment(messages, prompt, InjectionPosition.CHAT_PREFIX);
        if (conversation != null) {
            messages.addAll(conversation);
        }
        appendSegment(messages, prompt, InjectionPosition.CHAT_SUFFIX);

        boolean hasSystem = messages.stream().anyMatch(m -> PromptMessage.ROLE_SYSTEM.equals(m.getRole()));
        String systemPrompt = parameters.getSystemPrompt();
        if (!hasSystem && systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(0, PromptMessage.system(systemPrompt));
        }
        return messages;
    }

    private static void appendSegment(List<PromptMessage> messages, AssembledPrompt prompt,
            InjectionPosition position) {
        for (PromptEntry entry : prompt.segment(position).entries()) {
            if (!entry.isBlank()) {
                messages.add(new PromptMessage(entry.role(), entry.content()));
            }
        }
    }

    private <T> T await(CompletableFuture<T> future, CallTimer timer) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            timer.recordFailure(cause);
            log.error("[LLM] Provider call failed: {}", cause.getMessage());
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Provider call failed: " + cause.getMessage(), cause);
        }
    }
}
