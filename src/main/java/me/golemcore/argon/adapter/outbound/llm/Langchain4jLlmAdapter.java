package me.golemcore.argon.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.argon.domain.model.LlmCallParameters;
import me.golemcore.argon.domain.model.LlmRequest;
import me.golemcore.argon.domain.model.LlmResponse;
import me.golemcore.argon.domain.model.PromptMessage;
import me.golemcore.argon.domain.service.SecretFingerprint;
import me.golemcore.argon.infrastructure.config.ArgonProperties;
import me.golemcore.argon.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * A chat model is built per request from the resolved
 * {@link LlmCallParameters}, so every user and service can point at its own
 * provider, model and key:
 * <ul>
 * <li>{@code anthropic} - Anthropic Messages API
 * <li>anything else - OpenAI or an OpenAI-compatible endpoint via
 * {@code baseUrl}
 * </ul>
 *
 * <p>
 * Rate-limit failures are retried with exponential backoff
 * ({@code argon.llm.max-retries}, {@code argon.llm.initial-backoff-ms}); other
 * failures surface immediately.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jLlmAdapter implements LlmPort {

    static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int ANTHROPIC_DEFAULT_MAX_TOKENS = 4096;

    private final ArgonProperties properties;

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public boolean supports(String provider) {
        return provider != null && !provider.isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            LlmCallParameters parameters = request.getParameters();
            ChatModel model = createModel(parameters);
            List<ChatMessage> messages = convertMessages(request.getMessages());
            int maxRetries = properties.getLlm().getMaxRetries();

            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    ChatResponse response = model.chat(messages);
                    return convertResponse(response, parameters);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (properties.getLlm().getInitialBackoffMs()
                                * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit on {}/{} (attempt {}/{}), retrying in {}ms",
                                parameters.getProvider(), parameters.getModel(), attempt + 1, maxRetries, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] {}/{} chat failed: {}", parameters.getProvider(), parameters.getModel(),
                                e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    ChatModel createModel(LlmCallParameters parameters) {
        if (parameters.getApiKey() == null || parameters.getApiKey().isBlank()) {
            throw new IllegalStateException("No API key for provider " + parameters.getProvider()
                    + ". Store one for the user or set argon.llm.providers." + parameters.getProvider()
                    + ".api-key");
        }
        log.debug("[LLM] Building {} model {} (key {})", parameters.getProvider(), parameters.getModel(),
                SecretFingerprint.of(parameters.getApiKey()));
        if (PROVIDER_ANTHROPIC.equalsIgnoreCase(parameters.getProvider())) {
            return createAnthropicModel(parameters);
        }
        return createOpenAiModel(parameters);
    }

    private ChatModel createAnthropicModel(LlmCallParameters parameters) {
        var builder = AnthropicChatModel.builder()
                .apiKey(parameters.getApiKey())
                .modelName(parameters.getModel())
                .maxRetries(0)
                .maxTokens(parameters.getMaxTokens() != null ? parameters.getMaxTokens()
                        : ANTHROPIC_DEFAULT_MAX_TOKENS);
        if (parameters.getTimeout() != null) {
            builder.timeout(parameters.getTimeout());
        }
        if (parameters.getBaseUrl() != null) {
            builder.baseUrl(parameters.getBaseUrl());
        }
        if (parameters.getTemperature() != null) {
            builder.temperature(parameters.getTemperature());
        }
        if (parameters.getTopP() != null) {
            builder.topP(parameters.getTopP());
        }
        if (parameters.getTopK() != null) {
            builder.topK(parameters.getTopK());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(LlmCallParameters parameters) {
        var builder = OpenAiChatModel.builder()
                .apiKey(parameters.getApiKey())
                .modelName(parameters.getModel())
                .maxRetries(0);
        if (parameters.getTimeout() != null) {
            builder.timeout(parameters.getTimeout());
        }
        if (parameters.getBaseUrl() != null) {
            builder.baseUrl(parameters.getBaseUrl());
        }
        if (parameters.getTemperature() != null) {
            builder.temperature(parameters.getTemperature());
        }
        if (parameters.getTopP() != null) {
            builder.topP(parameters.getTopP());
        }
        if (parameters.getMaxTokens() != null) {
            builder.maxTokens(parameters.getMaxTokens());
        }
        if (parameters.getFrequencyPenalty() != null) {
            builder.frequencyPenalty(parameters.getFrequencyPenalty());
        }
        if (parameters.getPresencePenalty() != null) {
            builder.presencePenalty(parameters.getPresencePenalty());
        }
        return builder.build();
    }

    static List<ChatMessage> convertMessages(List<PromptMessage> messages) {
        return messages.stream()
                .map(Langchain4jLlmAdapter::convertMessage)
                .toList();
    }

    private static ChatMessage convertMessage(PromptMessage message) {
        String content = message.getContent() != null ? message.getContent() : "";
        String role = message.getRole() != null ? message.getRole() : PromptMessage.ROLE_USER;
        return switch (role) {
            case PromptMessage.ROLE_SYSTEM -> SystemMessage.from(content);
            case PromptMessage.ROLE_ASSISTANT -> AiMessage.from(content);
            default -> UserMessage.from(content);
        };
    }

    private static LlmResponse convertResponse(ChatResponse response, LlmCallParameters parameters) {
        TokenUsage usage = response.tokenUsage();
        return LlmResponse.builder()
                .content(response.aiMessage() != null ? response.aiMessage().text() : null)
                .model(parameters.getModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                .inputTokens(usage != null ? usage.inputTokenCount() : null)
                .outputTokens(usage != null ? usage.outputTokenCount() : null)
                .build();
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }
}
