package me.golemcore.argon.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.argon.domain.model.LlmCallParameters;
import me.golemcore.argon.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Embedding adapter using langchain4j's OpenAI embedding model (or any
 * OpenAI-compatible endpoint). Models are cached per model name, key and base
 * URL.
 */
@Component
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final Map<ModelKey, EmbeddingModel> models = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<float[]> embed(LlmCallParameters parameters, String text) {
        return CompletableFuture.supplyAsync(() -> {
            Response<Embedding> response = modelFor(parameters).embed(text);
            return response.content().vector();
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(LlmCallParameters parameters, List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();
            Response<List<Embedding>> response = modelFor(parameters).embedAll(segments);
            return response.content().stream()
                    .map(Embedding::vector)
                    .toList();
        });
    }

    private EmbeddingModel modelFor(LlmCallParameters parameters) {
        if (parameters.getApiKey() == null || parameters.getApiKey().isBlank()) {
            throw new IllegalStateException("No API key for embedding provider " + parameters.getProvider());
        }
        ModelKey key = new ModelKey(parameters.getModel(), parameters.getApiKey(), parameters.getBaseUrl());
        return models.computeIfAbsent(key, k -> {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(k.apiKey())
                    .modelName(k.model());
            if (k.baseUrl() != null) {
                builder.baseUrl(k.baseUrl());
            }
            if (parameters.getTimeout() != null) {
                builder.timeout(parameters.getTimeout());
            }
            log.info("[LLM] Embedding model initialized: {}", k.model());
            return builder.build();
        });
    }

    private record ModelKey(String model, String apiKey, String baseUrl) {

        ModelKey {
            Objects.requireNonNull(model, "model");
        }

        @Override
        public String toString() {
            return model + "@" + (baseUrl != null ? baseUrl : "default");
        }
    }
}
