package me.golemcore.argon.port.outbound;

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

import me.golemcore.argon.domain.model.LlmCallParameters;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for generating text embeddings with resolved embedding-service
 * parameters.
 */
public interface EmbeddingPort {

    /**
     * Generate embedding for a single text.
     *
     * @param parameters
     *            resolved embedding parameters (provider, model, credentials)
     * @param text
     *            the text to embed
     * @return vector representation
     */
    CompletableFuture<float[]> embed(LlmCallParameters parameters, String text);

    /**
     * Generate embeddings for multiple texts in one provider call.
     */
    CompletableFuture<List<float[]>> embedBatch(LlmCallParameters parameters, List<String> texts);
}
