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

import me.golemcore.argon.domain.model.LlmRequest;
import me.golemcore.argon.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for chat-completion providers (OpenAI-compatible endpoints, Anthropic).
 * Every request carries its own fully resolved parameters, so one adapter
 * serves all users and services.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier of this adapter.
     */
    String getProviderId();

    /**
     * Executes a chat completion and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Checks whether this adapter can talk to the given provider.
     */
    boolean supports(String provider);
}
