package me.golemcore.argon.domain.model;

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

import me.golemcore.argon.domain.exception.InvalidArgumentException;

import java.util.Locale;
import java.util.Optional;

/**
 * The independently configurable purposes an LLM is called for.
 */
public enum LlmServiceType {

    GENERATION("generation"),
    ANALYSIS("analysis"),
    MAINTENANCE("maintenance"),
    EMBEDDING("embedding");

    private final String id;

    LlmServiceType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Chat services produce text; embedding produces vectors.
     */
    public boolean isChat() {
        return this != EMBEDDING;
    }

    /**
     * Parses a service name, case-insensitively.
     *
     * @throws InvalidArgumentException
     *             if the name is not one of the four known services
     */
    public static LlmServiceType fromId(String value) {
        return tryParse(value)
                .orElseThrow(() -> new InvalidArgumentException("Unknown service: " + value));
    }

    public static Optional<LlmServiceType> tryParse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LlmServiceType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
