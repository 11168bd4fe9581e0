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

/**
 * Slot of the assembled prompt a module is injected into. Declaration order is
 * the order segments are reported in.
 *
 * <p>
 * The numeric codes are the ones used by SillyTavern preset files.
 */
public enum InjectionPosition {

    SYSTEM_PREFIX("system-prefix", 0),
    SYSTEM_SUFFIX("system-suffix", 3),
    CHAT_PREFIX("chat-prefix", 1),
    CHAT_SUFFIX("chat-suffix", 2);

    private final String id;
    private final int code;

    InjectionPosition(String id, int code) {
        this.id = id;
        this.code = code;
    }

    public String getId() {
        return id;
    }

    public int getCode() {
        return code;
    }

    public boolean isSystem() {
        return this == SYSTEM_PREFIX || this == SYSTEM_SUFFIX;
    }

    /**
     * Accepts {@code system-prefix}, {@code system_prefix} or
     * {@code SYSTEM_PREFIX}.
     */
    public static InjectionPosition fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException("Injection position is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (InjectionPosition position : values()) {
            if (position.id.equals(normalized)) {
                return position;
            }
        }
        throw new InvalidArgumentException("Unknown injection position: " + value);
    }

    public static InjectionPosition fromCode(int code) {
        for (InjectionPosition position : values()) {
            if (position.code == code) {
                return position;
            }
        }
        throw new InvalidArgumentException("Unknown injection position code: " + code);
    }
}
