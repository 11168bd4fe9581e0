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
import me.golemcore.argon.domain.exception.ConflictOnCreateException;
import me.golemcore.argon.domain.exception.NotFoundException;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.model.ServiceBinding;
import me.golemcore.argon.domain.model.UserSettings;
import me.golemcore.argon.port.outbound.persistence.UserSettingsRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Owns the per-user settings row and its per-service provider bindings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserSettingsService {

    private final UserSettingsRepository settingsRepository;
    private final Clock clock;

    /**
     * Creates the settings row for a user; returns the existing row when there
     * already is one.
     */
    public UserSettings createSettings(String userId) {
        return settingsRepository.findByUserId(userId).orElseGet(() -> insert(userId));
    }

    private UserSettings insert(String userId) {
        try {
            UserSettings created = settingsRepository.saveAndFlush(UserSettings.builder()
                    .userId(userId)
                    .createdAt(Instant.now(clock))
                    .build());
            log.info("[ConfigResolver] Created settings for user {}", userId);
            return created;
        } catch (DataIntegrityViolationException e) {
            log.warn("[ConfigResolver] Concurrent settings create for user {}, reading the winning row", userId);
            return settingsRepository.findByUserId(userId)
                    .orElseThrow(() -> new ConflictOnCreateException(
                            "Settings for user " + userId + " could not be created", e));
        }
    }

    public UserSettings getSettings(String userId) {
        return settingsRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("user settings", userId));
    }

    /**
     * Replaces the binding of one service. A {@code null} binding removes it, so
     * the service falls back to its defaults.
     */
    @Transactional
    public UserSettings updateBinding(String userId, LlmServiceType service, ServiceBinding binding) {
        UserSettings settings = getSettings(userId);
        if (binding == null) {
            settings.getBindings().remove(service);
        } else {
            settings.getBindings().put(service, binding);
        }
        UserSettings saved = settingsRepository.save(settings);
        log.info("[ConfigResolver] Updated {} binding for user {}: provider={}, model={}", service, userId,
                binding != null ? binding.getProvider() : null, binding != null ? binding.getModel() : null);
        return saved;
    }
}
