package me.golemcore.argon.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.service.PresetService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;

/**
 * Shared infrastructure beans and startup bootstrap.
 *
 * <p>
 * On startup the configured service defaults are logged and, when
 * {@code argon.prompts.ensure-default-preset} is set and the store has no
 * preset yet, the built-in default preset is created.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ArgonProperties properties;
    private final PresetService presetService;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        for (LlmServiceType service : LlmServiceType.values()) {
            ArgonProperties.ServiceDefaults defaults = properties.getServices().forService(service);
            log.info("[Startup] Service {}: {}/{} (timeout {})", service, defaults.getProvider(), defaults.getModel(),
                    defaults.getTimeout());
        }
        if (properties.getPrompts().isEnsureDefaultPreset()) {
            presetService.ensureDefaultPreset(properties.getPrompts().getDefaultPresetName())
                    .ifPresent(preset -> log.info("[Startup] Bootstrapped default preset {}", preset.getId()));
        }
    }
}
