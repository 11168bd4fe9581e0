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
import me.golemcore.argon.domain.model.LlmCallParameters;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.model.ServiceBinding;
import me.golemcore.argon.domain.model.ServiceOverrides;
import me.golemcore.argon.domain.model.UserPromptConfiguration;
import me.golemcore.argon.domain.model.UserPromptConfigurationUpdate;
import me.golemcore.argon.domain.model.UserSettings;
import me.golemcore.argon.infrastructure.config.ArgonProperties;
import me.golemcore.argon.port.outbound.persistence.PresetRepository;
import me.golemcore.argon.port.outbound.persistence.UserPromptConfigurationRepository;
import me.golemcore.argon.port.outbound.persistence.UserSettingsRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Resolves complete LLM call parameters per user and service.
 *
 * <p>
 * Precedence, highest first:
 * <ol>
 * <li>explicit per-call override</li>
 * <li>value stored for the user: the service binding for provider, model and
 * credentials; the prompt configuration for generation sampling; the service
 * binding for sampling of the other services</li>
 * <li>built-in default of that service ({@code argon.services.*})</li>
 * </ol>
 * Each service is resolved on its own; a value missing for one service never
 * falls back to what another service uses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserConfigResolver {

    private final UserPromptConfigurationRepository configurationRepository;
    private final UserSettingsRepository settingsRepository;
    private final PresetRepository presetRepository;
    private final ArgonProperties properties;

    /**
     * Returns the user's prompt configuration, creating it with schema defaults
     * on first access. Relies on the unique user key: when a concurrent caller
     * wins the insert, the row it created is read back and returned.
     *
     * <p>
     * Deliberately not transactional: the insert commits on its own so a lost
     * race surfaces as a constraint violation that can be recovered from.
     */
    public UserPromptConfiguration getOrCreate(String userId) {
        return configurationRepository.findByUserId(userId)
                .orElseGet(() -> create(userId));
    }

    private UserPromptConfiguration create(String userId) {
        try {
            UserPromptConfiguration created = configurationRepository
                    .saveAndFlush(UserPromptConfiguration.defaults(userId));
            log.info("[ConfigResolver] Created default prompt configuration for user {}", userId);
            return created;
        } catch (DataIntegrityViolationException e) {
            log.warn("[ConfigResolver] Concurrent create for user {}, reading the winning row", userId);
            return configurationRepository.findByUserId(userId)
                    .orElseThrow(() -> new ConflictOnCreateException(
                            "Prompt configuration for user " + userId + " could not be created", e));
        }
    }

    /**
     * Applies a partial update to the user's prompt configuration.
     *
     * @throws NotFoundException
     *             if the requested active preset does not exist
     */
    public UserPromptConfiguration updateConfiguration(String userId, UserPromptConfigurationUpdate update) {
        UserPromptConfiguration configuration = getOrCreate(userId);
        if (update.isClearActivePreset()) {
            configuration.setActivePresetId(null);
        } else if (update.getActivePresetId() != null) {
            if (!presetRepository.existsById(update.getActivePresetId())) {
                throw new NotFoundException("preset", update.getActivePresetId());
            }
            configuration.setActivePresetId(update.getActivePresetId());
        }
        setIfPresent(update.getTemperature(), configuration::setTemperature);
        setIfPresent(update.getTopP(), configuration::setTopP);
        setIfPresent(update.getTopK(), configuration::setTopK);
        setIfPresent(update.getTopA(), configuration::setTopA);
        setIfPresent(update.getMinP(), configuration::setMinP);
        setIfPresent(update.getMaxTokens(), configuration::setMaxTokens);
        setIfPresent(update.getFrequencyPenalty(), configuration::setFrequencyPenalty);
        setIfPresent(update.getPresencePenalty(), configuration::setPresencePenalty);
        setIfPresent(update.getRepetitionPenalty(), configuration::setRepetitionPenalty);
        setIfPresent(update.getReasoningEffort(), configuration::setReasoningEffort);
        setIfPresent(update.getContextSize(), configuration::setContextSize);
        UserPromptConfiguration saved = configurationRepository.save(configuration);
        log.info("[ConfigResolver] Updated prompt configuration for user {}", userId);
        return saved;
    }

    public LlmCallParameters resolve(String userId, String service) {
        return resolve(userId, LlmServiceType.fromId(service), ServiceOverrides.none());
    }

    public LlmCallParameters resolve(String userId, LlmServiceType service) {
        return resolve(userId, service, ServiceOverrides.none());
    }

    /**
     * Resolves one service for a user.
     *
     * @throws NotFoundException
     *             if the user has no settings row at all
     */
    public LlmCallParameters resolve(String userId, LlmServiceType service, ServiceOverrides overrides) {
        UserSettings settings = settingsRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("user settings", userId));
        return resolve(userId, service, overrides, settings, getOrCreate(userId));
    }

    /**
     * Resolves all four services with one settings read.
     */
    public Map<LlmServiceType, LlmCallParameters> resolveAll(String userId) {
        UserSettings settings = settingsRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("user settings", userId));
        UserPromptConfiguration configuration = getOrCreate(userId);
        Map<LlmServiceType, LlmCallParameters> resolved = new EnumMap<>(LlmServiceType.class);
        for (LlmServiceType service : LlmServiceType.values()) {
            resolved.put(service, resolve(userId, service, ServiceOverrides.none(), settings, configuration));
        }
        return resolved;
    }

    private LlmCallParameters resolve(String userId, LlmServiceType service, ServiceOverrides overrides,
            UserSettings settings, UserPromptConfiguration configuration) {
        ServiceOverrides override = overrides != null ? overrides : ServiceOverrides.none();
        ServiceBinding binding = settings.bindingFor(service);
        ArgonProperties.ServiceDefaults defaults = properties.getServices().forService(service);

        String provider = firstText(override.getProvider(), binding.getProvider(), defaults.getProvider());
        ArgonProperties.ProviderProperties providerConfig = properties.getLlm().getProviders().get(provider);

        LlmCallParameters.LlmCallParametersBuilder builder = LlmCallParameters.builder()
                .service(service)
                .provider(provider)
                .model(firstText(override.getModel(), binding.getModel(), defaults.getModel()))
                .apiKey(firstText(override.getApiKey(), binding.getApiKey(),
                        providerConfig != null ? providerConfig.getApiKey() : null))
                .baseUrl(firstText(override.getBaseUrl(), binding.getBaseUrl(),
                        providerConfig != null ? providerConfig.getBaseUrl() : null))
                .timeout(defaults.getTimeout())
                .systemPrompt(defaults.getSystemPrompt());

        if (service == LlmServiceType.GENERATION) {
            builder.temperature(first(override.getTemperature(), configuration.getTemperature(),
                    defaults.getTemperature()))
                    .topP(first(override.getTopP(), configuration.getTopP(), defaults.getTopP()))
                    .topK(first(override.getTopK(), configuration.getTopK(), null))
                    .topA(first(override.getTopA(), configuration.getTopA(), null))
                    .minP(first(override.getMinP(), configuration.getMinP(), null))
                    .maxTokens(first(override.getMaxTokens(), configuration.getMaxTokens(), defaults.getMaxTokens()))
                    .frequencyPenalty(first(override.getFrequencyPenalty(), configuration.getFrequencyPenalty(), null))
                    .presencePenalty(first(override.getPresencePenalty(), configuration.getPresencePenalty(), null))
                    .repetitionPenalty(
                            first(override.getRepetitionPenalty(), configuration.getRepetitionPenalty(), null))
                    .reasoningEffort(firstText(override.getReasoningEffort(), configuration.getReasoningEffort(),
                            null))
                    .contextSize(first(override.getContextSize(), configuration.getContextSize(), null));
        } else {
            builder.temperature(first(override.getTemperature(), binding.getTemperature(), defaults.getTemperature()))
                    .topP(first(override.getTopP(), null, defaults.getTopP()))
                    .topK(override.getTopK())
                    .topA(override.getTopA())
                    .minP(override.getMinP())
                    .maxTokens(first(override.getMaxTokens(), binding.getMaxTokens(), defaults.getMaxTokens()))
                    .frequencyPenalty(override.getFrequencyPenalty())
                    .presencePenalty(override.getPresencePenalty())
                    .repetitionPenalty(override.getRepetitionPenalty())
                    .reasoningEffort(override.getReasoningEffort())
                    .contextSize(override.getContextSize());
        }

        LlmCallParameters resolved = builder.build();
        log.debug("[ConfigResolver] Resolved {} for user {}: provider={}, model={}, key={}", service, userId,
                resolved.getProvider(), resolved.getModel(), SecretFingerprint.of(resolved.getApiKey()));
        return resolved;
    }

    private static <T> T first(T override, T stored, T fallback) {
        if (override != null) {
            return override;
        }
        return stored != null ? stored : fallback;
    }

    private static String firstText(String override, String stored, String fallback) {
        if (override != null && !override.isBlank()) {
            return override;
        }
        return stored != null && !stored.isBlank() ? stored : fallback;
    }

    private static <T> void setIfPresent(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
