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

import lombok.Data;
import me.golemcore.argon.domain.model.LlmServiceType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties bound from application.properties under the
 * {@code argon.*} prefix.
 *
 * <ul>
 * <li>{@link ServicesProperties} - built-in defaults per LLM service</li>
 * <li>{@link LlmProperties} - provider credentials and retry policy</li>
 * <li>{@link PromptsProperties} - default preset bootstrap and template
 * variables</li>
 * <li>{@link MonitoringProperties} - slow call threshold</li>
 * <li>{@link BranchProperties} - session branching</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "argon")
@Data
public class ArgonProperties {

    private ServicesProperties services = new ServicesProperties();
    private LlmProperties llm = new LlmProperties();
    private PromptsProperties prompts = new PromptsProperties();
    private MonitoringProperties monitoring = new MonitoringProperties();
    private BranchProperties branch = new BranchProperties();

    @Data
    public static class ServicesProperties {
        private ServiceDefaults generation = ServiceDefaults.of("openai", "gpt-4o", 0.7, 4000,
                Duration.ofSeconds(60), """
                        You are a skilled narrative AI assistant. Your role is to:
                        1. Generate engaging, contextually appropriate responses
                        2. Maintain character consistency and world coherence
                        3. Provide rich, immersive storytelling
                        4. Use the provided RAG context to enhance responses with relevant lore and memories""");

        private ServiceDefaults analysis = ServiceDefaults.of("openai", "gpt-4o-mini", 0.3, 2000,
                Duration.ofSeconds(30), """
                        You are an analytical AI that processes conversation turns to extract actionable insights.
                        Your task is to analyze the last turn (user input + AI response) and identify:
                        1. Key events that occurred
                        2. Character developments or changes
                        3. World state modifications
                        4. Information that should be remembered or updated
                        Return structured JSON with specific update intentions.""");

        private ServiceDefaults maintenance = ServiceDefaults.of("openai", "gpt-4o-mini", 0.5, 1500,
                Duration.ofSeconds(30), """
                        You are a maintenance AI responsible for background world updates and content rewriting.
                        Your tasks include:
                        1. UPDATE_NOTE: Rewrite and update lore entries, character notes, and world information
                        2. SIMULATE_WORLD: Simulate off-scene NPCs and world events
                        3. CREATE_ENTITY: Generate new characters, locations, or items as needed
                        Focus on consistency, brevity, and maintaining narrative coherence.""");

        private ServiceDefaults embedding = ServiceDefaults.of("openai", "text-embedding-3-small", 0.0, null,
                Duration.ofSeconds(15), null);

        public ServiceDefaults forService(LlmServiceType service) {
            return switch (service) {
                case GENERATION -> generation;
                case ANALYSIS -> analysis;
                case MAINTENANCE -> maintenance;
                case EMBEDDING -> embedding;
            };
        }
    }

    @Data
    public static class ServiceDefaults {
        private String provider;
        private String model;
        private Double temperature;
        private Double topP;
        private Integer maxTokens;
        private Duration timeout = Duration.ofSeconds(30);
        private String systemPrompt;

        static ServiceDefaults of(String provider, String model, Double temperature, Integer maxTokens,
                Duration timeout, String systemPrompt) {
            ServiceDefaults defaults = new ServiceDefaults();
            defaults.setProvider(provider);
            defaults.setModel(model);
            defaults.setTemperature(temperature);
            defaults.setMaxTokens(maxTokens);
            defaults.setTimeout(timeout);
            defaults.setSystemPrompt(systemPrompt);
            return defaults;
        }
    }

    @Data
    public static class LlmProperties {
        private Map<String, ProviderProperties> providers = new HashMap<>();
        private int maxRetries = 5;
        private long initialBackoffMs = 5_000;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class PromptsProperties {
        private boolean ensureDefaultPreset = true;
        private String defaultPresetName = "Argon Default";
        private Map<String, String> templateVars = new HashMap<>();
    }

    @Data
    public static class MonitoringProperties {
        private Duration slowCallThreshold = Duration.ofSeconds(10);
    }

    @Data
    public static class BranchProperties {
        private String titleSuffix = " (branch)";
        private String defaultTitle = "Chat";
    }
}
