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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.argon.domain.exception.InvalidArgumentException;
import me.golemcore.argon.domain.model.InjectionPosition;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.model.Preset;
import me.golemcore.argon.domain.model.PromptModule;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts SillyTavern chat-completion presets to and from presets with
 * per-service modules.
 *
 * <p>
 * SillyTavern prompts apply to a single chat; on import each prompt gets its
 * applicable services from a table of well-known identifiers, otherwise from
 * keywords in its content, defaulting to generation. Two modules wiring in
 * retrieval context and session memory are appended to every import and left
 * out of every export.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PresetImportService {

    static final String ENHANCEMENT_PREFIX = "argon_";
    static final String RAG_MODULE = "argon_rag_integration";
    static final String SESSION_MEMORY_MODULE = "argon_session_memory";
    static final String CORE_IDENTIFIER = "main";

    private static final Map<String, Set<LlmServiceType>> KNOWN_SERVICES = Map.ofEntries(
            Map.entry("main_system_role", EnumSet.of(LlmServiceType.GENERATION, LlmServiceType.ANALYSIS)),
            Map.entry("jailbreak_unrestricted", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("core_writing_style", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("general_instructions_constraints",
                    EnumSet.of(LlmServiceType.GENERATION, LlmServiceType.MAINTENANCE)),
            Map.entry("user_input_interpretation_guide", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("character_development_principles",
                    EnumSet.of(LlmServiceType.GENERATION, LlmServiceType.ANALYSIS)),
            Map.entry("nsfw", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("danger_protocol", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("color_formatting", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("stance_cooperative", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("stance_neutral", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("stance_adversarial", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("style_ao3_flavor", EnumSet.of(LlmServiceType.GENERATION)),
            Map.entry("style_ironic_comedy", EnumSet.of(LlmServiceType.GENERATION)));

    private static final Map<LlmServiceType, List<String>> SERVICE_KEYWORDS = Map.of(
            LlmServiceType.GENERATION, List.of("character", "roleplay", "story", "dialogue", "narrative"),
            LlmServiceType.ANALYSIS, List.of("analyze", "extract", "relationship", "memory"),
            LlmServiceType.MAINTENANCE, List.of("world", "consistency", "background", "maintain"));

    private static final Map<String, String> KNOWN_CATEGORIES = Map.ofEntries(
            Map.entry("main_system_role", "core"),
            Map.entry("jailbreak_unrestricted", "core"),
            Map.entry("core_writing_style", "core"),
            Map.entry("general_instructions_constraints", "core"),
            Map.entry("user_input_interpretation_guide", "core"),
            Map.entry("character_development_principles", "core"),
            Map.entry("style_ao3_flavor", "style"),
            Map.entry("style_ironic_comedy", "style"),
            Map.entry("author_style", "style"),
            Map.entry("stance_cooperative", "stance"),
            Map.entry("stance_neutral", "stance"),
            Map.entry("stance_adversarial", "stance"),
            Map.entry("nsfw", "utility"),
            Map.entry("danger_protocol", "utility"),
            Map.entry("color_formatting", "utility"),
            Map.entry("tutorial_mode", "utility"));

    private static final Map<String, String> CATEGORY_PREFIXES;

    static {
        Map<String, String> prefixes = new LinkedHashMap<>();
        prefixes.put("core", "📜︱System: ");
        prefixes.put("style", "🎨︱Style: ");
        prefixes.put("stance", "✨︱OPTIONAL STANCE: ");
        prefixes.put("utility", "🔧︱Utility: ");
        CATEGORY_PREFIXES = prefixes;
    }

    private static final String RAG_CONTENT = """
            ## RELEVANT KNOWLEDGE
            The following information from your memory and knowledge base is relevant to this conversation:
            {{rag_context}}

            Use this context to inform your responses, but don't explicitly reference it unless natural.""";

    private static final String SESSION_MEMORY_CONTENT = """
            ## SESSION MEMORY
            Remember that this conversation contributes to your understanding of {{char}} and the world. Pay attention to:
            - Character development and personality reveals
            - Relationship dynamics and changes
            - World-building details and lore
            - Important events and consequences

            Your responses will be analyzed to update memory systems automatically.""";

    private final PresetService presetService;
    private final ObjectMapper objectMapper;

    /**
     * Imports a SillyTavern preset document as a new preset.
     *
     * @throws InvalidArgumentException
     *             if the document is not valid JSON, has no {@code prompts}
     *             array, or uses an unknown injection position
     */
    @Transactional
    public Preset importSillyTavern(String json, String presetName) {
        JsonNode root = parse(json);
        JsonNode prompts = root.get("prompts");
        if (prompts == null || !prompts.isArray()) {
            throw new InvalidArgumentException("SillyTavern preset has no prompts array");
        }

        Preset preset = presetService.createPreset(presetName, "Imported from SillyTavern - " + presetName, true,
                false);
        Set<String> seen = new HashSet<>();
        int imported = 0;
        for (JsonNode prompt : prompts) {
            if (!shouldImport(prompt)) {
                continue;
            }
            PromptModule module = toModule(prompt);
            if (!seen.add(module.getIdentifier())) {
                log.warn("[Assembler] Skipping duplicate SillyTavern prompt '{}'", module.getIdentifier());
                continue;
            }
            presetService.addModule(preset.getId(), module);
            imported++;
        }
        presetService.addModule(preset.getId(), enhancementModule(RAG_MODULE, "RAG Context Integration",
                RAG_CONTENT, 5, EnumSet.of(LlmServiceType.GENERATION)));
        presetService.addModule(preset.getId(), enhancementModule(SESSION_MEMORY_MODULE, "Session Memory Awareness",
                SESSION_MEMORY_CONTENT, 6, EnumSet.of(LlmServiceType.GENERATION, LlmServiceType.ANALYSIS)));

        log.info("[PresetImport] Imported SillyTavern preset '{}' ({}) with {} prompts", presetName,
                preset.getId(), imported);
        return presetService.getPreset(preset.getId());
    }

    /**
     * Renders a preset in SillyTavern's format. Enhancement modules are left
     * out.
     */
    @Transactional(readOnly = true)
    public String exportSillyTavern(String presetId) {
        Preset preset = presetService.getPreset(presetId);
        ObjectNode root = objectMapper.createObjectNode();
        root.put("name", preset.getName());
        root.put("description", preset.getDescription());
        ArrayNode prompts = root.putArray("prompts");
        for (PromptModule module : presetService.getModules(presetId)) {
            if (module.getIdentifier().startsWith(ENHANCEMENT_PREFIX)) {
                continue;
            }
            ObjectNode prompt = prompts.addObject();
            prompt.put("identifier", module.getIdentifier());
            prompt.put("name", withCategoryPrefix(module.getName(), module.getCategory()));
            prompt.put("system_prompt", false);
            prompt.put("role", module.getRole());
            prompt.put("content", module.getContent());
            prompt.put("injection_position", module.getInjectionPosition().getCode());
            prompt.put("injection_depth", module.getInjectionDepth());
            prompt.put("injection_order", module.getInjectionOrder());
            prompt.put("forbid_overrides", module.isForbidOverrides());
            prompt.put("enabled", module.isEnabled());
        }
        root.put("temperature", 1.0);
        root.put("top_p", 1.0);
        root.put("top_k", 40);
        root.put("frequency_penalty", 0);
        root.put("presence_penalty", 0);
        root.put("repetition_penalty", 1);
        root.put("max_context_unlocked", false);
        root.put("stream_openai", true);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render preset " + presetId, e);
        }
    }

    static Set<LlmServiceType> applicableServices(String identifier, String content) {
        Set<LlmServiceType> known = KNOWN_SERVICES.get(identifier);
        if (known != null) {
            return EnumSet.copyOf(known);
        }
        String text = content != null ? content.toLowerCase(Locale.ROOT) : "";
        EnumSet<LlmServiceType> services = EnumSet.noneOf(LlmServiceType.class);
        SERVICE_KEYWORDS.forEach((service, keywords) -> {
            if (keywords.stream().anyMatch(text::contains)) {
                services.add(service);
            }
        });
        if (services.isEmpty()) {
            services.add(LlmServiceType.GENERATION);
        }
        return services;
    }

    static String category(String identifier, String name) {
        String known = KNOWN_CATEGORIES.get(identifier);
        if (known != null) {
            return known;
        }
        String lower = name != null ? name.toLowerCase(Locale.ROOT) : "";
        if (containsAny(lower, "system:", "core", "jailbreak", "instructions")) {
            return "core";
        }
        if (containsAny(lower, "style:", "author", "writing", "ao3", "comedy")) {
            return "style";
        }
        if (containsAny(lower, "stance:", "cooperative", "adversarial", "neutral")) {
            return "stance";
        }
        return "utility";
    }

    /**
     * Strips a leading "emoji︱Label: " decoration from a SillyTavern name.
     */
    static String cleanName(String name) {
        if (name == null) {
            return "Unnamed Prompt";
        }
        int separator = name.indexOf('︱');
        if (separator >= 0 && separator < 6) {
            int colon = name.indexOf(": ", separator);
            if (colon > 0) {
                return name.substring(colon + 2).trim();
            }
        }
        return name.trim();
    }

    private static String withCategoryPrefix(String name, String category) {
        String prefix = category != null ? CATEGORY_PREFIXES.getOrDefault(category, "") : "";
        return prefix + (name != null ? name : "");
    }

    private boolean shouldImport(JsonNode prompt) {
        if (prompt.path("marker").asBoolean(false)) {
            return false;
        }
        String identifier = prompt.path("identifier").asText("");
        return !identifier.isBlank() && !prompt.path("content").asText("").isBlank();
    }

    private PromptModule toModule(JsonNode prompt) {
        String identifier = prompt.path("identifier").asText();
        String name = prompt.path("name").asText("Unnamed Prompt");
        String content = prompt.path("content").asText("");
        return PromptModule.builder()
                .identifier(identifier)
                .name(cleanName(name))
                .category(category(identifier, name))
                .content(content)
                .enabled(prompt.path("enabled").asBoolean(true))
                .role(prompt.path("role").asText(PromptModule.DEFAULT_ROLE))
                .injectionPosition(position(prompt.get("injection_position")))
                .injectionDepth(prompt.path("injection_depth").asInt(PromptModule.DEFAULT_DEPTH))
                .injectionOrder(prompt.path("injection_order").asInt(0))
                .forbidOverrides(prompt.path("forbid_overrides").asBoolean(false))
                .applicableServices(applicableServices(identifier, content))
                .coreModule(CORE_IDENTIFIER.equals(identifier))
                .build();
    }

    private static InjectionPosition position(JsonNode node) {
        if (node == null || node.isNull()) {
            return InjectionPosition.SYSTEM_PREFIX;
        }
        if (node.isNumber()) {
            return InjectionPosition.fromCode(node.asInt());
        }
        return InjectionPosition.fromId(node.asText());
    }

    private static PromptModule enhancementModule(String identifier, String name, String content, int order,
            Set<LlmServiceType> services) {
        return PromptModule.builder()
                .identifier(identifier)
                .name(name)
                .category("core")
                .content(content)
                .injectionPosition(InjectionPosition.SYSTEM_PREFIX)
                .injectionDepth(PromptModule.DEFAULT_DEPTH)
                .injectionOrder(order)
                .applicableServices(EnumSet.copyOf(services))
                .build();
    }

    private JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidArgumentException("SillyTavern preset is empty");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new InvalidArgumentException("SillyTavern preset must be a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("SillyTavern preset is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
