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
import me.golemcore.argon.domain.model.AssembledPrompt;
import me.golemcore.argon.domain.model.InjectionPosition;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.model.Preset;
import me.golemcore.argon.domain.model.PromptEntry;
import me.golemcore.argon.domain.model.PromptModule;
import me.golemcore.argon.domain.model.PromptSegment;
import me.golemcore.argon.domain.model.UserPromptConfiguration;
import me.golemcore.argon.infrastructure.config.ArgonProperties;
import me.golemcore.argon.port.outbound.persistence.PresetRepository;
import me.golemcore.argon.port.outbound.persistence.PromptModuleRepository;
import me.golemcore.argon.port.outbound.persistence.UserPromptConfigurationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the modules of a preset into the four ordered, role-tagged prompt
 * segments for one service.
 *
 * <p>
 * A module is selected when it applies to the service and is either core or
 * enabled. Per-call overrides, keyed by module identifier, may switch an
 * enabled non-core module off for one call. They never switch a disabled
 * module on, and core modules cannot be switched off.
 * Within a position modules are ordered by (depth, order) and modules with
 * equal keys keep their declared order.
 *
 * <p>
 * Missing data is not an error: an unknown preset or a preset without modules
 * yields four empty segments. The only failure is an unknown service name.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptAssembler {

    private static final Comparator<PromptModule> PLACEMENT = Comparator
            .comparingInt(PromptModule::getInjectionDepth)
            .thenComparingInt(PromptModule::getInjectionOrder);

    private final PresetRepository presetRepository;
    private final PromptModuleRepository moduleRepository;
    private final UserPromptConfigurationRepository configurationRepository;
    private final PromptTemplateEngine templateEngine;
    private final ArgonProperties properties;

    /**
     * Assembles a preset for a service given by name.
     *
     * @throws me.golemcore.argon.domain.exception.InvalidArgumentException
     *             if {@code service} is not a known service name
     */
    @Transactional(readOnly = true)
    public AssembledPrompt assemble(String presetId, String service, Map<String, Boolean> overrides) {
        return assemble(presetId, LlmServiceType.fromId(service), overrides, Map.of());
    }

    @Transactional(readOnly = true)
    public AssembledPrompt assemble(String presetId, LlmServiceType service, Map<String, Boolean> overrides,
            Map<String, String> variables) {
        List<PromptModule> modules = presetId != null
                ? moduleRepository.findByPreset_IdOrderByDeclaredOrderAsc(presetId)
                : List.of();
        if (modules.isEmpty()) {
            log.debug("[Assembler] Preset {} has no modules, assembling empty prompt for {}", presetId, service);
        }
        return assemble(service, modules, overrides, variables);
    }

    /**
     * Assembles the user's active preset, falling back to the system default
     * preset. Reading never creates the user's configuration row.
     */
    @Transactional(readOnly = true)
    public AssembledPrompt assembleForUser(String userId, LlmServiceType service, Map<String, Boolean> overrides,
            Map<String, String> variables) {
        Optional<String> presetId = resolvePresetId(userId);
        if (presetId.isEmpty()) {
            log.debug("[Assembler] No active or default preset for user {}", userId);
            return AssembledPrompt.empty(service);
        }
        return assemble(presetId.get(), service, overrides, variables);
    }

    /**
     * Pure assembly over modules given in declared order.
     */
    public AssembledPrompt assemble(LlmServiceType service, List<PromptModule> modules,
            Map<String, Boolean> overrides, Map<String, String> variables) {
        Map<String, Boolean> effectiveOverrides = overrides != null ? overrides : Map.of();
        Map<String, String> effectiveVariables = mergeVariables(variables);

        Map<InjectionPosition, List<PromptModule>> byPosition = new EnumMap<>(InjectionPosition.class);
        int selected = 0;
        for (PromptModule module : modules) {
            if (!isSelected(module, service, effectiveOverrides)) {
                continue;
            }
            byPosition.computeIfAbsent(module.getInjectionPosition(), p -> new ArrayList<>()).add(module);
            selected++;
        }

        Map<InjectionPosition, PromptSegment> segments = new EnumMap<>(InjectionPosition.class);
        for (Map.Entry<InjectionPosition, List<PromptModule>> entry : byPosition.entrySet()) {
            List<PromptModule> positioned = entry.getValue();
            // List.sort is stable: equal (depth, order) keeps declared order
            positioned.sort(PLACEMENT);
            List<PromptEntry> entries = positioned.stream()
                    .map(module -> toEntry(module, effectiveVariables))
                    .toList();
            segments.put(entry.getKey(), new PromptSegment(entry.getKey(), entries));
        }

        log.debug("[Assembler] Selected {}/{} modules for {}", selected, modules.size(), service);
        return new AssembledPrompt(service, segments);
    }

    static boolean isSelected(PromptModule module, LlmServiceType service, Map<String, Boolean> overrides) {
        if (!module.appliesTo(service)) {
            return false;
        }
        if (module.isCoreModule()) {
            return true;
        }
        // overrides can only switch an enabled module off for this call
        return module.isEnabled() && !Boolean.FALSE.equals(overrides.get(module.getIdentifier()));
    }

    private PromptEntry toEntry(PromptModule module, Map<String, String> variables) {
        String content = templateEngine.render(module.getContent(), variables);
        return new PromptEntry(module.getIdentifier(), module.getRole(), content != null ? content : "",
                module.isForbidOverrides(), module.getServicePriority());
    }

    private Map<String, String> mergeVariables(Map<String, String> variables) {
        Map<String, String> global = properties.getPrompts().getTemplateVars();
        if (variables == null || variables.isEmpty()) {
            return global;
        }
        Map<String, String> merged = new HashMap<>(global);
        merged.putAll(variables);
        return merged;
    }

    private Optional<String> resolvePresetId(String userId) {
        Optional<String> active = configurationRepository.findByUserId(userId)
                .map(UserPromptConfiguration::getActivePresetId)
                .filter(presetRepository::existsById);
        if (active.isPresent()) {
            return active;
        }
        return presetRepository.findFirstByDefaultPresetTrueOrderByCreatedAtAsc().map(Preset::getId);
    }
}
