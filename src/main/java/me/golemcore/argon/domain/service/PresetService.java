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
import me.golemcore.argon.domain.exception.InvalidArgumentException;
import me.golemcore.argon.domain.exception.NotFoundException;
import me.golemcore.argon.domain.model.InjectionPosition;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.model.Preset;
import me.golemcore.argon.domain.model.PromptModule;
import me.golemcore.argon.port.outbound.persistence.PresetRepository;
import me.golemcore.argon.port.outbound.persistence.PromptModuleRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Data access for presets and their modules. The only rule enforced here is
 * identifier uniqueness inside a preset; module order is the insertion order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PresetService {

    static final String MAIN_IDENTIFIER = "main";
    static final String ANALYSIS_IDENTIFIER = "analysis_rules";
    static final String MAINTENANCE_IDENTIFIER = "maintenance_rules";

    private static final String DEFAULT_MAIN_CONTENT = """
            You are {{char}}, taking part in an ongoing roleplay with {{user}}.
            Stay in character, keep the world consistent and write vivid, immersive prose.
            Never speak or act for {{user}}.""";

    private static final String DEFAULT_ANALYSIS_CONTENT = """
            Analyze the latest exchange between {{user}} and {{char}}.
            Report new facts, relationship changes, lore changes and event progress as structured JSON.""";

    private static final String DEFAULT_MAINTENANCE_CONTENT = """
            Keep lore entries, character notes and off-scene world state consistent with the story so far.
            Prefer small, precise rewrites over broad changes.""";

    private final PresetRepository presetRepository;
    private final PromptModuleRepository moduleRepository;

    @Transactional(readOnly = true)
    public List<Preset> listPresets() {
        return presetRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Preset getPreset(String presetId) {
        return presetRepository.findById(presetId)
                .orElseThrow(() -> new NotFoundException("preset", presetId));
    }

    @Transactional(readOnly = true)
    public Optional<Preset> getDefaultPreset() {
        return presetRepository.findFirstByDefaultPresetTrueOrderByCreatedAtAsc();
    }

    @Transactional
    public Preset createPreset(String name, String description, boolean sillyTavernCompatible, boolean makeDefault) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Preset name is required");
        }
        Preset preset = presetRepository.save(Preset.builder()
                .name(name.trim())
                .description(description)
                .sillyTavernCompatible(sillyTavernCompatible)
                .build());
        if (makeDefault) {
            markDefault(preset);
        }
        log.info("[Presets] Created preset '{}' ({})", preset.getName(), preset.getId());
        return preset;
    }

    /**
     * Makes the preset the system default; any other default loses the flag.
     */
    @Transactional
    public Preset setDefault(String presetId) {
        return markDefault(getPreset(presetId));
    }

    @Transactional
    public void deletePreset(String presetId) {
        Preset preset = getPreset(presetId);
        presetRepository.delete(preset);
        log.info("[Presets] Deleted preset '{}' ({}) with {} modules", preset.getName(), presetId,
                preset.getModules().size());
    }

    /**
     * Appends a module to the preset, after every module already declared.
     *
     * @throws InvalidArgumentException
     *             if the identifier is blank or already used in this preset, or
     *             the module applies to no service
     */
    @Transactional
    public PromptModule addModule(String presetId, PromptModule module) {
        Preset preset = getPreset(presetId);
        validate(module);
        if (moduleRepository.existsByPreset_IdAndIdentifier(presetId, module.getIdentifier())) {
            throw new InvalidArgumentException(
                    "Module identifier '" + module.getIdentifier() + "' already exists in preset " + presetId);
        }
        module.setId(null);
        module.setDeclaredOrder(moduleRepository.findMaxDeclaredOrder(presetId) + 1);
        preset.addModule(module);
        PromptModule saved = moduleRepository.save(module);
        log.debug("[Presets] Added module '{}' to preset {} at declared position {}", saved.getIdentifier(), presetId,
                saved.getDeclaredOrder());
        return saved;
    }

    /**
     * Replaces the editable fields of a module. Declared order is kept.
     */
    @Transactional
    public PromptModule updateModule(String presetId, String moduleId, PromptModule changes) {
        PromptModule module = getModule(presetId, moduleId);
        validate(changes);
        if (!module.getIdentifier().equals(changes.getIdentifier())
                && moduleRepository.existsByPreset_IdAndIdentifier(presetId, changes.getIdentifier())) {
            throw new InvalidArgumentException(
                    "Module identifier '" + changes.getIdentifier() + "' already exists in preset " + presetId);
        }
        module.setIdentifier(changes.getIdentifier());
        module.setName(changes.getName());
        module.setCategory(changes.getCategory());
        module.setContent(changes.getContent());
        module.setEnabled(changes.isEnabled());
        module.setRole(changes.getRole());
        module.setInjectionPosition(changes.getInjectionPosition());
        module.setInjectionDepth(changes.getInjectionDepth());
        module.setInjectionOrder(changes.getInjectionOrder());
        module.setForbidOverrides(changes.isForbidOverrides());
        module.setApplicableServices(EnumSet.copyOf(changes.getApplicableServices()));
        module.setCoreModule(changes.isCoreModule());
        module.setServicePriority(changes.getServicePriority());
        return moduleRepository.save(module);
    }

    @Transactional
    public PromptModule toggleModule(String presetId, String moduleId, boolean enabled) {
        PromptModule module = getModule(presetId, moduleId);
        module.setEnabled(enabled);
        if (!enabled && module.isCoreModule()) {
            log.debug("[Presets] Module '{}' is core; disabling it does not remove it from assembly",
                    module.getIdentifier());
        }
        return moduleRepository.save(module);
    }

    @Transactional(readOnly = true)
    public PromptModule getModule(String presetId, String moduleId) {
        return moduleRepository.findByIdAndPreset_Id(moduleId, presetId)
                .orElseThrow(() -> new NotFoundException("module", moduleId));
    }

    /**
     * Modules of an existing preset in declared order.
     */
    @Transactional(readOnly = true)
    public List<PromptModule> getModules(String presetId) {
        if (!presetRepository.existsById(presetId)) {
            throw new NotFoundException("preset", presetId);
        }
        return moduleRepository.findByPreset_IdOrderByDeclaredOrderAsc(presetId);
    }

    /**
     * Creates the built-in default preset when the store holds no preset at all.
     *
     * @return the created preset, or empty when presets already exist
     */
    @Transactional
    public Optional<Preset> ensureDefaultPreset(String name) {
        if (presetRepository.count() > 0) {
            return Optional.empty();
        }
        Preset preset = Preset.builder()
                .name(name)
                .description("Built-in preset with the core system modules")
                .defaultPreset(true)
                .build();
        preset.addModule(PromptModule.builder()
                .identifier(MAIN_IDENTIFIER)
                .name("Main Prompt")
                .category("core")
                .content(DEFAULT_MAIN_CONTENT)
                .injectionPosition(InjectionPosition.SYSTEM_PREFIX)
                .injectionDepth(0)
                .applicableServices(EnumSet.of(LlmServiceType.GENERATION, LlmServiceType.ANALYSIS,
                        LlmServiceType.MAINTENANCE))
                .coreModule(true)
                .declaredOrder(0)
                .build());
        preset.addModule(PromptModule.builder()
                .identifier(ANALYSIS_IDENTIFIER)
                .name("Analysis Rules")
                .category("core")
                .content(DEFAULT_ANALYSIS_CONTENT)
                .injectionPosition(InjectionPosition.SYSTEM_SUFFIX)
                .applicableServices(EnumSet.of(LlmServiceType.ANALYSIS))
                .coreModule(true)
                .declaredOrder(1)
                .build());
        preset.addModule(PromptModule.builder()
                .identifier(MAINTENANCE_IDENTIFIER)
                .name("Maintenance Rules")
                .category("core")
                .content(DEFAULT_MAINTENANCE_CONTENT)
                .injectionPosition(InjectionPosition.SYSTEM_SUFFIX)
                .applicableServices(EnumSet.of(LlmServiceType.MAINTENANCE))
                .coreModule(true)
                .declaredOrder(2)
                .build());
        Preset saved = presetRepository.save(preset);
        log.info("[Presets] Created default preset '{}' ({}) with {} modules", saved.getName(), saved.getId(),
                saved.getModules().size());
        return Optional.of(saved);
    }

    private Preset markDefault(Preset preset) {
        presetRepository.clearDefaultExcept(preset.getId());
        Preset reloaded = getPreset(preset.getId());
        reloaded.setDefaultPreset(true);
        return presetRepository.save(reloaded);
    }

    private void validate(PromptModule module) {
        if (module == null) {
            throw new InvalidArgumentException("Module is required");
        }
        if (module.getIdentifier() == null || module.getIdentifier().isBlank()) {
            throw new InvalidArgumentException("Module identifier is required");
        }
        if (module.getApplicableServices() == null || module.getApplicableServices().isEmpty()) {
            throw new InvalidArgumentException(
                    "Module '" + module.getIdentifier() + "' must apply to at least one service");
        }
        if (module.getInjectionPosition() == null) {
            throw new InvalidArgumentException("Module '" + module.getIdentifier() + "' has no injection position");
        }
        if (module.getRole() == null || module.getRole().isBlank()) {
            module.setRole(PromptModule.DEFAULT_ROLE);
        }
    }
}
