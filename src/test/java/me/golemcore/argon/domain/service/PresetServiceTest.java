package me.golemcore.argon.domain.service;

import me.golemcore.argon.domain.exception.InvalidArgumentException;
import me.golemcore.argon.domain.exception.NotFoundException;
import me.golemcore.argon.domain.model.InjectionPosition;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.model.Preset;
import me.golemcore.argon.domain.model.PromptModule;
import me.golemcore.argon.port.outbound.persistence.PresetRepository;
import me.golemcore.argon.port.outbound.persistence.PromptModuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
class PresetServiceTest {

    private static final String PRESET_ID = "preset-1";

    private PresetRepository presetRepository;
    private PromptModuleRepository moduleRepository;
    private PresetService service;
    private Preset preset;

    @BeforeEach
    void setUp() {
        presetRepository = mock(PresetRepository.class);
        moduleRepository = mock(PromptModuleRepository.class);
        service = new PresetService(presetRepository, moduleRepository);

        preset = Preset.builder().id(PRESET_ID).name("Story").build();
        when(presetRepository.findById(PRESET_ID)).thenReturn(Optional.of(preset));
        when(presetRepository.save(any(Preset.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(moduleRepository.save(any(PromptModule.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static PromptModule module(String identifier) {
        return PromptModule.builder()
                .identifier(identifier)
                .content("content of " + identifier)
                .build();
    }

    // ===== Presets =====

    @Test
    void shouldRejectBlankPresetName() {
        assertThrows(InvalidArgumentException.class, () -> service.createPreset(" ", null, false, false));
    }

    @Test
    void shouldTagPresetLifecycleLogLines(CapturedOutput output) {
        service.createPreset("Adventure", null, false, false);
        service.deletePreset(PRESET_ID);

        assertTrue(output.getOut().contains("[Presets] Created preset 'Adventure'"));
        assertTrue(output.getOut().contains("[Presets] Deleted preset 'Story' (preset-1)"));
    }

    @Test
    void shouldClearOtherDefaultsWhenMarkingDefault() {
        Preset marked = service.setDefault(PRESET_ID);

        assertTrue(marked.isDefaultPreset());
        verify(presetRepository).clearDefaultExcept(PRESET_ID);
    }

    @Test
    void shouldFailForUnknownPreset() {
        when(presetRepository.findById("missing")).thenReturn(Optional.empty());

        NotFoundException error = assertThrows(NotFoundException.class, () -> service.getPreset("missing"));
        assertEquals("preset", error.getEntity());
    }

    // ===== Modules =====

    @Test
    void shouldAppendModuleAfterExistingOnes() {
        when(moduleRepository.existsByPreset_IdAndIdentifier(PRESET_ID, "style")).thenReturn(false);
        when(moduleRepository.findMaxDeclaredOrder(PRESET_ID)).thenReturn(2);

        PromptModule added = service.addModule(PRESET_ID, module("style"));

        assertEquals(3, added.getDeclaredOrder());
        assertEquals(preset, added.getPreset());
        assertEquals(List.of(added), preset.getModules());
    }

    @Test
    void shouldRejectDuplicateIdentifierInPreset() {
        when(moduleRepository.existsByPreset_IdAndIdentifier(PRESET_ID, "main")).thenReturn(true);

        assertThrows(InvalidArgumentException.class, () -> service.addModule(PRESET_ID, module("main")));
        verify(moduleRepository, never()).save(any());
    }

    @Test
    void shouldRejectModuleWithoutServices() {
        PromptModule module = module("orphan");
        module.setApplicableServices(Set.of());

        assertThrows(InvalidArgumentException.class, () -> service.addModule(PRESET_ID, module));
    }

    @Test
    void shouldDefaultBlankRoleToSystem() {
        when(moduleRepository.findMaxDeclaredOrder(PRESET_ID)).thenReturn(-1);
        PromptModule module = module("first");
        module.setRole(" ");

        PromptModule added = service.addModule(PRESET_ID, module);

        assertEquals("system", added.getRole());
        assertEquals(0, added.getDeclaredOrder());
    }

    @Test
    void shouldUpdateModuleFieldsButKeepDeclaredOrder() {
        PromptModule existing = module("style");
        existing.setId("m1");
        existing.setDeclaredOrder(5);
        when(moduleRepository.findByIdAndPreset_Id("m1", PRESET_ID)).thenReturn(Optional.of(existing));
        PromptModule changes = module("style");
        changes.setInjectionPosition(InjectionPosition.CHAT_SUFFIX);
        changes.setApplicableServices(EnumSet.of(LlmServiceType.ANALYSIS));

        PromptModule updated = service.updateModule(PRESET_ID, "m1", changes);

        assertEquals(InjectionPosition.CHAT_SUFFIX, updated.getInjectionPosition());
        assertEquals(EnumSet.of(LlmServiceType.ANALYSIS), updated.getApplicableServices());
        assertEquals(5, updated.getDeclaredOrder());
    }

    @Test
    void shouldToggleModule() {
        PromptModule existing = module("style");
        when(moduleRepository.findByIdAndPreset_Id("m1", PRESET_ID)).thenReturn(Optional.of(existing));

        assertFalse(service.toggleModule(PRESET_ID, "m1", false).isEnabled());
    }

    // ===== Default preset bootstrap =====

    @Test
    void shouldCreateDefaultPresetOnlyWhenStoreIsEmpty() {
        when(presetRepository.count()).thenReturn(0L);

        Preset created = service.ensureDefaultPreset("Argon Default").orElseThrow();

        assertTrue(created.isDefaultPreset());
        assertEquals(List.of(PresetService.MAIN_IDENTIFIER, PresetService.ANALYSIS_IDENTIFIER,
                PresetService.MAINTENANCE_IDENTIFIER),
                created.getModules().stream().map(PromptModule::getIdentifier).toList());
        assertTrue(created.getModules().stream().allMatch(PromptModule::isCoreModule));

        when(presetRepository.count()).thenReturn(1L);
        assertTrue(service.ensureDefaultPreset("Argon Default").isEmpty());
    }
}
