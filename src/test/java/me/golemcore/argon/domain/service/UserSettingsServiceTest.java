package me.golemcore.argon.domain.service;

import me.golemcore.argon.domain.exception.NotFoundException;
import me.golemcore.argon.domain.model.LlmServiceType;
import me.golemcore.argon.domain.model.ServiceBinding;
import me.golemcore.argon.domain.model.UserSettings;
import me.golemcore.argon.port.outbound.persistence.UserSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UserSettingsServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private UserSettingsRepository settingsRepository;
    private UserSettingsService service;

    @BeforeEach
    void setUp() {
        settingsRepository = mock(UserSettingsRepository.class);
        service = new UserSettingsService(settingsRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        when(settingsRepository.saveAndFlush(any(UserSettings.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(settingsRepository.save(any(UserSettings.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void shouldCreateSettingsOnce() {
        when(settingsRepository.findByUserId("u1")).thenReturn(Optional.empty());

        UserSettings created = service.createSettings("u1");

        assertEquals("u1", created.getUserId());
        assertEquals(NOW, created.getCreatedAt());
    }

    @Test
    void shouldReturnExistingSettingsInsteadOfCreating() {
        UserSettings existing = UserSettings.builder().id("s1").userId("u1").build();
        when(settingsRepository.findByUserId("u1")).thenReturn(Optional.of(existing));

        assertSame(existing, service.createSettings("u1"));
        verify(settingsRepository, never()).saveAndFlush(any());
    }

    @Test
    void shouldRecoverFromConcurrentCreate() {
        UserSettings winner = UserSettings.builder().id("s9").userId("u1").build();
        when(settingsRepository.findByUserId("u1")).thenReturn(Optional.empty()).thenReturn(Optional.of(winner));
        when(settingsRepository.saveAndFlush(any(UserSettings.class)))
                .thenThrow(new DataIntegrityViolationException("uq_user_settings_user"));

        assertSame(winner, service.createSettings("u1"));
    }

    @Test
    void shouldFailGettingMissingSettings() {
        when(settingsRepository.findByUserId("u2")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.getSettings("u2"));
    }

    @Test
    void shouldReplaceAndRemoveBinding() {
        UserSettings existing = UserSettings.builder().id("s1").userId("u1").build();
        when(settingsRepository.findByUserId("u1")).thenReturn(Optional.of(existing));

        service.updateBinding("u1", LlmServiceType.ANALYSIS,
                ServiceBinding.builder().provider("anthropic").model("claude-haiku").build());
        assertEquals("claude-haiku", existing.bindingFor(LlmServiceType.ANALYSIS).getModel());

        service.updateBinding("u1", LlmServiceType.ANALYSIS, null);
        assertFalse(existing.getBindings().containsKey(LlmServiceType.ANALYSIS));
    }
}
