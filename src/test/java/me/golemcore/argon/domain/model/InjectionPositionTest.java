package me.golemcore.argon.domain.model;

import me.golemcore.argon.domain.exception.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InjectionPositionTest {

    @Test
    void shouldParseHyphenUnderscoreAndEnumSpellings() {
        assertEquals(InjectionPosition.SYSTEM_PREFIX, InjectionPosition.fromId("system-prefix"));
        assertEquals(InjectionPosition.CHAT_SUFFIX, InjectionPosition.fromId("chat_suffix"));
        assertEquals(InjectionPosition.SYSTEM_SUFFIX, InjectionPosition.fromId("SYSTEM_SUFFIX"));
    }

    @Test
    void shouldMapSillyTavernCodes() {
        assertEquals(InjectionPosition.SYSTEM_PREFIX, InjectionPosition.fromCode(0));
        assertEquals(InjectionPosition.CHAT_PREFIX, InjectionPosition.fromCode(1));
        assertEquals(InjectionPosition.CHAT_SUFFIX, InjectionPosition.fromCode(2));
        assertEquals(InjectionPosition.SYSTEM_SUFFIX, InjectionPosition.fromCode(3));
        assertThrows(InvalidArgumentException.class, () -> InjectionPosition.fromCode(7));
    }

    @Test
    void shouldRejectUnknownOrMissingPosition() {
        assertThrows(InvalidArgumentException.class, () -> InjectionPosition.fromId("middle"));
        assertThrows(InvalidArgumentException.class, () -> InjectionPosition.fromId(" "));
    }

    @Test
    void shouldClassifySystemPositions() {
        assertTrue(InjectionPosition.SYSTEM_SUFFIX.isSystem());
        assertFalse(InjectionPosition.CHAT_PREFIX.isSystem());
    }
}
