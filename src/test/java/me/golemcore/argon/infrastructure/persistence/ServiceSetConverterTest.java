package me.golemcore.argon.infrastructure.persistence;

import me.golemcore.argon.domain.exception.IntegrityViolationException;
import me.golemcore.argon.domain.model.LlmServiceType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceSetConverterTest {

    private final ServiceSetConverter converter = new ServiceSetConverter();

    @Test
    void shouldWriteIdsInDeclarationOrder() {
        Set<LlmServiceType> services = new LinkedHashSet<>(
                List.of(LlmServiceType.MAINTENANCE, LlmServiceType.GENERATION));

        assertEquals("[\"generation\",\"maintenance\"]", converter.convertToDatabaseColumn(services));
        assertEquals("[]", converter.convertToDatabaseColumn(Set.of()));
        assertEquals("[]", converter.convertToDatabaseColumn(null));
    }

    @Test
    void shouldSkipUnknownIdsWhenReading() {
        Set<LlmServiceType> services = converter.convertToEntityAttribute("[\"analysis\",\"legacy\",\"generation\"]");

        assertEquals(EnumSet.of(LlmServiceType.GENERATION, LlmServiceType.ANALYSIS), services);
    }

    @Test
    void shouldReadBlankColumnAsEmptySet() {
        assertTrue(converter.convertToEntityAttribute(null).isEmpty());
        assertTrue(converter.convertToEntityAttribute("").isEmpty());
    }

    @Test
    void shouldFailOnUnreadableColumn() {
        assertThrows(IntegrityViolationException.class, () -> converter.convertToEntityAttribute("{broken"));
    }
}
