package me.golemcore.argon.infrastructure.persistence;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.argon.domain.exception.IntegrityViolationException;
import me.golemcore.argon.domain.model.LlmServiceType;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persists a module's applicable services as a JSON array of service ids, e.g.
 * {@code ["generation","analysis"]}. Ids that are no longer known are skipped
 * with a warning instead of failing the whole row.
 */
@Converter
@Slf4j
public class ServiceSetConverter implements AttributeConverter<Set<LlmServiceType>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Set<LlmServiceType> services) {
        if (services == null) {
            return "[]";
        }
        // EnumSet iterates in declaration order, keeping the column stable
        EnumSet<LlmServiceType> ordered = EnumSet.noneOf(LlmServiceType.class);
        ordered.addAll(services);
        List<String> ids = ordered.stream()
                .map(LlmServiceType::getId)
                .toList();
        try {
            return MAPPER.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize services: " + services, e);
        }
    }

    @Override
    public Set<LlmServiceType> convertToEntityAttribute(String dbData) {
        EnumSet<LlmServiceType> result = EnumSet.noneOf(LlmServiceType.class);
        if (dbData == null || dbData.isBlank()) {
            return result;
        }
        List<String> ids;
        try {
            ids = MAPPER.readValue(dbData, ID_LIST);
        } catch (JsonProcessingException e) {
            throw new IntegrityViolationException("Stored service list is unreadable: " + dbData, e);
        }
        for (String id : ids) {
            Optional<LlmServiceType> type = LlmServiceType.tryParse(id);
            if (type.isPresent()) {
                result.add(type.get());
            } else {
                log.warn("[Assembler] Ignoring unknown service '{}' in stored module", id);
            }
        }
        return result;
    }
}
