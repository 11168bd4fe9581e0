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
import me.golemcore.argon.domain.exception.IntegrityViolationException;

/**
 * Base for columns that hold a JSON document as text. A {@code null} or blank
 * column reads back as the converter's empty value.
 *
 * @param <T>
 *            attribute type
 */
public abstract class AbstractJsonConverter<T> implements AttributeConverter<T, String> {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private final TypeReference<T> type;

    protected AbstractJsonConverter(TypeReference<T> type) {
        this.type = type;
    }

    protected abstract T empty();

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize column value: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return empty();
        }
        try {
            T value = MAPPER.readValue(dbData, type);
            return value != null ? value : empty();
        } catch (JsonProcessingException e) {
            throw new IntegrityViolationException("Stored JSON column is unreadable: " + e.getOriginalMessage(), e);
        }
    }
}
