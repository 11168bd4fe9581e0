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

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stores retrieval results (a list of JSON objects) as one text column.
 */
@Converter
public class JsonMapListConverter extends AbstractJsonConverter<List<Map<String, Object>>> {

    public JsonMapListConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected List<Map<String, Object>> empty() {
        return new ArrayList<>();
    }
}
