package me.golemcore.argon.domain.exception;

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

import lombok.Getter;

/**
 * Raised when a record required by an operation does not exist. Carries the
 * kind of record and the identifier that was looked up.
 */
@Getter
public class NotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final String entityId;

    public NotFoundException(String entity, Object entityId) {
        super(entity + " not found: " + entityId);
        this.entity = entity;
        this.entityId = entityId != null ? entityId.toString() : null;
    }
}
