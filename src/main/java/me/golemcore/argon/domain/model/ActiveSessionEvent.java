package me.golemcore.argon.domain.model;

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

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import me.golemcore.argon.infrastructure.persistence.JsonMapConverter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A world or card event currently running in a session.
 */
@Entity
@Table(name = "active_session_events")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveSessionEvent {

    public static final String STATUS_ACTIVE = "active";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_session_id", nullable = false, length = 36)
    private String chatSessionId;

    @Column(name = "event_id", nullable = false, length = 100)
    private String eventId;

    @Column(name = "current_phase_id", length = 100)
    private String currentPhaseId;

    @Column(name = "event_status", nullable = false, length = 30)
    @Builder.Default
    private String status = STATUS_ACTIVE;

    @Column(name = "event_type", length = 30)
    private String eventType;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "dynamic_event_data", length = 65535)
    @Builder.Default
    private Map<String, Object> dynamicEventData = new LinkedHashMap<>();
}
