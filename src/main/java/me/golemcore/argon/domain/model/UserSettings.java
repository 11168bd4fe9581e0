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

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.MapKeyEnumerated;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-user settings row holding provider/model bindings per service. Resolving
 * LLM parameters requires this row to exist.
 */
@Entity
@Table(name = "user_settings", uniqueConstraints = @UniqueConstraint(name = "uq_user_settings_user", columnNames = "user_id"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_service_bindings", joinColumns = @JoinColumn(name = "settings_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "service", length = 20)
    @Builder.Default
    private Map<LlmServiceType, ServiceBinding> bindings = new EnumMap<>(LlmServiceType.class);

    @Column(name = "created_at")
    private Instant createdAt;

    public ServiceBinding bindingFor(LlmServiceType service) {
        ServiceBinding binding = bindings != null ? bindings.get(service) : null;
        return binding != null ? binding : ServiceBinding.empty();
    }
}
