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
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import me.golemcore.argon.infrastructure.persistence.ServiceSetConverter;

import java.util.EnumSet;
import java.util.Set;

/**
 * One unit of prompt content inside a {@link Preset}: placement
 * (position/depth/order), service applicability and enable/core flags.
 *
 * <p>
 * A core module is included for every service it applies to regardless of
 * {@link #enabled}; a disabled non-core module is excluded.
 */
@Entity
@Table(name = "prompt_modules", uniqueConstraints = @UniqueConstraint(name = "uq_prompt_module_identifier", columnNames = {
        "preset_id", "identifier" }))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptModule {

    public static final String DEFAULT_ROLE = "system";
    public static final int DEFAULT_DEPTH = 4;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "preset_id", nullable = false)
    private Preset preset;

    @Column(nullable = false, length = 200)
    private String identifier;

    @Column(length = 300)
    private String name;

    @Column(length = 50)
    private String category;

    @Column(length = 65535)
    private String content;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(name = "message_role", nullable = false, length = 20)
    @Builder.Default
    private String role = DEFAULT_ROLE;

    @Enumerated(EnumType.STRING)
    @Column(name = "injection_position", nullable = false, length = 20)
    @Builder.Default
    private InjectionPosition injectionPosition = InjectionPosition.SYSTEM_PREFIX;

    @Column(name = "injection_depth", nullable = false)
    @Builder.Default
    private int injectionDepth = DEFAULT_DEPTH;

    @Column(name = "injection_order", nullable = false)
    @Builder.Default
    private int injectionOrder = 0;

    @Column(name = "forbid_overrides", nullable = false)
    @Builder.Default
    private boolean forbidOverrides = false;

    @Convert(converter = ServiceSetConverter.class)
    @Column(name = "applicable_services", nullable = false, length = 200)
    @Builder.Default
    private Set<LlmServiceType> applicableServices = EnumSet.of(LlmServiceType.GENERATION);

    @Column(name = "is_core_module", nullable = false)
    @Builder.Default
    private boolean coreModule = false;

    @Column(name = "service_priority", nullable = false)
    @Builder.Default
    private int servicePriority = 0;

    @Column(name = "declared_order", nullable = false)
    @Builder.Default
    private int declaredOrder = 0;

    public boolean appliesTo(LlmServiceType service) {
        return applicableServices != null && applicableServices.contains(service);
    }
}
