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
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import me.golemcore.argon.infrastructure.persistence.JsonMapConverter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alternate, not yet committed response to a message. Index 0 is the original
 * response itself.
 */
@Entity
@Table(name = "temp_message_variants", uniqueConstraints = @UniqueConstraint(name = "uq_variant_index", columnNames = {
        "original_message_id", "variant_index" }))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TempMessageVariant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "original_message_id", nullable = false, length = 36)
    private String originalMessageId;

    @Column(name = "chat_session_id", nullable = false, length = 36)
    private String chatSessionId;

    @Column(name = "variant_index", nullable = false)
    private int variantIndex;

    @Column(length = 65535)
    private String content;

    @Column(name = "sender_type", nullable = false, length = 20)
    private String senderType;

    @Column(name = "active_persona_name", length = 200)
    private String activePersonaName;

    @Column(name = "active_persona_image_url", length = 1000)
    private String activePersonaImageUrl;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "variant_metadata", length = 65535)
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at")
    private Instant createdAt;
}
