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
import jakarta.persistence.Index;
import jakarta.persistence.Table;
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
 * One entry of a session's message log, ordered by {@link #timestamp}.
 */
@Entity
@Table(name = "chat_messages", indexes = @Index(name = "ix_chat_messages_session_time", columnList = "chat_session_id, sent_at"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    public static final String SENDER_USER = "USER";
    public static final String SENDER_AI = "AI";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_session_id", nullable = false, length = 36)
    private String chatSessionId;

    @Column(name = "sender_type", nullable = false, length = 20)
    private String senderType;

    @Column(length = 65535)
    private String content;

    @Column(name = "sent_at", nullable = false)
    private Instant timestamp;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "message_metadata", length = 65535)
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "active_persona_name", length = 200)
    private String activePersonaName;

    @Column(name = "active_persona_image_url", length = 1000)
    private String activePersonaImageUrl;

    @Column(name = "is_beginning_message", nullable = false)
    @Builder.Default
    private boolean beginningMessage = false;

    /**
     * Detached copy for another session with a fresh identity.
     */
    public ChatMessage copyForSession(String sessionId) {
        return ChatMessage.builder()
                .chatSessionId(sessionId)
                .senderType(senderType)
                .content(content)
                .timestamp(timestamp)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .activePersonaName(activePersonaName)
                .activePersonaImageUrl(activePersonaImageUrl)
                .beginningMessage(beginningMessage)
                .build();
    }
}
