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

/**
 * Session-local change to a shared lore entry. The base entry is left
 * untouched.
 */
@Entity
@Table(name = "session_lore_modifications")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionLoreModification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_session_id", nullable = false, length = 36)
    private String chatSessionId;

    @Column(name = "base_lore_entry_id", nullable = false, length = 36)
    private String baseLoreEntryId;

    @Column(name = "field_to_update", nullable = false, length = 100)
    private String fieldToUpdate;

    @Column(name = "new_content_segment", length = 10_000)
    private String newContentSegment;

    @Column(name = "change_reason", length = 2000)
    private String changeReason;
}
