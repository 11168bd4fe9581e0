package me.golemcore.argon.port.outbound.persistence;

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

import me.golemcore.argon.domain.model.Preset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PresetRepository extends JpaRepository<Preset, String> {

    List<Preset> findAllByOrderByNameAsc();

    Optional<Preset> findFirstByDefaultPresetTrueOrderByCreatedAtAsc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Preset p set p.defaultPreset = false where p.defaultPreset = true and p.id <> :presetId")
    int clearDefaultExcept(@Param("presetId") String presetId);
}
