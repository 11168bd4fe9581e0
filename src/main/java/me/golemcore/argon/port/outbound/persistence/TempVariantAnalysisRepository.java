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

import me.golemcore.argon.domain.model.TempVariantAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface TempVariantAnalysisRepository extends JpaRepository<TempVariantAnalysis, String> {

    Optional<TempVariantAnalysis> findByVariant_Id(String variantId);

    long countByVariant_Id(String variantId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TempVariantAnalysis a where a.variant.id = :variantId")
    int deleteAllForVariant(@Param("variantId") String variantId);
}
