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
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A user's stored choice of provider, model and credentials for one service.
 * Every field is optional; unset fields fall through to the service defaults.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceBinding {

    @Column(length = 50)
    private String provider;

    @Column(length = 200)
    private String model;

    @Column(name = "api_key", length = 500)
    @ToString.Exclude
    private String apiKey;

    @Column(name = "base_url", length = 500)
    private String baseUrl;

    private Double temperature;

    @Column(name = "max_tokens")
    private Integer maxTokens;

    public static ServiceBinding empty() {
        return new ServiceBinding();
    }
}
