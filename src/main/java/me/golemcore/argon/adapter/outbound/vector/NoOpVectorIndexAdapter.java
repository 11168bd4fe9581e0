package me.golemcore.argon.adapter.outbound.vector;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.argon.domain.model.RetrievedEntry;
import me.golemcore.argon.port.outbound.VectorIndexPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Vector index used when no real index is wired in. Reports itself
 * unavailable and never returns hits.
 */
@Component
@Slf4j
public class NoOpVectorIndexAdapter implements VectorIndexPort {

    @Override
    public CompletableFuture<List<RetrievedEntry>> search(String sessionId, String query, int topK) {
        log.debug("[VectorIndex] No vector index configured, returning no results for session {}", sessionId);
        return CompletableFuture.completedFuture(List.of());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
