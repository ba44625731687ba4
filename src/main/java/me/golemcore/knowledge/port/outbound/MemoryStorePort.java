package me.golemcore.knowledge.port.outbound;

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

import me.golemcore.knowledge.domain.model.MemoryQuery;
import me.golemcore.knowledge.domain.model.MemoryResponse;
import me.golemcore.knowledge.domain.model.MemoryUpdate;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the dual fast/slow memory store kept in sync by the event pipeline.
 *
 * <p>
 * System 1 holds fast, pattern-like memories (past interactions, code and team
 * patterns). System 2 holds deliberate state (reasoning traces, current mode).
 * Implementations may reject an update by completing the future exceptionally.
 */
public interface MemoryStorePort {

    /**
     * Apply an update to the fast pattern memory.
     */
    CompletableFuture<Void> updateSystem1(MemoryUpdate update);

    /**
     * Apply an update to the deliberate reasoning memory.
     */
    CompletableFuture<Void> updateSystem2(MemoryUpdate update);

    /**
     * Query stored memories.
     */
    CompletableFuture<MemoryResponse> query(MemoryQuery query);
}
