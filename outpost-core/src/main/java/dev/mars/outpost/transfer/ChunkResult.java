/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.outpost.transfer;

import io.vertx.core.Future;

/**
 * Outcome of offering a chunk to a transfer.
 *
 * @param applied   whether the chunk was accepted and queued for writing
 * @param reason    why the chunk was rejected, {@code null} when applied
 * @param persisted completes when the chunk's bytes (and, for the last chunk, the artifact
 *                  close) have reached the file system
 */
public record ChunkResult(boolean applied, String reason, Future<Void> persisted) {

    public static ChunkResult applied(Future<Void> persisted) {
        return new ChunkResult(true, null, persisted);
    }

    public static ChunkResult rejected(String reason) {
        return new ChunkResult(false, reason, Future.succeededFuture());
    }
}
