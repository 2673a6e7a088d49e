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

import dev.mars.outpost.core.TransferSnapshot;
import dev.mars.outpost.registry.AgentConnection;

import java.time.Instant;

/**
 * Mutable bookkeeping for one transfer. Only the orchestrator's context writes to it; the
 * snapshot is published through a volatile field so status reads need no lock.
 */
final class TransferSession {

    final AgentConnection connection;
    final ChunkReassembler reassembler;

    volatile TransferSnapshot snapshot;
    Instant lastActivity;
    boolean finalizing;

    TransferSession(TransferSnapshot snapshot, AgentConnection connection, ChunkReassembler reassembler) {
        this.snapshot = snapshot;
        this.connection = connection;
        this.reassembler = reassembler;
        this.lastActivity = snapshot.createdAt();
    }

    String transferId() {
        return snapshot.transferId();
    }

    String agentId() {
        return snapshot.agentId();
    }

    boolean isBoundTo(AgentConnection other) {
        return connection == other;
    }
}
