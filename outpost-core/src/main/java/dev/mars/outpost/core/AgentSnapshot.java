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

package dev.mars.outpost.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time view of a registered agent, as returned by the "list clients" query.
 *
 * @param agentId     the agent identifier established by the registration handshake
 * @param liveness    liveness at the time the snapshot was taken
 * @param connectedAt when the current connection registered
 * @param lastSeen    when the last inbound frame was observed on the connection
 */
public record AgentSnapshot(String agentId, AgentLiveness liveness, Instant connectedAt, Instant lastSeen) {

    public AgentSnapshot {
        Objects.requireNonNull(agentId, "agentId cannot be null");
        Objects.requireNonNull(liveness, "liveness cannot be null");
        Objects.requireNonNull(connectedAt, "connectedAt cannot be null");
        Objects.requireNonNull(lastSeen, "lastSeen cannot be null");
    }
}
