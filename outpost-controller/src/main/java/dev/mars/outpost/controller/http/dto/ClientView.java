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

package dev.mars.outpost.controller.http.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.outpost.core.AgentSnapshot;

import java.time.Instant;

/**
 * Control-plane rendering of a connected agent.
 */
public record ClientView(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("liveness") String liveness,
        @JsonProperty("connected_at") Instant connectedAt,
        @JsonProperty("last_seen") Instant lastSeen
) {

    public static ClientView from(AgentSnapshot agent) {
        return new ClientView(agent.agentId(), agent.liveness().getValue(), agent.connectedAt(), agent.lastSeen());
    }
}
