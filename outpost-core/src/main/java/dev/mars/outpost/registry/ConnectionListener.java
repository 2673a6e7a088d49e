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

package dev.mars.outpost.registry;

/**
 * Receives liveness changes from the {@link ConnectionRegistry}.
 *
 * <p>Callbacks run on the thread that changed the registry and must not block.</p>
 */
public interface ConnectionListener {

    default void onAgentRegistered(String agentId, AgentConnection connection) {
    }

    /**
     * The agent registered again on a new connection; {@code previous} has been closed.
     */
    default void onConnectionReplaced(String agentId, AgentConnection previous, AgentConnection current) {
    }

    /**
     * The agent's connection was removed from the registry.
     */
    default void onAgentDeregistered(String agentId, AgentConnection connection) {
    }
}
