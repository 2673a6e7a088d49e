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

import dev.mars.outpost.protocol.ProtocolMessage;
import io.vertx.core.Future;

/**
 * Handle on an agent's persistent connection.
 *
 * <p>The handle is owned by the {@link ConnectionRegistry} for as long as the agent is
 * registered. Implementations must be safe to call from any thread.</p>
 */
public interface AgentConnection {

    /**
     * Unique identifier of this physical connection. Two connections from the same agent
     * have different identifiers.
     */
    String connectionId();

    /**
     * The agent identity established by the registration handshake.
     */
    String agentId();

    String remoteAddress();

    /**
     * Writes a message to the agent.
     *
     * @return a future completed once the frame has been handed to the transport, failed if
     *         the connection is closed
     */
    Future<Void> send(ProtocolMessage message);

    /**
     * Closes the connection. Closing an already closed connection succeeds.
     */
    Future<Void> close(String reason);
}
