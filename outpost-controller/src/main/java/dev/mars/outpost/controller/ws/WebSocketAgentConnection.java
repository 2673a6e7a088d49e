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

package dev.mars.outpost.controller.ws;

import dev.mars.outpost.protocol.ChunkStreamCodec;
import dev.mars.outpost.protocol.ProtocolMessage;
import dev.mars.outpost.registry.AgentConnection;
import io.vertx.core.Future;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.net.SocketAddress;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * {@link AgentConnection} backed by a server-side WebSocket. Every message is sent as one JSON
 * text frame.
 */
public class WebSocketAgentConnection implements AgentConnection {

    static final short NORMAL_CLOSURE = 1000;
    static final short POLICY_VIOLATION = 1008;
    static final short UNSUPPORTED_DATA = 1003;

    // RFC 6455 limits the close reason to 123 bytes
    private static final int MAX_CLOSE_REASON_BYTES = 123;

    private final String connectionId = UUID.randomUUID().toString();
    private final ServerWebSocket socket;
    private final ChunkStreamCodec codec;
    private final String remoteAddress;
    private volatile String agentId;

    public WebSocketAgentConnection(ServerWebSocket socket, ChunkStreamCodec codec) {
        this.socket = socket;
        this.codec = codec;
        SocketAddress address = socket.remoteAddress();
        this.remoteAddress = address != null ? address.toString() : "unknown";
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    /**
     * @return the registered agent id, or {@code null} before the handshake
     */
    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    boolean isRegistered() {
        return agentId != null;
    }

    void bind(String agentId) {
        this.agentId = agentId;
    }

    @Override
    public Future<Void> send(ProtocolMessage message) {
        if (socket.isClosed()) {
            return Future.failedFuture("connection to client " + agentId + " is closed");
        }
        return socket.writeTextMessage(codec.encode(message));
    }

    @Override
    public Future<Void> close(String reason) {
        return close(NORMAL_CLOSURE, reason);
    }

    Future<Void> close(short code, String reason) {
        if (socket.isClosed()) {
            return Future.succeededFuture();
        }
        return socket.close(code, truncate(reason));
    }

    static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        byte[] bytes = reason.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= MAX_CLOSE_REASON_BYTES) {
            return reason;
        }
        String cut = new String(bytes, 0, MAX_CLOSE_REASON_BYTES, StandardCharsets.UTF_8);
        // a multi-byte character split at the boundary decodes to U+FFFD
        while (cut.getBytes(StandardCharsets.UTF_8).length > MAX_CLOSE_REASON_BYTES) {
            cut = cut.substring(0, cut.length() - 1);
        }
        return cut;
    }

    @Override
    public String toString() {
        return "WebSocketAgentConnection{" + "id=" + connectionId + ", agent=" + agentId
                + ", remote=" + remoteAddress + '}';
    }
}
