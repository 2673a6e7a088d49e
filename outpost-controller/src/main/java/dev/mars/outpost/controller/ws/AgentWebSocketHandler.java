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

import dev.mars.outpost.core.exceptions.ProtocolException;
import dev.mars.outpost.protocol.ChunkStreamCodec;
import dev.mars.outpost.protocol.ErrorMessage;
import dev.mars.outpost.protocol.FileChunkMessage;
import dev.mars.outpost.protocol.ProtocolMessage;
import dev.mars.outpost.protocol.RegisterMessage;
import dev.mars.outpost.protocol.RegisteredMessage;
import dev.mars.outpost.registry.ConnectionRegistry;
import dev.mars.outpost.transfer.ChunkResult;
import dev.mars.outpost.transfer.TransferOrchestrator;
import io.vertx.core.Context;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Upgrades {@code GET /ws} to the agent data plane and runs one message loop per socket.
 *
 * <p>The first frame must be {@code register}; anything else, or silence past the handshake
 * timeout, closes the socket with 1008. Once registered, chunk and error frames are handed to
 * the {@link TransferOrchestrator}, every inbound frame refreshes the agent's last-seen time,
 * and the socket is pinged periodically. Reading pauses while a chunk is waiting for its write,
 * so at most one chunk per download is held in memory.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class AgentWebSocketHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(AgentWebSocketHandler.class);

    private final Vertx vertx;
    private final ConnectionRegistry registry;
    private final TransferOrchestrator orchestrator;
    private final ChunkStreamCodec codec;
    private final AgentEndpointOptions options;

    public AgentWebSocketHandler(Vertx vertx, ConnectionRegistry registry, TransferOrchestrator orchestrator,
                                 ChunkStreamCodec codec, AgentEndpointOptions options) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    @Override
    public void handle(RoutingContext ctx) {
        ctx.request().toWebSocket()
                .onSuccess(this::accept)
                .onFailure(err -> logger.warn("WebSocket upgrade from {} failed: {}",
                        ctx.request().remoteAddress(), err.getMessage()));
    }

    void accept(ServerWebSocket socket) {
        new AgentSession(socket).start();
    }

    /**
     * Message loop of one agent socket. All callbacks run on the socket's context.
     */
    private final class AgentSession {

        private final ServerWebSocket socket;
        private final WebSocketAgentConnection connection;
        private final Context context;
        private long handshakeTimerId = -1;
        private long pingTimerId = -1;
        private final ChunkWriteGate writeGate;

        AgentSession(ServerWebSocket socket) {
            this.socket = socket;
            this.connection = new WebSocketAgentConnection(socket, codec);
            this.context = vertx.getOrCreateContext();
            this.writeGate = new ChunkWriteGate(socket::pause, socket::resume);
        }

        void start() {
            logger.debug("Agent socket opened from {}", connection.remoteAddress());
            handshakeTimerId = vertx.setTimer(options.handshakeTimeout().toMillis(), id -> {
                handshakeTimerId = -1;
                if (!connection.isRegistered()) {
                    logger.warn("Socket from {} did not register within {}ms, closing",
                            connection.remoteAddress(), options.handshakeTimeout().toMillis());
                    connection.close(WebSocketAgentConnection.POLICY_VIOLATION, "registration timeout");
                }
            });
            socket.textMessageHandler(this::onFrame);
            socket.binaryMessageHandler(this::onBinaryFrame);
            socket.pongHandler(pong -> touch());
            socket.exceptionHandler(err -> logger.warn("Socket error on {}: {}", connection, err.getMessage()));
            socket.closeHandler(v -> onClose());
        }

        private void onFrame(String frame) {
            ProtocolMessage message;
            try {
                message = codec.decode(frame);
            } catch (ProtocolException e) {
                onUndecodableFrame(e);
                return;
            }

            if (!connection.isRegistered()) {
                onHandshake(message);
                return;
            }

            touch();
            if (message instanceof FileChunkMessage chunk) {
                onChunk(chunk);
            } else if (message instanceof ErrorMessage error) {
                logger.warn("Client {} reported an error for download {}: {}",
                        connection.agentId(), error.downloadId(), error.message());
                orchestrator.onAgentError(connection, error);
            } else if (message instanceof RegisterMessage register) {
                if (!register.clientId().equals(connection.agentId())) {
                    logger.warn("Client {} tried to re-register as {}, closing", connection.agentId(), register.clientId());
                    connection.close(WebSocketAgentConnection.POLICY_VIOLATION, "client id cannot change");
                } else {
                    logger.debug("Ignoring repeated registration from client {}", connection.agentId());
                }
            } else {
                logger.warn("Ignoring unexpected '{}' frame from client {}",
                        message.getClass().getSimpleName(), connection.agentId());
            }
        }

        private void onHandshake(ProtocolMessage message) {
            if (!(message instanceof RegisterMessage register)) {
                logger.warn("First frame from {} was not a registration, closing", connection.remoteAddress());
                connection.close(WebSocketAgentConnection.POLICY_VIOLATION, "expected register");
                return;
            }
            cancelHandshakeTimer();
            String agentId = register.clientId().strip();
            connection.bind(agentId);
            try {
                registry.register(agentId, connection);
            } catch (IllegalStateException e) {
                logger.warn("Rejecting registration of {}: {}", agentId, e.getMessage());
                connection.close(WebSocketAgentConnection.POLICY_VIOLATION, "registration rejected");
                return;
            }
            connection.send(new RegisteredMessage(agentId, "Registered successfully"))
                    .onFailure(err -> logger.warn("Could not acknowledge registration of {}: {}", agentId, err.getMessage()));
            long pingMs = options.pingInterval().toMillis();
            pingTimerId = vertx.setPeriodic(pingMs, pingMs, id -> socket.writePing(Buffer.buffer("ping"))
                    .onFailure(err -> logger.debug("Ping to client {} failed: {}", agentId, err.getMessage())));
        }

        private void onChunk(FileChunkMessage chunk) {
            String downloadId = chunk.downloadId();
            writeGate.track(downloadId);
            orchestrator.onChunk(connection, chunk)
                    .compose(ChunkResult::persisted)
                    .onComplete(ar -> context.runOnContext(v -> writeGate.settle(downloadId)));
        }

        private void onUndecodableFrame(ProtocolException e) {
            if (!connection.isRegistered()) {
                logger.warn("Undecodable frame from unregistered socket {}: {}", connection.remoteAddress(), e.getMessage());
                connection.close(WebSocketAgentConnection.POLICY_VIOLATION, "expected register");
                return;
            }
            touch();
            if (e.getTransferId().isPresent()) {
                orchestrator.onProtocolViolation(connection, e.getTransferId().get(), e.getMessage());
            } else {
                logger.warn("Dropping undecodable frame from client {}: {}", connection.agentId(), e.getMessage());
            }
        }

        private void onBinaryFrame(Buffer buffer) {
            logger.warn("Binary frame from {} is not supported, closing", connection);
            connection.close(WebSocketAgentConnection.UNSUPPORTED_DATA, "binary frames are not supported");
        }

        private void touch() {
            if (connection.isRegistered()) {
                registry.touch(connection.agentId());
            }
        }

        private void onClose() {
            cancelHandshakeTimer();
            if (pingTimerId >= 0) {
                vertx.cancelTimer(pingTimerId);
                pingTimerId = -1;
            }
            if (connection.isRegistered()) {
                registry.deregister(connection.agentId(), connection);
            } else {
                logger.debug("Unregistered socket from {} closed", connection.remoteAddress());
            }
        }

        private void cancelHandshakeTimer() {
            if (handshakeTimerId >= 0) {
                vertx.cancelTimer(handshakeTimerId);
                handshakeTimerId = -1;
            }
        }
    }
}
