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

package dev.mars.outpost.agent.connection;

import dev.mars.outpost.agent.config.AgentSettings;
import dev.mars.outpost.agent.service.FileStreamService;
import dev.mars.outpost.core.exceptions.ProtocolException;
import dev.mars.outpost.protocol.CancelMessage;
import dev.mars.outpost.protocol.ChunkStreamCodec;
import dev.mars.outpost.protocol.DownloadRequestMessage;
import dev.mars.outpost.protocol.ProtocolMessage;
import dev.mars.outpost.protocol.RegisterMessage;
import dev.mars.outpost.protocol.RegisteredMessage;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;

/**
 * The agent's single outbound WebSocket to the server.
 *
 * <p>Connects, registers, and dispatches server frames: {@code download_request} starts a
 * stream, {@code cancel} stops one. When the socket closes or cannot be opened, a new attempt
 * is scheduled after the reconnect delay until {@link #stop()} is called.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ServerConnection {

    private static final Logger logger = LoggerFactory.getLogger(ServerConnection.class);

    private final Vertx vertx;
    private final AgentSettings settings;
    private final FileStreamService streams;
    private final ChunkStreamCodec codec = new ChunkStreamCodec();
    private final WebSocketClient client;

    private volatile WebSocket socket;
    private volatile boolean registered;
    private volatile boolean stopped;
    private long reconnectTimerId = -1;
    private int connectAttempts;

    public ServerConnection(Vertx vertx, AgentSettings settings, FileStreamService streams) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.streams = Objects.requireNonNull(streams, "streams cannot be null");
        this.client = vertx.createWebSocketClient(new WebSocketClientOptions()
                .setMaxFrameSize(settings.getMaxFrameSize())
                .setMaxMessageSize(settings.getMaxFrameSize()));
    }

    /**
     * Makes the first connection attempt. Failures are retried in the background, so the
     * returned future reports only the outcome of this first attempt.
     */
    public Future<Void> start() {
        return connect();
    }

    public boolean isConnected() {
        WebSocket current = socket;
        return current != null && !current.isClosed();
    }

    public boolean isRegistered() {
        return registered && isConnected();
    }

    /**
     * Closes the socket and stops reconnecting. Idempotent.
     */
    public Future<Void> stop() {
        if (stopped) {
            return Future.succeededFuture();
        }
        stopped = true;
        if (reconnectTimerId >= 0) {
            vertx.cancelTimer(reconnectTimerId);
            reconnectTimerId = -1;
        }
        streams.cancelAll("agent shutting down");
        WebSocket current = socket;
        Future<Void> closed = current != null && !current.isClosed()
                ? current.close((short) 1000, "agent shutting down")
                : Future.succeededFuture();
        return closed
                .recover(err -> {
                    logger.debug("Closing socket failed: {}", err.getMessage());
                    return Future.succeededFuture();
                })
                .compose(v -> client.close());
    }

    private Future<Void> connect() {
        if (stopped) {
            return Future.succeededFuture();
        }
        URI uri = settings.getWebSocketUri();
        boolean ssl = "wss".equals(uri.getScheme());
        int port = uri.getPort() > 0 ? uri.getPort() : (ssl ? 443 : 80);
        WebSocketConnectOptions options = new WebSocketConnectOptions()
                .setHost(uri.getHost())
                .setPort(port)
                .setSsl(ssl)
                .setURI(uri.getRawPath());

        connectAttempts++;
        logger.info("Connecting to {} as {} (attempt {})", uri, settings.getAgentId(), connectAttempts);
        return client.connect(options)
                .onSuccess(this::onConnected)
                .onFailure(err -> {
                    logger.warn("Connection to {} failed: {}", uri, err.getMessage());
                    scheduleReconnect();
                })
                .mapEmpty();
    }

    private void onConnected(WebSocket ws) {
        if (stopped) {
            ws.close();
            return;
        }
        this.socket = ws;
        this.registered = false;
        ws.textMessageHandler(this::onFrame);
        ws.exceptionHandler(err -> logger.warn("Socket error: {}", err.getMessage()));
        ws.closeHandler(v -> onClosed(ws));
        ws.writeTextMessage(codec.encode(new RegisterMessage(settings.getAgentId())))
                .onSuccess(v -> logger.info("Connected to server, registering as {}", settings.getAgentId()))
                .onFailure(err -> {
                    // the close handler schedules the reconnect
                    logger.warn("Could not send registration: {}", err.getMessage());
                    ws.close();
                });
    }

    private void onFrame(String frame) {
        ProtocolMessage message;
        try {
            message = codec.decode(frame);
        } catch (ProtocolException e) {
            logger.warn("Dropping undecodable frame from server: {}", e.getMessage());
            return;
        }

        if (message instanceof RegisteredMessage ack) {
            registered = true;
            connectAttempts = 0;
            logger.info("Registered with server as {}: {}", ack.clientId(), ack.message());
        } else if (message instanceof DownloadRequestMessage request) {
            WebSocket ws = socket;
            streams.stream(request, out -> send(ws, out))
                    .onFailure(err -> logger.debug("Stream {} ended without completing: {}",
                            request.downloadId(), err.getMessage()));
        } else if (message instanceof CancelMessage cancel) {
            streams.cancel(cancel.downloadId(), cancel.reason());
        } else {
            logger.warn("Ignoring unexpected '{}' frame from server", message.getClass().getSimpleName());
        }
    }

    private Future<Void> send(WebSocket ws, ProtocolMessage message) {
        if (ws == null || ws.isClosed()) {
            return Future.failedFuture("connection to server is closed");
        }
        return ws.writeTextMessage(codec.encode(message));
    }

    private void onClosed(WebSocket ws) {
        if (socket != ws) {
            return;
        }
        registered = false;
        logger.warn("Connection to server closed (code {}, reason {})", ws.closeStatusCode(), ws.closeReason());
        streams.cancelAll("connection closed");
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (stopped) {
            return;
        }
        long delayMs = settings.getReconnectDelay().toMillis();
        logger.info("Reconnecting in {}ms", delayMs);
        reconnectTimerId = vertx.setTimer(delayMs, id -> {
            reconnectTimerId = -1;
            connect();
        });
    }
}
