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

package dev.mars.outpost.controller.http;

import dev.mars.outpost.controller.http.handlers.ClientListHandler;
import dev.mars.outpost.controller.http.handlers.DownloadHandler;
import dev.mars.outpost.controller.http.handlers.HealthHandler;
import dev.mars.outpost.controller.ws.AgentEndpointOptions;
import dev.mars.outpost.controller.ws.AgentWebSocketHandler;
import dev.mars.outpost.protocol.ChunkStreamCodec;
import dev.mars.outpost.registry.ConnectionRegistry;
import dev.mars.outpost.transfer.TransferOrchestrator;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server hosting both the control plane ({@code /health}, {@code /api/*}) and the agent
 * data plane ({@code /ws}).
 *
 * <p>Middleware order: correlation id, drain mode, then the body handler for {@code /api/*}
 * only, since consuming the body would break the WebSocket upgrade.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class HttpApiServer {

    private static final Logger logger = LoggerFactory.getLogger(HttpApiServer.class);

    private static final long MAX_BODY_SIZE = 64 * 1024;

    private final Vertx vertx;
    private final String host;
    private final int port;
    private final ConnectionRegistry registry;
    private final TransferOrchestrator orchestrator;
    private final AgentEndpointOptions endpointOptions;
    private final String version;
    private final DrainModeHandler drainModeHandler = new DrainModeHandler();
    private HttpServer httpServer;

    public HttpApiServer(Vertx vertx, String host, int port, ConnectionRegistry registry,
                         TransferOrchestrator orchestrator, AgentEndpointOptions endpointOptions, String version) {
        this.vertx = vertx;
        this.host = host;
        this.port = port;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.endpointOptions = endpointOptions;
        this.version = version;
    }

    public Future<Void> start() {
        Router router = Router.router(vertx);

        router.route().handler(new CorrelationIdHandler());
        router.route().handler(drainModeHandler);
        router.route("/api/*").handler(BodyHandler.create().setBodyLimit(MAX_BODY_SIZE));

        router.get("/ws").handler(new AgentWebSocketHandler(vertx, registry, orchestrator,
                new ChunkStreamCodec(), endpointOptions));

        router.get("/health").handler(new HealthHandler(registry, orchestrator, version));
        router.get("/api/clients").handler(new ClientListHandler(registry));

        DownloadHandler downloads = new DownloadHandler(orchestrator);
        router.post("/api/download").handler(downloads.handleCreate());
        router.get("/api/downloads").handler(downloads.handleList());
        router.get("/api/downloads/:downloadId").handler(downloads.handleGet());
        router.delete("/api/downloads/:downloadId").handler(downloads.handleCancel());

        GlobalErrorHandler errorHandler = new GlobalErrorHandler();
        router.route().failureHandler(errorHandler);
        router.errorHandler(404, errorHandler);
        router.errorHandler(405, errorHandler);

        HttpServerOptions options = new HttpServerOptions()
                .setHost(host)
                .setPort(port)
                .setMaxWebSocketFrameSize(endpointOptions.maxFrameSize())
                .setMaxWebSocketMessageSize(endpointOptions.maxFrameSize());

        httpServer = vertx.createHttpServer(options).requestHandler(router);

        return httpServer.listen()
                .onSuccess(server -> logger.info("HTTP API Server listening on {}:{}", host, server.actualPort()))
                .onFailure(err -> logger.error("Failed to start HTTP API Server", err))
                .mapEmpty();
    }

    /**
     * @return the bound port, useful when the server was started on port 0
     */
    public int actualPort() {
        return httpServer != null ? httpServer.actualPort() : port;
    }

    /**
     * Stops accepting new API requests and agent sockets. {@code /health} keeps answering.
     * Idempotent.
     */
    public Future<Void> enterDrainMode() {
        drainModeHandler.enterDrainMode();
        return Future.succeededFuture();
    }

    public boolean isDraining() {
        return drainModeHandler.isDraining();
    }

    public Future<Void> stop() {
        if (httpServer != null) {
            return httpServer.close()
                    .onSuccess(v -> logger.info("HTTP API Server stopped"));
        }
        return Future.succeededFuture();
    }
}
