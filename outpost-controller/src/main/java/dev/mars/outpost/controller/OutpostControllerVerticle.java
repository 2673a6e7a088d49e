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

package dev.mars.outpost.controller;

import dev.mars.outpost.config.TransferSettings;
import dev.mars.outpost.controller.config.AppConfig;
import dev.mars.outpost.controller.http.HttpApiServer;
import dev.mars.outpost.controller.lifecycle.ShutdownCoordinator;
import dev.mars.outpost.registry.ConnectionRegistry;
import dev.mars.outpost.transfer.TransferOrchestrator;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main Verticle for the Outpost Controller.
 * Builds the connection registry, the transfer orchestrator and the HTTP server, in that order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class OutpostControllerVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(OutpostControllerVerticle.class);

    private ConnectionRegistry registry;
    private TransferOrchestrator orchestrator;
    private HttpApiServer apiServer;
    private ShutdownCoordinator shutdownCoordinator;

    @Override
    public void start(Promise<Void> startPromise) throws Exception {
        logger.info("Starting OutpostControllerVerticle...");

        AppConfig config = AppConfig.get();
        TransferSettings settings;
        try {
            settings = config.toTransferSettings();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid transfer configuration: {}", e.getMessage());
            startPromise.fail(e);
            return;
        }

        String downloadDir = settings.getDownloadDirectory().toAbsolutePath().toString();
        vertx.fileSystem().mkdirs(downloadDir)
                .compose(v -> {
                    logger.info("Artifacts will be written to {}", downloadDir);

                    this.registry = new ConnectionRegistry();
                    this.orchestrator = new TransferOrchestrator(vertx, registry, settings);
                    orchestrator.start();

                    this.apiServer = new HttpApiServer(vertx, config.getHttpHost(), config.getHttpPort(),
                            registry, orchestrator, config.toEndpointOptions(), config.getVersion());
                    return apiServer.start();
                })
                .onSuccess(v -> {
                    setupShutdownCoordinator(config);
                    logger.info("OutpostControllerVerticle started successfully");
                    startPromise.complete();
                })
                .onFailure(err -> {
                    logger.error("Failed to start OutpostControllerVerticle", err);
                    if (orchestrator != null) {
                        orchestrator.stop();
                    }
                    startPromise.fail(err);
                });
    }

    /**
     * Configures the shutdown coordinator with graceful shutdown hooks.
     *
     * <p>Shutdown sequence:
     * <ol>
     *   <li>DRAIN: reject new API requests and agent sockets</li>
     *   <li>AWAIT: let in-flight transfers finish, bounded by the shutdown timeout</li>
     *   <li>STOP_SERVICES: close agent sockets, then the HTTP server, then the orchestrator</li>
     * </ol>
     */
    private void setupShutdownCoordinator(AppConfig config) {
        long drainTimeoutMs = config.getShutdownDrainTimeoutMs();
        long shutdownTimeoutMs = config.getShutdownTimeoutMs();

        this.shutdownCoordinator = new ShutdownCoordinator(vertx, drainTimeoutMs, shutdownTimeoutMs);

        shutdownCoordinator.onDrain("http-api-drain", () -> apiServer.enterDrainMode());

        shutdownCoordinator.onAwaitIdle("in-flight-transfers", () -> orchestrator.activeCount() == 0);

        // closing a socket deregisters its agent, which fails whatever it was still sending
        shutdownCoordinator.onServiceStop("agent-connections-close", () -> {
            registry.closeAll("server shutting down");
            return Future.succeededFuture();
        });
        shutdownCoordinator.onServiceStop("http-api-stop", () -> apiServer.stop());
        shutdownCoordinator.onServiceStop("transfer-orchestrator-stop", () -> orchestrator.stop());

        logger.info("Shutdown coordinator configured (drain={}ms, timeout={}ms)", drainTimeoutMs, shutdownTimeoutMs);
    }

    @Override
    public void stop(Promise<Void> stopPromise) throws Exception {
        logger.info("Stopping OutpostControllerVerticle...");

        if (shutdownCoordinator != null) {
            shutdownCoordinator.shutdown()
                    .onComplete(ar -> {
                        if (ar.failed()) {
                            logger.warn("Error during graceful shutdown", ar.cause());
                        }
                        logger.info("OutpostControllerVerticle stopped");
                        stopPromise.complete();
                    });
            return;
        }

        Future<Void> httpStopped = apiServer != null ? apiServer.stop() : Future.succeededFuture();
        Future<Void> orchestratorStopped = orchestrator != null ? orchestrator.stop() : Future.succeededFuture();
        Future.all(httpStopped, orchestratorStopped)
                .onComplete(ar -> {
                    logger.info("OutpostControllerVerticle stopped (immediate)");
                    stopPromise.complete();
                });
    }

    /**
     * @return the port the HTTP server is bound to, or -1 before start
     */
    public int actualPort() {
        return apiServer != null ? apiServer.actualPort() : -1;
    }

    ConnectionRegistry registry() {
        return registry;
    }

    TransferOrchestrator orchestrator() {
        return orchestrator;
    }
}
