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

package dev.mars.outpost.agent;

import dev.mars.outpost.agent.config.AgentConfig;
import dev.mars.outpost.agent.config.AgentSettings;
import dev.mars.outpost.agent.connection.ServerConnection;
import dev.mars.outpost.agent.service.FileStreamService;
import dev.mars.outpost.agent.service.PathExpander;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main class for the Outpost Agent.
 *
 * <p>The agent runs next to the files, behind NAT, and keeps one outbound WebSocket open to
 * the server. It never listens on a port: downloads are requested over that socket and the
 * file is streamed back over it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class OutpostAgent {

    private static final Logger logger = LoggerFactory.getLogger(OutpostAgent.class);

    private final Vertx vertx;
    private final AgentSettings settings;
    private final FileStreamService streamService;
    private final ServerConnection connection;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public OutpostAgent(Vertx vertx, AgentSettings settings) {
        this(vertx, settings, PathExpander.system());
    }

    public OutpostAgent(Vertx vertx, AgentSettings settings, PathExpander expander) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.settings = Objects.requireNonNull(settings, "AgentSettings cannot be null");
        this.streamService = new FileStreamService(vertx, settings.getChunkSize(), expander);
        this.connection = new ServerConnection(vertx, settings, streamService);
        logger.info("Outpost Agent initialized: {}", settings.getAgentId());
    }

    public static void main(String[] args) {
        logger.info("Starting Outpost Agent...");

        AgentSettings settings;
        try {
            settings = AgentConfig.get().toSettings(args);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            logger.error("Usage: outpost-agent --client-id <id> [--server <url>] [--chunk-size <bytes>]");
            System.exit(2);
            return;
        }

        Vertx vertx = Vertx.vertx();
        OutpostAgent agent = new OutpostAgent(vertx, settings);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            try {
                agent.shutdown()
                        .transform(ar -> vertx.close())
                        .toCompletionStage().toCompletableFuture()
                        .get(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                logger.warn("Agent did not stop cleanly: {}", e.getMessage());
            }
        }, "outpost-agent-shutdown"));

        agent.start();
        try {
            agent.awaitShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Outpost Agent stopped");
    }

    /**
     * Opens the connection to the server. A failed first attempt is logged and retried in the
     * background, so the returned future only reflects that first attempt.
     */
    public Future<Void> start() {
        if (closed.get()) {
            throw new IllegalStateException("Agent is closed, cannot start");
        }
        running = true;
        logger.info("Outpost Agent {} connecting to {}", settings.getAgentId(), settings.getWebSocketUri());
        return connection.start();
    }

    /**
     * Stops streaming, closes the connection and stops reconnecting. Idempotent.
     */
    public Future<Void> shutdown() {
        if (closed.getAndSet(true)) {
            logger.info("Agent already closed, skipping shutdown");
            return Future.succeededFuture();
        }
        logger.info("Shutting down Outpost Agent...");
        running = false;
        return connection.stop()
                .onComplete(ar -> {
                    if (ar.failed()) {
                        logger.warn("Error during shutdown: {}", ar.cause().getMessage());
                    }
                    logger.info("Outpost Agent shutdown complete");
                    shutdownLatch.countDown();
                });
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isRegistered() {
        return connection.isRegistered();
    }

    public int activeStreams() {
        return streamService.activeCount();
    }

    public AgentSettings getSettings() {
        return settings;
    }
}
