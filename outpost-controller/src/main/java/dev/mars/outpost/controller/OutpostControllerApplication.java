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

import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Entry point for the Outpost Controller.
 *
 * <p>Creates Vert.x, deploys {@link OutpostControllerVerticle} and undeploys it from a JVM
 * shutdown hook so that in-flight transfers get a chance to finish.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class OutpostControllerApplication {

    private static final Logger logger = LoggerFactory.getLogger(OutpostControllerApplication.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 60;

    public static void main(String[] args) {
        Vertx vertx = Vertx.vertx();

        vertx.deployVerticle(new OutpostControllerVerticle())
                .onSuccess(id -> {
                    logger.info("Outpost Controller deployed ({})", id);
                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        logger.info("Shutdown signal received, stopping Outpost Controller...");
                        try {
                            vertx.undeploy(id)
                                    .transform(ar -> vertx.close())
                                    .toCompletionStage().toCompletableFuture()
                                    .get(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } catch (Exception e) {
                            logger.warn("Outpost Controller did not stop cleanly: {}", e.getMessage());
                        }
                    }, "outpost-shutdown"));
                })
                .onFailure(err -> {
                    logger.error("Failed to start Outpost Controller", err);
                    vertx.close();
                    System.exit(1);
                });
    }
}
