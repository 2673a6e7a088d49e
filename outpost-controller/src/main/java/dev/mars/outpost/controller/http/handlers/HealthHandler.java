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

package dev.mars.outpost.controller.http.handlers;

import dev.mars.outpost.registry.ConnectionRegistry;
import dev.mars.outpost.transfer.TransferOrchestrator;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.time.Instant;

/**
 * Handles {@code GET /health}: process liveness plus connection and download counts.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class HealthHandler implements Handler<RoutingContext> {

    private final ConnectionRegistry registry;
    private final TransferOrchestrator orchestrator;
    private final String version;

    public HealthHandler(ConnectionRegistry registry, TransferOrchestrator orchestrator, String version) {
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.version = version;
    }

    @Override
    public void handle(RoutingContext ctx) {
        ctx.json(new JsonObject()
                .put("status", "healthy")
                .put("version", version)
                .put("connected_clients", registry.size())
                .put("active_downloads", orchestrator.activeCount())
                .put("timestamp", Instant.now().toString()));
    }
}
