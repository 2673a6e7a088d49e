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

import dev.mars.outpost.controller.http.dto.ApiJson;
import dev.mars.outpost.controller.http.dto.ClientView;
import dev.mars.outpost.core.AgentSnapshot;
import dev.mars.outpost.registry.ConnectionRegistry;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Handles {@code GET /api/clients}: the agents that currently hold a live connection.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ClientListHandler implements Handler<RoutingContext> {

    private final ConnectionRegistry registry;

    public ClientListHandler(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handle(RoutingContext ctx) {
        List<AgentSnapshot> agents = registry.list();
        List<ClientView> clients = agents.stream().map(ClientView::from).collect(Collectors.toList());
        ctx.json(new JsonObject()
                .put("clients", ApiJson.toJsonArray(clients))
                .put("total", clients.size()));
    }
}
