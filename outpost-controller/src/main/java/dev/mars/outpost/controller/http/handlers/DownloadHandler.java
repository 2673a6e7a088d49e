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

import dev.mars.outpost.controller.http.ErrorCode;
import dev.mars.outpost.controller.http.OutpostApiException;
import dev.mars.outpost.controller.http.dto.ApiJson;
import dev.mars.outpost.controller.http.dto.DownloadRequest;
import dev.mars.outpost.controller.http.dto.DownloadView;
import dev.mars.outpost.core.TransferSnapshot;
import dev.mars.outpost.transfer.TransferOrchestrator;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * HTTP handler for download operations.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/download}: Pull a file from a connected client</li>
 *   <li>{@code GET /api/downloads}: List all downloads, newest first</li>
 *   <li>{@code GET /api/downloads/:downloadId}: Get a download's progress</li>
 *   <li>{@code DELETE /api/downloads/:downloadId}: Cancel a download</li>
 * </ul>
 *
 * <p>Domain failures are passed to {@code ctx.fail} and rendered by the global error
 * handler.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class DownloadHandler {

    private static final Logger logger = LoggerFactory.getLogger(DownloadHandler.class);

    private final TransferOrchestrator orchestrator;

    public DownloadHandler(TransferOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Handles {@code POST /api/download}.
     */
    public Handler<RoutingContext> handleCreate() {
        return ctx -> {
            try {
                DownloadRequest request = DownloadRequest.fromJson(ctx.body().asJsonObject());
                logger.debug("Download requested: client={}, path={}", request.clientId(), request.filePath());

                orchestrator.create(request.clientId(), request.filePath())
                        .onSuccess(snapshot -> {
                            ctx.response().setStatusCode(201);
                            ctx.json(new JsonObject()
                                    .put("download_id", snapshot.transferId())
                                    .put("client_id", snapshot.agentId())
                                    .put("status", snapshot.status().getValue())
                                    .put("message", "Download request sent to client " + snapshot.agentId()));
                        })
                        .onFailure(ctx::fail);
            } catch (Exception e) {
                ctx.fail(e);
            }
        };
    }

    /**
     * Handles {@code GET /api/downloads}.
     */
    public Handler<RoutingContext> handleList() {
        return ctx -> {
            List<DownloadView> downloads = orchestrator.list().stream()
                    .map(DownloadView::from)
                    .collect(Collectors.toList());
            ctx.json(new JsonObject()
                    .put("downloads", ApiJson.toJsonArray(downloads))
                    .put("total", downloads.size()));
        };
    }

    /**
     * Handles {@code GET /api/downloads/:downloadId}.
     */
    public Handler<RoutingContext> handleGet() {
        return ctx -> {
            String downloadId = ctx.pathParam("downloadId");
            TransferSnapshot snapshot = orchestrator.find(downloadId)
                    .orElseThrow(() -> OutpostApiException.notFound(ErrorCode.TRANSFER_NOT_FOUND, downloadId));
            ctx.json(ApiJson.toJson(DownloadView.from(snapshot)));
        };
    }

    /**
     * Handles {@code DELETE /api/downloads/:downloadId}.
     */
    public Handler<RoutingContext> handleCancel() {
        return ctx -> {
            String downloadId = ctx.pathParam("downloadId");
            orchestrator.cancel(downloadId)
                    .onSuccess(snapshot -> {
                        logger.info("Download {} cancelled by operator", downloadId);
                        ctx.json(ApiJson.toJson(DownloadView.from(snapshot)));
                    })
                    .onFailure(ctx::fail);
        };
    }
}
