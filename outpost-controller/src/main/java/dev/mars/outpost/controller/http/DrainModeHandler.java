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

import io.vertx.core.Handler;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Router gate that turns new work away once the controller starts shutting down.
 *
 * <p>Until {@link #enterDrainMode()} is called every request is passed on. From then on only
 * {@code /health} is routed, so load balancers can still watch the controller wind down.
 * Everything else is answered with {@code 503 SERVICE_SHUTTING_DOWN} and a
 * {@code Retry-After: 30} header:</p>
 * <ul>
 *   <li>{@code /api/*} calls, so no new download is created;</li>
 *   <li>{@code GET /ws} upgrades, refused before they reach the agent socket handler, so an agent
 *       reconnects to another controller instead of registering with one about to close its
 *       socket.</li>
 * </ul>
 *
 * <p>Agent sockets that are already open are not affected; shutdown closes them after in-flight
 * downloads have finished or timed out.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class DrainModeHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(DrainModeHandler.class);

    static final String RETRY_AFTER_SECONDS = "30";

    private static final String HEALTH_PATH = "/health";
    private static final String AGENT_SOCKET_PATH = "/ws";

    private volatile boolean draining;

    @Override
    public void handle(RoutingContext ctx) {
        String path = ctx.request().path();
        if (!draining || isHealthCheck(path)) {
            ctx.next();
            return;
        }

        HttpServerRequest request = ctx.request();
        if (AGENT_SOCKET_PATH.equals(path)) {
            logger.info("Refusing agent socket from {} while draining", request.remoteAddress());
        } else {
            logger.debug("Refusing {} {} while draining", request.method(), path);
        }

        ErrorResponse.withMessage(ErrorCode.SERVICE_SHUTTING_DOWN, path,
                        ErrorCode.SERVICE_SHUTTING_DOWN.messageTemplate(), CorrelationIdHandler.getRequestId(ctx))
                .sendTo(ctx.response().putHeader("Retry-After", RETRY_AFTER_SECONDS));
    }

    /**
     * Starts refusing new downloads and agent sockets. Calling it again has no effect.
     */
    public synchronized void enterDrainMode() {
        if (draining) {
            return;
        }
        draining = true;
        logger.info("Drain mode entered: new downloads and agent sockets are refused, /health stays available");
    }

    public boolean isDraining() {
        return draining;
    }

    static boolean isHealthCheck(String path) {
        return path.equals(HEALTH_PATH) || path.startsWith(HEALTH_PATH + "/");
    }
}
