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

import dev.mars.outpost.core.exceptions.AgentBusyException;
import dev.mars.outpost.core.exceptions.AgentNotConnectedException;
import dev.mars.outpost.core.exceptions.InvalidTransitionException;
import dev.mars.outpost.core.exceptions.TransferNotFoundException;
import io.vertx.core.Handler;
import io.vertx.core.json.DecodeException;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global error handler for the HTTP API.
 *
 * <p>Catches all unhandled exceptions and converts them to standardized {@link ErrorResponse}
 * JSON responses.</p>
 *
 * <p>Exception mapping:</p>
 * <ul>
 *   <li>{@link OutpostApiException} → uses the exception's error code</li>
 *   <li>{@link AgentNotConnectedException} → 404 AGENT_NOT_CONNECTED</li>
 *   <li>{@link AgentBusyException} → 409 AGENT_BUSY</li>
 *   <li>{@link TransferNotFoundException} → 404 TRANSFER_NOT_FOUND</li>
 *   <li>{@link InvalidTransitionException} → 409 TRANSFER_STATE_CONFLICT</li>
 *   <li>{@link IllegalArgumentException} → 400 VALIDATION_ERROR</li>
 *   <li>{@link DecodeException} → 400 BAD_REQUEST (JSON parsing)</li>
 *   <li>All others → 500 INTERNAL_ERROR</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class GlobalErrorHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @Override
    public void handle(RoutingContext ctx) {
        Throwable failure = ctx.failure();
        String path = ctx.request().path();
        int statusCode = ctx.statusCode();
        String requestId = CorrelationIdHandler.getRequestId(ctx);

        ErrorResponse errorResponse;

        if (failure == null) {
            // No exception, just a status code (e.g., 404 from router)
            errorResponse = mapStatusCodeToError(statusCode, path, requestId);
        } else if (failure instanceof OutpostApiException apiEx) {
            errorResponse = ErrorResponse.withMessage(apiEx.getErrorCode(), path, apiEx.getMessage(), requestId);
            logError(apiEx.getErrorCode(), failure, path);
        } else if (failure instanceof AgentNotConnectedException notConnected) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.AGENT_NOT_CONNECTED, path,
                    ErrorCode.AGENT_NOT_CONNECTED.formatMessage(notConnected.getAgentId()), requestId);
            logError(ErrorCode.AGENT_NOT_CONNECTED, failure, path);
        } else if (failure instanceof AgentBusyException busy) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.AGENT_BUSY, path,
                    ErrorCode.AGENT_BUSY.formatMessage(busy.getAgentId(), busy.getActiveTransferId()), requestId);
            logError(ErrorCode.AGENT_BUSY, failure, path);
        } else if (failure instanceof TransferNotFoundException notFound) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.TRANSFER_NOT_FOUND, path,
                    ErrorCode.TRANSFER_NOT_FOUND.formatMessage(notFound.getTransferId()), requestId);
            logError(ErrorCode.TRANSFER_NOT_FOUND, failure, path);
        } else if (failure instanceof InvalidTransitionException invalid) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.TRANSFER_STATE_CONFLICT, path,
                    ErrorCode.TRANSFER_STATE_CONFLICT.formatMessage(invalid.getTransferId(),
                            invalid.getCurrentState(), "cancel"), requestId);
            logError(ErrorCode.TRANSFER_STATE_CONFLICT, failure, path);
        } else if (failure instanceof DecodeException) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, path, "Invalid JSON: " + failure.getMessage(), requestId);
            logError(ErrorCode.BAD_REQUEST, failure, path);
        } else if (failure instanceof IllegalArgumentException) {
            errorResponse = ErrorResponse.fromException(ErrorCode.VALIDATION_ERROR, failure, path, requestId);
            logError(ErrorCode.VALIDATION_ERROR, failure, path);
        } else {
            // Generic server error - don't expose internal details
            errorResponse = ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path, "An unexpected error occurred", requestId);
            logger.error("Unhandled exception at path {}: {}", path, failure.getMessage(), failure);
        }

        errorResponse.sendTo(ctx.response());
    }

    /**
     * Maps HTTP status codes (from router) to appropriate ErrorResponse.
     */
    private ErrorResponse mapStatusCodeToError(int statusCode, String path, String requestId) {
        return switch (statusCode) {
            case 400 -> ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, path, "Bad request", requestId);
            case 404 -> ErrorResponse.withMessage(ErrorCode.NOT_FOUND, path, ErrorCode.NOT_FOUND.formatMessage(path), requestId);
            case 405 -> ErrorResponse.withMessage(ErrorCode.METHOD_NOT_ALLOWED, path, ErrorCode.METHOD_NOT_ALLOWED.formatMessage("unknown"), requestId);
            case 409 -> ErrorResponse.withMessage(ErrorCode.CONFLICT, path, "Resource conflict", requestId);
            case 413 -> ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, path, "Request body too large", requestId);
            case 503 -> ErrorResponse.withMessage(ErrorCode.SERVICE_UNAVAILABLE, path, "Service unavailable", requestId);
            case 504 -> ErrorResponse.withMessage(ErrorCode.TIMEOUT, path, "Request timeout", requestId);
            default -> ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path, "Error " + statusCode, requestId);
        };
    }

    /**
     * Logs the error with appropriate level based on status code.
     * The correlation ID is included via SLF4J MDC (set by {@link CorrelationIdHandler}).
     */
    private void logError(ErrorCode code, Throwable failure, String path) {
        if (code.httpStatus() >= 500) {
            logger.error("Server error [{}] at {}: {}", code.code(), path, failure.getMessage(), failure);
        } else {
            logger.warn("Client error [{}] at {}: {}", code.code(), path, failure.getMessage());
        }
    }
}
