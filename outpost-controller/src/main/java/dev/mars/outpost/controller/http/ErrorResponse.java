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

import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Objects;

/**
 * Body of every error the control plane returns, whether it comes from a handler, the router or
 * drain mode.
 *
 * <pre>{@code
 * {
 *   "error": {
 *     "code": "AGENT_NOT_CONNECTED",
 *     "message": "Client 'restaurant-999' is not connected",
 *     "timestamp": "2026-03-02T10:00:00Z",
 *     "path": "/api/download",
 *     "requestId": "req-1a2b3c4d"
 *   }
 * }
 * }</pre>
 *
 * <p>{@code requestId} is the {@code X-Request-ID} of the response, so a failed download request
 * can be found in the controller log. A missing timestamp is set to now and a missing request
 * id is generated.</p>
 *
 * @param code      {@link ErrorCode#code()} of the failure
 * @param message   text shown to the caller
 * @param timestamp when the error was produced
 * @param path      request path, omitted from the JSON when {@code null}
 * @param requestId correlation id
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record ErrorResponse(String code, String message, Instant timestamp, String path, String requestId) {

    public ErrorResponse {
        Objects.requireNonNull(code, "code cannot be null");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (requestId == null || requestId.isBlank()) {
            requestId = CorrelationIdHandler.newRequestId();
        }
    }

    public static ErrorResponse withMessage(ErrorCode code, String path, String message, String requestId) {
        return new ErrorResponse(code.code(), message, null, path, requestId);
    }

    /**
     * Builds the message from the code's template.
     */
    public static ErrorResponse of(ErrorCode code, String path, Object... messageArgs) {
        return new ErrorResponse(code.code(), code.formatMessage(messageArgs), null, path, null);
    }

    /**
     * Uses the exception's message, or the code's template when it has none.
     */
    public static ErrorResponse fromException(ErrorCode code, Throwable cause, String path, String requestId) {
        String message = cause.getMessage();
        return withMessage(code, path, message != null ? message : code.messageTemplate(), requestId);
    }

    /**
     * Status for {@link #code}; 500 when the code is unknown.
     */
    public int httpStatus() {
        return ErrorCode.fromCode(code).map(ErrorCode::httpStatus).orElse(500);
    }

    public JsonObject toJson() {
        JsonObject error = new JsonObject()
                .put("code", code)
                .put("message", message)
                .put("timestamp", timestamp.toString());
        if (path != null) {
            error.put("path", path);
        }
        error.put("requestId", requestId);
        return new JsonObject().put("error", error);
    }

    /**
     * Ends {@code response} with this error unless something was already written.
     */
    public void sendTo(HttpServerResponse response) {
        if (response.ended()) {
            return;
        }
        response.setStatusCode(httpStatus())
                .putHeader("Content-Type", "application/json")
                .end(toJson().encode());
    }
}
