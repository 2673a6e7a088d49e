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

import java.util.Arrays;
import java.util.Optional;

/**
 * Standardized error codes for the Outpost HTTP API.
 *
 * <p>Each error code includes:</p>
 * <ul>
 *   <li>A unique string code (e.g., "TRANSFER_NOT_FOUND")</li>
 *   <li>An HTTP status code</li>
 *   <li>A message template for consistent error messages</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ErrorCode {

    // ==================== General Errors (400-499) ====================

    /** Request body is missing or malformed */
    BAD_REQUEST("BAD_REQUEST", 400, "Invalid request: %s"),

    /** Request validation failed */
    VALIDATION_ERROR("VALIDATION_ERROR", 400, "Validation failed: %s"),

    /** Generic resource not found */
    NOT_FOUND("NOT_FOUND", 404, "Resource not found: %s"),

    /** HTTP method not supported for this endpoint */
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", 405, "Method %s not allowed"),

    /** Resource state conflict */
    CONFLICT("CONFLICT", 409, "Conflict: %s"),

    // ==================== Download Errors ====================

    /** Download not found */
    TRANSFER_NOT_FOUND("TRANSFER_NOT_FOUND", 404, "Download '%s' not found"),

    /** Download is in a state that doesn't allow this operation */
    TRANSFER_STATE_CONFLICT("TRANSFER_STATE_CONFLICT", 409, "Download '%s' is in state '%s', cannot %s"),

    // ==================== Client Errors ====================

    /** Client has no live connection */
    AGENT_NOT_CONNECTED("AGENT_NOT_CONNECTED", 404, "Client '%s' is not connected"),

    /** Client already has a download and concurrent downloads are disabled */
    AGENT_BUSY("AGENT_BUSY", 409, "Client '%s' already has download '%s' in progress"),

    // ==================== Server Errors (500+) ====================

    /** Unexpected internal error */
    INTERNAL_ERROR("INTERNAL_ERROR", 500, "Internal server error: %s"),

    /** Service temporarily unavailable */
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", 503, "Service temporarily unavailable: %s"),

    /** Server is draining before shutdown */
    SERVICE_SHUTTING_DOWN("SERVICE_SHUTTING_DOWN", 503, "Server is shutting down"),

    /** Request timeout */
    TIMEOUT("TIMEOUT", 504, "Request timed out: %s");

    private final String code;
    private final int httpStatus;
    private final String messageTemplate;

    ErrorCode(String code, int httpStatus, String messageTemplate) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.messageTemplate = messageTemplate;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Returns the message template (may contain %s placeholders).
     */
    public String messageTemplate() {
        return messageTemplate;
    }

    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    /**
     * Looks up an ErrorCode by its string code.
     */
    public static Optional<ErrorCode> fromCode(String code) {
        return Arrays.stream(values())
            .filter(e -> e.code.equals(code))
            .findFirst();
    }
}
