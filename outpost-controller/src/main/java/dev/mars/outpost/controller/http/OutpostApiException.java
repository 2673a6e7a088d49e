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

import java.util.Objects;

/**
 * Raised by a control-plane handler that already knows which {@link ErrorCode} to answer with:
 * a download request body that fails validation, or a download id nobody knows. Failures coming
 * out of the orchestrator keep their domain exception types and are mapped by
 * {@link GlobalErrorHandler}.
 *
 * <pre>{@code
 * TransferSnapshot snapshot = orchestrator.find(downloadId)
 *         .orElseThrow(() -> OutpostApiException.notFound(ErrorCode.TRANSFER_NOT_FOUND, downloadId));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class OutpostApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public OutpostApiException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode cannot be null");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return errorCode.httpStatus();
    }

    /**
     * A 404 whose message is {@code code}'s template filled with {@code args}.
     *
     * @throws IllegalArgumentException if {@code code} does not map to 404
     */
    public static OutpostApiException notFound(ErrorCode code, Object... args) {
        return withStatus(404, code, args);
    }

    /**
     * A 400 whose message is {@code code}'s template filled with {@code args}.
     *
     * @throws IllegalArgumentException if {@code code} does not map to 400
     */
    public static OutpostApiException badRequest(ErrorCode code, Object... args) {
        return withStatus(400, code, args);
    }

    private static OutpostApiException withStatus(int status, ErrorCode code, Object... args) {
        if (code.httpStatus() != status) {
            throw new IllegalArgumentException(code.code() + " maps to " + code.httpStatus() + ", not " + status);
        }
        return new OutpostApiException(code, code.formatMessage(args));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode.code() + "]: " + getMessage();
    }
}
