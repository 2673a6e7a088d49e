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

package dev.mars.outpost.core;

/**
 * Why a transfer ended in {@link TransferStatus#FAILED}.
 *
 * <p>Each reason has a stable machine-readable code, exposed to the control plane as
 * {@code error_code}, and a default human-readable description used when no more specific
 * detail is available.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum FailureReason {

    /** The agent's connection dropped while the transfer was in flight. */
    AGENT_DISCONNECTED("AGENT_DISCONNECTED", "agent disconnected"),

    /** The agent opened a new connection, invalidating transfers on the old one. */
    CONNECTION_REPLACED("CONNECTION_REPLACED", "connection replaced"),

    /** Out-of-order, duplicate, oversized or malformed chunk, or a short end of stream. */
    PROTOCOL_VIOLATION("PROTOCOL_VIOLATION", "protocol violation"),

    /** No chunk arrived within the configured inactivity timeout. */
    INACTIVITY_TIMEOUT("INACTIVITY_TIMEOUT", "inactivity timeout"),

    /** The destination artifact could not be opened, written, flushed or closed. */
    ARTIFACT_WRITE_FAILURE("ARTIFACT_WRITE_FAILURE", "artifact write failure"),

    /** The agent sent an explicit error/abort message. */
    AGENT_ERROR("AGENT_ERROR", "agent reported an error"),

    /** The download request could not be handed to the agent's connection. */
    DISPATCH_FAILED("DISPATCH_FAILED", "dispatch failed"),

    /** An operator cancelled the transfer. */
    CANCELLED("CANCELLED", "cancelled");

    private final String code;
    private final String description;

    FailureReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
