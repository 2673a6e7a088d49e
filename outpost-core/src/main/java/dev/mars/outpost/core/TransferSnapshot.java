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

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable copy of a transfer record.
 *
 * <p>The orchestrator replaces a transfer's snapshot wholesale on every mutation, so a reader
 * holding a snapshot always sees a consistent combination of status, counters and error.
 * {@code transferId}, {@code agentId}, {@code sourcePath}, {@code artifactPath} and
 * {@code createdAt} are carried over unchanged by every {@code with*} method.</p>
 *
 * @param transferId     opaque unique identifier generated at creation
 * @param agentId        the agent the file is pulled from
 * @param sourcePath     path requested from the agent, interpreted only by the agent
 * @param artifactPath   where the controller writes the received bytes
 * @param status         current lifecycle state
 * @param chunksReceived number of accepted chunks
 * @param bytesReceived  number of accepted payload bytes
 * @param totalSize      size declared by the agent on the final chunk, {@code null} until then
 * @param createdAt      creation time
 * @param completedAt    time the transfer reached a terminal state, {@code null} before
 * @param failureReason  classification of the failure, only set when {@code FAILED}
 * @param error          human-readable failure detail, only set when {@code FAILED}
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record TransferSnapshot(
        String transferId,
        String agentId,
        String sourcePath,
        Path artifactPath,
        TransferStatus status,
        long chunksReceived,
        long bytesReceived,
        Long totalSize,
        Instant createdAt,
        Instant completedAt,
        FailureReason failureReason,
        String error
) {

    public TransferSnapshot {
        Objects.requireNonNull(transferId, "transferId cannot be null");
        Objects.requireNonNull(agentId, "agentId cannot be null");
        Objects.requireNonNull(sourcePath, "sourcePath cannot be null");
        Objects.requireNonNull(artifactPath, "artifactPath cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        if (chunksReceived < 0 || bytesReceived < 0) {
            throw new IllegalArgumentException("counters cannot be negative");
        }
        if ((status == TransferStatus.FAILED) != (failureReason != null)) {
            throw new IllegalArgumentException("failureReason must be set exactly when status is FAILED");
        }
        if (status != TransferStatus.FAILED && error != null) {
            throw new IllegalArgumentException("error is only allowed on FAILED transfers");
        }
    }

    /**
     * Creates the initial record of a new transfer.
     */
    public static TransferSnapshot pending(String transferId, String agentId, String sourcePath,
                                           Path artifactPath, Instant createdAt) {
        return new TransferSnapshot(transferId, agentId, sourcePath, artifactPath, TransferStatus.PENDING,
                0, 0, null, createdAt, null, null, null);
    }

    public TransferSnapshot withStatus(TransferStatus newStatus) {
        return new TransferSnapshot(transferId, agentId, sourcePath, artifactPath, newStatus,
                chunksReceived, bytesReceived, totalSize, createdAt, completedAt, failureReason, error);
    }

    /**
     * Records one more accepted chunk of {@code payloadBytes} bytes.
     */
    public TransferSnapshot withChunk(int payloadBytes) {
        return new TransferSnapshot(transferId, agentId, sourcePath, artifactPath, TransferStatus.IN_PROGRESS,
                chunksReceived + 1, bytesReceived + payloadBytes, totalSize, createdAt, completedAt,
                failureReason, error);
    }

    public TransferSnapshot completed(Instant at) {
        return new TransferSnapshot(transferId, agentId, sourcePath, artifactPath, TransferStatus.COMPLETED,
                chunksReceived, bytesReceived, bytesReceived, createdAt, at, null, null);
    }

    public TransferSnapshot failed(FailureReason reason, String detail, Instant at) {
        Objects.requireNonNull(reason, "reason cannot be null");
        String message = detail == null || detail.isBlank() ? reason.getDescription() : detail;
        return new TransferSnapshot(transferId, agentId, sourcePath, artifactPath, TransferStatus.FAILED,
                chunksReceived, bytesReceived, totalSize, createdAt, at, reason, message);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
