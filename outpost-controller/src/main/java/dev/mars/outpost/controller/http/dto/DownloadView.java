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

package dev.mars.outpost.controller.http.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.outpost.core.TransferSnapshot;

import java.time.Instant;

/**
 * Control-plane rendering of a transfer snapshot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DownloadView(
        @JsonProperty("download_id") String downloadId,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("remote_path") String remotePath,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("status") String status,
        @JsonProperty("chunks_received") long chunksReceived,
        @JsonProperty("bytes_received") long bytesReceived,
        @JsonProperty("total_size") Long totalSize,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("error") String error,
        @JsonProperty("error_code") String errorCode
) {

    public static DownloadView from(TransferSnapshot snapshot) {
        return new DownloadView(
                snapshot.transferId(),
                snapshot.agentId(),
                snapshot.sourcePath(),
                snapshot.artifactPath().toString(),
                snapshot.status().getValue(),
                snapshot.chunksReceived(),
                snapshot.bytesReceived(),
                snapshot.totalSize(),
                snapshot.createdAt(),
                snapshot.completedAt(),
                snapshot.error(),
                snapshot.failureReason() != null ? snapshot.failureReason().getCode() : null);
    }
}
