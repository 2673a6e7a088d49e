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

package dev.mars.outpost.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * One ordered slice of a file, sent agent to server.
 *
 * <p>{@code chunkNum} is 1-based and strictly increasing per download. The final chunk sets
 * {@code last}; there is no separate end-of-stream message. The agent may declare the
 * expected totals on the final chunk so the receiver can detect a short stream. An empty file
 * is sent as a single empty chunk numbered 1 with {@code last} set.</p>
 *
 * <p>The payload travels base64-encoded in the {@code data} property. The array is neither
 * copied nor defensively cloned, so a chunk holds only one buffer in memory; callers must not
 * mutate it after construction. Equality and the hash code compare the payload by content, and
 * {@link #toString()} prints its size instead of the bytes.</p>
 *
 * @param downloadId  the download this chunk belongs to
 * @param chunkNum    1-based sequence number
 * @param data        payload bytes, never {@code null}
 * @param last        whether this is the final chunk
 * @param totalChunks declared chunk count, optional
 * @param totalSize   declared file size in bytes, optional
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileChunkMessage(@JsonProperty("download_id") String downloadId,
                               @JsonProperty("chunk_num") long chunkNum,
                               @JsonProperty("data") byte[] data,
                               @JsonProperty("is_last") boolean last,
                               @JsonProperty("total_chunks") Long totalChunks,
                               @JsonProperty("total_size") Long totalSize) implements ProtocolMessage {

    public FileChunkMessage {
        Messages.requireText(downloadId, "download_id");
        if (chunkNum < 1) {
            throw new IllegalArgumentException("chunk_num must be >= 1, got " + chunkNum);
        }
        if (data == null) {
            throw new IllegalArgumentException("data is required");
        }
        if (totalChunks != null && totalChunks < 1) {
            throw new IllegalArgumentException("total_chunks must be >= 1, got " + totalChunks);
        }
        if (totalSize != null && totalSize < 0) {
            throw new IllegalArgumentException("total_size must be >= 0, got " + totalSize);
        }
    }

    /**
     * Creates an intermediate chunk without declared totals.
     */
    public static FileChunkMessage of(String downloadId, long chunkNum, byte[] data) {
        return new FileChunkMessage(downloadId, chunkNum, data, false, null, null);
    }

    /**
     * Creates the final chunk of a download, declaring the totals the receiver should have seen.
     */
    public static FileChunkMessage lastOf(String downloadId, long chunkNum, byte[] data, long totalSize) {
        return new FileChunkMessage(downloadId, chunkNum, data, true, chunkNum, totalSize);
    }

    public int payloadSize() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileChunkMessage that)) return false;
        return chunkNum == that.chunkNum
                && last == that.last
                && downloadId.equals(that.downloadId)
                && Arrays.equals(data, that.data)
                && Objects.equals(totalChunks, that.totalChunks)
                && Objects.equals(totalSize, that.totalSize);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(downloadId, chunkNum, last, totalChunks, totalSize);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "FileChunkMessage{" +
                "downloadId='" + downloadId + '\'' +
                ", chunkNum=" + chunkNum +
                ", payloadSize=" + data.length +
                ", last=" + last +
                ", totalChunks=" + totalChunks +
                ", totalSize=" + totalSize +
                '}';
    }
}
