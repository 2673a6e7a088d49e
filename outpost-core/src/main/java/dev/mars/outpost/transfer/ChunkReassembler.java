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

package dev.mars.outpost.transfer;

import dev.mars.outpost.protocol.FileChunkMessage;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.OpenOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes the chunks of one transfer, in sequence, to its destination artifact.
 *
 * <p>The artifact is opened on the first accepted chunk, so a transfer that never receives data
 * leaves nothing on disk. Writes are chained so that chunk {@code n + 1} is only written after
 * chunk {@code n} has been handed to the file. On the last chunk the declared totals are checked,
 * then the artifact is flushed and closed. Once a write has failed every later chunk is
 * rejected, so the counters never run ahead of a broken artifact. After {@link #abort()}
 * whatever was written stays on disk as a partial artifact.</p>
 *
 * <p>Not thread-safe; the owning orchestrator calls it from a single context.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ChunkReassembler {

    private static final Logger logger = LoggerFactory.getLogger(ChunkReassembler.class);

    private enum State { OPEN, SEALED, ABORTED }

    private final FileSystem fileSystem;
    private final String transferId;
    private final Path artifactPath;
    private final int maxChunkSize;

    private State state = State.OPEN;
    private long expectedSequence = 1;
    private long bytesAccepted;
    private Future<AsyncFile> artifact;
    private boolean artifactClosed;
    private Future<Void> writes = Future.succeededFuture();

    public ChunkReassembler(FileSystem fileSystem, String transferId, Path artifactPath, int maxChunkSize) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem cannot be null");
        this.transferId = Objects.requireNonNull(transferId, "transferId cannot be null");
        this.artifactPath = Objects.requireNonNull(artifactPath, "artifactPath cannot be null");
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive");
        }
        this.maxChunkSize = maxChunkSize;
    }

    /**
     * Offers the next chunk. A rejected chunk leaves the reassembler unchanged.
     */
    public ChunkResult accept(FileChunkMessage chunk) {
        if (!transferId.equals(chunk.downloadId())) {
            return ChunkResult.rejected("chunk belongs to download " + chunk.downloadId());
        }
        if (state == State.SEALED) {
            return ChunkResult.rejected("chunk " + chunk.chunkNum() + " received after end of stream");
        }
        if (state == State.ABORTED) {
            return ChunkResult.rejected("download has been aborted");
        }
        if (writeFailed()) {
            return ChunkResult.rejected("artifact write failed: " + writes.cause().getMessage());
        }
        if (chunk.chunkNum() != expectedSequence) {
            return ChunkResult.rejected(String.format("expected chunk %d but received chunk %d",
                    expectedSequence, chunk.chunkNum()));
        }
        if (chunk.payloadSize() > maxChunkSize) {
            return ChunkResult.rejected(String.format("chunk %d carries %d bytes, above the %d byte limit",
                    chunk.chunkNum(), chunk.payloadSize(), maxChunkSize));
        }

        long bytesAfter = bytesAccepted + chunk.payloadSize();
        if (chunk.last()) {
            if (chunk.totalChunks() != null && chunk.totalChunks() != chunk.chunkNum()) {
                return ChunkResult.rejected(String.format(
                        "end of stream before all expected data was received: chunk %d of %d declared chunks",
                        chunk.chunkNum(), chunk.totalChunks()));
            }
            if (chunk.totalSize() != null && chunk.totalSize() != bytesAfter) {
                return ChunkResult.rejected(String.format(
                        "end of stream before all expected data was received: %d of %d declared bytes",
                        bytesAfter, chunk.totalSize()));
            }
        }

        expectedSequence++;
        bytesAccepted = bytesAfter;
        Buffer payload = Buffer.buffer(chunk.data());
        writes = writes.compose(v -> artifact()).compose(file -> file.write(payload));
        if (chunk.last()) {
            state = State.SEALED;
            writes = writes.compose(v -> closeArtifact());
        }
        return ChunkResult.applied(writes);
    }

    /**
     * Stops accepting chunks and closes the artifact once pending writes have settled. The
     * returned future never fails.
     */
    public Future<Void> abort() {
        if (state == State.ABORTED) {
            return writes.transform(ar -> Future.succeededFuture());
        }
        state = State.ABORTED;
        writes = writes
                .transform(ar -> closeArtifact())
                .transform(ar -> {
                    if (ar.failed()) {
                        logger.warn("Closing partial artifact {} for download {} failed: {}",
                                artifactPath, transferId, ar.cause().getMessage());
                    }
                    return Future.succeededFuture();
                });
        return writes;
    }

    /**
     * Whether an earlier write to the artifact has failed. No further chunk is accepted then.
     */
    public boolean writeFailed() {
        return writes.failed();
    }

    public long expectedSequence() {
        return expectedSequence;
    }

    public long bytesAccepted() {
        return bytesAccepted;
    }

    public boolean isSealed() {
        return state == State.SEALED;
    }

    public Path artifactPath() {
        return artifactPath;
    }

    private Future<AsyncFile> artifact() {
        if (artifact == null) {
            Path parent = artifactPath.toAbsolutePath().getParent();
            OpenOptions options = new OpenOptions().setCreate(true).setWrite(true).setTruncateExisting(true);
            Future<Void> directory = parent == null ? Future.succeededFuture() : fileSystem.mkdirs(parent.toString());
            artifact = directory.compose(v -> fileSystem.open(artifactPath.toString(), options));
            logger.debug("Opening artifact {} for download {}", artifactPath, transferId);
        }
        return artifact;
    }

    private Future<Void> closeArtifact() {
        if (artifact == null || artifactClosed) {
            return Future.succeededFuture();
        }
        artifactClosed = true;
        return artifact.compose(file -> file.flush().compose(v -> file.close()));
    }
}
