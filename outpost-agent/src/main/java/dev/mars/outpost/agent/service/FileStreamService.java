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

package dev.mars.outpost.agent.service;

import dev.mars.outpost.protocol.DownloadRequestMessage;
import dev.mars.outpost.protocol.ErrorMessage;
import dev.mars.outpost.protocol.FileChunkMessage;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.OpenOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streams requested files to the server as ordered chunks.
 *
 * <p>Each download reads its file through a Vert.x {@link AsyncFile} and waits for every chunk
 * frame to be written before reading the next one. The final chunk declares the chunk count
 * and file size; an empty file is sent as one empty final chunk. A file that cannot be read
 * is reported with an {@code error} frame instead. Several downloads may stream at the same
 * time; each can be cancelled on its own.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class FileStreamService {

    private static final Logger logger = LoggerFactory.getLogger(FileStreamService.class);

    private final Vertx vertx;
    private final int chunkSize;
    private final PathExpander expander;
    private final Map<String, ActiveStream> active = new ConcurrentHashMap<>();

    public FileStreamService(Vertx vertx, int chunkSize, PathExpander expander) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.expander = Objects.requireNonNull(expander, "expander cannot be null");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Streams the requested file through {@code sender}.
     *
     * @return a future that succeeds once the final chunk is written, and fails if the file
     *         could not be read (after the {@code error} frame is sent), if the download was
     *         cancelled, or if a frame could not be written
     */
    public Future<Void> stream(DownloadRequestMessage request, FrameSender sender) {
        String downloadId = request.downloadId();
        String path = expander.expand(request.filePath());
        ActiveStream stream = new ActiveStream(downloadId, path, sender);
        if (active.putIfAbsent(downloadId, stream) != null) {
            logger.warn("Download {} is already streaming, ignoring duplicate request", downloadId);
            return Future.failedFuture(new IllegalStateException("download " + downloadId + " is already streaming"));
        }

        logger.info("Download {} requested: {} (expanded: {})", downloadId, request.filePath(), path);
        FileSystem fs = vertx.fileSystem();
        return fs.props(path)
                .compose(props -> {
                    if (!props.isRegularFile()) {
                        return Future.<Void>failedFuture(new IOException("Not a regular file: " + path));
                    }
                    long size = props.size();
                    long totalChunks = size == 0 ? 1 : (size + chunkSize - 1) / chunkSize;
                    logger.info("Download {}: sending {} bytes in {} chunk(s)", downloadId, size, totalChunks);
                    return fs.open(path, new OpenOptions().setRead(true).setWrite(false).setCreate(false))
                            .compose(file -> {
                                stream.file = file;
                                return sendChunk(stream, 1, 0, size, totalChunks);
                            });
                })
                .transform(ar -> finish(stream, ar));
    }

    /**
     * Stops a running download before its next chunk.
     *
     * @return whether a download with that id was streaming
     */
    public boolean cancel(String downloadId, String reason) {
        ActiveStream stream = active.get(downloadId);
        if (stream == null) {
            logger.debug("Cancel for unknown download {} ignored", downloadId);
            return false;
        }
        logger.info("Download {} cancelled by server: {}", downloadId, reason);
        stream.cancelled = true;
        return true;
    }

    /**
     * Stops every running download, e.g. because the connection they stream over is gone.
     */
    public void cancelAll(String reason) {
        active.keySet().forEach(id -> cancel(id, reason));
    }

    public int activeCount() {
        return active.size();
    }

    private Future<Void> sendChunk(ActiveStream stream, long chunkNum, long position, long size, long totalChunks) {
        if (stream.cancelled) {
            return Future.failedFuture(new CancellationException("download cancelled"));
        }
        int length = (int) Math.min(chunkSize, size - position);
        Future<Buffer> read = length == 0
                ? Future.succeededFuture(Buffer.buffer())
                : stream.file.read(Buffer.buffer(length), 0, position, length);

        return read.compose(buffer -> {
            if (buffer.length() != length) {
                return Future.failedFuture(new IOException("file changed while reading: expected " + length
                        + " bytes at offset " + position + ", got " + buffer.length()));
            }
            if (stream.cancelled) {
                return Future.failedFuture(new CancellationException("download cancelled"));
            }
            boolean last = chunkNum == totalChunks;
            FileChunkMessage chunk = last
                    ? FileChunkMessage.lastOf(stream.downloadId, chunkNum, buffer.getBytes(), size)
                    : FileChunkMessage.of(stream.downloadId, chunkNum, buffer.getBytes());
            return stream.sender.send(chunk)
                    .recover(err -> {
                        stream.sendFailed = true;
                        return Future.failedFuture(err);
                    })
                    .compose(v -> last
                            ? Future.succeededFuture()
                            : sendChunk(stream, chunkNum + 1, position + length, size, totalChunks));
        });
    }

    private Future<Void> finish(ActiveStream stream, AsyncResult<Void> result) {
        active.remove(stream.downloadId, stream);
        if (stream.file != null) {
            stream.file.close()
                    .onFailure(err -> logger.debug("Closing {} failed: {}", stream.path, err.getMessage()));
        }

        if (result.succeeded()) {
            logger.info("Download {} sent: {}", stream.downloadId, stream.path);
            return Future.succeededFuture();
        }

        Throwable cause = result.cause();
        if (stream.cancelled) {
            logger.info("Download {} stopped after cancellation", stream.downloadId);
            return Future.failedFuture(new CancellationException("download " + stream.downloadId + " cancelled"));
        }
        if (stream.sendFailed) {
            logger.warn("Download {} aborted, connection lost: {}", stream.downloadId, cause.getMessage());
            return Future.failedFuture(cause);
        }

        String message = describe(cause, stream.path);
        logger.warn("Download {} failed: {}", stream.downloadId, message);
        return stream.sender.send(new ErrorMessage(stream.downloadId, message))
                .onFailure(err -> logger.warn("Could not report failure of download {}: {}",
                        stream.downloadId, err.getMessage()))
                .transform(ar -> Future.failedFuture(cause));
    }

    static String describe(Throwable failure, String path) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof NoSuchFileException) {
                return "File not found: " + path;
            }
            if (t instanceof AccessDeniedException) {
                return "Permission denied: " + path;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        if (failure instanceof IOException && failure.getMessage() != null) {
            return failure.getMessage();
        }
        return "Failed to read " + path + ": " + failure.getMessage();
    }

    private static final class ActiveStream {
        private final String downloadId;
        private final String path;
        private final FrameSender sender;
        private AsyncFile file;
        private volatile boolean cancelled;
        private boolean sendFailed;

        private ActiveStream(String downloadId, String path, FrameSender sender) {
            this.downloadId = downloadId;
            this.path = path;
            this.sender = sender;
        }
    }
}
