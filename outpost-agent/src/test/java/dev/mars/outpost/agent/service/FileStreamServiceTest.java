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
import dev.mars.outpost.protocol.ProtocolMessage;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileStreamService}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@ExtendWith(VertxExtension.class)
@DisplayName("FileStreamService")
class FileStreamServiceTest {

    @TempDir
    Path dir;

    private Vertx vertx;
    private FileStreamService service;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        this.service = new FileStreamService(vertx, 4, new PathExpander(Map.of("DATA", dir.toString()), null));
    }

    @Test
    @DisplayName("A file is sent in order as fixed-size chunks, the last one declaring the totals")
    void streamsChunksInOrder() throws Exception {
        Files.writeString(dir.resolve("orders.csv"), "0123456789");
        RecordingSender sender = new RecordingSender();

        join(service.stream(new DownloadRequestMessage("d-1", "$DATA/orders.csv"), sender));

        List<FileChunkMessage> chunks = sender.chunks();
        assertEquals(3, chunks.size());
        assertEquals(List.of(1L, 2L, 3L), chunks.stream().map(FileChunkMessage::chunkNum).collect(Collectors.toList()));
        assertEquals("0123", text(chunks.get(0)));
        assertEquals("4567", text(chunks.get(1)));
        assertEquals("89", text(chunks.get(2)));
        assertFalse(chunks.get(0).last());
        assertFalse(chunks.get(1).last());
        assertTrue(chunks.get(2).last());
        assertEquals(3L, chunks.get(2).totalChunks());
        assertEquals(10L, chunks.get(2).totalSize());
        assertTrue(chunks.stream().allMatch(c -> c.downloadId().equals("d-1")));
        assertEquals(0, service.activeCount());
    }

    @Test
    @DisplayName("A file of exactly one chunk size is a single last chunk")
    void exactChunkSize() throws Exception {
        Files.writeString(dir.resolve("four.txt"), "abcd");
        RecordingSender sender = new RecordingSender();

        join(service.stream(new DownloadRequestMessage("d-1", dir.resolve("four.txt").toString()), sender));

        assertEquals(1, sender.chunks().size());
        assertTrue(sender.chunks().get(0).last());
        assertEquals("abcd", text(sender.chunks().get(0)));
    }

    @Test
    @DisplayName("An empty file is a single empty last chunk")
    void emptyFile() throws Exception {
        Files.createFile(dir.resolve("empty.log"));
        RecordingSender sender = new RecordingSender();

        join(service.stream(new DownloadRequestMessage("d-1", dir.resolve("empty.log").toString()), sender));

        List<FileChunkMessage> chunks = sender.chunks();
        assertEquals(1, chunks.size());
        assertEquals(1L, chunks.get(0).chunkNum());
        assertEquals(0, chunks.get(0).payloadSize());
        assertTrue(chunks.get(0).last());
        assertEquals(0L, chunks.get(0).totalSize());
    }

    @Test
    @DisplayName("A binary file arrives byte for byte")
    void binaryContent() throws Exception {
        byte[] content = new byte[1031];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i * 31);
        }
        Files.write(dir.resolve("blob.bin"), content);
        FileStreamService wide = new FileStreamService(vertx, 100, new PathExpander(Map.of(), null));
        RecordingSender sender = new RecordingSender();

        join(wide.stream(new DownloadRequestMessage("d-1", dir.resolve("blob.bin").toString()), sender));

        ByteArrayOutputStream received = new ByteArrayOutputStream();
        for (FileChunkMessage chunk : sender.chunks()) {
            received.write(chunk.data());
        }
        assertEquals(11, sender.chunks().size());
        assertArrayEquals(content, received.toByteArray());
    }

    @Test
    @DisplayName("A missing file is reported with an error frame and no chunks")
    void missingFileReportsError() {
        RecordingSender sender = new RecordingSender();
        String path = dir.resolve("missing.txt").toString();

        assertThrows(ExecutionException.class,
                () -> join(service.stream(new DownloadRequestMessage("d-1", path), sender)));

        assertTrue(sender.chunks().isEmpty());
        List<ErrorMessage> errors = sender.errors();
        assertEquals(1, errors.size());
        assertEquals("d-1", errors.get(0).downloadId());
        assertEquals("File not found: " + path, errors.get(0).message());
        assertEquals(0, service.activeCount());
    }

    @Test
    @DisplayName("A directory is reported as not a regular file")
    void directoryReportsError() {
        RecordingSender sender = new RecordingSender();

        assertThrows(ExecutionException.class,
                () -> join(service.stream(new DownloadRequestMessage("d-1", dir.toString()), sender)));

        assertEquals(1, sender.errors().size());
        assertTrue(sender.errors().get(0).message().startsWith("Not a regular file"));
    }

    @Test
    @DisplayName("Cancelling stops the stream before its next chunk without an error frame")
    void cancelStopsStream() throws Exception {
        Files.writeString(dir.resolve("big.txt"), "a".repeat(40));
        GatedSender sender = new GatedSender();

        Future<Void> streaming = service.stream(new DownloadRequestMessage("d-1", dir.resolve("big.txt").toString()), sender);
        await().atMost(Duration.ofSeconds(5)).until(() -> sender.sent.size() == 1);

        assertTrue(service.cancel("d-1", "operator"));
        sender.release();

        ExecutionException e = assertThrows(ExecutionException.class, () -> join(streaming));
        assertInstanceOf(CancellationException.class, e.getCause());
        assertEquals(1, sender.sent.size());
        assertEquals(0, service.activeCount());
        assertFalse(service.cancel("d-1", "again"));
    }

    @Test
    @DisplayName("A second request for a streaming download id is refused")
    void duplicateIdRefused() throws Exception {
        Files.writeString(dir.resolve("big.txt"), "a".repeat(40));
        GatedSender sender = new GatedSender();
        String path = dir.resolve("big.txt").toString();

        Future<Void> first = service.stream(new DownloadRequestMessage("d-1", path), sender);
        await().atMost(Duration.ofSeconds(5)).until(() -> sender.sent.size() == 1);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> join(service.stream(new DownloadRequestMessage("d-1", path), new RecordingSender())));
        assertInstanceOf(IllegalStateException.class, e.getCause());

        service.cancelAll("test over");
        sender.release();
        assertThrows(ExecutionException.class, () -> join(first));
    }

    @Test
    @DisplayName("Concurrent downloads stream independently")
    void concurrentDownloads() throws Exception {
        Files.writeString(dir.resolve("a.txt"), "aaaaaaaaaa");
        Files.writeString(dir.resolve("b.txt"), "bbbbbbbbbbbbbbbbbbbb");
        RecordingSender sender = new RecordingSender();

        join(Future.all(
                service.stream(new DownloadRequestMessage("d-a", dir.resolve("a.txt").toString()), sender),
                service.stream(new DownloadRequestMessage("d-b", dir.resolve("b.txt").toString()), sender)));

        List<FileChunkMessage> a = sender.chunksOf("d-a");
        List<FileChunkMessage> b = sender.chunksOf("d-b");
        assertEquals(3, a.size());
        assertEquals(5, b.size());
        assertEquals("aaaaaaaaaa", a.stream().map(FileStreamServiceTest::text).collect(Collectors.joining()));
        assertEquals("bbbbbbbbbbbbbbbbbbbb", b.stream().map(FileStreamServiceTest::text).collect(Collectors.joining()));
        assertTrue(a.get(2).last());
        assertTrue(b.get(4).last());
    }

    @Test
    @DisplayName("A failed send aborts the stream without an error frame")
    void failedSendAborts() throws Exception {
        Files.writeString(dir.resolve("big.txt"), "a".repeat(40));
        List<ProtocolMessage> attempted = new CopyOnWriteArrayList<>();
        FrameSender broken = message -> {
            attempted.add(message);
            return Future.failedFuture("connection to server is closed");
        };

        assertThrows(ExecutionException.class,
                () -> join(service.stream(new DownloadRequestMessage("d-1", dir.resolve("big.txt").toString()), broken)));

        assertEquals(1, attempted.size());
        assertInstanceOf(FileChunkMessage.class, attempted.get(0));
        assertEquals(0, service.activeCount());
    }

    @Test
    @DisplayName("Read failures are described for the server")
    void describesFailures() {
        assertEquals("File not found: /x", FileStreamService.describe(new NoSuchFileException("/x"), "/x"));
        assertEquals("Permission denied: /x", FileStreamService.describe(new AccessDeniedException("/x"), "/x"));
        assertEquals("File not found: /x",
                FileStreamService.describe(new RuntimeException("wrapped", new NoSuchFileException("/x")), "/x"));
        assertEquals("disk on fire", FileStreamService.describe(new IOException("disk on fire"), "/x"));
        assertEquals("Failed to read /x: boom", FileStreamService.describe(new IllegalStateException("boom"), "/x"));
    }

    private static String text(FileChunkMessage chunk) {
        return new String(chunk.data(), StandardCharsets.UTF_8);
    }

    private static <T> T join(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static class RecordingSender implements FrameSender {
        final List<ProtocolMessage> sent = new CopyOnWriteArrayList<>();

        @Override
        public Future<Void> send(ProtocolMessage message) {
            sent.add(message);
            return Future.succeededFuture();
        }

        List<FileChunkMessage> chunks() {
            return sent.stream()
                    .filter(FileChunkMessage.class::isInstance)
                    .map(FileChunkMessage.class::cast)
                    .collect(Collectors.toList());
        }

        List<FileChunkMessage> chunksOf(String downloadId) {
            return chunks().stream().filter(c -> c.downloadId().equals(downloadId)).collect(Collectors.toList());
        }

        List<ErrorMessage> errors() {
            return sent.stream()
                    .filter(ErrorMessage.class::isInstance)
                    .map(ErrorMessage.class::cast)
                    .collect(Collectors.toList());
        }
    }

    /**
     * Holds the first write open until released, so the stream can be observed mid-flight.
     */
    private static class GatedSender implements FrameSender {
        final List<ProtocolMessage> sent = new CopyOnWriteArrayList<>();
        private final Promise<Void> gate = Promise.promise();

        @Override
        public Future<Void> send(ProtocolMessage message) {
            sent.add(message);
            return gate.future();
        }

        void release() {
            gate.tryComplete();
        }
    }
}
