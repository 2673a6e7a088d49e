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
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ChunkReassembler} against the real file system.
 */
@ExtendWith(VertxExtension.class)
class ChunkReassemblerTest {

    private static final String ID = "d-1";

    @TempDir
    Path tempDir;

    private Vertx vertx;
    private Path artifact;
    private ChunkReassembler reassembler;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        artifact = tempDir.resolve("nested").resolve("artifact.bin");
        reassembler = new ChunkReassembler(vertx.fileSystem(), ID, artifact, 8);
    }

    @Test
    @DisplayName("Chunks are written in order and the artifact is closed on the last one")
    void testSequentialChunks() throws Exception {
        assertTrue(reassembler.accept(FileChunkMessage.of(ID, 1, bytes("hello "))).applied());
        assertTrue(reassembler.accept(FileChunkMessage.of(ID, 2, bytes("outpost"))).applied());
        ChunkResult last = reassembler.accept(FileChunkMessage.lastOf(ID, 3, bytes("!"), 14));

        assertTrue(last.applied());
        await(last.persisted());
        assertTrue(reassembler.isSealed());
        assertEquals(14, reassembler.bytesAccepted());
        assertEquals("hello outpost!", Files.readString(artifact));
    }

    @Test
    @DisplayName("An empty file is a single empty last chunk")
    void testEmptyFile() throws Exception {
        ChunkResult result = reassembler.accept(FileChunkMessage.lastOf(ID, 1, new byte[0], 0));

        assertTrue(result.applied());
        await(result.persisted());
        assertTrue(Files.exists(artifact));
        assertEquals(0, Files.size(artifact));
    }

    @Test
    @DisplayName("Out-of-sequence and duplicate chunks are rejected without side effects")
    void testSequenceViolation() {
        assertTrue(reassembler.accept(FileChunkMessage.of(ID, 1, bytes("a"))).applied());

        ChunkResult gap = reassembler.accept(FileChunkMessage.of(ID, 3, bytes("c")));
        assertFalse(gap.applied());
        assertEquals("expected chunk 2 but received chunk 3", gap.reason());

        ChunkResult duplicate = reassembler.accept(FileChunkMessage.of(ID, 1, bytes("a")));
        assertFalse(duplicate.applied());
        assertEquals(2, reassembler.expectedSequence());
        assertEquals(1, reassembler.bytesAccepted());
    }

    @Test
    void testOversizedChunkRejected() {
        ChunkResult result = reassembler.accept(FileChunkMessage.of(ID, 1, new byte[9]));
        assertFalse(result.applied());
        assertTrue(result.reason().contains("above the 8 byte limit"), result.reason());
        assertFalse(Files.exists(artifact));
    }

    @Test
    @DisplayName("A last chunk whose declared totals disagree is a short stream")
    void testShortEndOfStream() {
        reassembler.accept(FileChunkMessage.of(ID, 1, bytes("abc")));

        ChunkResult shortSize = reassembler.accept(new FileChunkMessage(ID, 2, bytes("d"), true, 2L, 10L));
        assertFalse(shortSize.applied());
        assertTrue(shortSize.reason().startsWith("end of stream before all expected data was received"));

        ChunkResult shortCount = reassembler.accept(new FileChunkMessage(ID, 2, bytes("d"), true, 5L, null));
        assertFalse(shortCount.applied());
        assertFalse(reassembler.isSealed());
    }

    @Test
    void testChunksAfterEndOfStreamRejected() throws Exception {
        await(reassembler.accept(FileChunkMessage.lastOf(ID, 1, bytes("x"), 1)).persisted());

        ChunkResult late = reassembler.accept(FileChunkMessage.of(ID, 2, bytes("y")));
        assertFalse(late.applied());
        assertEquals("x", Files.readString(artifact));
    }

    @Test
    void testChunkForOtherDownloadRejected() {
        assertFalse(reassembler.accept(FileChunkMessage.of("other", 1, bytes("x"))).applied());
    }

    @Test
    @DisplayName("Abort keeps what was written as a partial artifact")
    void testAbortLeavesPartialArtifact() throws Exception {
        reassembler.accept(FileChunkMessage.of(ID, 1, bytes("part")));
        await(reassembler.abort());

        assertEquals("part", Files.readString(artifact));
        assertFalse(reassembler.accept(FileChunkMessage.of(ID, 2, bytes("x"))).applied());
        await(reassembler.abort());
    }

    @Test
    @DisplayName("After a failed write no further chunk is accepted")
    void testChunksAfterFailedWriteRejected() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        ChunkReassembler broken = new ChunkReassembler(vertx.fileSystem(), ID, blocker.resolve("artifact.bin"), 8);

        ChunkResult first = broken.accept(FileChunkMessage.of(ID, 1, bytes("abc")));
        assertTrue(first.applied());
        assertThrows(ExecutionException.class, () -> await(first.persisted()));
        assertTrue(broken.writeFailed());

        ChunkResult second = broken.accept(FileChunkMessage.of(ID, 2, bytes("def")));
        assertFalse(second.applied());
        assertTrue(second.reason().startsWith("artifact write failed"), second.reason());
        assertEquals(2, broken.expectedSequence());
        assertEquals(3, broken.bytesAccepted());
        await(broken.abort());
    }

    @Test
    void testAbortBeforeAnyDataCreatesNothing() throws Exception {
        await(reassembler.abort());
        assertFalse(Files.exists(artifact));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
}
