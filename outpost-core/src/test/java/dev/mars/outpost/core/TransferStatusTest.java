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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Paths;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TransferStatus} transitions and {@link TransferSnapshot} derivations.
 */
class TransferStatusTest {

    @Test
    @DisplayName("Forward path is allowed")
    void testForwardTransitions() {
        assertTrue(TransferStatus.PENDING.canTransitionTo(TransferStatus.DISPATCHED));
        assertTrue(TransferStatus.DISPATCHED.canTransitionTo(TransferStatus.IN_PROGRESS));
        assertTrue(TransferStatus.IN_PROGRESS.canTransitionTo(TransferStatus.IN_PROGRESS));
        assertTrue(TransferStatus.IN_PROGRESS.canTransitionTo(TransferStatus.COMPLETED));
    }

    @Test
    @DisplayName("Skipping or reversing states is not allowed")
    void testIllegalTransitions() {
        assertFalse(TransferStatus.PENDING.canTransitionTo(TransferStatus.IN_PROGRESS));
        assertFalse(TransferStatus.PENDING.canTransitionTo(TransferStatus.COMPLETED));
        assertFalse(TransferStatus.DISPATCHED.canTransitionTo(TransferStatus.COMPLETED));
        assertFalse(TransferStatus.IN_PROGRESS.canTransitionTo(TransferStatus.DISPATCHED));
    }

    @ParameterizedTest
    @EnumSource(value = TransferStatus.class, names = {"PENDING", "DISPATCHED", "IN_PROGRESS"})
    void testEveryNonTerminalStateCanFail(TransferStatus status) {
        assertFalse(status.isTerminal());
        assertTrue(status.canTransitionTo(TransferStatus.FAILED));
    }

    @ParameterizedTest
    @EnumSource(value = TransferStatus.class, names = {"COMPLETED", "FAILED"})
    void testTerminalStatesAreAbsorbing(TransferStatus status) {
        assertTrue(status.isTerminal());
        assertEquals(0, status.getValidTransitions().length);
        for (TransferStatus target : TransferStatus.values()) {
            assertFalse(status.canTransitionTo(target), status + " -> " + target);
        }
    }

    @Test
    void testWireValues() {
        assertEquals("in_progress", TransferStatus.IN_PROGRESS.getValue());
        assertEquals("in_progress", TransferStatus.IN_PROGRESS.toString());
        assertEquals(TransferStatus.COMPLETED, TransferStatus.fromValue("completed"));
        assertEquals(TransferStatus.IN_PROGRESS, TransferStatus.fromValue("IN_PROGRESS"));
        assertThrows(IllegalArgumentException.class, () -> TransferStatus.fromValue("paused"));
    }

    @Test
    @DisplayName("Snapshot counters and completion")
    void testSnapshotProgression() {
        Instant created = Instant.parse("2026-03-02T10:00:00Z");
        TransferSnapshot pending = TransferSnapshot.pending("d-1", "client-a", "/tmp/x",
                Paths.get("downloads", "x"), created);
        assertEquals(TransferStatus.PENDING, pending.status());
        assertNull(pending.totalSize());

        TransferSnapshot progressed = pending.withStatus(TransferStatus.DISPATCHED).withChunk(10).withChunk(5);
        assertEquals(TransferStatus.IN_PROGRESS, progressed.status());
        assertEquals(2, progressed.chunksReceived());
        assertEquals(15, progressed.bytesReceived());

        TransferSnapshot done = progressed.completed(created.plusSeconds(3));
        assertEquals(TransferStatus.COMPLETED, done.status());
        assertEquals(15L, done.totalSize());
        assertEquals(created.plusSeconds(3), done.completedAt());
        assertNull(done.error());
    }

    @Test
    @DisplayName("Failed snapshot carries a reason and defaults its message")
    void testSnapshotFailure() {
        TransferSnapshot pending = TransferSnapshot.pending("d-1", "client-a", "/tmp/x",
                Paths.get("downloads", "x"), Instant.EPOCH);

        TransferSnapshot failed = pending.failed(FailureReason.AGENT_DISCONNECTED, null, Instant.EPOCH);
        assertEquals(FailureReason.AGENT_DISCONNECTED, failed.failureReason());
        assertEquals("agent disconnected", failed.error());

        TransferSnapshot detailed = pending.failed(FailureReason.AGENT_ERROR, "File not found", Instant.EPOCH);
        assertEquals("File not found", detailed.error());

        assertThrows(IllegalArgumentException.class, () -> pending.withStatus(TransferStatus.FAILED));
    }
}
