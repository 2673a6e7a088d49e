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

package dev.mars.outpost.controller.ws;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read gate of one agent socket that keeps at most one unpersisted chunk per download.
 *
 * <p>Each chunk handed to the orchestrator is tracked under its download id until its write has
 * settled. While any download has a chunk outstanding the socket is paused, so the next chunk of
 * that download is not read off the wire before the previous one is on disk. Reading resumes
 * once every tracked write has settled.</p>
 *
 * <p>Not thread-safe; used from the socket's context only.</p>
 */
final class ChunkWriteGate {

    private final Runnable pause;
    private final Runnable resume;
    private final Map<String, Integer> outstanding = new HashMap<>();
    private boolean paused;

    ChunkWriteGate(Runnable pause, Runnable resume) {
        this.pause = Objects.requireNonNull(pause, "pause cannot be null");
        this.resume = Objects.requireNonNull(resume, "resume cannot be null");
    }

    /**
     * Records a chunk of {@code downloadId} whose write has not settled yet and pauses reading.
     */
    void track(String downloadId) {
        outstanding.merge(downloadId, 1, Integer::sum);
        if (!paused) {
            paused = true;
            pause.run();
        }
    }

    /**
     * Records that a tracked write of {@code downloadId} has settled, successfully or not.
     */
    void settle(String downloadId) {
        outstanding.computeIfPresent(downloadId, (id, count) -> count > 1 ? count - 1 : null);
        if (paused && outstanding.isEmpty()) {
            paused = false;
            resume.run();
        }
    }

    boolean isPaused() {
        return paused;
    }

    int outstanding(String downloadId) {
        return outstanding.getOrDefault(downloadId, 0);
    }
}
