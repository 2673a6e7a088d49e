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

package dev.mars.outpost.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable engine settings, resolved once at process start.
 *
 * <p>Use {@link #builder()} to override individual defaults:</p>
 * <pre>{@code
 * TransferSettings settings = TransferSettings.builder()
 *         .downloadDirectory(Paths.get("/var/outpost/downloads"))
 *         .inactivityTimeout(Duration.ofSeconds(45))
 *         .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class TransferSettings {

    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;
    public static final Duration DEFAULT_INACTIVITY_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(1);
    public static final Path DEFAULT_DOWNLOAD_DIRECTORY = Paths.get("downloads");

    private final Path downloadDirectory;
    private final int chunkSize;
    private final Duration inactivityTimeout;
    private final Duration sweepInterval;
    private final boolean concurrentTransfersPerAgent;

    private TransferSettings(Builder builder) {
        this.downloadDirectory = builder.downloadDirectory;
        this.chunkSize = builder.chunkSize;
        this.inactivityTimeout = builder.inactivityTimeout;
        this.sweepInterval = builder.sweepInterval;
        this.concurrentTransfersPerAgent = builder.concurrentTransfersPerAgent;
    }

    public static TransferSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Directory receiving the destination artifacts.
     */
    public Path getDownloadDirectory() {
        return downloadDirectory;
    }

    /**
     * Largest payload, in bytes, accepted in a single chunk. Bounds the memory held per transfer.
     */
    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * How long an in-flight transfer may go without an accepted chunk before it is failed.
     */
    public Duration getInactivityTimeout() {
        return inactivityTimeout;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    /**
     * Whether an agent may run several transfers at once. When {@code false}, a new transfer
     * is refused while the agent still has a non-terminal one.
     */
    public boolean isConcurrentTransfersPerAgent() {
        return concurrentTransfersPerAgent;
    }

    @Override
    public String toString() {
        return "TransferSettings{" +
                "downloadDirectory=" + downloadDirectory +
                ", chunkSize=" + chunkSize +
                ", inactivityTimeout=" + inactivityTimeout +
                ", sweepInterval=" + sweepInterval +
                ", concurrentTransfersPerAgent=" + concurrentTransfersPerAgent +
                '}';
    }

    public static final class Builder {
        private Path downloadDirectory = DEFAULT_DOWNLOAD_DIRECTORY;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private Duration inactivityTimeout = DEFAULT_INACTIVITY_TIMEOUT;
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
        private boolean concurrentTransfersPerAgent = true;

        private Builder() {
        }

        public Builder downloadDirectory(Path downloadDirectory) {
            this.downloadDirectory = Objects.requireNonNull(downloadDirectory, "downloadDirectory cannot be null");
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder inactivityTimeout(Duration inactivityTimeout) {
            this.inactivityTimeout = Objects.requireNonNull(inactivityTimeout, "inactivityTimeout cannot be null");
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval cannot be null");
            return this;
        }

        public Builder concurrentTransfersPerAgent(boolean concurrentTransfersPerAgent) {
            this.concurrentTransfersPerAgent = concurrentTransfersPerAgent;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public TransferSettings build() {
            if (chunkSize <= 0) {
                throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
            }
            if (inactivityTimeout.isNegative() || inactivityTimeout.isZero()) {
                throw new IllegalArgumentException("inactivityTimeout must be positive, got: " + inactivityTimeout);
            }
            if (sweepInterval.isNegative() || sweepInterval.isZero()) {
                throw new IllegalArgumentException("sweepInterval must be positive, got: " + sweepInterval);
            }
            return new TransferSettings(this);
        }
    }
}
