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

package dev.mars.outpost.agent.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of one agent process.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class AgentSettings {

    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;
    public static final String DEFAULT_SERVER_URL = "http://localhost:8080";
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_FRAME_SIZE = 16 * 1024 * 1024;

    private final String agentId;
    private final URI serverUrl;
    private final int chunkSize;
    private final Duration reconnectDelay;
    private final int maxFrameSize;

    private AgentSettings(Builder builder) {
        this.agentId = builder.agentId;
        this.serverUrl = builder.serverUrl;
        this.chunkSize = builder.chunkSize;
        this.reconnectDelay = builder.reconnectDelay;
        this.maxFrameSize = builder.maxFrameSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getAgentId() {
        return agentId;
    }

    public URI getServerUrl() {
        return serverUrl;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    /**
     * The agent endpoint derived from the server URL: {@code http} becomes {@code ws},
     * {@code https} becomes {@code wss}, and {@code /ws} is appended to the path.
     */
    public URI getWebSocketUri() {
        String scheme = "https".equalsIgnoreCase(serverUrl.getScheme()) ? "wss" : "ws";
        String path = serverUrl.getPath() == null ? "" : serverUrl.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return URI.create(scheme + "://" + serverUrl.getRawAuthority() + path + "/ws");
    }

    @Override
    public String toString() {
        return "AgentSettings{" +
                "agentId='" + agentId + '\'' +
                ", serverUrl=" + serverUrl +
                ", chunkSize=" + chunkSize +
                ", reconnectDelay=" + reconnectDelay +
                '}';
    }

    public static final class Builder {
        private String agentId;
        private URI serverUrl = URI.create(DEFAULT_SERVER_URL);
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;
        private int maxFrameSize = DEFAULT_MAX_FRAME_SIZE;

        private Builder() {
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder serverUrl(String serverUrl) {
            Objects.requireNonNull(serverUrl, "serverUrl cannot be null");
            this.serverUrl = URI.create(serverUrl.strip());
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder reconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay cannot be null");
            return this;
        }

        public Builder maxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the agent id is missing or a value is out of range
         */
        public AgentSettings build() {
            if (agentId == null || agentId.isBlank()) {
                throw new IllegalArgumentException("agent id is required (outpost.agent.id or --client-id)");
            }
            agentId = agentId.strip();
            String scheme = serverUrl.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new IllegalArgumentException("server URL must start with http:// or https://, got: " + serverUrl);
            }
            if (serverUrl.getHost() == null) {
                throw new IllegalArgumentException("server URL has no host: " + serverUrl);
            }
            if (chunkSize <= 0) {
                throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
            }
            if (reconnectDelay.isNegative() || reconnectDelay.isZero()) {
                throw new IllegalArgumentException("reconnectDelay must be positive, got: " + reconnectDelay);
            }
            if (maxFrameSize <= 0) {
                throw new IllegalArgumentException("maxFrameSize must be positive, got: " + maxFrameSize);
            }
            return new AgentSettings(this);
        }
    }
}
