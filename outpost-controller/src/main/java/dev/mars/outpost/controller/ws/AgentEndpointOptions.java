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

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of the agent WebSocket endpoint.
 *
 * @param handshakeTimeout how long a new socket may take to send its {@code register} frame
 * @param pingInterval     interval between server pings
 * @param maxFrameSize     largest accepted WebSocket frame and message, in bytes
 */
public record AgentEndpointOptions(Duration handshakeTimeout, Duration pingInterval, int maxFrameSize) {

    public static final AgentEndpointOptions DEFAULTS =
            new AgentEndpointOptions(Duration.ofSeconds(10), Duration.ofSeconds(30), 16 * 1024 * 1024);

    public AgentEndpointOptions {
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout cannot be null");
        Objects.requireNonNull(pingInterval, "pingInterval cannot be null");
        if (handshakeTimeout.toMillis() < 1 || pingInterval.toMillis() < 1) {
            throw new IllegalArgumentException("handshakeTimeout and pingInterval must be at least 1ms");
        }
        if (maxFrameSize <= 0) {
            throw new IllegalArgumentException("maxFrameSize must be positive, got: " + maxFrameSize);
        }
    }
}
