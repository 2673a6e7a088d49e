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

package dev.mars.outpost.agent.connection;

import dev.mars.outpost.agent.ServerFixture;
import dev.mars.outpost.agent.config.AgentSettings;
import dev.mars.outpost.agent.service.FileStreamService;
import dev.mars.outpost.agent.service.PathExpander;
import dev.mars.outpost.registry.AgentConnection;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.net.ServerSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static dev.mars.outpost.agent.ServerFixture.join;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Connection lifecycle of {@link ServerConnection}: registration, reconnects and stop.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@ExtendWith(VertxExtension.class)
@DisplayName("ServerConnection")
class ServerConnectionTest {

    private static final String AGENT_ID = "restaurant-1";

    @TempDir
    Path downloadDir;

    private Vertx vertx;
    private ServerFixture server;
    private ServerConnection connection;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
    }

    @AfterEach
    void tearDown() throws Exception {
        if (connection != null) {
            join(connection.stop());
        }
        if (server != null) {
            server.stop();
        }
    }

    @Test
    @DisplayName("Connects and registers under the configured id")
    void registers() throws Exception {
        server = ServerFixture.start(vertx, downloadDir, 0);
        connection = newConnection(server.port());

        join(connection.start());

        await().atMost(Duration.ofSeconds(5)).until(connection::isRegistered);
        assertTrue(server.registry().isConnected(AGENT_ID));
        assertTrue(connection.isConnected());
    }

    @Test
    @DisplayName("Reconnects after the server closes the socket")
    void reconnectsAfterServerClose() throws Exception {
        server = ServerFixture.start(vertx, downloadDir, 0);
        connection = newConnection(server.port());
        join(connection.start());
        await().atMost(Duration.ofSeconds(5)).until(() -> server.registry().isConnected(AGENT_ID));
        AgentConnection first = server.registry().lookup(AGENT_ID).orElseThrow();

        join(first.close("test closes the connection"));

        await().atMost(Duration.ofSeconds(5)).until(() -> server.registry().lookup(AGENT_ID)
                .map(c -> !c.connectionId().equals(first.connectionId()))
                .orElse(false));
        await().atMost(Duration.ofSeconds(5)).until(connection::isRegistered);
    }

    @Test
    @DisplayName("Keeps retrying until the server comes up")
    void retriesUntilServerIsUp() throws Exception {
        int port = freePort();
        connection = newConnection(port);

        assertThrows(ExecutionException.class, () -> join(connection.start()));
        assertFalse(connection.isConnected());

        server = ServerFixture.start(vertx, downloadDir, port);

        await().atMost(Duration.ofSeconds(10)).until(() -> server.registry().isConnected(AGENT_ID));
        await().atMost(Duration.ofSeconds(5)).until(connection::isRegistered);
    }

    @Test
    @DisplayName("Stopping closes the socket and stops reconnecting")
    void stopEndsReconnects() throws Exception {
        server = ServerFixture.start(vertx, downloadDir, 0);
        connection = newConnection(server.port());
        join(connection.start());
        await().atMost(Duration.ofSeconds(5)).until(() -> server.registry().isConnected(AGENT_ID));

        join(connection.stop());

        await().atMost(Duration.ofSeconds(5)).until(() -> server.registry().size() == 0);
        await().during(Duration.ofMillis(600)).atMost(Duration.ofSeconds(2))
                .until(() -> server.registry().size() == 0);
        assertFalse(connection.isRegistered());
        join(connection.stop());
    }

    private ServerConnection newConnection(int port) {
        AgentSettings settings = AgentSettings.builder()
                .agentId(AGENT_ID)
                .serverUrl("http://" + ServerFixture.HOST + ":" + port)
                .reconnectDelay(Duration.ofMillis(200))
                .build();
        FileStreamService streams = new FileStreamService(vertx, settings.getChunkSize(),
                new PathExpander(Map.of(), null));
        return new ServerConnection(vertx, settings, streams);
    }

    private static int freePort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
