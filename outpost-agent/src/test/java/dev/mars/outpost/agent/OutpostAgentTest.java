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

package dev.mars.outpost.agent;

import dev.mars.outpost.agent.config.AgentSettings;
import dev.mars.outpost.agent.service.PathExpander;
import dev.mars.outpost.core.FailureReason;
import dev.mars.outpost.core.TransferSnapshot;
import dev.mars.outpost.core.TransferStatus;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static dev.mars.outpost.agent.ServerFixture.join;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: real agents pulling files into a real server over WebSockets.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@ExtendWith(VertxExtension.class)
@DisplayName("Outpost Agent end to end")
class OutpostAgentTest {

    @TempDir
    Path downloadDir;

    @TempDir
    Path agentDir;

    private Vertx vertx;
    private ServerFixture server;
    private WebClient webClient;
    private final List<OutpostAgent> agents = new ArrayList<>();

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        this.vertx = vertx;
        this.server = ServerFixture.start(vertx, downloadDir, 0);
        this.webClient = WebClient.create(vertx);
    }

    @AfterEach
    void tearDown() throws Exception {
        for (OutpostAgent agent : agents) {
            join(agent.shutdown());
        }
        webClient.close();
        server.stop();
    }

    @Test
    @DisplayName("A file requested over HTTP is pulled byte for byte")
    void pullsFileOverHttp() throws Exception {
        byte[] content = randomBytes(10_000, 1);
        Files.write(agentDir.resolve("sales.db"), content);
        startAgent("restaurant-1", 1000);

        HttpResponse<Buffer> created = join(webClient.post(server.port(), ServerFixture.HOST, "/api/download")
                .sendJsonObject(new JsonObject()
                        .put("client_id", "restaurant-1")
                        .put("file_path", "$SITE_DATA/sales.db")));
        assertEquals(201, created.statusCode());
        String downloadId = created.bodyAsJsonObject().getString("download_id");

        TransferSnapshot done = server.awaitTerminal(downloadId);
        assertEquals(TransferStatus.COMPLETED, done.status());
        assertEquals(10, done.chunksReceived());
        assertEquals(content.length, done.bytesReceived());
        assertArrayEquals(content, Files.readAllBytes(done.artifactPath()));

        JsonObject view = join(webClient.get(server.port(), ServerFixture.HOST, "/api/downloads/" + downloadId).send())
                .bodyAsJsonObject();
        assertEquals("completed", view.getString("status"));
        await().atMost(Duration.ofSeconds(5)).until(() -> agents.get(0).activeStreams() == 0);
    }

    @Test
    @DisplayName("An empty file completes as an empty artifact")
    void pullsEmptyFile() throws Exception {
        Files.createFile(agentDir.resolve("empty.log"));
        startAgent("restaurant-1", 1000);

        TransferSnapshot created = join(server.orchestrator().create("restaurant-1", "$SITE_DATA/empty.log"));
        TransferSnapshot done = server.awaitTerminal(created.transferId());

        assertEquals(TransferStatus.COMPLETED, done.status());
        assertEquals(0, Files.size(done.artifactPath()));
    }

    @Test
    @DisplayName("Two agents stream concurrently into separate artifacts")
    void twoAgentsConcurrently() throws Exception {
        byte[] first = randomBytes(50_000, 2);
        byte[] second = randomBytes(70_001, 3);
        Files.write(agentDir.resolve("first.bin"), first);
        Files.write(agentDir.resolve("second.bin"), second);
        startAgent("restaurant-1", 4096);
        startAgent("restaurant-2", 4096);

        TransferSnapshot a = join(server.orchestrator().create("restaurant-1", agentDir.resolve("first.bin").toString()));
        TransferSnapshot b = join(server.orchestrator().create("restaurant-2", agentDir.resolve("second.bin").toString()));

        TransferSnapshot doneA = server.awaitTerminal(a.transferId());
        TransferSnapshot doneB = server.awaitTerminal(b.transferId());
        assertEquals(TransferStatus.COMPLETED, doneA.status());
        assertEquals(TransferStatus.COMPLETED, doneB.status());
        assertNotEquals(doneA.artifactPath(), doneB.artifactPath());
        assertArrayEquals(first, Files.readAllBytes(doneA.artifactPath()));
        assertArrayEquals(second, Files.readAllBytes(doneB.artifactPath()));
    }

    @Test
    @DisplayName("A missing file fails the download with the agent's message")
    void missingFileFails() throws Exception {
        startAgent("restaurant-1", 1000);
        String path = agentDir.resolve("nope.txt").toString();

        TransferSnapshot created = join(server.orchestrator().create("restaurant-1", path));
        TransferSnapshot done = server.awaitTerminal(created.transferId());

        assertEquals(TransferStatus.FAILED, done.status());
        assertEquals(FailureReason.AGENT_ERROR, done.failureReason());
        assertEquals("File not found: " + path, done.error());
    }

    @Test
    @DisplayName("Cancelling a download stops the agent's stream")
    void cancelStopsAgentStream() throws Exception {
        Files.write(agentDir.resolve("large.bin"), randomBytes(16 * 1024 * 1024, 4));
        OutpostAgent agent = startAgent("restaurant-1", 1024);

        TransferSnapshot created = join(server.orchestrator().create("restaurant-1", "$SITE_DATA/large.bin"));
        await().atMost(Duration.ofSeconds(10)).pollInterval(Duration.ofMillis(5))
                .until(() -> server.orchestrator().find(created.transferId())
                        .map(s -> s.bytesReceived() > 0).orElse(false));

        TransferSnapshot cancelled = join(server.orchestrator().cancel(created.transferId()));

        assertEquals(FailureReason.CANCELLED, cancelled.failureReason());
        await().atMost(Duration.ofSeconds(10)).until(() -> agent.activeStreams() == 0);
        assertTrue(agent.isRegistered());
    }

    @Test
    @DisplayName("Shutting the agent down mid-stream fails the download as disconnected")
    void shutdownMidStream() throws Exception {
        Files.write(agentDir.resolve("large.bin"), randomBytes(16 * 1024 * 1024, 5));
        OutpostAgent agent = startAgent("restaurant-1", 1024);

        TransferSnapshot created = join(server.orchestrator().create("restaurant-1", "$SITE_DATA/large.bin"));
        await().atMost(Duration.ofSeconds(10)).pollInterval(Duration.ofMillis(5))
                .until(() -> server.orchestrator().find(created.transferId())
                        .map(s -> s.bytesReceived() > 0).orElse(false));

        join(agent.shutdown());

        TransferSnapshot done = server.awaitTerminal(created.transferId());
        assertEquals(FailureReason.AGENT_DISCONNECTED, done.failureReason());
        await().atMost(Duration.ofSeconds(5)).until(() -> !server.registry().isConnected("restaurant-1"));
        assertFalse(agent.isRunning());
    }

    @Test
    @DisplayName("Shutdown is idempotent and final")
    void shutdownIsIdempotent() throws Exception {
        OutpostAgent agent = startAgent("restaurant-1", 1000);

        join(agent.shutdown());
        join(agent.shutdown());

        assertFalse(agent.isRunning());
        assertThrows(IllegalStateException.class, agent::start);
        await().atMost(Duration.ofSeconds(5)).until(() -> server.registry().size() == 0);
    }

    private OutpostAgent startAgent(String id, int chunkSize) throws Exception {
        AgentSettings settings = AgentSettings.builder()
                .agentId(id)
                .serverUrl(server.url())
                .chunkSize(chunkSize)
                .reconnectDelay(Duration.ofMillis(200))
                .build();
        OutpostAgent agent = new OutpostAgent(vertx, settings,
                new PathExpander(Map.of("SITE_DATA", agentDir.toString()), null));
        agents.add(agent);
        join(agent.start());
        await().atMost(Duration.ofSeconds(5)).until(() -> server.registry().isConnected(id) && agent.isRegistered());
        return agent;
    }

    private static byte[] randomBytes(int size, long seed) {
        byte[] bytes = new byte[size];
        new Random(seed).nextBytes(bytes);
        return bytes;
    }
}
