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

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.json.JsonObject;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;

/**
 * Minimal agent stand-in speaking raw protocol frames over a real WebSocket.
 */
public final class AgentSocketStub {

    private final WebSocketClient client;
    private final List<JsonObject> received = new CopyOnWriteArrayList<>();
    private volatile WebSocket socket;
    private volatile boolean closed;
    private volatile Short closeCode;

    private AgentSocketStub(Vertx vertx) {
        this.client = vertx.createWebSocketClient();
    }

    public static AgentSocketStub connect(Vertx vertx, int port) throws Exception {
        AgentSocketStub agent = new AgentSocketStub(vertx);
        join(agent.client.connect(port, "127.0.0.1", "/ws").onSuccess(ws -> {
            agent.socket = ws;
            ws.textMessageHandler(text -> agent.received.add(new JsonObject(text)));
            ws.closeHandler(v -> {
                agent.closeCode = ws.closeStatusCode();
                agent.closed = true;
            });
        }));
        return agent;
    }

    public static Future<WebSocket> tryConnect(Vertx vertx, int port) {
        return vertx.createWebSocketClient().connect(port, "127.0.0.1", "/ws");
    }

    public AgentSocketStub register(String clientId) throws Exception {
        send(new JsonObject().put("type", "register").put("client_id", clientId));
        awaitFrame("registered");
        return this;
    }

    public void send(JsonObject frame) throws Exception {
        sendText(frame.encode());
    }

    public void sendText(String text) throws Exception {
        join(socket.writeTextMessage(text));
    }

    public WebSocket socket() {
        return socket;
    }

    public JsonObject awaitFrame(String type) {
        await().atMost(Duration.ofSeconds(5)).until(() -> find(type).isPresent());
        return find(type).get();
    }

    public Optional<JsonObject> find(String type) {
        return received.stream().filter(f -> type.equals(f.getString("type"))).findFirst();
    }

    public boolean isClosed() {
        return closed;
    }

    public Short closeCode() {
        return closeCode;
    }

    public void awaitClosed() {
        await().atMost(Duration.ofSeconds(5)).until(this::isClosed);
    }

    public void close() throws Exception {
        if (!closed && socket != null) {
            join(socket.close());
        }
        join(client.close());
    }

    private static <T> T join(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
}
