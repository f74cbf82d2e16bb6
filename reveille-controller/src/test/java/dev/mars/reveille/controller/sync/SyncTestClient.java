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

package dev.mars.reveille.controller.sync;

import dev.mars.reveille.core.MessageType;
import dev.mars.reveille.core.SyncMessage;
import dev.mars.reveille.core.exceptions.ProtocolException;
import io.vertx.core.Vertx;
import io.vertx.core.http.ClientWebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketConnectOptions;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Blocking WebSocket client for driving the sync endpoint from test threads. Handlers are
 * attached before the handshake so the first server frame is never missed.
 */
public final class SyncTestClient implements AutoCloseable {

    private static final long TIMEOUT_SECONDS = 5;

    private final WebSocketClient client;
    private final ClientWebSocket webSocket;
    private final BlockingQueue<SyncMessage> inbox = new LinkedBlockingQueue<>();
    private final CompletableFuture<Short> closeCode = new CompletableFuture<>();

    private SyncTestClient(Vertx vertx) {
        this.client = vertx.createWebSocketClient();
        this.webSocket = client.webSocket();
        webSocket.textMessageHandler(text -> {
            try {
                inbox.add(SyncMessage.decode(text));
            } catch (ProtocolException e) {
                throw new IllegalStateException("Server sent an undecodable frame: " + text, e);
            }
        });
        webSocket.closeHandler(v -> closeCode.complete(webSocket.closeStatusCode()));
    }

    public static SyncTestClient connect(Vertx vertx, int port, String query) throws Exception {
        SyncTestClient testClient = new SyncTestClient(vertx);
        testClient.webSocket.connect(new WebSocketConnectOptions()
                        .setHost("127.0.0.1")
                        .setPort(port)
                        .setURI(SyncEndpoint.PATH + "?" + query))
                .toCompletionStage().toCompletableFuture().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return testClient;
    }

    public static SyncTestClient agent(Vertx vertx, int port, String token) throws Exception {
        return connect(vertx, port, "token=" + token + "&client_type=alarm_client");
    }

    public static SyncTestClient observer(Vertx vertx, int port, String token) throws Exception {
        return connect(vertx, port, "token=" + token + "&client_type=web");
    }

    public SyncMessage next() throws InterruptedException {
        SyncMessage message = inbox.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertNotNull(message, "No message received within " + TIMEOUT_SECONDS + "s");
        return message;
    }

    public SyncMessage expect(MessageType type) throws InterruptedException {
        SyncMessage message = next();
        assertEquals(type, message.type(), "Unexpected message " + message.encode());
        return message;
    }

    public void assertNothingPending(long millis) throws InterruptedException {
        assertNull(inbox.poll(millis, TimeUnit.MILLISECONDS));
    }

    public void send(SyncMessage message) {
        webSocket.writeTextMessage(message.encode());
    }

    public void sendText(String text) {
        webSocket.writeTextMessage(text);
    }

    public Short awaitClose() throws Exception {
        return closeCode.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public void close() throws Exception {
        if (!webSocket.isClosed()) {
            webSocket.close().toCompletionStage().toCompletableFuture().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
        client.close();
    }
}
