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

package dev.mars.reveille.agent.channel;

import dev.mars.reveille.agent.config.AgentConfiguration;
import dev.mars.reveille.agent.observability.AgentMetrics;
import dev.mars.reveille.core.MessageType;
import dev.mars.reveille.core.SyncMessage;
import dev.mars.reveille.core.exceptions.ProtocolException;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The agent's long-lived WebSocket to the controller.
 *
 * <p>Every connect attempt is preceded by a fresh login through the {@link CredentialProvider};
 * the token travels in the query string together with {@code client_type=alarm_client}.
 * While open, a heartbeat frame goes out every heartbeat period. Any closure while running
 * schedules a reconnect after the next backoff delay, and a failed login counts as a failed
 * attempt. The backoff returns to its floor every time the socket opens.</p>
 *
 * <p>Inbound text frames are decoded and handed to the inbound handler; frames that do not
 * decode are logged and dropped. {@link #send(SyncMessage)} is best effort.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class ReconnectingChannel {

    private static final Logger logger = LoggerFactory.getLogger(ReconnectingChannel.class);

    static final String CLIENT_TYPE = "alarm_client";

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final CredentialProvider credentials;
    private final Handler<SyncMessage> inboundHandler;
    private final AgentMetrics metrics;
    private final ReconnectBackoff backoff;
    private final WebSocketClient client;

    private final AtomicReference<ChannelState> state = new AtomicReference<>(ChannelState.UNAUTHENTICATED);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile WebSocket socket;
    private volatile long heartbeatTimerId = -1;
    private volatile long reconnectTimerId = -1;

    public ReconnectingChannel(Vertx vertx, AgentConfiguration config, CredentialProvider credentials,
                               Handler<SyncMessage> inboundHandler, AgentMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.credentials = Objects.requireNonNull(credentials, "Credential provider cannot be null");
        this.inboundHandler = Objects.requireNonNull(inboundHandler, "Inbound handler cannot be null");
        this.metrics = metrics;
        this.backoff = new ReconnectBackoff(config.getReconnectInitialDelay(), config.getReconnectMaxDelay(),
                config.getReconnectMultiplier());
        this.client = vertx.createWebSocketClient(new WebSocketClientOptions()
                .setConnectTimeout((int) config.getHttpTimeout().toMillis()));
    }

    /**
     * Authenticates and makes the first connect attempt.
     *
     * @return a future that fails if the first login fails (the channel is then not started),
     *         and succeeds once the first connect attempt has settled, open or not
     */
    public Future<Void> start() {
        if (!running.compareAndSet(false, true)) {
            return Future.failedFuture(new IllegalStateException("Channel already started"));
        }
        logger.info("Starting sync channel to {}", config.getWsUrl());
        state.set(ChannelState.AUTHENTICATING);

        return credentials.authenticate()
                .onFailure(err -> {
                    logger.error("Initial authentication failed: {}", err.getMessage());
                    running.set(false);
                    state.set(ChannelState.UNAUTHENTICATED);
                })
                .compose(token -> connect(token).recover(err -> Future.succeededFuture()));
    }

    /**
     * Sends a frame if the channel is open, otherwise drops it.
     *
     * @return true if the frame was handed to the socket
     */
    public boolean send(SyncMessage message) {
        WebSocket ws = socket;
        if (ws == null || state.get() != ChannelState.OPEN || ws.isClosed()) {
            logger.warn("Sync channel not open, dropping {}", message.type());
            return false;
        }
        ws.writeTextMessage(message.encode())
                .onFailure(err -> logger.warn("Failed to send {}: {}", message.type(), err.getMessage()));
        logger.debug("Sent {}", message.type());
        return true;
    }

    /**
     * Stops reconnecting, cancels the timers and closes the socket.
     */
    public Future<Void> stop() {
        if (!running.getAndSet(false)) {
            return Future.succeededFuture();
        }
        logger.info("Stopping sync channel");
        state.set(ChannelState.STOPPED);
        cancelTimer(reconnectTimerId);
        reconnectTimerId = -1;
        stopHeartbeat();

        WebSocket ws = socket;
        socket = null;
        Future<Void> closed = ws == null ? Future.succeededFuture() : ws.close();
        return closed
                .recover(err -> {
                    logger.debug("Error closing socket: {}", err.getMessage());
                    return Future.succeededFuture();
                })
                .compose(v -> client.close());
    }

    public ChannelState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get().isOpen();
    }

    private Future<Void> connect(String token) {
        if (!running.get()) {
            return Future.succeededFuture();
        }
        state.set(ChannelState.CONNECTING);
        String separator = config.getWsUrl().contains("?") ? "&" : "?";
        String uri = config.getWsUrl() + separator
                + "token=" + URLEncoder.encode(token, StandardCharsets.UTF_8)
                + "&client_type=" + CLIENT_TYPE;

        return client.connect(new WebSocketConnectOptions().setAbsoluteURI(uri))
                .onSuccess(this::onOpen)
                .onFailure(err -> {
                    logger.warn("Sync channel connect failed: {}", err.getMessage());
                    if (running.get()) {
                        state.set(ChannelState.CLOSED);
                        scheduleReconnect();
                    }
                })
                .mapEmpty();
    }

    private void onOpen(WebSocket ws) {
        if (!running.get()) {
            ws.close();
            return;
        }
        socket = ws;
        state.set(ChannelState.OPEN);
        backoff.reset();
        if (metrics != null) {
            metrics.recordChannelOpened();
        }
        logger.info("Sync channel open");

        ws.textMessageHandler(this::onText);
        ws.exceptionHandler(err -> logger.warn("Sync channel error: {}", err.getMessage()));
        ws.closeHandler(v -> onClosed(ws));

        long period = Math.max(1, config.getHeartbeatInterval().toMillis());
        heartbeatTimerId = vertx.setPeriodic(period, id -> send(SyncMessage.of(MessageType.HEARTBEAT)));
    }

    private void onText(String text) {
        SyncMessage message;
        try {
            message = SyncMessage.decode(text);
        } catch (ProtocolException e) {
            logger.warn("Dropping undecodable frame: {}", e.getMessage());
            return;
        }
        logger.debug("Received {}", message.type());
        try {
            inboundHandler.handle(message);
        } catch (RuntimeException e) {
            logger.error("Error handling {}", message.type(), e);
        }
    }

    private void onClosed(WebSocket ws) {
        if (socket != ws) {
            return;
        }
        socket = null;
        stopHeartbeat();
        if (metrics != null) {
            metrics.recordChannelClosed();
        }
        if (!running.get()) {
            return;
        }
        logger.warn("Sync channel closed (code {}, reason {})", ws.closeStatusCode(), ws.closeReason());
        state.set(ChannelState.CLOSED);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        Duration delay = backoff.next();
        logger.info("Reconnecting in {}ms", delay.toMillis());
        reconnectTimerId = vertx.setTimer(Math.max(1, delay.toMillis()), id -> reconnect());
    }

    private void reconnect() {
        reconnectTimerId = -1;
        if (!running.get()) {
            return;
        }
        state.set(ChannelState.AUTHENTICATING);
        credentials.authenticate()
                .onSuccess(token -> connect(token)
                        .onComplete(ar -> recordReconnect(running.get() && state.get() == ChannelState.OPEN)))
                .onFailure(err -> {
                    logger.warn("Re-authentication failed: {}", err.getMessage());
                    recordReconnect(false);
                    if (running.get()) {
                        state.set(ChannelState.CLOSED);
                        scheduleReconnect();
                    }
                });
    }

    private void recordReconnect(boolean success) {
        if (metrics != null) {
            metrics.recordReconnectAttempt(success);
        }
    }

    private void stopHeartbeat() {
        cancelTimer(heartbeatTimerId);
        heartbeatTimerId = -1;
    }

    private void cancelTimer(long timerId) {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
        }
    }
}
