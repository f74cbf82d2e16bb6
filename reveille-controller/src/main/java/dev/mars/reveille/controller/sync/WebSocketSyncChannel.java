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

import dev.mars.reveille.controller.auth.Principal;
import dev.mars.reveille.core.SyncMessage;
import io.vertx.core.Future;
import io.vertx.core.http.ServerWebSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/**
 * {@link SyncChannel} over an accepted server WebSocket, one JSON text frame per message.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class WebSocketSyncChannel implements SyncChannel {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketSyncChannel.class);

    private final String id;
    private final ServerWebSocket webSocket;
    private final Principal principal;
    private final ChannelRole role;

    public WebSocketSyncChannel(ServerWebSocket webSocket, Principal principal, ChannelRole role) {
        this.webSocket = Objects.requireNonNull(webSocket, "WebSocket cannot be null");
        this.principal = Objects.requireNonNull(principal, "Principal cannot be null");
        this.role = Objects.requireNonNull(role, "Role cannot be null");
        this.id = "ch-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Principal principal() {
        return principal;
    }

    @Override
    public ChannelRole role() {
        return role;
    }

    @Override
    public boolean isOpen() {
        return !webSocket.isClosed();
    }

    @Override
    public boolean send(SyncMessage message) {
        if (webSocket.isClosed()) {
            return false;
        }
        try {
            webSocket.writeTextMessage(message.encode())
                    .onFailure(err -> logger.warn("Failed to deliver {} on channel {}: {}",
                            message.type(), id, err.getMessage()));
            return true;
        } catch (IllegalStateException e) {
            logger.debug("Channel {} refused {}: {}", id, message.type(), e.getMessage());
            return false;
        }
    }

    @Override
    public Future<Void> close(short code, String reason) {
        return webSocket.isClosed() ? Future.succeededFuture() : webSocket.close(code, reason);
    }

    @Override
    public String toString() {
        return "WebSocketSyncChannel{id=" + id + ", user=" + principal.username() + ", role=" + role + "}";
    }
}
