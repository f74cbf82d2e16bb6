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
import dev.mars.reveille.controller.auth.TokenService;
import dev.mars.reveille.controller.store.AlarmEventLog;
import dev.mars.reveille.controller.store.AlarmRecord;
import dev.mars.reveille.controller.store.AlarmRepository;
import dev.mars.reveille.core.AlarmStatus;
import dev.mars.reveille.core.MessageType;
import dev.mars.reveille.core.Schedule;
import dev.mars.reveille.core.SyncMessage;
import dev.mars.reveille.core.exceptions.ProtocolException;
import io.vertx.core.Handler;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Controller side of the sync protocol, mounted as the HTTP server's WebSocket handler.
 *
 * <p>A socket on {@value #PATH} must carry {@code token} and optionally {@code client_type}
 * query parameters. Sockets with an unknown or expired token receive {@code AUTH_FAILED}
 * and are closed with status 1008. Accepted sockets are registered with the
 * {@link ConnectionRegistry} and then served:</p>
 * <ul>
 *   <li>{@code REQUEST_STATE} is answered with a {@code STATE_SYNC} of the principal's alarms</li>
 *   <li>{@code HEARTBEAT} is answered with {@code PONG}</li>
 *   <li>{@code ACK_SUCCESS} and {@code ACK_ERROR} are logged and counted, never retried</li>
 *   <li>{@code ALARM_TRIGGERED} and {@code ALARM_COMPLETED} are appended to the event log
 *       and forwarded to the principal's observers</li>
 * </ul>
 * <p>Observers also receive {@code CLIENT_STATUS_UPDATE} whenever an agent channel opens or closes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class SyncEndpoint implements Handler<ServerWebSocket> {

    private static final Logger logger = LoggerFactory.getLogger(SyncEndpoint.class);

    public static final String PATH = "/ws";
    static final short POLICY_VIOLATION = 1008;

    private final TokenService tokenService;
    private final AlarmRepository repository;
    private final AlarmEventLog eventLog;
    private final ConnectionRegistry registry;

    private final AtomicLong acksReceived = new AtomicLong();
    private final AtomicLong ackErrorsReceived = new AtomicLong();

    public SyncEndpoint(TokenService tokenService, AlarmRepository repository, AlarmEventLog eventLog,
                        ConnectionRegistry registry) {
        this.tokenService = Objects.requireNonNull(tokenService, "TokenService cannot be null");
        this.repository = Objects.requireNonNull(repository, "AlarmRepository cannot be null");
        this.eventLog = Objects.requireNonNull(eventLog, "AlarmEventLog cannot be null");
        this.registry = Objects.requireNonNull(registry, "ConnectionRegistry cannot be null");
    }

    // ==================== Connection Handling ====================

    @Override
    public void handle(ServerWebSocket webSocket) {
        if (!PATH.equals(webSocket.path())) {
            logger.warn("Rejecting WebSocket on unknown path {}", webSocket.path());
            webSocket.close(POLICY_VIOLATION, "Unknown endpoint");
            return;
        }

        Map<String, String> params;
        try {
            params = parseQuery(webSocket.query());
        } catch (IllegalArgumentException e) {
            reject(webSocket, "Malformed connection parameters");
            return;
        }

        Optional<Principal> principal = tokenService.resolve(params.get("token"));
        if (principal.isEmpty()) {
            reject(webSocket, "Invalid authentication token");
            return;
        }
        accept(webSocket, principal.get(), ChannelRole.fromClientType(params.get("client_type")));
    }

    private void reject(ServerWebSocket webSocket, String reason) {
        logger.warn("WebSocket connection from {} rejected: {}", webSocket.remoteAddress(), reason);
        webSocket.writeTextMessage(SyncMessage.authFailed(reason).encode())
                .eventually(() -> webSocket.close(POLICY_VIOLATION, reason))
                .onFailure(err -> logger.debug("Closing rejected WebSocket failed: {}", err.getMessage()));
    }

    private void accept(ServerWebSocket webSocket, Principal principal, ChannelRole role) {
        WebSocketSyncChannel channel = new WebSocketSyncChannel(webSocket, principal, role);
        webSocket.textMessageHandler(text -> onFrame(channel, text));
        webSocket.exceptionHandler(err -> logger.warn("Channel {} error: {}", channel.id(), err.getMessage()));
        webSocket.closeHandler(v -> onClosed(channel));

        registry.register(channel);
        logger.info("User '{}' connected via WebSocket as {}", principal.username(), role);

        channel.send(SyncMessage.authSuccess(registry.isAgentConnected(principal.id())));
        if (role == ChannelRole.AGENT) {
            registry.sendToRole(principal.id(), ChannelRole.OBSERVER, SyncMessage.clientStatus(true));
        }
    }

    private void onClosed(SyncChannel channel) {
        if (!registry.unregister(channel)) {
            return;
        }
        long principalId = channel.principal().id();
        logger.info("User '{}' disconnected from WebSocket ({})", channel.principal().username(), channel.role());
        if (channel.role() == ChannelRole.AGENT) {
            registry.sendToRole(principalId, ChannelRole.OBSERVER,
                    SyncMessage.clientStatus(registry.isAgentConnected(principalId)));
        }
    }

    // ==================== Inbound Messages ====================

    void onFrame(SyncChannel channel, String text) {
        SyncMessage message;
        try {
            message = SyncMessage.decode(text);
        } catch (ProtocolException e) {
            logger.warn("Dropping frame on channel {}: {}", channel.id(), e.getMessage());
            return;
        }
        logger.debug("Received {} on channel {}", message.type(), channel.id());

        switch (message.type()) {
            case REQUEST_STATE -> sendState(channel);
            case HEARTBEAT -> channel.send(SyncMessage.of(MessageType.PONG));
            case ACK_SUCCESS -> onAck(channel, message.data(), true);
            case ACK_ERROR -> onAck(channel, message.data(), false);
            case ALARM_TRIGGERED, ALARM_COMPLETED -> onLifecycle(channel, message);
            default -> logger.warn("Unexpected {} from channel {}, ignoring", message.type(), channel.id());
        }
    }

    private void sendState(SyncChannel channel) {
        List<Schedule> schedules = repository.findAll(channel.principal().id()).stream()
                .map(AlarmRecord::schedule)
                .collect(Collectors.toList());
        channel.send(SyncMessage.stateSync(schedules));
        logger.info("Sent state sync with {} alarms to user '{}'", schedules.size(), channel.principal().username());
    }

    private void onAck(SyncChannel channel, JsonObject data, boolean success) {
        Object alarmId = data == null ? null : data.getValue("alarm_id");
        acksReceived.incrementAndGet();
        if (success) {
            logger.info("User '{}' acknowledged alarm {}", channel.principal().username(), alarmId);
            return;
        }
        ackErrorsReceived.incrementAndGet();
        Object error = data == null ? null : data.getValue("error");
        logger.error("User '{}' reported error scheduling alarm {}: {}", channel.principal().username(), alarmId,
                error != null ? error : "Unknown error");
    }

    private void onLifecycle(SyncChannel channel, SyncMessage message) {
        JsonObject data = message.data();
        Object rawId = data == null ? null : data.getValue("alarm_id");
        if (!(rawId instanceof Number)) {
            logger.warn("Dropping {} without a numeric alarm_id on channel {}", message.type(), channel.id());
            return;
        }
        long alarmId = ((Number) rawId).longValue();

        AlarmStatus status;
        if (message.type() == MessageType.ALARM_TRIGGERED) {
            status = AlarmStatus.STARTED;
        } else {
            Object rawStatus = data.getValue("status");
            Optional<AlarmStatus> parsed = rawStatus == null
                    ? Optional.of(AlarmStatus.COMPLETED)
                    : rawStatus instanceof String ? AlarmStatus.fromWire((String) rawStatus) : Optional.empty();
            if (parsed.isEmpty() || !parsed.get().isTerminal()) {
                logger.warn("Dropping ALARM_COMPLETED for alarm {} with unknown status '{}'", alarmId, rawStatus);
                return;
            }
            status = parsed.get();
        }

        Object rawError = data.getValue("error");
        String error = rawError instanceof String ? (String) rawError : null;
        long principalId = channel.principal().id();
        eventLog.append(principalId, alarmId, status, error);
        logger.info("Alarm {} of user '{}' reported {}", alarmId, channel.principal().username(), status.wireValue());

        registry.sendToRole(principalId, ChannelRole.OBSERVER, message);
    }

    // ==================== Outbound Deltas ====================

    /**
     * Pushes a created or changed alarm to every channel of its owner.
     *
     * @return the number of channels that accepted the message
     */
    public int publishUpsert(long principalId, Schedule schedule) {
        return registry.send(principalId, SyncMessage.setAlarm(schedule));
    }

    /**
     * Pushes a deletion to every channel of the owner.
     *
     * @return the number of channels that accepted the message
     */
    public int publishDelete(long principalId, long alarmId) {
        return registry.send(principalId, SyncMessage.deleteAlarm(alarmId));
    }

    public long getAcksReceived() {
        return acksReceived.get();
    }

    public long getAckErrorsReceived() {
        return ackErrorsReceived.get();
    }

    static Map<String, String> parseQuery(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }
}
