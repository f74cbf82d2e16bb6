package dev.mars.reveille.core;

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

import dev.mars.reveille.core.exceptions.ProtocolException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/**
 * The envelope of every frame on the sync channel:
 * {@code {"type":"...", "data":{...}|null, "timestamp":"ISO-8601"|null}}.
 *
 * <p>The static factories build the payload shapes both sides agree on, so that the
 * field names live in one place.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public record SyncMessage(MessageType type, JsonObject data, String timestamp) {

    public SyncMessage {
        Objects.requireNonNull(type, "Message type cannot be null");
    }

    public static SyncMessage of(MessageType type) {
        return new SyncMessage(type, null, Instant.now().toString());
    }

    public static SyncMessage of(MessageType type, JsonObject data) {
        return new SyncMessage(type, data, Instant.now().toString());
    }

    public static SyncMessage authSuccess(boolean agentConnected) {
        return of(MessageType.AUTH_SUCCESS, new JsonObject().put("alarm_client_connected", agentConnected));
    }

    public static SyncMessage authFailed(String reason) {
        return of(MessageType.AUTH_FAILED, new JsonObject().put("reason", reason));
    }

    public static SyncMessage clientStatus(boolean agentConnected) {
        return of(MessageType.CLIENT_STATUS_UPDATE, new JsonObject().put("alarm_client_connected", agentConnected));
    }

    public static SyncMessage stateSync(Collection<Schedule> schedules) {
        JsonArray alarms = new JsonArray();
        schedules.forEach(schedule -> alarms.add(schedule.toJson()));
        return of(MessageType.STATE_SYNC, new JsonObject().put("alarms", alarms));
    }

    public static SyncMessage setAlarm(Schedule schedule) {
        return of(MessageType.SET_ALARM, schedule.toJson());
    }

    public static SyncMessage deleteAlarm(long id) {
        return of(MessageType.DELETE_ALARM, new JsonObject().put("id", id));
    }

    /**
     * @param alarmId the acknowledged alarm, null when the payload carried no usable id
     * @param error   failure reason, ignored on success
     */
    public static SyncMessage ack(Long alarmId, boolean success, String error) {
        JsonObject payload = new JsonObject()
                .put("alarm_id", alarmId)
                .put("success", success)
                .put("error", success ? null : error);
        return of(success ? MessageType.ACK_SUCCESS : MessageType.ACK_ERROR, payload);
    }

    public static SyncMessage alarmTriggered(long alarmId) {
        return of(MessageType.ALARM_TRIGGERED, new JsonObject()
                .put("alarm_id", alarmId)
                .put("status", AlarmStatus.STARTED.wireValue()));
    }

    public static SyncMessage alarmCompleted(long alarmId, AlarmStatus status, String error) {
        return of(MessageType.ALARM_COMPLETED, new JsonObject()
                .put("alarm_id", alarmId)
                .put("status", status.wireValue())
                .put("error", error));
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("type", type.name())
                .put("data", data)
                .put("timestamp", timestamp);
    }

    public String encode() {
        return toJson().encode();
    }

    /**
     * Decodes one text frame.
     *
     * @throws ProtocolException if the frame is not a JSON object, has no known {@code type},
     *                           or carries a {@code data} field that is not an object
     */
    public static SyncMessage decode(String text) throws ProtocolException {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("Empty frame");
        }
        JsonObject json;
        try {
            json = new JsonObject(text);
        } catch (DecodeException | ClassCastException e) {
            throw new ProtocolException("Frame is not a JSON object: " + e.getMessage(), e);
        }

        Object rawType = json.getValue("type");
        if (!(rawType instanceof String)) {
            throw new ProtocolException("Frame has no message type");
        }
        MessageType type = MessageType.fromWire((String) rawType)
                .orElseThrow(() -> new ProtocolException("Unknown message type: " + rawType));

        Object rawData = json.getValue("data");
        if (rawData != null && !(rawData instanceof JsonObject)) {
            throw new ProtocolException("Field 'data' of " + type + " must be an object");
        }
        Object rawTimestamp = json.getValue("timestamp");
        String timestamp = rawTimestamp instanceof String ? (String) rawTimestamp : null;
        return new SyncMessage(type, (JsonObject) rawData, timestamp);
    }
}
