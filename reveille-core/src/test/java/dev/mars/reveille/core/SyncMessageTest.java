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
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
class SyncMessageTest {

    @Test
    void decodesHeartbeatWithoutData() throws ProtocolException {
        SyncMessage message = SyncMessage.decode("{\"type\":\"HEARTBEAT\"}");
        assertEquals(MessageType.HEARTBEAT, message.type());
        assertNull(message.data());
        assertNull(message.timestamp());
    }

    @Test
    void encodedEnvelopeCarriesTypeDataAndTimestamp() throws ProtocolException {
        SyncMessage message = SyncMessage.deleteAlarm(7);
        JsonObject json = new JsonObject(message.encode());
        assertEquals("DELETE_ALARM", json.getString("type"));
        assertEquals(7L, json.getJsonObject("data").getLong("id"));
        assertTrue(json.containsKey("timestamp"));

        SyncMessage decoded = SyncMessage.decode(message.encode());
        assertEquals(MessageType.DELETE_ALARM, decoded.type());
        assertEquals(message.timestamp(), decoded.timestamp());
    }

    @Test
    void stateSyncWrapsAlarmsArray() {
        SyncMessage message = SyncMessage.stateSync(List.of(
                new Schedule(1, "A", "07:00", List.of(0), true),
                new Schedule(2, "B", "08:00", List.of(1), false)));
        assertEquals(2, message.data().getJsonArray("alarms").size());
        assertEquals(2L, message.data().getJsonArray("alarms").getJsonObject(1).getLong("id"));
    }

    @Test
    void successAckHasNullError() {
        SyncMessage ack = SyncMessage.ack(3L, true, "ignored");
        assertEquals(MessageType.ACK_SUCCESS, ack.type());
        assertEquals(3L, ack.data().getLong("alarm_id"));
        assertTrue(ack.data().getBoolean("success"));
        assertTrue(ack.data().containsKey("error"));
        assertNull(ack.data().getString("error"));
    }

    @Test
    void errorAckCarriesReasonAndMaybeNullId() {
        SyncMessage ack = SyncMessage.ack(null, false, "Schedule id is missing");
        assertEquals(MessageType.ACK_ERROR, ack.type());
        assertNull(ack.data().getLong("alarm_id"));
        assertFalse(ack.data().getBoolean("success"));
        assertEquals("Schedule id is missing", ack.data().getString("error"));
    }

    @Test
    void alarmCompletedUsesWireStatus() {
        SyncMessage message = SyncMessage.alarmCompleted(4, AlarmStatus.STOPPED_EARLY, "too long");
        assertEquals("stopped_early", message.data().getString("status"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "not json", "[1,2]", "{\"data\":{}}", "{\"type\":\"NOPE\"}",
            "{\"type\":42}", "{\"type\":\"SET_ALARM\",\"data\":[1]}"})
    void rejectsMalformedFrames(String frame) {
        assertThrows(ProtocolException.class, () -> SyncMessage.decode(frame));
    }

    @Test
    void alarmStatusWireValues() {
        assertEquals(AlarmStatus.COMPLETED, AlarmStatus.fromWire("completed").orElseThrow());
        assertTrue(AlarmStatus.fromWire("exploded").isEmpty());
        assertFalse(AlarmStatus.STARTED.isTerminal());
        assertTrue(AlarmStatus.FAILED.isTerminal());
    }
}
