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

import java.util.Optional;

/**
 * Message types exchanged over the sync channel. The enum constant name is the wire value.
 *
 * <h3>Handshake:</h3>
 * <pre>
 * client                          controller
 *   |-- (connect ?token=...) ------->|
 *   |&lt;------- AUTH_SUCCESS ----------|   or AUTH_FAILED + close 1008
 *   |-------- REQUEST_STATE -------->|
 *   |&lt;------- STATE_SYNC ------------|
 *   |-------- ACK_SUCCESS x N ------>|
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public enum MessageType {

    /** Controller to client: token accepted. Carries {@code alarm_client_connected}. */
    AUTH_SUCCESS,

    /** Controller to client: token rejected, the socket is closed right after. */
    AUTH_FAILED,

    /** Client to controller: ask for a full snapshot. */
    REQUEST_STATE,

    /** Controller to client: full snapshot, {@code {"alarms":[...]}}. */
    STATE_SYNC,

    /** Controller to client: create or replace one schedule. */
    SET_ALARM,

    /** Controller to client: remove one schedule, {@code {"id":n}}. */
    DELETE_ALARM,

    ACK_SUCCESS,
    ACK_ERROR,

    /** Agent to controller: a workload started for an alarm. */
    ALARM_TRIGGERED,

    /** Agent to controller: a workload finished, with its terminal status. */
    ALARM_COMPLETED,

    /** Controller to observers: an agent channel opened or closed. */
    CLIENT_STATUS_UPDATE,

    HEARTBEAT,
    PONG;

    /**
     * Looks up a wire value.
     *
     * @param value the {@code type} field of an envelope
     * @return the matching type, or empty for null and unknown values
     */
    public static Optional<MessageType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MessageType type : values()) {
            if (type.name().equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
