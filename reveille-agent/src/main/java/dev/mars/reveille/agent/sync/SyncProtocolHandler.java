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

package dev.mars.reveille.agent.sync;

import dev.mars.reveille.agent.observability.AgentMetrics;
import dev.mars.reveille.agent.schedule.RecurringScheduler;
import dev.mars.reveille.agent.schedule.ScheduleStore;
import dev.mars.reveille.core.MessageType;
import dev.mars.reveille.core.Schedule;
import dev.mars.reveille.core.SyncMessage;
import dev.mars.reveille.core.exceptions.InvalidScheduleException;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies controller frames to the local store and scheduler and acknowledges each alarm.
 *
 * <ul>
 *   <li>AUTH_SUCCESS: asks for a full snapshot with REQUEST_STATE.</li>
 *   <li>STATE_SYNC: the snapshot replaces everything local. Alarms missing from it are
 *       disarmed and forgotten. Every entry gets its own ACK_SUCCESS or ACK_ERROR.</li>
 *   <li>SET_ALARM: upsert and acknowledge.</li>
 *   <li>DELETE_ALARM: remove and acknowledge success, also for unknown ids.</li>
 * </ul>
 *
 * <p>Frames with a missing payload are logged and dropped without an acknowledgment.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class SyncProtocolHandler implements Handler<SyncMessage> {

    private static final Logger logger = LoggerFactory.getLogger(SyncProtocolHandler.class);

    private final ScheduleStore store;
    private final RecurringScheduler scheduler;
    private final MessageSink sink;
    private final AgentMetrics metrics;

    public SyncProtocolHandler(ScheduleStore store, RecurringScheduler scheduler, MessageSink sink,
                               AgentMetrics metrics) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.sink = Objects.requireNonNull(sink, "Sink cannot be null");
        this.metrics = metrics;
    }

    @Override
    public void handle(SyncMessage message) {
        switch (message.type()) {
            case AUTH_SUCCESS:
                logger.info("Authenticated with controller, requesting state");
                sink.send(SyncMessage.of(MessageType.REQUEST_STATE));
                break;
            case AUTH_FAILED:
                logger.error("Controller rejected authentication: {}",
                        message.data() == null ? "no reason given" : message.data().getString("reason"));
                break;
            case STATE_SYNC:
                handleStateSync(message.data());
                break;
            case SET_ALARM:
                handleSetAlarm(message.data());
                break;
            case DELETE_ALARM:
                handleDeleteAlarm(message.data());
                break;
            case PONG:
                logger.debug("Heartbeat acknowledged");
                break;
            default:
                logger.warn("Ignoring unexpected message type {}", message.type());
                break;
        }
    }

    private void handleStateSync(JsonObject data) {
        Object rawAlarms = data == null ? null : data.getValue("alarms");
        if (!(rawAlarms instanceof JsonArray)) {
            logger.warn("STATE_SYNC without an alarms array, dropped");
            return;
        }
        JsonArray alarms = (JsonArray) rawAlarms;
        logger.info("Received state snapshot with {} alarm(s)", alarms.size());

        scheduler.clear();
        store.clear();

        List<Schedule> accepted = new ArrayList<>();
        for (Object entry : alarms) {
            if (!(entry instanceof JsonObject)) {
                ackError(null, "Alarm entry is not an object");
                continue;
            }
            try {
                Schedule schedule = Schedule.fromJson((JsonObject) entry);
                scheduler.upsert(schedule);
                accepted.add(schedule);
                ackSuccess(schedule.id());
            } catch (InvalidScheduleException e) {
                ackError(e.getScheduleId(), e.getMessage());
            }
        }
        store.replaceAll(accepted);
        logger.info("State synchronized: {} alarm(s) stored, {} armed", store.size(), scheduler.scheduledIds().size());
    }

    private void handleSetAlarm(JsonObject data) {
        if (data == null) {
            logger.warn("SET_ALARM without data, dropped");
            return;
        }
        try {
            Schedule schedule = Schedule.fromJson(data);
            scheduler.upsert(schedule);
            store.upsert(schedule);
            ackSuccess(schedule.id());
        } catch (InvalidScheduleException e) {
            if (e.getScheduleId() != null) {
                scheduler.remove(e.getScheduleId());
                store.remove(e.getScheduleId());
            }
            ackError(e.getScheduleId(), e.getMessage());
        }
    }

    private void handleDeleteAlarm(JsonObject data) {
        Object rawId = data == null ? null : data.getValue("id");
        if (!(rawId instanceof Number)) {
            logger.warn("DELETE_ALARM without an id, dropped");
            return;
        }
        long id = ((Number) rawId).longValue();
        scheduler.remove(id);
        if (!store.remove(id)) {
            logger.debug("DELETE_ALARM for unknown alarm {}", id);
        }
        ackSuccess(id);
    }

    private void ackSuccess(long alarmId) {
        sink.send(SyncMessage.ack(alarmId, true, null));
        if (metrics != null) {
            metrics.recordAck(true);
        }
    }

    private void ackError(Long alarmId, String reason) {
        logger.warn("Rejecting alarm {}: {}", alarmId, reason);
        sink.send(SyncMessage.ack(alarmId, false, reason));
        if (metrics != null) {
            metrics.recordAck(false);
        }
    }
}
