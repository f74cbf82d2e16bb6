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

package dev.mars.reveille.controller.service;

import dev.mars.reveille.controller.auth.Principal;
import dev.mars.reveille.controller.http.ReveilleApiException;
import dev.mars.reveille.controller.store.AlarmEvent;
import dev.mars.reveille.controller.store.AlarmEventLog;
import dev.mars.reveille.controller.store.AlarmRecord;
import dev.mars.reveille.controller.store.AlarmRepository;
import dev.mars.reveille.controller.sync.SyncEndpoint;
import dev.mars.reveille.core.Schedule;
import dev.mars.reveille.core.exceptions.InvalidScheduleException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Alarm CRUD for the REST API. Every successful mutation is stored first and then pushed to the
 * owner's channels as {@code SET_ALARM} or {@code DELETE_ALARM}; agents that are offline pick
 * the change up from the snapshot they request on reconnect.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class AlarmService {

    private static final Logger logger = LoggerFactory.getLogger(AlarmService.class);

    /** Fields a client may set; anything else in a request body is ignored. */
    private static final List<String> EDITABLE_FIELDS = List.of("label", "time", "repeat_days", "enabled");

    private final AlarmRepository repository;
    private final AlarmEventLog eventLog;
    private final SyncEndpoint syncEndpoint;

    public AlarmService(AlarmRepository repository, AlarmEventLog eventLog, SyncEndpoint syncEndpoint) {
        this.repository = Objects.requireNonNull(repository, "AlarmRepository cannot be null");
        this.eventLog = Objects.requireNonNull(eventLog, "AlarmEventLog cannot be null");
        this.syncEndpoint = Objects.requireNonNull(syncEndpoint, "SyncEndpoint cannot be null");
    }

    public List<AlarmRecord> list(Principal principal) {
        return repository.findAll(principal.id());
    }

    /**
     * @throws ReveilleApiException alarm not found if the principal owns no such alarm
     */
    public AlarmRecord get(Principal principal, long alarmId) {
        return repository.find(principal.id(), alarmId)
                .orElseThrow(() -> ReveilleApiException.alarmNotFound(alarmId));
    }

    /**
     * Creates an alarm from a request body. {@code time} is required; {@code label} defaults to
     * {@value Schedule#DEFAULT_LABEL}, {@code repeat_days} to none and {@code enabled} to true.
     */
    public AlarmRecord create(Principal principal, JsonObject body) {
        Schedule draft = toSchedule(0L, editableFields(body));
        AlarmRecord created = repository.create(principal.id(), draft);
        logger.info("User '{}' created alarm {}: {}", principal.username(), created.id(), created.schedule().time());

        publishUpsert(principal, created);
        return created;
    }

    /**
     * Applies the fields present in the body to an existing alarm. Absent or null fields keep
     * their current value.
     */
    public AlarmRecord update(Principal principal, long alarmId, JsonObject body) {
        AlarmRecord existing = get(principal, alarmId);
        JsonObject merged = existing.schedule().toJson().mergeIn(editableFields(body));
        AlarmRecord updated = save(principal, toSchedule(alarmId, merged));
        logger.info("User '{}' updated alarm {}", principal.username(), alarmId);

        publishUpsert(principal, updated);
        return updated;
    }

    public AlarmRecord toggle(Principal principal, long alarmId, boolean enabled) {
        AlarmRecord existing = get(principal, alarmId);
        AlarmRecord updated = save(principal, existing.schedule().withEnabled(enabled));
        logger.info("User '{}' {} alarm {}", principal.username(), enabled ? "enabled" : "disabled", alarmId);

        publishUpsert(principal, updated);
        return updated;
    }

    public void delete(Principal principal, long alarmId) {
        if (!repository.delete(principal.id(), alarmId)) {
            throw ReveilleApiException.alarmNotFound(alarmId);
        }
        logger.info("User '{}' deleted alarm {}", principal.username(), alarmId);

        int delivered = syncEndpoint.publishDelete(principal.id(), alarmId);
        logger.debug("DELETE_ALARM {} pushed to {} channel(s)", alarmId, delivered);
    }

    /**
     * @return the firing history of an alarm the principal still owns, newest first
     */
    public List<AlarmEvent> history(Principal principal, long alarmId) {
        get(principal, alarmId);
        return eventLog.history(principal.id(), alarmId);
    }

    // ==================== Private Helpers ====================

    private AlarmRecord save(Principal principal, Schedule schedule) {
        return repository.update(principal.id(), schedule)
                .orElseThrow(() -> ReveilleApiException.alarmNotFound(schedule.id()));
    }

    private void publishUpsert(Principal principal, AlarmRecord record) {
        int delivered = syncEndpoint.publishUpsert(principal.id(), record.schedule());
        logger.debug("SET_ALARM {} pushed to {} channel(s)", record.id(), delivered);
    }

    private static JsonObject editableFields(JsonObject body) {
        if (body == null) {
            throw ReveilleApiException.missingBody();
        }
        JsonObject fields = new JsonObject();
        for (String field : EDITABLE_FIELDS) {
            Object value = body.getValue(field);
            if (value != null) {
                fields.put(field, value);
            }
        }
        return fields;
    }

    private static Schedule toSchedule(long id, JsonObject fields) {
        try {
            return Schedule.fromJson(fields.copy().put("id", id));
        } catch (InvalidScheduleException e) {
            throw ReveilleApiException.invalidAlarm(id, e);
        }
    }
}
