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

package dev.mars.reveille.controller.store;

import dev.mars.reveille.core.Schedule;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Objects;

/**
 * A schedule as held by the controller: the synced definition plus ownership and audit timestamps
 * that never travel to agents.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public record AlarmRecord(long principalId, Schedule schedule, Instant createdAt, Instant updatedAt) {

    public AlarmRecord {
        Objects.requireNonNull(schedule, "Schedule cannot be null");
        Objects.requireNonNull(createdAt, "Created timestamp cannot be null");
        Objects.requireNonNull(updatedAt, "Updated timestamp cannot be null");
    }

    public long id() {
        return schedule.id();
    }

    /**
     * The REST representation: the wire schedule plus {@code user_id}, {@code created_at}
     * and {@code updated_at}.
     */
    public JsonObject toJson() {
        return schedule.toJson()
                .put("user_id", principalId)
                .put("created_at", createdAt.toString())
                .put("updated_at", updatedAt.toString());
    }
}
