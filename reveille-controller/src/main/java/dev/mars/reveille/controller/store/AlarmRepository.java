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

import java.util.List;
import java.util.Optional;

/**
 * Persistent alarm set of the controller. Every lookup is scoped to the owning principal;
 * an alarm owned by someone else is indistinguishable from a missing one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public interface AlarmRepository {

    /**
     * @return the principal's alarms in creation order
     */
    List<AlarmRecord> findAll(long principalId);

    Optional<AlarmRecord> find(long principalId, long alarmId);

    /**
     * Stores a new alarm under a freshly assigned id. The id of {@code draft} is ignored.
     */
    AlarmRecord create(long principalId, Schedule draft);

    /**
     * Replaces the alarm with the same id, keeping its creation timestamp.
     *
     * @return the updated record, or empty if the principal owns no alarm with that id
     */
    Optional<AlarmRecord> update(long principalId, Schedule schedule);

    boolean delete(long principalId, long alarmId);
}
