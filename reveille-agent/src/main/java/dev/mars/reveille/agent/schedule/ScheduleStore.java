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

package dev.mars.reveille.agent.schedule;

import dev.mars.reveille.core.Schedule;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * The agent's local copy of the controller's schedules, keyed by id.
 *
 * <p>Written only by the sync protocol handler. Readers get snapshot copies.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class ScheduleStore {

    private final Map<Long, Schedule> schedules = new ConcurrentHashMap<>();

    /**
     * Replaces the whole store with the given schedules.
     */
    public void replaceAll(Collection<Schedule> snapshot) {
        schedules.clear();
        snapshot.forEach(schedule -> schedules.put(schedule.id(), schedule));
    }

    public Optional<Schedule> upsert(Schedule schedule) {
        return Optional.ofNullable(schedules.put(schedule.id(), schedule));
    }

    /**
     * @return true if a schedule with that id was present
     */
    public boolean remove(long id) {
        return schedules.remove(id) != null;
    }

    public Optional<Schedule> get(long id) {
        return Optional.ofNullable(schedules.get(id));
    }

    public boolean contains(long id) {
        return schedules.containsKey(id);
    }

    public void clear() {
        schedules.clear();
    }

    public int size() {
        return schedules.size();
    }

    /**
     * @return the schedules ordered by id
     */
    public List<Schedule> snapshot() {
        return schedules.values().stream()
                .sorted(Comparator.comparingLong(Schedule::id))
                .collect(Collectors.toList());
    }
}
