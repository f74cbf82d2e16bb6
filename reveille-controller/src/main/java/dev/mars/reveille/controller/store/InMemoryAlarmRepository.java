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

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Alarm store backed by a concurrent map. Ids come from one sequence shared by all principals
 * so they stay unique on every agent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class InMemoryAlarmRepository implements AlarmRepository {

    private final Clock clock;
    private final Map<Long, AlarmRecord> alarms = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    public InMemoryAlarmRepository(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public List<AlarmRecord> findAll(long principalId) {
        return alarms.values().stream()
                .filter(record -> record.principalId() == principalId)
                .sorted(Comparator.comparingLong(AlarmRecord::id))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<AlarmRecord> find(long principalId, long alarmId) {
        AlarmRecord record = alarms.get(alarmId);
        return record != null && record.principalId() == principalId ? Optional.of(record) : Optional.empty();
    }

    @Override
    public AlarmRecord create(long principalId, Schedule draft) {
        Objects.requireNonNull(draft, "Schedule cannot be null");
        Instant now = clock.instant();
        AlarmRecord record = new AlarmRecord(principalId, draft.withId(idSequence.incrementAndGet()), now, now);
        alarms.put(record.id(), record);
        return record;
    }

    @Override
    public Optional<AlarmRecord> update(long principalId, Schedule schedule) {
        Objects.requireNonNull(schedule, "Schedule cannot be null");
        if (find(principalId, schedule.id()).isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(alarms.computeIfPresent(schedule.id(), (id, existing) ->
                new AlarmRecord(principalId, schedule, existing.createdAt(), clock.instant())));
    }

    @Override
    public boolean delete(long principalId, long alarmId) {
        AlarmRecord record = alarms.get(alarmId);
        return record != null && record.principalId() == principalId && alarms.remove(alarmId, record);
    }
}
