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

import dev.mars.reveille.core.AlarmStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event history held in memory. Events for alarms that were deleted afterwards are kept.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class InMemoryAlarmEventLog implements AlarmEventLog {

    private final Clock clock;
    private final List<AlarmEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong idSequence = new AtomicLong();

    public InMemoryAlarmEventLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public AlarmEvent append(long principalId, long alarmId, AlarmStatus status, String error) {
        AlarmEvent event = new AlarmEvent(idSequence.incrementAndGet(), alarmId, principalId, status,
                clock.instant(), error);
        events.add(event);
        return event;
    }

    @Override
    public List<AlarmEvent> history(long principalId, long alarmId) {
        List<AlarmEvent> matching = new ArrayList<>();
        for (AlarmEvent event : events) {
            if (event.principalId() == principalId && event.alarmId() == alarmId) {
                matching.add(event);
            }
        }
        Collections.reverse(matching);
        return matching;
    }
}
