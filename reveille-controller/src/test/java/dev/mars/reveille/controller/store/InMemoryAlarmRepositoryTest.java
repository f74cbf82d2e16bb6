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
import dev.mars.reveille.core.Schedule;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-memory alarm repository and event log.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
@DisplayName("In-memory store Tests")
class InMemoryAlarmRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-10-19T07:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final InMemoryAlarmRepository repository = new InMemoryAlarmRepository(CLOCK);

    private static Schedule draft(String time) {
        return new Schedule(0, "Alarm", time, List.of(), true);
    }

    @Test
    @DisplayName("Should assign increasing ids from one sequence across owners")
    void shouldAssignIds() {
        AlarmRecord first = repository.create(1, draft("06:00"));
        AlarmRecord second = repository.create(2, draft("07:00"));
        AlarmRecord third = repository.create(1, draft("08:00"));

        assertEquals(1, first.id());
        assertEquals(2, second.id());
        assertEquals(3, third.id());
        assertThat(repository.findAll(1)).extracting(AlarmRecord::id).containsExactly(1L, 3L);
        assertEquals(NOW, first.createdAt());
    }

    @Test
    @DisplayName("Should scope lookups to the owner")
    void shouldScopeToOwner() {
        AlarmRecord record = repository.create(1, draft("06:00"));

        assertTrue(repository.find(1, record.id()).isPresent());
        assertTrue(repository.find(2, record.id()).isEmpty());
        assertTrue(repository.findAll(2).isEmpty());
    }

    @Test
    @DisplayName("Should update only the owner's alarm and keep its creation time")
    void shouldUpdate() {
        AlarmRecord record = repository.create(1, draft("06:00"));
        Schedule changed = record.schedule().withEnabled(false);

        assertTrue(repository.update(2, changed).isEmpty());
        AlarmRecord updated = repository.update(1, changed).orElseThrow();

        assertFalse(updated.schedule().enabled());
        assertEquals(record.createdAt(), updated.createdAt());
        assertTrue(repository.update(1, draft("09:00").withId(42)).isEmpty());
    }

    @Test
    @DisplayName("Should delete only the owner's alarm")
    void shouldDelete() {
        AlarmRecord record = repository.create(1, draft("06:00"));

        assertFalse(repository.delete(2, record.id()));
        assertTrue(repository.delete(1, record.id()));
        assertFalse(repository.delete(1, record.id()));
        assertTrue(repository.findAll(1).isEmpty());
    }

    @Test
    @DisplayName("Should render the REST representation with ownership and timestamps")
    void shouldRenderJson() {
        JsonObject json = repository.create(7, new Schedule(0, "Gym", "05:30", List.of(1, 3), true)).toJson();

        assertEquals(7L, json.getLong("user_id"));
        assertEquals("Gym", json.getString("label"));
        assertEquals("05:30", json.getString("time"));
        assertEquals(List.of(1, 3), json.getJsonArray("repeat_days").getList());
        assertEquals(NOW.toString(), json.getString("created_at"));
        assertEquals(NOW.toString(), json.getString("updated_at"));
    }

    @Test
    @DisplayName("Event log should return an alarm's history newest first")
    void eventLogShouldReturnNewestFirst() {
        InMemoryAlarmEventLog log = new InMemoryAlarmEventLog(CLOCK);
        log.append(1, 5, AlarmStatus.STARTED, null);
        log.append(1, 6, AlarmStatus.STARTED, null);
        log.append(1, 5, AlarmStatus.COMPLETED, null);
        log.append(2, 5, AlarmStatus.STARTED, null);

        List<AlarmEvent> history = log.history(1, 5);

        assertThat(history).extracting(AlarmEvent::status)
                .containsExactly(AlarmStatus.COMPLETED, AlarmStatus.STARTED);
        assertThat(history).allMatch(event -> event.alarmId() == 5 && event.principalId() == 1);
        assertTrue(history.get(0).id() > history.get(1).id());
        assertEquals(NOW, history.get(0).timestamp());
    }
}
