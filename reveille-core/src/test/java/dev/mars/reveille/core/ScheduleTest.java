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

import dev.mars.reveille.core.exceptions.InvalidScheduleException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
class ScheduleTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        void weekdaysAreSortedAndDeduplicated() {
            Schedule schedule = new Schedule(1, "Wake", "07:00", Arrays.asList(4, 0, 2, 0, 4), true);
            assertEquals(List.of(0, 2, 4), schedule.repeatDays());
        }

        @Test
        void nullWeekdayIsRejected() {
            assertThatThrownBy(() -> new Schedule(1, "Wake", "07:00", Arrays.asList(0, null, 2), true))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("null");
        }

        @Test
        void nullLabelDefaults() {
            Schedule schedule = new Schedule(1, null, "07:00", List.of(0), true);
            assertEquals(Schedule.DEFAULT_LABEL, schedule.label());
        }

        @Test
        void emptyWeekdaysIsNotRecurring() {
            assertFalse(new Schedule(1, "Once", "07:00", List.of(), true).isRecurring());
            assertTrue(new Schedule(1, "Daily", "07:00", List.of(0, 1), true).isRecurring());
        }

        @Test
        void weekdayIndexZeroIsMonday() throws InvalidScheduleException {
            Schedule schedule = new Schedule(1, "Wake", "07:00", List.of(0, 6), true);
            assertThat(schedule.weekdays()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.SUNDAY);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @ValueSource(strings = {"00:00", "07:05", "19:59", "23:59"})
        void acceptsValidTimes(String time) throws InvalidScheduleException {
            Schedule schedule = new Schedule(1, "A", time, List.of(0), true);
            schedule.validate();
            assertEquals(LocalTime.parse(time), schedule.fireTime());
        }

        @ParameterizedTest
        @ValueSource(strings = {"24:00", "7:00", "07:60", "0700", "07:00:00", "ab:cd", ""})
        void rejectsInvalidTimes(String time) {
            Schedule schedule = new Schedule(9, "A", time, List.of(0), true);
            assertThatThrownBy(schedule::validate)
                    .isInstanceOf(InvalidScheduleException.class)
                    .satisfies(e -> {
                        InvalidScheduleException ise = (InvalidScheduleException) e;
                        assertEquals(9L, ise.getScheduleId());
                        assertEquals("time", ise.getField());
                    });
        }

        @Test
        void rejectsWeekdayOutOfRange() {
            Schedule schedule = new Schedule(2, "A", "07:00", List.of(0, 7), true);
            assertThatThrownBy(schedule::validate)
                    .isInstanceOf(InvalidScheduleException.class)
                    .hasMessageContaining("7");
        }

        @Test
        void rejectsLongLabel() {
            Schedule schedule = new Schedule(2, "x".repeat(51), "07:00", List.of(0), true);
            assertThatThrownBy(schedule::validate).isInstanceOf(InvalidScheduleException.class);
        }
    }

    @Nested
    @DisplayName("Wire format")
    class WireFormat {

        @Test
        void toJsonUsesWireFieldNames() {
            JsonObject json = new Schedule(3, "Wake", "06:30", List.of(1, 0), false).toJson();
            assertEquals(3L, json.getLong("id"));
            assertEquals("Wake", json.getString("label"));
            assertEquals("06:30", json.getString("time"));
            assertEquals(new JsonArray().add(0).add(1), json.getJsonArray("repeat_days"));
            assertFalse(json.getBoolean("enabled"));
        }

        @Test
        void fromJsonAppliesDefaults() throws InvalidScheduleException {
            Schedule schedule = Schedule.fromJson(new JsonObject().put("id", 4).put("time", "08:15"));
            assertEquals(4L, schedule.id());
            assertEquals(Schedule.DEFAULT_LABEL, schedule.label());
            assertTrue(schedule.repeatDays().isEmpty());
            assertTrue(schedule.enabled());
        }

        @Test
        void fromJsonParsesDecodedFrame() throws InvalidScheduleException {
            JsonObject json = new JsonObject(
                    "{\"id\":5,\"label\":\"Gym\",\"time\":\"05:45\",\"repeat_days\":[5,3,3],\"enabled\":true}");
            Schedule schedule = Schedule.fromJson(json);
            assertEquals(new Schedule(5, "Gym", "05:45", List.of(3, 5), true), schedule);
        }

        @Test
        void missingIdIsReportedWithoutId() {
            assertThatThrownBy(() -> Schedule.fromJson(new JsonObject().put("time", "07:00")))
                    .isInstanceOf(InvalidScheduleException.class)
                    .satisfies(e -> assertEquals(null, ((InvalidScheduleException) e).getScheduleId()));
        }

        @Test
        void badTimeIsReportedWithId() {
            assertThatThrownBy(() -> Schedule.fromJson(new JsonObject().put("id", 12).put("time", "25:00")))
                    .isInstanceOf(InvalidScheduleException.class)
                    .satisfies(e -> assertEquals(12L, ((InvalidScheduleException) e).getScheduleId()));
        }

        @Test
        void nonIntegerWeekdayIsRejected() {
            JsonObject json = new JsonObject().put("id", 1).put("time", "07:00")
                    .put("repeat_days", new JsonArray().add("monday"));
            assertThatThrownBy(() -> Schedule.fromJson(json))
                    .isInstanceOf(InvalidScheduleException.class)
                    .satisfies(e -> assertEquals("repeat_days", ((InvalidScheduleException) e).getField()));
        }

        @Test
        void nullPayloadIsRejected() {
            assertThatThrownBy(() -> Schedule.fromJson(null)).isInstanceOf(InvalidScheduleException.class);
        }
    }
}
