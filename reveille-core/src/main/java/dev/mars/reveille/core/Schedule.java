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

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A recurring alarm definition as owned by the controller and mirrored on every agent.
 *
 * <p>Weekday indices run from {@code 0} (Monday) to {@code 6} (Sunday). The weekday list is
 * canonicalized on construction: sorted ascending, duplicates removed. An empty weekday list
 * is a legal record (a one-time alarm in the controller's vocabulary) but agents never arm it.</p>
 *
 * <p>Construction does not validate the time string or the weekday range so that a record
 * can be carried around and rejected explicitly by {@link #validate()}, which is what
 * the agent scheduler and the controller API call before accepting a schedule.</p>
 *
 * <h3>Wire format:</h3>
 * <pre>
 * {"id":1,"label":"Wake","time":"07:00","repeat_days":[0,1,2],"enabled":true}
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public record Schedule(long id, String label, String time, List<Integer> repeatDays, boolean enabled) {

    public static final String DEFAULT_LABEL = "Alarm";
    public static final int MAX_LABEL_LENGTH = 50;

    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");

    public Schedule {
        Objects.requireNonNull(time, "Time cannot be null");
        label = label != null ? label : DEFAULT_LABEL;
        if (repeatDays == null) {
            repeatDays = List.of();
        } else {
            if (repeatDays.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("Repeat days cannot contain null");
            }
            repeatDays = List.copyOf(new TreeSet<>(repeatDays));
        }
    }

    /**
     * @return true when at least one weekday is listed
     */
    public boolean isRecurring() {
        return !repeatDays.isEmpty();
    }

    /**
     * Parses the {@code HH:MM} time of day.
     *
     * @throws InvalidScheduleException if the time is not a valid 24-hour {@code HH:MM} string
     */
    public LocalTime fireTime() throws InvalidScheduleException {
        Matcher matcher = TIME_PATTERN.matcher(time);
        if (!matcher.matches()) {
            throw new InvalidScheduleException(id, "time",
                    "Invalid time format '" + time + "', expected HH:MM (24-hour)");
        }
        return LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    /**
     * Maps the weekday indices to {@link DayOfWeek} values.
     *
     * @throws InvalidScheduleException if an index lies outside 0..6
     */
    public Set<DayOfWeek> weekdays() throws InvalidScheduleException {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (Integer day : repeatDays) {
            if (day < 0 || day > 6) {
                throw new InvalidScheduleException(id, "repeat_days",
                        "Invalid weekday index " + day + ", expected 0 (Monday) to 6 (Sunday)");
            }
            days.add(DayOfWeek.of(day + 1));
        }
        return days;
    }

    /**
     * Checks the time string, the weekday range and the label length.
     *
     * @throws InvalidScheduleException describing the first offending field
     */
    public void validate() throws InvalidScheduleException {
        fireTime();
        weekdays();
        if (label.length() > MAX_LABEL_LENGTH) {
            throw new InvalidScheduleException(id, "label",
                    "Label exceeds " + MAX_LABEL_LENGTH + " characters");
        }
    }

    public Schedule withId(long newId) {
        return new Schedule(newId, label, time, repeatDays, enabled);
    }

    public Schedule withEnabled(boolean newEnabled) {
        return new Schedule(id, label, time, repeatDays, newEnabled);
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("id", id)
                .put("label", label)
                .put("time", time)
                .put("repeat_days", new JsonArray(new ArrayList<>(repeatDays)))
                .put("enabled", enabled);
    }

    /**
     * Parses and validates a schedule from its wire representation.
     *
     * <p>{@code label} defaults to {@value #DEFAULT_LABEL}, {@code repeat_days} to an empty
     * list and {@code enabled} to {@code true}. {@code id} and {@code time} are required.</p>
     *
     * @param json the wire object, may be null
     * @return a validated schedule
     * @throws InvalidScheduleException naming the offending field and the id when one was readable
     */
    public static Schedule fromJson(JsonObject json) throws InvalidScheduleException {
        if (json == null) {
            throw new InvalidScheduleException(null, "data", "Schedule payload is missing");
        }

        Object rawId = json.getValue("id");
        if (!(rawId instanceof Number)) {
            throw new InvalidScheduleException(null, "id",
                    rawId == null ? "Schedule id is missing" : "Schedule id must be a number");
        }
        long id = ((Number) rawId).longValue();

        Object rawLabel = json.getValue("label");
        if (rawLabel != null && !(rawLabel instanceof String)) {
            throw new InvalidScheduleException(id, "label", "Label must be a string");
        }

        Object rawTime = json.getValue("time");
        if (!(rawTime instanceof String)) {
            throw new InvalidScheduleException(id, "time",
                    rawTime == null ? "Time is missing" : "Time must be a string");
        }

        Object rawDays = json.getValue("repeat_days");
        List<Integer> days = rawDays == null ? List.of() : parseDays(id, rawDays);

        Object rawEnabled = json.getValue("enabled");
        if (rawEnabled != null && !(rawEnabled instanceof Boolean)) {
            throw new InvalidScheduleException(id, "enabled", "Enabled must be a boolean");
        }
        boolean enabled = rawEnabled == null || (Boolean) rawEnabled;

        Schedule schedule = new Schedule(id, (String) rawLabel, (String) rawTime, days, enabled);
        schedule.validate();
        return schedule;
    }

    private static List<Integer> parseDays(long id, Object rawDays) throws InvalidScheduleException {
        if (!(rawDays instanceof JsonArray)) {
            throw new InvalidScheduleException(id, "repeat_days", "repeat_days must be an array");
        }
        Collection<Integer> days = new TreeSet<>();
        for (Object value : (JsonArray) rawDays) {
            if (!(value instanceof Integer) && !(value instanceof Long)) {
                throw new InvalidScheduleException(id, "repeat_days",
                        "repeat_days must contain integers, found " + value);
            }
            long day = ((Number) value).longValue();
            if (day < 0 || day > 6) {
                throw new InvalidScheduleException(id, "repeat_days",
                        "Invalid weekday index " + day + ", expected 0 (Monday) to 6 (Sunday)");
            }
            days.add((int) day);
        }
        return List.copyOf(days);
    }
}
