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

import dev.mars.reveille.agent.observability.AgentMetrics;
import dev.mars.reveille.core.Schedule;
import dev.mars.reveille.core.exceptions.InvalidScheduleException;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Arms one Vert.x timer per enabled recurring schedule and re-arms it after every firing.
 *
 * <p>The next fire time is the earliest (weekday, HH:MM) in the configured zone strictly after
 * now, on one of the schedule's weekdays. Delays longer than the maximum hop are split into
 * several timers so that the wall clock is consulted again before firing; a host that was
 * suspended past the fire time fires as soon as it wakes. Firings later than the grace window
 * are still delivered and logged as late.</p>
 *
 * <p>A disabled schedule and a schedule with no weekdays are accepted but never armed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class RecurringScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RecurringScheduler.class);

    public enum ArmState {
        ARMED,
        DISABLED,
        NOT_RECURRING
    }

    /**
     * Result of {@link #upsert(Schedule)}.
     *
     * @param state    what the scheduler did with the schedule
     * @param nextFire the next fire instant when armed, otherwise null
     */
    public record UpsertResult(ArmState state, Instant nextFire) {

        static UpsertResult armed(Instant nextFire) {
            return new UpsertResult(ArmState.ARMED, nextFire);
        }

        public boolean isArmed() {
            return state == ArmState.ARMED;
        }
    }

    private final Vertx vertx;
    private final ZoneId zoneId;
    private final Clock clock;
    private final Duration grace;
    private final Duration maxHop;
    private final Handler<Long> fireHandler;
    private final AgentMetrics metrics;

    private final Map<Long, ArmedJob> jobs = new ConcurrentHashMap<>();

    /**
     * @param fireHandler receives the schedule id each time an alarm fires
     */
    public RecurringScheduler(Vertx vertx, ZoneId zoneId, Clock clock, Duration grace, Duration maxHop,
                              Handler<Long> fireHandler, AgentMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.zoneId = Objects.requireNonNull(zoneId, "Zone cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.grace = Objects.requireNonNull(grace, "Grace cannot be null");
        this.maxHop = Objects.requireNonNull(maxHop, "Max hop cannot be null");
        this.fireHandler = Objects.requireNonNull(fireHandler, "Fire handler cannot be null");
        this.metrics = metrics;
        if (metrics != null) {
            metrics.bindArmedCount(jobs::size);
        }
    }

    /**
     * Records a schedule, replacing any job armed for the same id.
     *
     * @throws InvalidScheduleException if the time or a weekday is invalid; the previous job stays disarmed
     */
    public UpsertResult upsert(Schedule schedule) throws InvalidScheduleException {
        disarm(schedule.id());

        LocalTime time = schedule.fireTime();
        Set<DayOfWeek> weekdays = schedule.weekdays();

        if (!schedule.enabled()) {
            logger.info("Alarm {} ({}) is disabled, not armed", schedule.id(), schedule.label());
            return new UpsertResult(ArmState.DISABLED, null);
        }
        if (weekdays.isEmpty()) {
            logger.info("Alarm {} ({}) has no repeat days, not armed", schedule.id(), schedule.label());
            return new UpsertResult(ArmState.NOT_RECURRING, null);
        }

        ArmedJob job = new ArmedJob(schedule.id(), time, weekdays);
        jobs.put(job.scheduleId, job);
        Instant nextFire = nextFireTime(time, weekdays, zoneId, clock.instant());
        arm(job, nextFire);
        logger.info("Alarm {} ({}) armed for {} on {}, next fire {}", schedule.id(), schedule.label(),
                schedule.time(), weekdays, ZonedDateTime.ofInstant(nextFire, zoneId));
        return UpsertResult.armed(nextFire);
    }

    /**
     * Disarms and forgets a schedule. Unknown ids are ignored.
     */
    public void remove(long scheduleId) {
        if (disarm(scheduleId)) {
            logger.info("Alarm {} disarmed", scheduleId);
        }
    }

    /**
     * Disarms every schedule.
     */
    public void clear() {
        for (Long id : Set.copyOf(jobs.keySet())) {
            disarm(id);
        }
        logger.debug("All alarms disarmed");
    }

    public Optional<Instant> nextFireTime(long scheduleId) {
        ArmedJob job = jobs.get(scheduleId);
        return job == null ? Optional.empty() : Optional.ofNullable(job.nextFire);
    }

    public Set<Long> scheduledIds() {
        return new TreeSet<>(jobs.keySet());
    }

    /**
     * Computes the earliest instant strictly after {@code now} that falls on one of the weekdays at
     * the given local time in the given zone. A local time inside a DST gap resolves to the
     * instant after the gap.
     *
     * @throws IllegalArgumentException if no weekday is given
     */
    public static Instant nextFireTime(LocalTime time, Set<DayOfWeek> weekdays, ZoneId zoneId, Instant now) {
        if (weekdays.isEmpty()) {
            throw new IllegalArgumentException("At least one weekday is required");
        }
        LocalDate today = LocalDate.ofInstant(now, zoneId);
        for (int offset = 0; offset <= 7; offset++) {
            LocalDate day = today.plusDays(offset);
            if (!weekdays.contains(day.getDayOfWeek())) {
                continue;
            }
            Instant candidate = ZonedDateTime.of(day, time, zoneId).toInstant();
            if (candidate.isAfter(now)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No fire time found within a week for " + time + " on " + weekdays);
    }

    private boolean disarm(long scheduleId) {
        ArmedJob job = jobs.remove(scheduleId);
        if (job == null) {
            return false;
        }
        vertx.cancelTimer(job.timerId);
        return true;
    }

    private void arm(ArmedJob job, Instant target) {
        job.nextFire = target;
        long remaining = Duration.between(clock.instant(), target).toMillis();
        boolean finalLeg = remaining <= maxHop.toMillis();
        long delay = Math.max(1, finalLeg ? remaining : maxHop.toMillis());
        job.timerId = vertx.setTimer(delay, timerId -> onTimer(job, target, finalLeg));
    }

    private void onTimer(ArmedJob job, Instant target, boolean finalLeg) {
        // superseded by a later upsert or removed
        if (jobs.get(job.scheduleId) != job) {
            return;
        }
        if (!finalLeg) {
            arm(job, target);
            return;
        }

        Instant now = clock.instant();
        boolean late = Duration.between(target, now).compareTo(grace) > 0;
        if (late) {
            logger.warn("Alarm {} fired late: due {}, now {}", job.scheduleId, target, now);
        } else {
            logger.info("Alarm {} fired", job.scheduleId);
        }
        if (metrics != null) {
            metrics.recordAlarmFired(late);
        }

        try {
            fireHandler.handle(job.scheduleId);
        } catch (RuntimeException e) {
            logger.error("Fire handler failed for alarm {}", job.scheduleId, e);
        }

        if (jobs.get(job.scheduleId) == job) {
            Instant base = now.isAfter(target) ? now : target;
            arm(job, nextFireTime(job.time, job.weekdays, zoneId, base));
            logger.debug("Alarm {} re-armed for {}", job.scheduleId, job.nextFire);
        }
    }

    private static final class ArmedJob {
        private final long scheduleId;
        private final LocalTime time;
        private final Set<DayOfWeek> weekdays;
        private volatile Instant nextFire;
        private volatile long timerId;

        private ArmedJob(long scheduleId, LocalTime time, Set<DayOfWeek> weekdays) {
            this.scheduleId = scheduleId;
            this.time = time;
            this.weekdays = weekdays;
        }
    }
}
