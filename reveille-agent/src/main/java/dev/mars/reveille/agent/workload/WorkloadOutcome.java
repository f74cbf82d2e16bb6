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

package dev.mars.reveille.agent.workload;

import dev.mars.reveille.core.AlarmStatus;

import java.time.Duration;
import java.util.Objects;

/**
 * Terminal result of one workload trigger.
 *
 * @param scheduleId the alarm that triggered the run
 * @param status     COMPLETED, FAILED or STOPPED_EARLY
 * @param error      failure text, null when completed
 * @param elapsed    wall-clock time spent in the runner
 */
public record WorkloadOutcome(long scheduleId, AlarmStatus status, String error, Duration elapsed) {

    public WorkloadOutcome {
        Objects.requireNonNull(status, "Status cannot be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Outcome status must be terminal, got: " + status);
        }
    }

    public static WorkloadOutcome completed(long scheduleId, Duration elapsed) {
        return new WorkloadOutcome(scheduleId, AlarmStatus.COMPLETED, null, elapsed);
    }

    public static WorkloadOutcome failed(long scheduleId, String error, Duration elapsed) {
        return new WorkloadOutcome(scheduleId, AlarmStatus.FAILED, error, elapsed);
    }

    public static WorkloadOutcome stoppedEarly(long scheduleId, String error, Duration elapsed) {
        return new WorkloadOutcome(scheduleId, AlarmStatus.STOPPED_EARLY, error, elapsed);
    }

    public boolean isSuccess() {
        return status == AlarmStatus.COMPLETED;
    }
}
