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

import java.util.Optional;

/**
 * Lifecycle status of one alarm firing as reported by an agent.
 *
 * <pre>
 * STARTED → {COMPLETED | FAILED | STOPPED_EARLY}
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public enum AlarmStatus {

    STARTED("started"),
    COMPLETED("completed"),
    /** The workload hit its wall-clock ceiling and was killed. */
    STOPPED_EARLY("stopped_early"),
    FAILED("failed");

    private final String wireValue;

    AlarmStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != STARTED;
    }

    public static Optional<AlarmStatus> fromWire(String value) {
        for (AlarmStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
