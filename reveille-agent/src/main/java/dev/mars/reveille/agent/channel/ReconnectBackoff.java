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

package dev.mars.reveille.agent.channel;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential reconnect delay: starts at the floor, multiplies after every use and
 * saturates at the ceiling. {@link #reset()} returns to the floor after a successful open.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class ReconnectBackoff {

    private final Duration floor;
    private final Duration ceiling;
    private final double multiplier;
    private Duration current;

    public ReconnectBackoff(Duration floor, Duration ceiling, double multiplier) {
        this.floor = Objects.requireNonNull(floor, "Floor cannot be null");
        this.ceiling = Objects.requireNonNull(ceiling, "Ceiling cannot be null");
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1, got: " + multiplier);
        }
        if (floor.compareTo(ceiling) > 0) {
            throw new IllegalArgumentException("Floor " + floor + " exceeds ceiling " + ceiling);
        }
        this.multiplier = multiplier;
        this.current = floor;
    }

    /**
     * @return the delay to wait now; the following call returns the next step
     */
    public synchronized Duration next() {
        Duration delay = current;
        long grown = (long) Math.min((double) ceiling.toMillis(), current.toMillis() * multiplier);
        current = Duration.ofMillis(grown);
        return delay;
    }

    public synchronized void reset() {
        current = floor;
    }

    public synchronized Duration peek() {
        return current;
    }
}
