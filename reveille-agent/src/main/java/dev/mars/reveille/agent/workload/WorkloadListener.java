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

/**
 * Receives workload lifecycle events. Both callbacks run on the event loop context
 * that called {@link WorkloadRunner#trigger(long)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public interface WorkloadListener {

    /**
     * The lock was taken, the prerequisites hold and the child process is about to start.
     * Not called when the trigger fails before that point.
     */
    void onTriggered(long scheduleId);

    /**
     * Called exactly once per trigger with its terminal outcome.
     */
    void onCompleted(WorkloadOutcome outcome);
}
