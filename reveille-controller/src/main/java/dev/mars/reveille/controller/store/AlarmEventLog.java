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

import java.util.List;

/**
 * Append-only history of alarm firings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public interface AlarmEventLog {

    AlarmEvent append(long principalId, long alarmId, AlarmStatus status, String error);

    /**
     * @return events for one alarm, newest first
     */
    List<AlarmEvent> history(long principalId, long alarmId);
}
