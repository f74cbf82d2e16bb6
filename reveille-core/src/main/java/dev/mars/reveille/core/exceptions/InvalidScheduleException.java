package dev.mars.reveille.core.exceptions;

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


/**
 * Thrown when a schedule cannot be parsed or fails validation.
 *
 * <p>Carries the schedule id when one could be read, so that the agent can
 * acknowledge the failure against the right alarm. The id is {@code null}
 * when the payload did not carry a usable id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class InvalidScheduleException extends ReveilleException {

    private final Long scheduleId;
    private final String field;

    /**
     * @param scheduleId the id of the offending schedule, or {@code null} if unknown
     * @param field      the wire field that was rejected
     * @param reason     human readable reason
     */
    public InvalidScheduleException(Long scheduleId, String field, String reason) {
        super(reason);
        this.scheduleId = scheduleId;
        this.field = field;
    }

    public Long getScheduleId() {
        return scheduleId;
    }

    public String getField() {
        return field;
    }
}
