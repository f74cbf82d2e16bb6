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

package dev.mars.reveille.controller.http;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Error body of every failed API call. {@code alarmId} and {@code field} are written only
 * when the failure concerns a stored alarm or a single request field.
 *
 * <pre>{@code
 * {
 *   "error": {
 *     "code": "ALARM_INVALID",
 *     "message": "Invalid alarm: Time must be HH:MM",
 *     "timestamp": "2026-10-19T10:00:00Z",
 *     "path": "/api/alarms/42",
 *     "alarmId": 42,
 *     "field": "time"
 *   }
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public record ErrorResponse(
    ErrorCode code,
    String message,
    Instant timestamp,
    String path,
    Long alarmId,
    String field
) {
    public static ErrorResponse of(ErrorCode code, String path, String message) {
        return new ErrorResponse(code, message, Instant.now(), path, null, null);
    }

    public static ErrorResponse from(ReveilleApiException e, String path) {
        return new ErrorResponse(e.getErrorCode(), e.getMessage(), Instant.now(), path, e.getAlarmId(), e.getField());
    }

    /**
     * Uses the message of the cause, or the template of the code when the cause has none.
     */
    public static ErrorResponse fromException(ErrorCode code, Throwable cause, String path) {
        String message = cause.getMessage() != null ? cause.getMessage() : code.messageTemplate();
        return of(code, path, message);
    }

    public JsonObject toJson() {
        JsonObject error = new JsonObject()
            .put("code", code.code())
            .put("message", message)
            .put("timestamp", timestamp.toString())
            .put("path", path);
        if (alarmId != null) {
            error.put("alarmId", alarmId);
        }
        if (field != null) {
            error.put("field", field);
        }
        return new JsonObject().put("error", error);
    }

    public int httpStatus() {
        return code.httpStatus();
    }
}
