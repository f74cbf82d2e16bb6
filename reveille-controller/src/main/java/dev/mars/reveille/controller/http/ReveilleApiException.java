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

import dev.mars.reveille.core.exceptions.InvalidScheduleException;

/**
 * Runtime exception thrown from request handlers and the alarm service. Besides its
 * {@link ErrorCode} it can name the alarm and the request field it concerns; the
 * {@link GlobalErrorHandler} copies both into the {@link ErrorResponse}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class ReveilleApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Long alarmId;
    private final String field;

    public ReveilleApiException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    private ReveilleApiException(ErrorCode errorCode, String message, Long alarmId, String field, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.alarmId = alarmId;
        this.field = field;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return errorCode.httpStatus();
    }

    /**
     * @return the alarm the error concerns, or {@code null} when it concerns no stored alarm
     */
    public Long getAlarmId() {
        return alarmId;
    }

    /**
     * @return the request field that was rejected, or {@code null}
     */
    public String getField() {
        return field;
    }

    // ==================== Alarm Errors ====================

    /**
     * The alarm does not exist or belongs to another user. Both cases answer 404.
     */
    public static ReveilleApiException alarmNotFound(long alarmId) {
        return new ReveilleApiException(ErrorCode.ALARM_NOT_FOUND,
                ErrorCode.ALARM_NOT_FOUND.formatMessage(alarmId), alarmId, null, null);
    }

    /**
     * Wraps a schedule validation failure. An id of {@code 0} marks an alarm not yet created.
     */
    public static ReveilleApiException invalidAlarm(long alarmId, InvalidScheduleException cause) {
        return new ReveilleApiException(ErrorCode.ALARM_INVALID,
                ErrorCode.ALARM_INVALID.formatMessage(cause.getMessage()),
                alarmId > 0 ? alarmId : null, cause.getField(), cause);
    }

    // ==================== Request Errors ====================

    public static ReveilleApiException missingField(String field) {
        return new ReveilleApiException(ErrorCode.MISSING_REQUIRED_FIELD,
                ErrorCode.MISSING_REQUIRED_FIELD.formatMessage(field), null, field, null);
    }

    public static ReveilleApiException missingBody() {
        return new ReveilleApiException(ErrorCode.BAD_REQUEST,
                ErrorCode.BAD_REQUEST.formatMessage("request body is required"));
    }

    public static ReveilleApiException invalidAlarmId(String raw) {
        return new ReveilleApiException(ErrorCode.BAD_REQUEST,
                ErrorCode.BAD_REQUEST.formatMessage("alarm id must be a number, got '" + raw + "'"),
                null, "id", null);
    }

    // ==================== Auth Errors ====================

    public static ReveilleApiException notAuthenticated() {
        return new ReveilleApiException(ErrorCode.UNAUTHORIZED, ErrorCode.UNAUTHORIZED.messageTemplate());
    }

    public static ReveilleApiException invalidCredentials() {
        return new ReveilleApiException(ErrorCode.INVALID_CREDENTIALS, ErrorCode.INVALID_CREDENTIALS.messageTemplate());
    }

    public static ReveilleApiException internal(String what, Throwable cause) {
        return new ReveilleApiException(ErrorCode.INTERNAL_ERROR,
                ErrorCode.INTERNAL_ERROR.formatMessage(what), null, null, cause);
    }
}
