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

/**
 * Error codes returned in {@link ErrorResponse} bodies, each bound to an HTTP status.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public enum ErrorCode {

    // ==================== General Errors (400-499) ====================

    /** Request body is missing or malformed */
    BAD_REQUEST("BAD_REQUEST", 400, "Invalid request: %s"),

    /** Request validation failed */
    VALIDATION_ERROR("VALIDATION_ERROR", 400, "Validation failed: %s"),

    /** Required field is missing */
    MISSING_REQUIRED_FIELD("MISSING_REQUIRED_FIELD", 400, "Required field '%s' is missing"),

    /** Authentication required but not provided */
    UNAUTHORIZED("UNAUTHORIZED", 401, "Authentication required"),

    /** Username or password did not match */
    INVALID_CREDENTIALS("INVALID_CREDENTIALS", 401, "Incorrect username or password"),

    /** Generic resource not found */
    NOT_FOUND("NOT_FOUND", 404, "Resource not found: %s"),

    /** HTTP method not supported for this endpoint */
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", 405, "Method %s not allowed"),

    // ==================== Alarm Errors ====================

    /** Alarm not found for the current user */
    ALARM_NOT_FOUND("ALARM_NOT_FOUND", 404, "Alarm with id %s not found"),

    /** Alarm definition is invalid */
    ALARM_INVALID("ALARM_INVALID", 400, "Invalid alarm: %s"),

    // ==================== Server Errors (500+) ====================

    /** Unexpected internal error */
    INTERNAL_ERROR("INTERNAL_ERROR", 500, "Internal server error: %s"),

    /** Service temporarily unavailable */
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", 503, "Service temporarily unavailable: %s");

    private final String code;
    private final int httpStatus;
    private final String messageTemplate;

    ErrorCode(String code, int httpStatus, String messageTemplate) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.messageTemplate = messageTemplate;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Returns the message template (may contain %s placeholders).
     */
    public String messageTemplate() {
        return messageTemplate;
    }

    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }
}
