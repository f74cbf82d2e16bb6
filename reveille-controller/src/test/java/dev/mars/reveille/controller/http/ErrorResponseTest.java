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
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the error codes, the API exception factories and the error envelope.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
@DisplayName("Error Response Tests")
class ErrorResponseTest {

    // ==================== ErrorCode Tests ====================

    @Nested
    @DisplayName("ErrorCode")
    class ErrorCodeTests {

        @Test
        @DisplayName("Error codes have correct HTTP status codes")
        void testErrorCodeHttpStatus() {
            assertEquals(400, ErrorCode.BAD_REQUEST.httpStatus());
            assertEquals(400, ErrorCode.ALARM_INVALID.httpStatus());
            assertEquals(401, ErrorCode.UNAUTHORIZED.httpStatus());
            assertEquals(401, ErrorCode.INVALID_CREDENTIALS.httpStatus());
            assertEquals(404, ErrorCode.ALARM_NOT_FOUND.httpStatus());
            assertEquals(405, ErrorCode.METHOD_NOT_ALLOWED.httpStatus());
            assertEquals(500, ErrorCode.INTERNAL_ERROR.httpStatus());
        }

        @Test
        @DisplayName("Error codes have unique string codes")
        void testErrorCodesAreUnique() {
            List<String> codes = Arrays.stream(ErrorCode.values())
                    .map(ErrorCode::code)
                    .collect(Collectors.toList());

            assertEquals(codes.size(), new HashSet<>(codes).size(), "All error codes should be unique");
        }
    }

    // ==================== Exception and Envelope Tests ====================

    @Nested
    @DisplayName("ReveilleApiException and ErrorResponse")
    class EnvelopeTests {

        @Test
        @DisplayName("Alarm factories carry the alarm id and the rejected field")
        void testAlarmFactories() {
            ReveilleApiException notFound = ReveilleApiException.alarmNotFound(12L);
            assertEquals("Alarm with id 12 not found", notFound.getMessage());
            assertEquals(404, notFound.getHttpStatus());
            assertEquals(Long.valueOf(12L), notFound.getAlarmId());
            assertNull(notFound.getField());

            InvalidScheduleException cause = new InvalidScheduleException(7L, "time", "Time must be HH:MM");
            ReveilleApiException invalid = ReveilleApiException.invalidAlarm(7L, cause);
            assertEquals(ErrorCode.ALARM_INVALID, invalid.getErrorCode());
            assertEquals("Invalid alarm: Time must be HH:MM", invalid.getMessage());
            assertEquals(Long.valueOf(7L), invalid.getAlarmId());
            assertEquals("time", invalid.getField());
            assertSame(cause, invalid.getCause());
        }

        @Test
        @DisplayName("An alarm not yet created has no alarm id")
        void testInvalidDraft() {
            ReveilleApiException invalid = ReveilleApiException.invalidAlarm(0L,
                    new InvalidScheduleException(0L, "repeat_days", "Weekday 9 is out of range"));

            assertNull(invalid.getAlarmId());
            assertEquals("repeat_days", invalid.getField());
        }

        @Test
        @DisplayName("Request and auth factories use the code templates")
        void testRequestFactories() {
            ReveilleApiException missing = ReveilleApiException.missingField("time");
            assertEquals("Required field 'time' is missing", missing.getMessage());
            assertEquals("time", missing.getField());

            assertEquals("id", ReveilleApiException.invalidAlarmId("abc").getField());
            assertEquals(ErrorCode.BAD_REQUEST, ReveilleApiException.missingBody().getErrorCode());
            assertEquals("Incorrect username or password", ReveilleApiException.invalidCredentials().getMessage());
            assertEquals(401, ReveilleApiException.notAuthenticated().getHttpStatus());
        }

        @Test
        @DisplayName("Envelope writes alarmId and field when the exception carries them")
        void testToJsonWithAlarmDetails() {
            ErrorResponse response = ErrorResponse.from(ReveilleApiException.invalidAlarm(42L,
                    new InvalidScheduleException(42L, "time", "Time must be HH:MM")), "/api/alarms/42");

            JsonObject error = response.toJson().getJsonObject("error");
            assertEquals("ALARM_INVALID", error.getString("code"));
            assertEquals("Invalid alarm: Time must be HH:MM", error.getString("message"));
            assertEquals("/api/alarms/42", error.getString("path"));
            assertEquals(Long.valueOf(42L), error.getLong("alarmId"));
            assertEquals("time", error.getString("field"));
            assertNotNull(error.getString("timestamp"));
            assertEquals(400, response.httpStatus());
        }

        @Test
        @DisplayName("Envelope omits alarm details for generic errors")
        void testToJsonWithoutAlarmDetails() {
            ErrorResponse response = ErrorResponse.fromException(ErrorCode.INTERNAL_ERROR,
                    new IllegalStateException(), "/x");

            JsonObject error = response.toJson().getJsonObject("error");
            assertFalse(error.containsKey("alarmId"));
            assertFalse(error.containsKey("field"));
            assertEquals(ErrorCode.INTERNAL_ERROR.messageTemplate(), response.message());
            assertEquals(500, response.httpStatus());
        }
    }
}
