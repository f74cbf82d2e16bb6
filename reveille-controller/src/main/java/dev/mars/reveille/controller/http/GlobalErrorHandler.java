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

import io.vertx.core.Handler;
import io.vertx.core.json.DecodeException;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global error handler for the HTTP API.
 *
 * <p>Catches all unhandled exceptions and converts them to standardized
 * {@link ErrorResponse} JSON responses.</p>
 *
 * <p>Exception mapping:</p>
 * <ul>
 *   <li>{@link ReveilleApiException} → Uses exception's error code</li>
 *   <li>{@link IllegalArgumentException} → 400 VALIDATION_ERROR</li>
 *   <li>{@link DecodeException} → 400 BAD_REQUEST (JSON parsing)</li>
 *   <li>All others → 500 INTERNAL_ERROR</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class GlobalErrorHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @Override
    public void handle(RoutingContext ctx) {
        Throwable failure = ctx.failure();
        String path = ctx.request().path();
        int statusCode = ctx.statusCode();

        ErrorResponse errorResponse;

        if (failure == null) {
            // Router-generated status without an exception, e.g. 404 or 405
            errorResponse = mapStatusCodeToError(statusCode, ctx.request().method().name(), path);
        } else if (failure instanceof ReveilleApiException apiEx) {
            errorResponse = ErrorResponse.from(apiEx, path);
            logError(apiEx.getErrorCode(), failure, path);
        } else if (failure instanceof IllegalArgumentException) {
            errorResponse = ErrorResponse.fromException(ErrorCode.VALIDATION_ERROR, failure, path);
            logError(ErrorCode.VALIDATION_ERROR, failure, path);
        } else if (failure instanceof DecodeException) {
            errorResponse = ErrorResponse.of(ErrorCode.BAD_REQUEST, path,
                    "Invalid JSON: " + failure.getMessage());
            logError(ErrorCode.BAD_REQUEST, failure, path);
        } else {
            // Don't expose internal details
            errorResponse = ErrorResponse.of(ErrorCode.INTERNAL_ERROR, path,
                    "An unexpected error occurred");
            logger.error("Unhandled exception at path {}: {}", path, failure.getMessage(), failure);
        }

        sendErrorResponse(ctx, errorResponse);
    }

    private ErrorResponse mapStatusCodeToError(int statusCode, String method, String path) {
        return switch (statusCode) {
            case 400 -> ErrorResponse.of(ErrorCode.BAD_REQUEST, path, "Bad request");
            case 401 -> ErrorResponse.of(ErrorCode.UNAUTHORIZED, path,
                    ErrorCode.UNAUTHORIZED.messageTemplate());
            case 404 -> ErrorResponse.of(ErrorCode.NOT_FOUND, path,
                    ErrorCode.NOT_FOUND.formatMessage(path));
            case 405 -> ErrorResponse.of(ErrorCode.METHOD_NOT_ALLOWED, path,
                    ErrorCode.METHOD_NOT_ALLOWED.formatMessage(method));
            case 503 -> ErrorResponse.of(ErrorCode.SERVICE_UNAVAILABLE, path, "Service unavailable");
            default -> ErrorResponse.of(ErrorCode.INTERNAL_ERROR, path, "Error " + statusCode);
        };
    }

    private void sendErrorResponse(RoutingContext ctx, ErrorResponse errorResponse) {
        if (ctx.response().ended()) {
            return;
        }
        ctx.response()
            .setStatusCode(errorResponse.httpStatus())
            .putHeader("Content-Type", "application/json")
            .end(errorResponse.toJson().encode());
    }

    /**
     * Client errors are logged without a stack trace.
     */
    private void logError(ErrorCode code, Throwable failure, String path) {
        if (code.httpStatus() >= 500) {
            logger.error("Server error [{}] at {}: {}", code.code(), path, failure.getMessage(), failure);
        } else {
            logger.warn("Client error [{}] at {}: {}", code.code(), path, failure.getMessage());
        }
    }
}
