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

package dev.mars.reveille.controller.http.handlers;

import dev.mars.reveille.controller.auth.Principal;
import dev.mars.reveille.controller.auth.TokenService;
import dev.mars.reveille.controller.auth.UserDirectory;
import dev.mars.reveille.controller.http.BearerAuthHandler;
import dev.mars.reveille.controller.http.ReveilleApiException;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * HTTP handler for authentication.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/login}: exchange {@code {"username","password"}} for a bearer token</li>
 *   <li>{@code GET /api/me}: the authenticated user</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class LoginHandler {

    private static final Logger logger = LoggerFactory.getLogger(LoginHandler.class);

    private final UserDirectory userDirectory;
    private final TokenService tokenService;

    public LoginHandler(UserDirectory userDirectory, TokenService tokenService) {
        this.userDirectory = Objects.requireNonNull(userDirectory, "UserDirectory cannot be null");
        this.tokenService = Objects.requireNonNull(tokenService, "TokenService cannot be null");
    }

    /**
     * Handles {@code POST /api/login}.
     */
    public Handler<RoutingContext> handleLogin() {
        return ctx -> {
            JsonObject body = ctx.body().asJsonObject();
            if (body == null) {
                throw ReveilleApiException.missingBody();
            }
            String username = requireString(body, "username");
            String password = requireString(body, "password");

            Principal principal = userDirectory.authenticate(username, password).orElseThrow(() -> {
                logger.warn("Failed login attempt for user '{}'", username);
                return ReveilleApiException.invalidCredentials();
            });

            String token = tokenService.issue(principal);
            logger.info("User '{}' logged in", principal.username());
            ctx.json(new JsonObject()
                    .put("access_token", token)
                    .put("token_type", "bearer")
                    .put("expires_in", tokenService.ttl().toSeconds()));
        };
    }

    /**
     * Handles {@code GET /api/me}.
     */
    public Handler<RoutingContext> handleMe() {
        return ctx -> {
            Principal principal = BearerAuthHandler.principal(ctx);
            ctx.json(new JsonObject()
                    .put("id", principal.id())
                    .put("username", principal.username()));
        };
    }

    private static String requireString(JsonObject body, String field) {
        Object value = body.getValue(field);
        if (!(value instanceof String) || ((String) value).isEmpty()) {
            throw ReveilleApiException.missingField(field);
        }
        return (String) value;
    }
}
