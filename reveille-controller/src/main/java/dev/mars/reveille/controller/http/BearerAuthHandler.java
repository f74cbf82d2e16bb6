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

import dev.mars.reveille.controller.auth.Principal;
import dev.mars.reveille.controller.auth.TokenService;
import io.vertx.core.Handler;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.RoutingContext;

import java.util.Objects;

/**
 * Resolves {@code Authorization: Bearer <token>} to a {@link Principal} and stores it in the
 * routing context. Requests without a valid token fail with 401.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class BearerAuthHandler implements Handler<RoutingContext> {

    public static final String CTX_PRINCIPAL = "principal";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;

    public BearerAuthHandler(TokenService tokenService) {
        this.tokenService = Objects.requireNonNull(tokenService, "TokenService cannot be null");
    }

    @Override
    public void handle(RoutingContext ctx) {
        String header = ctx.request().getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw ReveilleApiException.notAuthenticated();
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        Principal principal = tokenService.resolve(token)
                .orElseThrow(() -> ReveilleApiException.notAuthenticated());

        ctx.put(CTX_PRINCIPAL, principal);
        ctx.next();
    }

    /**
     * The principal stored by this handler. Only valid on routes behind it.
     */
    public static Principal principal(RoutingContext ctx) {
        Principal principal = ctx.get(CTX_PRINCIPAL);
        if (principal == null) {
            throw ReveilleApiException.notAuthenticated();
        }
        return principal;
    }
}
