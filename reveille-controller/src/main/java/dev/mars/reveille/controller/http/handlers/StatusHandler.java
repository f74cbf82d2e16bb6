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
import dev.mars.reveille.controller.http.BearerAuthHandler;
import dev.mars.reveille.controller.sync.ConnectionRegistry;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;

/**
 * {@code GET /api/status}: whether the caller's agent is online and when it last connected
 * and disconnected.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class StatusHandler implements Handler<RoutingContext> {

    private final ConnectionRegistry registry;

    public StatusHandler(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handle(RoutingContext ctx) {
        Principal principal = BearerAuthHandler.principal(ctx);
        ctx.json(registry.status(principal.id()).toJson());
    }
}
