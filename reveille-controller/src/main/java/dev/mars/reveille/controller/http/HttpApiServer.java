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

import dev.mars.reveille.controller.http.handlers.AlarmHandler;
import dev.mars.reveille.controller.http.handlers.LoginHandler;
import dev.mars.reveille.controller.http.handlers.StatusHandler;
import dev.mars.reveille.controller.sync.SyncEndpoint;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The controller's single listening port: REST routes through a Vert.x Web {@link Router}
 * and the sync WebSocket through {@link SyncEndpoint}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class HttpApiServer {

    private static final Logger logger = LoggerFactory.getLogger(HttpApiServer.class);
    private static final long MAX_BODY_BYTES = 64 * 1024;

    private final Vertx vertx;
    private final String host;
    private final int port;
    private final LoginHandler loginHandler;
    private final AlarmHandler alarmHandler;
    private final StatusHandler statusHandler;
    private final BearerAuthHandler authHandler;
    private final SyncEndpoint syncEndpoint;
    private HttpServer httpServer;

    public HttpApiServer(Vertx vertx, String host, int port, LoginHandler loginHandler, AlarmHandler alarmHandler,
                         StatusHandler statusHandler, BearerAuthHandler authHandler, SyncEndpoint syncEndpoint) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.host = Objects.requireNonNull(host, "Host cannot be null");
        this.port = port;
        this.loginHandler = Objects.requireNonNull(loginHandler, "LoginHandler cannot be null");
        this.alarmHandler = Objects.requireNonNull(alarmHandler, "AlarmHandler cannot be null");
        this.statusHandler = Objects.requireNonNull(statusHandler, "StatusHandler cannot be null");
        this.authHandler = Objects.requireNonNull(authHandler, "BearerAuthHandler cannot be null");
        this.syncEndpoint = Objects.requireNonNull(syncEndpoint, "SyncEndpoint cannot be null");
    }

    public Future<Void> start() {
        Router router = Router.router(vertx);

        router.route("/api/*").handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES));

        router.get("/health")
                .respond(ctx -> Future.succeededFuture(new JsonObject().put("status", "UP")));

        // Public
        router.post("/api/login").handler(loginHandler.handleLogin());

        // Authenticated
        router.route("/api/me").handler(authHandler);
        router.route("/api/status").handler(authHandler);
        router.route("/api/alarms*").handler(authHandler);

        router.get("/api/me").handler(loginHandler.handleMe());
        router.get("/api/status").handler(statusHandler);

        router.get("/api/alarms").handler(alarmHandler.handleList());
        router.post("/api/alarms").handler(alarmHandler.handleCreate());
        router.get("/api/alarms/:id").handler(alarmHandler.handleGet());
        router.put("/api/alarms/:id").handler(alarmHandler.handleUpdate());
        router.delete("/api/alarms/:id").handler(alarmHandler.handleDelete());
        router.patch("/api/alarms/:id/toggle").handler(alarmHandler.handleToggle());
        router.get("/api/alarms/:id/history").handler(alarmHandler.handleHistory());

        router.route().last().handler(ctx -> ctx.fail(404));
        router.route().failureHandler(new GlobalErrorHandler());

        httpServer = vertx.createHttpServer()
                .requestHandler(router)
                .webSocketHandler(syncEndpoint);

        return httpServer.listen(port, host)
                .onSuccess(server -> logger.info("HTTP API Server listening on {}:{}", host, server.actualPort()))
                .onFailure(err -> logger.error("Failed to start HTTP API Server", err))
                .mapEmpty();
    }

    /**
     * The bound port, which differs from the configured one when that was 0.
     */
    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    public Future<Void> stop() {
        if (httpServer != null) {
            return httpServer.close()
                    .onSuccess(v -> logger.info("HTTP API Server stopped"));
        }
        return Future.succeededFuture();
    }
}
