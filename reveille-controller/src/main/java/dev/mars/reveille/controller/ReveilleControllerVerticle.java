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

package dev.mars.reveille.controller;

import dev.mars.reveille.controller.auth.InMemoryTokenService;
import dev.mars.reveille.controller.auth.InMemoryUserDirectory;
import dev.mars.reveille.controller.config.AppConfig;
import dev.mars.reveille.controller.http.BearerAuthHandler;
import dev.mars.reveille.controller.http.HttpApiServer;
import dev.mars.reveille.controller.http.handlers.AlarmHandler;
import dev.mars.reveille.controller.http.handlers.LoginHandler;
import dev.mars.reveille.controller.http.handlers.StatusHandler;
import dev.mars.reveille.controller.service.AlarmService;
import dev.mars.reveille.controller.store.InMemoryAlarmEventLog;
import dev.mars.reveille.controller.store.InMemoryAlarmRepository;
import dev.mars.reveille.controller.sync.ConnectionRegistry;
import dev.mars.reveille.controller.sync.SyncEndpoint;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Main Verticle for the Reveille controller.
 * Wires the in-memory stores, the connection registry, the sync endpoint and the HTTP API.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-19
 */
public class ReveilleControllerVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(ReveilleControllerVerticle.class);

    private final AppConfig config;
    private final Clock clock;

    private ConnectionRegistry registry;
    private HttpApiServer apiServer;

    public ReveilleControllerVerticle(AppConfig config) {
        this(config, Clock.systemUTC());
    }

    ReveilleControllerVerticle(AppConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "AppConfig cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public void start(Promise<Void> startPromise) {
        logger.info("Starting ReveilleControllerVerticle...");

        try {
            config.validate();

            InMemoryUserDirectory users = new InMemoryUserDirectory();
            users.addUser(config.getAdminUsername(), config.getAdminPassword());
            InMemoryTokenService tokens = new InMemoryTokenService(clock, Duration.ofHours(config.getTokenTtlHours()));

            InMemoryAlarmRepository alarms = new InMemoryAlarmRepository(clock);
            InMemoryAlarmEventLog events = new InMemoryAlarmEventLog(clock);
            registry = new ConnectionRegistry(clock);
            SyncEndpoint syncEndpoint = new SyncEndpoint(tokens, alarms, events, registry);
            AlarmService alarmService = new AlarmService(alarms, events, syncEndpoint);

            apiServer = new HttpApiServer(vertx, config.getHttpHost(), config.getHttpPort(),
                    new LoginHandler(users, tokens),
                    new AlarmHandler(alarmService),
                    new StatusHandler(registry),
                    new BearerAuthHandler(tokens),
                    syncEndpoint);

            apiServer.start()
                    .onSuccess(v -> {
                        logger.info("ReveilleControllerVerticle started on port {}", apiServer.actualPort());
                        startPromise.complete();
                    })
                    .onFailure(startPromise::fail);
        } catch (Exception e) {
            logger.error("Failed to start ReveilleControllerVerticle: {}", e.getMessage());
            startPromise.fail(e);
        }
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping ReveilleControllerVerticle...");
        if (apiServer == null) {
            stopPromise.complete();
            return;
        }
        apiServer.stop()
                .onSuccess(v -> logger.info("ReveilleControllerVerticle stopped"))
                .onComplete(ar -> {
                    if (ar.failed()) {
                        logger.warn("Error during shutdown", ar.cause());
                    }
                    stopPromise.complete();
                });
    }

    /**
     * The bound HTTP port once started, -1 before.
     */
    public int httpPort() {
        return apiServer == null ? -1 : apiServer.actualPort();
    }

    ConnectionRegistry registry() {
        return registry;
    }
}
