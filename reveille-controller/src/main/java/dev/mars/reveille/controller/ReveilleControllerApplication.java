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

import dev.mars.reveille.controller.config.AppConfig;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;

/**
 * Entry point for the Reveille controller: deploys {@link ReveilleControllerVerticle} on a
 * fresh Vert.x instance and closes it on JVM shutdown.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public final class ReveilleControllerApplication {

    private static final Logger logger = LoggerFactory.getLogger(ReveilleControllerApplication.class);

    private ReveilleControllerApplication() {
    }

    public static void main(String[] args) {
        logger.info("Starting Reveille controller...");

        AppConfig config = AppConfig.get();
        config.logConfiguration();

        Vertx vertx = Vertx.vertx();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping Reveille controller...");
            vertx.close().toCompletionStage().toCompletableFuture().join();
            logger.info("Reveille controller stopped");
        }));

        try {
            String deploymentId = vertx.deployVerticle(new ReveilleControllerVerticle(config))
                    .toCompletionStage().toCompletableFuture().join();
            logger.info("Reveille controller started (deployment {})", deploymentId);
        } catch (CompletionException e) {
            logger.error("Failed to start Reveille controller", e.getCause());
            System.exit(1);
        }
    }
}
