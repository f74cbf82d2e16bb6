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

package dev.mars.reveille.agent;

import dev.mars.reveille.agent.channel.CredentialProvider;
import dev.mars.reveille.agent.channel.HttpCredentialProvider;
import dev.mars.reveille.agent.channel.ReconnectingChannel;
import dev.mars.reveille.agent.config.AgentConfig;
import dev.mars.reveille.agent.config.AgentConfiguration;
import dev.mars.reveille.agent.observability.AgentMetrics;
import dev.mars.reveille.agent.observability.AgentTelemetryConfig;
import dev.mars.reveille.agent.schedule.RecurringScheduler;
import dev.mars.reveille.agent.schedule.ScheduleStore;
import dev.mars.reveille.agent.sync.AlarmEventReporter;
import dev.mars.reveille.agent.sync.SyncProtocolHandler;
import dev.mars.reveille.agent.workload.SingleFlightGuard;
import dev.mars.reveille.agent.workload.WorkloadRunner;
import dev.mars.reveille.core.SyncMessage;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main class for the Reveille agent.
 *
 * <p>Keeps a local copy of the controller's alarms, fires them from local Vert.x timers
 * whether or not the controller is reachable, runs the alarm workload one at a time and
 * reports each run back over the sync channel.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class ReveilleAgent {

    private static final Logger logger = LoggerFactory.getLogger(ReveilleAgent.class);

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final ScheduleStore store;
    private final RecurringScheduler scheduler;
    private final WorkloadRunner runner;
    private final ReconnectingChannel channel;
    private final HttpCredentialProvider httpCredentials;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /**
     * Creates an agent that logs in through the controller's REST API.
     */
    public ReveilleAgent(Vertx vertx, AgentConfiguration config) {
        this(vertx, config, null, Clock.system(config.getZoneId()));
    }

    /**
     * @param credentials token source, or null to log in through the controller's REST API
     * @param clock       wall clock used for schedule computation
     */
    ReveilleAgent(Vertx vertx, AgentConfiguration config, CredentialProvider credentials, Clock clock) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.config = Objects.requireNonNull(config, "AgentConfiguration cannot be null");

        AgentMetrics metrics = new AgentMetrics(config.getUsername(), System.currentTimeMillis());

        this.store = new ScheduleStore();
        SingleFlightGuard guard = new SingleFlightGuard(config.getLockFile(), WorkloadRunner.lockStaleAfter(config),
                config.getLockPollInterval());
        this.runner = new WorkloadRunner(vertx, config, guard, new AlarmEventReporter(this::sendToController), metrics);
        this.scheduler = new RecurringScheduler(vertx, config.getZoneId(), clock, config.getSchedulerGrace(),
                config.getMaxTimerHop(), runner::trigger, metrics);

        SyncProtocolHandler protocolHandler = new SyncProtocolHandler(store, scheduler, this::sendToController, metrics);
        this.httpCredentials = credentials == null ? new HttpCredentialProvider(vertx, config) : null;
        this.channel = new ReconnectingChannel(vertx, config,
                credentials == null ? httpCredentials : credentials, protocolHandler, metrics);

        logger.info("Reveille agent initialized for user {} (zone {})", config.getUsername(), config.getZoneId());
    }

    public static void main(String[] args) {
        logger.info("Starting Reveille agent...");

        AgentConfig agentConfig = AgentConfig.get();
        agentConfig.logConfiguration();
        AgentConfiguration config;
        try {
            agentConfig.validate();
            config = agentConfig.toConfiguration();
        } catch (RuntimeException e) {
            logger.error("Invalid agent configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        OpenTelemetrySdk telemetry = agentConfig.isTelemetryEnabled()
                ? AgentTelemetryConfig.initialize(config.getUsername(), agentConfig.getPrometheusPort())
                : null;

        Vertx vertx = Vertx.vertx();
        ReveilleAgent agent = new ReveilleAgent(vertx, config);

        List<String> problems = agent.checkPrerequisites();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> logger.error("Prerequisite check failed: {}", problem));
            logger.error("Cannot start the agent without the workload files");
            vertx.close();
            System.exit(1);
            return;
        }
        logger.info("Prerequisite check passed");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            agent.shutdown()
                    .eventually(() -> vertx.close())
                    .toCompletionStage().toCompletableFuture().join();
            if (telemetry != null) {
                telemetry.close();
            }
            logger.info("Reveille agent stopped");
        }));

        try {
            agent.start().toCompletionStage().toCompletableFuture().join();
            agent.awaitShutdown();
        } catch (Exception e) {
            logger.error("Failed to start Reveille agent", e);
            vertx.close();
            System.exit(1);
        }
    }

    /**
     * @return one message per missing workload prerequisite
     */
    public List<String> checkPrerequisites() {
        return runner.checkPrerequisites();
    }

    /**
     * Logs in and opens the sync channel. Fails if the first login fails.
     */
    public Future<Void> start() {
        if (closed.get()) {
            return Future.failedFuture(new IllegalStateException("Agent is closed, cannot start"));
        }
        running = true;
        return channel.start()
                .onSuccess(v -> logger.info("Reveille agent started"));
    }

    /**
     * Closes the channel and disarms every alarm. A workload already running is left to
     * finish or hit its ceiling.
     */
    public Future<Void> shutdown() {
        if (closed.getAndSet(true)) {
            logger.info("Agent already closed, skipping shutdown");
            return Future.succeededFuture();
        }
        logger.info("Shutting down Reveille agent...");
        running = false;
        scheduler.clear();

        return channel.stop()
                .eventually(() -> runner.close())
                .onComplete(ar -> {
                    if (httpCredentials != null) {
                        httpCredentials.close();
                    }
                    if (ar.failed()) {
                        logger.error("Error during shutdown", ar.cause());
                    }
                    logger.info("Reveille agent shutdown complete");
                    shutdownLatch.countDown();
                });
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public boolean isRunning() {
        return running;
    }

    ScheduleStore getStore() {
        return store;
    }

    RecurringScheduler getScheduler() {
        return scheduler;
    }

    ReconnectingChannel getChannel() {
        return channel;
    }

    private boolean sendToController(SyncMessage message) {
        return channel.send(message);
    }
}
