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

package dev.mars.reveille.agent.observability;

import dev.mars.reveille.core.AlarmStatus;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * OpenTelemetry metrics for the Reveille agent.
 *
 * Provides:
 * - reveille.agent.connections.opened (counter) - Sync channel opens
 * - reveille.agent.reconnect.attempts (counter) - Reconnect attempts, by outcome
 * - reveille.agent.acks.sent (counter) - Acknowledgments sent, by success
 * - reveille.agent.alarms.fired (counter) - Scheduler firings, by lateness
 * - reveille.agent.workloads.completed (counter) - Workload outcomes, by status
 * - reveille.agent.channel.connected (gauge) - 1 while the sync channel is open
 * - reveille.agent.alarms.armed (gauge) - Schedules currently armed
 * - reveille.agent.uptime.seconds (gauge) - Agent uptime in seconds
 *
 * <p>Instruments come from {@link GlobalOpenTelemetry}; with no SDK registered (tests,
 * telemetry disabled) every call is a no-op.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0 (OpenTelemetry)
 */
public class AgentMetrics {

    private static final Logger logger = LoggerFactory.getLogger(AgentMetrics.class);
    private static final String METER_NAME = "reveille-agent";

    private static final AttributeKey<String> AGENT_KEY = AttributeKey.stringKey("agent.user");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<String> STATUS_KEY = AttributeKey.stringKey("status");
    private static final AttributeKey<Boolean> LATE_KEY = AttributeKey.booleanKey("late");

    private final LongCounter connectionsOpened;
    private final LongCounter reconnectAttempts;
    private final LongCounter acksSent;
    private final LongCounter alarmsFired;
    private final LongCounter workloadsCompleted;

    private final AtomicLong channelConnected = new AtomicLong(0);
    private volatile IntSupplier armedSupplier = () -> 0;

    private final String agentUser;

    /**
     * @param agentUser       the principal the agent authenticates as
     * @param startTimeMillis the agent start time in milliseconds
     */
    public AgentMetrics(String agentUser, long startTimeMillis) {
        this.agentUser = agentUser;

        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        connectionsOpened = meter.counterBuilder("reveille.agent.connections.opened")
                .setDescription("Number of times the sync channel reached the open state")
                .setUnit("1")
                .build();

        reconnectAttempts = meter.counterBuilder("reveille.agent.reconnect.attempts")
                .setDescription("Reconnect attempts after the sync channel closed")
                .setUnit("1")
                .build();

        acksSent = meter.counterBuilder("reveille.agent.acks.sent")
                .setDescription("Per-alarm acknowledgments sent to the controller")
                .setUnit("1")
                .build();

        alarmsFired = meter.counterBuilder("reveille.agent.alarms.fired")
                .setDescription("Scheduler firings")
                .setUnit("1")
                .build();

        workloadsCompleted = meter.counterBuilder("reveille.agent.workloads.completed")
                .setDescription("Workload runs by terminal status")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("reveille.agent.channel.connected")
                .setDescription("1 while the sync channel is open, 0 otherwise")
                .ofLongs()
                .buildWithCallback(measurement ->
                        measurement.record(channelConnected.get(), Attributes.of(AGENT_KEY, agentUser)));

        meter.gaugeBuilder("reveille.agent.alarms.armed")
                .setDescription("Number of schedules currently armed")
                .ofLongs()
                .buildWithCallback(measurement ->
                        measurement.record(armedSupplier.getAsInt(), Attributes.of(AGENT_KEY, agentUser)));

        meter.gaugeBuilder("reveille.agent.uptime.seconds")
                .setDescription("Agent uptime in seconds")
                .ofLongs()
                .buildWithCallback(measurement ->
                        measurement.record((System.currentTimeMillis() - startTimeMillis) / 1000,
                                Attributes.of(AGENT_KEY, agentUser)));

        logger.info("AgentMetrics initialized for user: {}", agentUser);
    }

    public void bindArmedCount(IntSupplier supplier) {
        this.armedSupplier = supplier;
    }

    public void recordChannelOpened() {
        channelConnected.set(1);
        connectionsOpened.add(1, Attributes.of(AGENT_KEY, agentUser));
    }

    public void recordChannelClosed() {
        channelConnected.set(0);
    }

    public void recordReconnectAttempt(boolean success) {
        reconnectAttempts.add(1, Attributes.of(AGENT_KEY, agentUser, OUTCOME_KEY, success ? "success" : "failure"));
    }

    public void recordAck(boolean success) {
        acksSent.add(1, Attributes.of(AGENT_KEY, agentUser, OUTCOME_KEY, success ? "success" : "error"));
    }

    public void recordAlarmFired(boolean late) {
        alarmsFired.add(1, Attributes.of(AGENT_KEY, agentUser, LATE_KEY, late));
    }

    public void recordWorkloadOutcome(AlarmStatus status) {
        workloadsCompleted.add(1, Attributes.of(AGENT_KEY, agentUser, STATUS_KEY, status.wireValue()));
    }
}
