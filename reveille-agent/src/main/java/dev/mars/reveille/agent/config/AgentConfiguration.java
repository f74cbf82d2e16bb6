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

package dev.mars.reveille.agent.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Immutable settings for one agent process.
 *
 * <p>Built from {@link AgentConfig} at startup, or directly through the {@link Builder}
 * in tests so that components can be wired without touching the environment.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public final class AgentConfiguration {

    private final String wsUrl;
    private final String restApiUrl;
    private final String username;
    private final String password;
    private final ZoneId zoneId;
    private final Path workloadRoot;
    private final String workloadScript;
    private final String interpreter;
    private final String modelPath;
    private final Duration maxWorkloadDuration;
    private final Path lockFile;
    private final Duration reconnectInitialDelay;
    private final Duration reconnectMaxDelay;
    private final double reconnectMultiplier;
    private final Duration heartbeatInterval;
    private final Duration httpTimeout;
    private final Duration schedulerGrace;
    private final Duration maxTimerHop;
    private final Duration lockPollInterval;

    private AgentConfiguration(Builder builder) {
        this.wsUrl = builder.wsUrl;
        this.restApiUrl = builder.restApiUrl;
        this.username = builder.username;
        this.password = builder.password;
        this.zoneId = builder.zoneId;
        this.workloadRoot = builder.workloadRoot;
        this.workloadScript = builder.workloadScript;
        this.interpreter = builder.interpreter;
        this.modelPath = builder.modelPath;
        this.maxWorkloadDuration = builder.maxWorkloadDuration;
        this.lockFile = builder.lockFile;
        this.reconnectInitialDelay = builder.reconnectInitialDelay;
        this.reconnectMaxDelay = builder.reconnectMaxDelay;
        this.reconnectMultiplier = builder.reconnectMultiplier;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.httpTimeout = builder.httpTimeout;
        this.schedulerGrace = builder.schedulerGrace;
        this.maxTimerHop = builder.maxTimerHop;
        this.lockPollInterval = builder.lockPollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Absolute path of the workload executable. */
    public Path scriptPath() {
        return workloadRoot.resolve(workloadScript);
    }

    /** Absolute path of the model artifact the workload loads. */
    public Path modelFilePath() {
        return workloadRoot.resolve(modelPath);
    }

    public boolean hasInterpreter() {
        return interpreter != null && !interpreter.isBlank();
    }

    // Getters
    public String getWsUrl() { return wsUrl; }
    public String getRestApiUrl() { return restApiUrl; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public ZoneId getZoneId() { return zoneId; }
    public Path getWorkloadRoot() { return workloadRoot; }
    public String getWorkloadScript() { return workloadScript; }
    public String getInterpreter() { return interpreter; }
    public String getModelPath() { return modelPath; }
    public Duration getMaxWorkloadDuration() { return maxWorkloadDuration; }
    public Path getLockFile() { return lockFile; }
    public Duration getReconnectInitialDelay() { return reconnectInitialDelay; }
    public Duration getReconnectMaxDelay() { return reconnectMaxDelay; }
    public double getReconnectMultiplier() { return reconnectMultiplier; }
    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public Duration getHttpTimeout() { return httpTimeout; }
    public Duration getSchedulerGrace() { return schedulerGrace; }
    public Duration getMaxTimerHop() { return maxTimerHop; }
    public Duration getLockPollInterval() { return lockPollInterval; }

    public static class Builder {
        private String wsUrl = "ws://localhost:8000/ws";
        private String restApiUrl = "http://localhost:8000/api";
        private String username = "admin";
        private String password = "admin";
        private ZoneId zoneId = ZoneId.systemDefault();
        private Path workloadRoot = Paths.get("").toAbsolutePath();
        private String workloadScript = "run_alarm.py";
        private String interpreter = "python";
        private String modelPath = "models/shufflenet_pretrained_weights.pth";
        private Duration maxWorkloadDuration = Duration.ofSeconds(1900);
        private Path lockFile = Paths.get(System.getProperty("java.io.tmpdir"), "reveille-alarm.lock");
        private Duration reconnectInitialDelay = Duration.ofSeconds(1);
        private Duration reconnectMaxDelay = Duration.ofSeconds(60);
        private double reconnectMultiplier = 2.0;
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration httpTimeout = Duration.ofSeconds(10);
        private Duration schedulerGrace = Duration.ofSeconds(60);
        private Duration maxTimerHop = Duration.ofHours(1);
        private Duration lockPollInterval = Duration.ofSeconds(1);

        public Builder wsUrl(String wsUrl) { this.wsUrl = wsUrl; return this; }
        public Builder restApiUrl(String restApiUrl) { this.restApiUrl = restApiUrl; return this; }
        public Builder username(String username) { this.username = username; return this; }
        public Builder password(String password) { this.password = password; return this; }
        public Builder zoneId(ZoneId zoneId) { this.zoneId = zoneId; return this; }
        public Builder workloadRoot(Path workloadRoot) { this.workloadRoot = workloadRoot; return this; }
        public Builder workloadScript(String workloadScript) { this.workloadScript = workloadScript; return this; }
        public Builder interpreter(String interpreter) { this.interpreter = interpreter; return this; }
        public Builder modelPath(String modelPath) { this.modelPath = modelPath; return this; }
        public Builder maxWorkloadDuration(Duration maxWorkloadDuration) { this.maxWorkloadDuration = maxWorkloadDuration; return this; }
        public Builder lockFile(Path lockFile) { this.lockFile = lockFile; return this; }
        public Builder reconnectInitialDelay(Duration delay) { this.reconnectInitialDelay = delay; return this; }
        public Builder reconnectMaxDelay(Duration delay) { this.reconnectMaxDelay = delay; return this; }
        public Builder reconnectMultiplier(double multiplier) { this.reconnectMultiplier = multiplier; return this; }
        public Builder heartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; return this; }
        public Builder httpTimeout(Duration httpTimeout) { this.httpTimeout = httpTimeout; return this; }
        public Builder schedulerGrace(Duration schedulerGrace) { this.schedulerGrace = schedulerGrace; return this; }
        public Builder maxTimerHop(Duration maxTimerHop) { this.maxTimerHop = maxTimerHop; return this; }
        public Builder lockPollInterval(Duration lockPollInterval) { this.lockPollInterval = lockPollInterval; return this; }

        public AgentConfiguration build() {
            Objects.requireNonNull(wsUrl, "WebSocket URL cannot be null");
            Objects.requireNonNull(restApiUrl, "REST API URL cannot be null");
            Objects.requireNonNull(zoneId, "Zone cannot be null");
            Objects.requireNonNull(workloadRoot, "Workload root cannot be null");
            Objects.requireNonNull(workloadScript, "Workload script cannot be null");
            Objects.requireNonNull(modelPath, "Model path cannot be null");
            Objects.requireNonNull(lockFile, "Lock file cannot be null");
            if (reconnectMultiplier < 1.0) {
                throw new IllegalArgumentException("Reconnect multiplier must be at least 1, got: " + reconnectMultiplier);
            }
            if (reconnectInitialDelay.compareTo(reconnectMaxDelay) > 0) {
                throw new IllegalArgumentException("Reconnect initial delay exceeds the maximum delay");
            }
            if (maxWorkloadDuration.isNegative() || maxWorkloadDuration.isZero()) {
                throw new IllegalArgumentException("Maximum workload duration must be positive");
            }
            if (maxTimerHop.isNegative() || maxTimerHop.isZero()) {
                throw new IllegalArgumentException("Maximum timer hop must be positive");
            }
            return new AgentConfiguration(this);
        }
    }
}
