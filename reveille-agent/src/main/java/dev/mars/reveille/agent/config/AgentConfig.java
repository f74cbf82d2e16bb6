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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Centralized configuration loader for the Reveille agent.
 *
 * <p>Loads configuration from reveille-agent.properties with environment variable and
 * system property overrides. {@link #toConfiguration()} turns the resolved values into
 * the immutable {@link AgentConfiguration} that the agent components consume.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public final class AgentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);
    static final String CONFIG_FILE = "reveille-agent.properties";
    private static final AgentConfig INSTANCE = new AgentConfig(CONFIG_FILE);

    private final Properties properties;

    AgentConfig(String configFile) {
        this.properties = new Properties();
        loadProperties(configFile);
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static AgentConfig get() {
        return INSTANCE;
    }

    // ==================== Controller Connection ====================

    public String getWsUrl() {
        return getString("reveille.agent.ws-url", "ws://localhost:8000/ws");
    }

    public String getRestApiUrl() {
        return getString("reveille.agent.rest-api-url", "http://localhost:8000/api");
    }

    public String getUsername() {
        return getString("reveille.agent.username", "admin");
    }

    public String getPassword() {
        return getString("reveille.agent.password", "admin");
    }

    public long getHttpTimeoutMs() {
        return getLong("reveille.agent.http.connect-timeout-ms", 10000);
    }

    // ==================== Scheduling ====================

    public String getTimezone() {
        return getString("reveille.agent.timezone", ZoneId.systemDefault().getId());
    }

    public long getSchedulerGraceMs() {
        return getLong("reveille.agent.scheduler.grace-ms", 60000);
    }

    public long getSchedulerMaxHopMs() {
        return getLong("reveille.agent.scheduler.max-hop-ms", 3600000);
    }

    // ==================== Workload ====================

    public String getWorkloadRoot() {
        return getString("reveille.agent.workload.root", Paths.get("").toAbsolutePath().toString());
    }

    public String getWorkloadScript() {
        return getString("reveille.agent.workload.script", "run_alarm.py");
    }

    public String getWorkloadInterpreter() {
        return getString("reveille.agent.workload.interpreter", "python");
    }

    public String getModelPath() {
        return getString("reveille.agent.workload.model-path", "models/shufflenet_pretrained_weights.pth");
    }

    public long getMaxWorkloadDurationSeconds() {
        return getLong("reveille.agent.workload.max-duration-seconds", 1900);
    }

    public String getLockFile() {
        return getString("reveille.agent.lock-file",
                Paths.get(System.getProperty("java.io.tmpdir"), "reveille-alarm.lock").toString());
    }

    // ==================== Reconnect and Heartbeat ====================

    public long getReconnectInitialDelayMs() {
        return getLong("reveille.agent.reconnect.initial-delay-ms", 1000);
    }

    public long getReconnectMaxDelayMs() {
        return getLong("reveille.agent.reconnect.max-delay-ms", 60000);
    }

    public double getReconnectMultiplier() {
        return getDouble("reveille.agent.reconnect.multiplier", 2.0);
    }

    public long getHeartbeatIntervalMs() {
        return getLong("reveille.agent.heartbeat.interval-ms", 30000);
    }

    // ==================== Telemetry Configuration ====================

    public boolean isTelemetryEnabled() {
        return getBoolean("reveille.agent.telemetry.enabled", true);
    }

    public int getPrometheusPort() {
        return getInt("reveille.agent.telemetry.prometheus.port", 9465);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., REVEILLE_AGENT_WS_URL)</li>
     *   <li>System property (e.g., -Dreveille.agent.ws-url=...)</li>
     *   <li>Properties file (reveille-agent.properties)</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid decimal value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Validates that required configuration is present and values are sensible.
     * Called during startup to fail fast on misconfiguration.
     *
     * @throws IllegalStateException if required configuration is invalid
     */
    public void validate() {
        String wsUrl = getWsUrl();
        if (!wsUrl.startsWith("ws://") && !wsUrl.startsWith("wss://")) {
            throw new IllegalStateException("WebSocket URL must start with ws:// or wss://, got: " + wsUrl);
        }
        String restApiUrl = getRestApiUrl();
        if (!restApiUrl.startsWith("http://") && !restApiUrl.startsWith("https://")) {
            throw new IllegalStateException("REST API URL must start with http:// or https://, got: " + restApiUrl);
        }
        if (getUsername().isBlank()) {
            throw new IllegalStateException("Agent username must be configured");
        }
        try {
            ZoneId.of(getTimezone());
        } catch (DateTimeException e) {
            throw new IllegalStateException("Unknown timezone: " + getTimezone(), e);
        }
        if (getHeartbeatIntervalMs() <= 0) {
            throw new IllegalStateException("Heartbeat interval must be positive, got: " + getHeartbeatIntervalMs());
        }
        if (getReconnectInitialDelayMs() <= 0 || getReconnectMaxDelayMs() < getReconnectInitialDelayMs()) {
            throw new IllegalStateException("Reconnect delays must be positive with max >= initial, got: "
                    + getReconnectInitialDelayMs() + "/" + getReconnectMaxDelayMs());
        }
        if (getReconnectMultiplier() < 1.0) {
            throw new IllegalStateException("Reconnect multiplier must be at least 1, got: " + getReconnectMultiplier());
        }
        if (getMaxWorkloadDurationSeconds() <= 0) {
            throw new IllegalStateException(
                    "Maximum workload duration must be positive, got: " + getMaxWorkloadDurationSeconds());
        }
        int port = getPrometheusPort();
        if (port < 1 || port > 65535) {
            throw new IllegalStateException("Prometheus port must be between 1 and 65535, got: " + port);
        }

        logger.info("Agent configuration validated successfully");
    }

    /**
     * Resolves every setting into an immutable {@link AgentConfiguration}.
     */
    public AgentConfiguration toConfiguration() {
        return AgentConfiguration.builder()
                .wsUrl(getWsUrl())
                .restApiUrl(getRestApiUrl())
                .username(getUsername())
                .password(getPassword())
                .zoneId(ZoneId.of(getTimezone()))
                .workloadRoot(Path.of(getWorkloadRoot()))
                .workloadScript(getWorkloadScript())
                .interpreter(getWorkloadInterpreter())
                .modelPath(getModelPath())
                .maxWorkloadDuration(Duration.ofSeconds(getMaxWorkloadDurationSeconds()))
                .lockFile(Path.of(getLockFile()))
                .reconnectInitialDelay(Duration.ofMillis(getReconnectInitialDelayMs()))
                .reconnectMaxDelay(Duration.ofMillis(getReconnectMaxDelayMs()))
                .reconnectMultiplier(getReconnectMultiplier())
                .heartbeatInterval(Duration.ofMillis(getHeartbeatIntervalMs()))
                .httpTimeout(Duration.ofMillis(getHttpTimeoutMs()))
                .schedulerGrace(Duration.ofMillis(getSchedulerGraceMs()))
                .maxTimerHop(Duration.ofMillis(getSchedulerMaxHopMs()))
                .build();
    }

    /**
     * Logs the resolved configuration, password excluded.
     */
    public void logConfiguration() {
        logger.info("=== Reveille Agent Configuration ===");
        logger.info("  WebSocket URL:        {}", getWsUrl());
        logger.info("  REST API URL:         {}", getRestApiUrl());
        logger.info("  Username:             {}", getUsername());
        logger.info("  Timezone:             {}", getTimezone());
        logger.info("  --- Workload ---");
        logger.info("  Root:                 {}", getWorkloadRoot());
        logger.info("  Script:               {}", getWorkloadScript());
        logger.info("  Interpreter:          {}", getWorkloadInterpreter());
        logger.info("  Model:                {}", getModelPath());
        logger.info("  Max Duration:         {}s", getMaxWorkloadDurationSeconds());
        logger.info("  Lock File:            {}", getLockFile());
        logger.info("  --- Reconnect ---");
        logger.info("  Initial Delay:        {}ms", getReconnectInitialDelayMs());
        logger.info("  Max Delay:            {}ms", getReconnectMaxDelayMs());
        logger.info("  Multiplier:           {}", getReconnectMultiplier());
        logger.info("  Heartbeat Interval:   {}ms", getHeartbeatIntervalMs());
        logger.info("  --- Telemetry ---");
        logger.info("  Enabled:              {}", isTelemetryEnabled());
        logger.info("  Prometheus Port:      {}", getPrometheusPort());
        logger.info("====================================");
    }

    // ==================== Private Helpers ====================

    private void loadProperties(String configFile) {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", configFile);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", configFile);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
    }
}
