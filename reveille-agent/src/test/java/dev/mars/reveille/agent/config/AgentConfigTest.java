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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AgentConfig configuration loading and the AgentConfiguration it produces.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
class AgentConfigTest {

    private static final String TEST_CONFIG = "reveille-agent-test.properties";

    @AfterEach
    void clearOverrides() {
        System.clearProperty("reveille.agent.username");
        System.clearProperty("reveille.agent.ws-url");
        System.clearProperty("reveille.agent.timezone");
        System.clearProperty("reveille.agent.heartbeat.interval-ms");
    }

    @Test
    @DisplayName("Should return singleton instance")
    void shouldReturnSingletonInstance() {
        assertSame(AgentConfig.get(), AgentConfig.get(), "Should return the same singleton instance");
    }

    @Test
    @DisplayName("Should read values from the properties file")
    void shouldReadPropertiesFile() {
        AgentConfig config = new AgentConfig(TEST_CONFIG);

        assertEquals("ws://controller.test:9000/ws", config.getWsUrl());
        assertEquals("test-agent", config.getUsername());
        assertEquals("UTC", config.getTimezone());
        assertEquals(250, config.getReconnectInitialDelayMs());
        assertEquals(4000, config.getReconnectMaxDelayMs());
        assertEquals(120, config.getMaxWorkloadDurationSeconds());
    }

    @Test
    @DisplayName("Should fall back to defaults for keys the file does not set")
    void shouldFallBackToDefaults() {
        AgentConfig config = new AgentConfig(TEST_CONFIG);

        assertEquals("http://localhost:8000/api", config.getRestApiUrl());
        assertEquals("admin", config.getPassword());
        assertEquals("run_alarm.py", config.getWorkloadScript());
        assertEquals("python", config.getWorkloadInterpreter());
        assertEquals(30000, config.getHeartbeatIntervalMs());
        assertEquals(60000, config.getSchedulerGraceMs());
    }

    @Test
    @DisplayName("Should use the default for an unparseable number")
    void shouldIgnoreInvalidNumber() {
        AgentConfig config = new AgentConfig(TEST_CONFIG);

        assertEquals(2.0, config.getReconnectMultiplier());
    }

    @Test
    @DisplayName("Should use defaults when the properties file is missing")
    void shouldTolerateMissingFile() {
        AgentConfig config = new AgentConfig("does-not-exist.properties");

        assertEquals("ws://localhost:8000/ws", config.getWsUrl());
        assertEquals(1900, config.getMaxWorkloadDurationSeconds());
        assertEquals(1000, config.getReconnectInitialDelayMs());
        assertEquals(60000, config.getReconnectMaxDelayMs());
    }

    @Test
    @DisplayName("System property should override the properties file")
    void systemPropertyShouldOverrideFile() {
        System.setProperty("reveille.agent.username", "override-agent");
        AgentConfig config = new AgentConfig(TEST_CONFIG);

        assertEquals("override-agent", config.getUsername());
    }

    @Test
    @DisplayName("Should validate the test configuration")
    void shouldValidate() {
        assertDoesNotThrow(() -> new AgentConfig(TEST_CONFIG).validate());
    }

    @Test
    @DisplayName("Should reject a non-WebSocket URL")
    void shouldRejectHttpWsUrl() {
        System.setProperty("reveille.agent.ws-url", "http://controller.test/ws");
        AgentConfig config = new AgentConfig(TEST_CONFIG);

        IllegalStateException e = assertThrows(IllegalStateException.class, config::validate);
        assertTrue(e.getMessage().contains("ws://"));
    }

    @Test
    @DisplayName("Should reject an unknown timezone")
    void shouldRejectUnknownTimezone() {
        System.setProperty("reveille.agent.timezone", "Mars/Olympus_Mons");
        AgentConfig config = new AgentConfig(TEST_CONFIG);

        assertThrows(IllegalStateException.class, config::validate);
    }

    @Test
    @DisplayName("Should reject a non-positive heartbeat interval")
    void shouldRejectZeroHeartbeat() {
        System.setProperty("reveille.agent.heartbeat.interval-ms", "0");
        AgentConfig config = new AgentConfig(TEST_CONFIG);

        assertThrows(IllegalStateException.class, config::validate);
    }

    @Test
    @DisplayName("Should resolve into an AgentConfiguration")
    void shouldBuildConfiguration() {
        AgentConfiguration configuration = new AgentConfig(TEST_CONFIG).toConfiguration();

        assertEquals("ws://controller.test:9000/ws", configuration.getWsUrl());
        assertEquals(ZoneId.of("UTC"), configuration.getZoneId());
        assertEquals(Duration.ofMillis(250), configuration.getReconnectInitialDelay());
        assertEquals(Duration.ofMillis(4000), configuration.getReconnectMaxDelay());
        assertEquals(Duration.ofSeconds(120), configuration.getMaxWorkloadDuration());
        assertEquals(Duration.ofSeconds(30), configuration.getHeartbeatInterval());
        assertEquals(Duration.ofHours(1), configuration.getMaxTimerHop());
    }

    @Test
    @DisplayName("Builder should resolve workload paths against the root")
    void builderShouldResolvePaths() {
        Path root = Path.of("/opt/reveille");
        AgentConfiguration configuration = AgentConfiguration.builder()
                .workloadRoot(root)
                .workloadScript("run_alarm.py")
                .modelPath("models/weights.pth")
                .zoneId(ZoneOffset.UTC)
                .build();

        assertEquals(root.resolve("run_alarm.py"), configuration.scriptPath());
        assertEquals(root.resolve("models/weights.pth"), configuration.modelFilePath());
    }

    @Test
    @DisplayName("Builder should reject a multiplier below one")
    void builderShouldRejectShrinkingBackoff() {
        AgentConfiguration.Builder builder = AgentConfiguration.builder().reconnectMultiplier(0.5);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    @DisplayName("Builder should reject an initial delay above the maximum")
    void builderShouldRejectInvertedDelays() {
        AgentConfiguration.Builder builder = AgentConfiguration.builder()
                .reconnectInitialDelay(Duration.ofSeconds(90))
                .reconnectMaxDelay(Duration.ofSeconds(60));

        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
