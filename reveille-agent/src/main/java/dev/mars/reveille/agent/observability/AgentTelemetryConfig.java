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

import io.opentelemetry.exporter.prometheus.PrometheusHttpServer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry configuration for the Reveille agent.
 *
 * Provides Prometheus metrics export on a configurable port (default 9465) and registers
 * the SDK globally so that {@link AgentMetrics} picks it up.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0 (OpenTelemetry)
 */
public final class AgentTelemetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentTelemetryConfig.class);

    private AgentTelemetryConfig() {
    }

    /**
     * Builds the SDK with a Prometheus reader and registers it as the global instance.
     * Call once, before the first {@link AgentMetrics} is created.
     *
     * @param agentUser      the principal the agent authenticates as, used as instance id
     * @param prometheusPort port of the scrape endpoint
     * @return the SDK, to be closed on shutdown
     */
    public static OpenTelemetrySdk initialize(String agentUser, int prometheusPort) {
        Resource resource = Resource.getDefault().toBuilder()
                .put("service.name", "reveille-agent")
                .put("service.instance.id", agentUser)
                .build();

        PrometheusHttpServer prometheusReader = PrometheusHttpServer.builder()
                .setPort(prometheusPort)
                .build();

        SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                .setResource(resource)
                .registerMetricReader(prometheusReader)
                .build();

        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
                .setMeterProvider(meterProvider)
                .buildAndRegisterGlobal();

        logger.info("Prometheus metrics available on port {}", prometheusPort);
        return openTelemetry;
    }
}
