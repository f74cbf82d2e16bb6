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

package dev.mars.reveille.controller.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Centralized configuration for the Reveille controller.
 *
 * <p>Loads configuration from reveille-controller.properties with environment variable override support.
 * Environment variables take precedence and use uppercase with underscores
 * (e.g., reveille.http.port -> REVEILLE_HTTP_PORT).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public final class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    static final String CONFIG_FILE = "reveille-controller.properties";
    private static final AppConfig INSTANCE = new AppConfig(CONFIG_FILE);

    private final Properties properties;

    AppConfig(String configFile) {
        this.properties = new Properties();
        loadProperties(configFile);
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static AppConfig get() {
        return INSTANCE;
    }

    // ==================== HTTP Configuration ====================

    public int getHttpPort() {
        return getInt("reveille.http.port", 8000);
    }

    public String getHttpHost() {
        return getString("reveille.http.host", "0.0.0.0");
    }

    // ==================== Security Configuration ====================

    /**
     * The account seeded at startup. Agents log in with it unless configured otherwise.
     */
    public String getAdminUsername() {
        return getString("reveille.admin.username", "admin");
    }

    public String getAdminPassword() {
        return getString("reveille.admin.password", "admin");
    }

    public long getTokenTtlHours() {
        return getLong("reveille.token.ttl-hours", 24);
    }

    // ==================== Application Info ====================

    public String getVersion() {
        return getString("reveille.version", "1.0.0");
    }

    /**
     * Fails fast on settings the controller cannot start with.
     *
     * @throws IllegalStateException describing the first invalid setting
     */
    public void validate() {
        int port = getHttpPort();
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("HTTP port must be between 0 and 65535, got: " + port);
        }
        if (getAdminUsername().isBlank()) {
            throw new IllegalStateException("Admin username must be configured");
        }
        if (getAdminPassword().isEmpty()) {
            throw new IllegalStateException("Admin password must be configured");
        }
        if (getTokenTtlHours() <= 0) {
            throw new IllegalStateException("Token TTL must be positive, got: " + getTokenTtlHours());
        }
        if ("admin".equals(getAdminPassword())) {
            logger.warn("Admin account uses the default password. Set reveille.admin.password for production.");
        }
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with environment variable and system property override.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., REVEILLE_HTTP_PORT)</li>
     *   <li>System property (e.g., -Dreveille.http.port=8000)</li>
     *   <li>Properties file (reveille-controller.properties)</li>
     *   <li>Default value</li>
     * </ol>
     *
     * @param key the property key (e.g., "reveille.http.port")
     * @param defaultValue the default value if not found
     * @return the resolved property value
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
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

    // ==================== Private Helpers ====================

    private void loadProperties(String configFile) {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", configFile);
            } else {
                logger.warn("Configuration file {} not found, using defaults", configFile);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
    }

    public void logConfiguration() {
        logger.info("=== Reveille Controller Configuration ===");
        logger.info("  HTTP Host:            {}", getHttpHost());
        logger.info("  HTTP Port:            {}", getHttpPort());
        logger.info("  Admin User:           {}", getAdminUsername());
        logger.info("  Token TTL:            {}h", getTokenTtlHours());
        logger.info("  Version:              {}", getVersion());
        logger.info("=========================================");
    }
}
