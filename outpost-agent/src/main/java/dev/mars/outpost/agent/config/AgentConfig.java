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

package dev.mars.outpost.agent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Centralized configuration loader for the Outpost Agent.
 *
 * <p>Loads {@code outpost-agent.properties} from the classpath; environment variables
 * ({@code OUTPOST_AGENT_ID}) and system properties ({@code -Doutpost.agent.id=...}) take
 * precedence over the file.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class AgentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);
    private static final String CONFIG_FILE = "outpost-agent.properties";
    private static final AgentConfig INSTANCE = new AgentConfig();

    private final Properties properties;

    private AgentConfig() {
        this.properties = new Properties();
        loadProperties();
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static AgentConfig get() {
        return INSTANCE;
    }

    // ==================== Agent Identity ====================

    /**
     * @return the configured agent id, or an empty string when none is set
     */
    public String getAgentId() {
        return getString("outpost.agent.id", "");
    }

    // ==================== Server Connection ====================

    public String getServerUrl() {
        return getString("outpost.agent.server.url", AgentSettings.DEFAULT_SERVER_URL);
    }

    public long getReconnectDelayMs() {
        return getLong("outpost.agent.reconnect-delay-ms", AgentSettings.DEFAULT_RECONNECT_DELAY.toMillis());
    }

    public int getMaxFrameSize() {
        return getInt("outpost.agent.max-frame-size", AgentSettings.DEFAULT_MAX_FRAME_SIZE);
    }

    // ==================== Streaming ====================

    public int getChunkSize() {
        return getInt("outpost.agent.chunk-size", AgentSettings.DEFAULT_CHUNK_SIZE);
    }

    /**
     * Builds validated settings, letting command line flags win over every configured value.
     *
     * <p>Recognised flags: {@code --client-id}, {@code --server}, {@code --chunk-size}, each
     * either as {@code --flag value} or {@code --flag=value}.</p>
     *
     * @throws IllegalArgumentException on an unknown flag, a flag without value, or an invalid
     *                                  setting
     */
    public AgentSettings toSettings(String... args) {
        AgentSettings.Builder builder = AgentSettings.builder()
                .agentId(getAgentId())
                .serverUrl(getServerUrl())
                .chunkSize(getChunkSize())
                .reconnectDelay(Duration.ofMillis(getReconnectDelayMs()))
                .maxFrameSize(getMaxFrameSize());

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            String value;
            int eq = flag.indexOf('=');
            if (eq > 0) {
                value = flag.substring(eq + 1);
                flag = flag.substring(0, eq);
            } else if (i + 1 < args.length) {
                value = args[++i];
            } else {
                throw new IllegalArgumentException("missing value for " + flag);
            }
            switch (flag) {
                case "--client-id" -> builder.agentId(value);
                case "--server" -> builder.serverUrl(value);
                case "--chunk-size" -> builder.chunkSize(parseInt(flag, value));
                default -> throw new IllegalArgumentException("unknown option: " + flag);
            }
        }

        AgentSettings settings = builder.build();
        logConfiguration(settings);
        return settings;
    }

    // ==================== Core Property Accessors ====================

    /**
     * Resolution order: environment variable, system property, properties file, default.
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

    // ==================== Private Helpers ====================

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number, got: " + value);
        }
    }

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
    }

    private void logConfiguration(AgentSettings settings) {
        logger.info("=== Outpost Agent Configuration ===");
        logger.info("  Agent ID:             {}", settings.getAgentId());
        logger.info("  Server URL:           {}", settings.getServerUrl());
        logger.info("  WebSocket URI:        {}", settings.getWebSocketUri());
        logger.info("  Chunk Size:           {} bytes", settings.getChunkSize());
        logger.info("  Reconnect Delay:      {}ms", settings.getReconnectDelay().toMillis());
        logger.info("===================================");
    }
}
