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

package dev.mars.outpost.controller.config;

import dev.mars.outpost.config.TransferSettings;
import dev.mars.outpost.controller.ws.AgentEndpointOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Centralized configuration for the Outpost controller.
 *
 * <p>Loads configuration from {@code outpost-controller.properties} with environment variable
 * and system property override support. Environment variables take precedence and use
 * uppercase with underscores (e.g., outpost.http.port -> OUTPOST_HTTP_PORT).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private static final String CONFIG_FILE = "outpost-controller.properties";
    private static final AppConfig INSTANCE = new AppConfig();

    private final Properties properties;

    private AppConfig() {
        this.properties = new Properties();
        loadProperties();
        logConfiguration();
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static AppConfig get() {
        return INSTANCE;
    }

    // ==================== HTTP Configuration ====================

    public int getHttpPort() {
        return getInt("outpost.http.port", 8080);
    }

    public String getHttpHost() {
        return getString("outpost.http.host", "0.0.0.0");
    }

    // ==================== Transfer Configuration ====================

    public String getDownloadDir() {
        return getString("outpost.download.dir", "./downloads");
    }

    /**
     * Largest chunk payload accepted from an agent, in bytes.
     */
    public int getChunkSize() {
        return getInt("outpost.transfer.chunk-size", TransferSettings.DEFAULT_CHUNK_SIZE);
    }

    public long getInactivityTimeoutMs() {
        return getLong("outpost.transfer.inactivity-timeout-ms", 30000);
    }

    public long getTimeoutSweepIntervalMs() {
        return getLong("outpost.transfer.timeout-sweep-interval-ms", 1000);
    }

    public boolean isConcurrentTransfersPerAgent() {
        return getBoolean("outpost.transfer.concurrent-per-agent", true);
    }

    // ==================== WebSocket Configuration ====================

    public int getWebSocketMaxFrameSize() {
        return getInt("outpost.websocket.max-frame-size", 16 * 1024 * 1024);
    }

    public long getWebSocketPingIntervalMs() {
        return getLong("outpost.websocket.ping-interval-ms", 30000);
    }

    public long getWebSocketHandshakeTimeoutMs() {
        return getLong("outpost.websocket.handshake-timeout-ms", 10000);
    }


    // ==================== Shutdown Configuration ====================

    public long getShutdownDrainTimeoutMs() {
        return getLong("outpost.shutdown.drain-timeout-ms", 5000);
    }

    public long getShutdownTimeoutMs() {
        return getLong("outpost.shutdown.timeout-ms", 30000);
    }

    // ==================== Application Info ====================

    public String getVersion() {
        return getString("outpost.version", "1.0.0");
    }

    /**
     * Converts the transfer keys into the engine's immutable settings.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public TransferSettings toTransferSettings() {
        return TransferSettings.builder()
                .downloadDirectory(Paths.get(getDownloadDir()))
                .chunkSize(getChunkSize())
                .inactivityTimeout(Duration.ofMillis(getInactivityTimeoutMs()))
                .sweepInterval(Duration.ofMillis(getTimeoutSweepIntervalMs()))
                .concurrentTransfersPerAgent(isConcurrentTransfersPerAgent())
                .build();
    }

    public AgentEndpointOptions toEndpointOptions() {
        return new AgentEndpointOptions(
                Duration.ofMillis(getWebSocketHandshakeTimeoutMs()),
                Duration.ofMillis(getWebSocketPingIntervalMs()),
                getWebSocketMaxFrameSize());
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with environment variable and system property override.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., OUTPOST_HTTP_PORT)</li>
     *   <li>System property (e.g., -Doutpost.http.port=8080)</li>
     *   <li>Properties file (outpost-controller.properties)</li>
     *   <li>Default value</li>
     * </ol>
     *
     * @param key the property key (e.g., "outpost.http.port")
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

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
    }

    private void logConfiguration() {
        logger.info("=== Outpost Controller Configuration ===");
        logger.info("  HTTP Host:            {}", getHttpHost());
        logger.info("  HTTP Port:            {}", getHttpPort());
        logger.info("  Download Dir:         {}", getDownloadDir());
        logger.info("  Version:              {}", getVersion());
        logger.info("  --- Transfers ---");
        logger.info("  Chunk Size:           {} bytes", getChunkSize());
        logger.info("  Inactivity Timeout:   {}ms", getInactivityTimeoutMs());
        logger.info("  Sweep Interval:       {}ms", getTimeoutSweepIntervalMs());
        logger.info("  Concurrent/Agent:     {}", isConcurrentTransfersPerAgent());
        logger.info("  --- WebSocket ---");
        logger.info("  Max Frame Size:       {} bytes", getWebSocketMaxFrameSize());
        logger.info("  Ping Interval:        {}ms", getWebSocketPingIntervalMs());
        logger.info("  Handshake Timeout:    {}ms", getWebSocketHandshakeTimeoutMs());
        logger.info("  --- Shutdown ---");
        logger.info("  Drain Timeout:        {}ms", getShutdownDrainTimeoutMs());
        logger.info("  Shutdown Timeout:     {}ms", getShutdownTimeoutMs());
        logger.info("=========================================");
    }
}
