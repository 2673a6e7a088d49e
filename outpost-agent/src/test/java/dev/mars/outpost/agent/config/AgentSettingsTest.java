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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Agent settings")
class AgentSettingsTest {

    @Nested
    @DisplayName("AgentSettings")
    class SettingsTests {

        @Test
        @DisplayName("Defaults apply when only the id is given")
        void defaults() {
            AgentSettings settings = AgentSettings.builder().agentId("  restaurant-1 ").build();

            assertEquals("restaurant-1", settings.getAgentId());
            assertEquals(URI.create("http://localhost:8080"), settings.getServerUrl());
            assertEquals(1024 * 1024, settings.getChunkSize());
            assertEquals(Duration.ofSeconds(5), settings.getReconnectDelay());
            assertEquals(16 * 1024 * 1024, settings.getMaxFrameSize());
        }

        @Test
        @DisplayName("The WebSocket URI is derived from the server URL")
        void webSocketUri() {
            assertEquals(URI.create("ws://localhost:8080/ws"),
                    AgentSettings.builder().agentId("a").build().getWebSocketUri());
            assertEquals(URI.create("wss://outpost.example.com/ws"),
                    AgentSettings.builder().agentId("a").serverUrl("https://outpost.example.com").build().getWebSocketUri());
            assertEquals(URI.create("ws://10.0.0.5:9000/outpost/ws"),
                    AgentSettings.builder().agentId("a").serverUrl("http://10.0.0.5:9000/outpost/").build().getWebSocketUri());
        }

        @Test
        @DisplayName("A missing id is rejected")
        void missingIdRejected() {
            assertThrows(IllegalArgumentException.class, () -> AgentSettings.builder().build());
            assertThrows(IllegalArgumentException.class, () -> AgentSettings.builder().agentId("  ").build());
        }

        @Test
        @DisplayName("Unsupported server URLs are rejected")
        void badServerUrlRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> AgentSettings.builder().agentId("a").serverUrl("ftp://host").build());
            assertThrows(IllegalArgumentException.class,
                    () -> AgentSettings.builder().agentId("a").serverUrl("ws://host:8080").build());
            assertThrows(IllegalArgumentException.class,
                    () -> AgentSettings.builder().agentId("a").serverUrl("http:///nohost").build());
        }

        @Test
        @DisplayName("Non-positive sizes and delays are rejected")
        void nonPositiveValuesRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> AgentSettings.builder().agentId("a").chunkSize(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> AgentSettings.builder().agentId("a").maxFrameSize(-1).build());
            assertThrows(IllegalArgumentException.class,
                    () -> AgentSettings.builder().agentId("a").reconnectDelay(Duration.ZERO).build());
        }
    }

    @Nested
    @DisplayName("Command line flags")
    class FlagTests {

        @Test
        @DisplayName("Flags override configured values in both spellings")
        void flagsOverrideConfiguration() {
            AgentSettings settings = AgentConfig.get().toSettings(
                    "--client-id", "restaurant-42", "--server=https://outpost.example.com:8443", "--chunk-size", "4096");

            assertEquals("restaurant-42", settings.getAgentId());
            assertEquals(URI.create("https://outpost.example.com:8443"), settings.getServerUrl());
            assertEquals(URI.create("wss://outpost.example.com:8443/ws"), settings.getWebSocketUri());
            assertEquals(4096, settings.getChunkSize());
        }

        @Test
        @DisplayName("Configured defaults are used when no flag is given")
        void configuredDefaults() {
            AgentSettings settings = AgentConfig.get().toSettings("--client-id=restaurant-1");

            assertEquals(URI.create("http://localhost:8080"), settings.getServerUrl());
            assertEquals(AgentSettings.DEFAULT_CHUNK_SIZE, settings.getChunkSize());
        }

        @Test
        @DisplayName("Unknown flags, missing values and bad numbers are rejected")
        void invalidFlagsRejected() {
            AgentConfig config = AgentConfig.get();

            assertThrows(IllegalArgumentException.class, () -> config.toSettings("--client-id", "a", "--verbose", "1"));
            assertThrows(IllegalArgumentException.class, () -> config.toSettings("--client-id"));
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> config.toSettings("--client-id", "a", "--chunk-size", "big"));
            assertTrue(e.getMessage().contains("--chunk-size"));
        }

        @Test
        @DisplayName("Without a configured id the agent refuses to start")
        void idRequired() {
            assertThrows(IllegalArgumentException.class, () -> AgentConfig.get().toSettings());
        }
    }

    @Test
    @DisplayName("Typed lookups fall back to defaults")
    void typedLookupsFallBack() {
        AgentConfig config = AgentConfig.get();

        assertEquals(7, config.getInt("outpost.agent.test.missing", 7));
        assertEquals(9L, config.getLong("outpost.agent.test.missing", 9L));
        assertEquals("fallback", config.getString("outpost.agent.test.missing", "fallback"));
        assertEquals(5000L, config.getReconnectDelayMs());
    }
}
