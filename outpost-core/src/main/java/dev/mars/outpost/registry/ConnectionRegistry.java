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

package dev.mars.outpost.registry;

import dev.mars.outpost.core.AgentLiveness;
import dev.mars.outpost.core.AgentSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps agent identities to their live connection.
 *
 * <p>At most one connection is registered per agent, and a connection is registered under at
 * most one agent. Registering an agent that already has a connection closes the old one and
 * reports the replacement to every {@link ConnectionListener}. Mutations are serialized on the
 * registry; lookups read the underlying map without locking.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, String> agentByConnection = new ConcurrentHashMap<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public ConnectionRegistry() {
        this(Clock.systemUTC());
    }

    public ConnectionRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Registers {@code connection} as the live connection for {@code agentId}, replacing and
     * closing any previous connection for that agent.
     *
     * @throws IllegalStateException if the connection is already registered under another agent
     */
    public void register(String agentId, AgentConnection connection) {
        Objects.requireNonNull(agentId, "agentId cannot be null");
        Objects.requireNonNull(connection, "connection cannot be null");

        Entry previous;
        synchronized (this) {
            String boundAgent = agentByConnection.get(connection.connectionId());
            if (boundAgent != null && !boundAgent.equals(agentId)) {
                throw new IllegalStateException("Connection " + connection.connectionId()
                        + " is already registered for client " + boundAgent);
            }
            previous = entries.put(agentId, new Entry(connection, clock.instant()));
            agentByConnection.put(connection.connectionId(), agentId);
            if (previous != null && previous.connection != connection) {
                agentByConnection.remove(previous.connection.connectionId());
            }
        }

        if (previous != null && previous.connection != connection) {
            logger.warn("Client {} reconnected from {}, replacing connection {}",
                    agentId, connection.remoteAddress(), previous.connection.connectionId());
            previous.connection.close("connection replaced")
                    .onFailure(err -> logger.debug("Closing replaced connection for client {} failed: {}",
                            agentId, err.getMessage()));
            for (ConnectionListener listener : listeners) {
                listener.onConnectionReplaced(agentId, previous.connection, connection);
            }
        } else {
            logger.info("Client {} registered from {}", agentId, connection.remoteAddress());
        }
        for (ConnectionListener listener : listeners) {
            listener.onAgentRegistered(agentId, connection);
        }
    }

    public Optional<AgentConnection> lookup(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(agentId);
        return entry == null ? Optional.empty() : Optional.of(entry.connection);
    }

    public boolean isConnected(String agentId) {
        return agentId != null && entries.containsKey(agentId);
    }

    /**
     * Removes the agent's connection, whatever it is.
     *
     * @return {@code true} if a connection was removed
     */
    public boolean deregister(String agentId) {
        Entry removed;
        synchronized (this) {
            removed = entries.remove(agentId);
            if (removed != null) {
                agentByConnection.remove(removed.connection.connectionId());
            }
        }
        if (removed == null) {
            return false;
        }
        notifyDeregistered(agentId, removed.connection);
        return true;
    }

    /**
     * Removes the agent's connection only if it is still {@code connection}. A late close of a
     * connection that has already been replaced is therefore a no-op.
     *
     * @return {@code true} if the connection was removed
     */
    public boolean deregister(String agentId, AgentConnection connection) {
        Entry removed = null;
        synchronized (this) {
            Entry current = entries.get(agentId);
            if (current != null && current.connection == connection) {
                entries.remove(agentId);
                agentByConnection.remove(connection.connectionId());
                removed = current;
            }
        }
        if (removed == null) {
            logger.debug("Ignoring close of stale connection {} for client {}", connection.connectionId(), agentId);
            return false;
        }
        notifyDeregistered(agentId, connection);
        return true;
    }

    /**
     * Records inbound activity on the agent's current connection.
     */
    public void touch(String agentId) {
        Entry entry = entries.get(agentId);
        if (entry != null) {
            entry.lastSeen = clock.instant();
        }
    }

    public List<AgentSnapshot> list() {
        List<AgentSnapshot> snapshots = new ArrayList<>(entries.size());
        entries.forEach((agentId, entry) ->
                snapshots.add(new AgentSnapshot(agentId, AgentLiveness.CONNECTED, entry.connectedAt, entry.lastSeen)));
        snapshots.sort(Comparator.comparing(AgentSnapshot::agentId));
        return snapshots;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Closes every registered connection. Each close deregisters the agent through the
     * transport's close handling.
     */
    public void closeAll(String reason) {
        List<Entry> current = new ArrayList<>(entries.values());
        if (!current.isEmpty()) {
            logger.info("Closing {} client connection(s): {}", current.size(), reason);
        }
        for (Entry entry : current) {
            entry.connection.close(reason)
                    .onFailure(err -> logger.debug("Closing connection {} failed: {}",
                            entry.connection.connectionId(), err.getMessage()));
        }
    }

    private void notifyDeregistered(String agentId, AgentConnection connection) {
        logger.info("Client {} disconnected", agentId);
        for (ConnectionListener listener : listeners) {
            listener.onAgentDeregistered(agentId, connection);
        }
    }

    private static final class Entry {
        final AgentConnection connection;
        final Instant connectedAt;
        volatile Instant lastSeen;

        Entry(AgentConnection connection, Instant connectedAt) {
            this.connection = connection;
            this.connectedAt = connectedAt;
            this.lastSeen = connectedAt;
        }
    }
}
