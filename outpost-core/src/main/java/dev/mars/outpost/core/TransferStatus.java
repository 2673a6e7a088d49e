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

package dev.mars.outpost.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of a transfer pulled from an agent.
 *
 * <p>A transfer only ever moves forward through these states:</p>
 * <pre>
 *   PENDING     → DISPATCHED, FAILED
 *   DISPATCHED  → IN_PROGRESS, FAILED
 *   IN_PROGRESS → IN_PROGRESS, COMPLETED, FAILED
 *   COMPLETED   → (terminal)
 *   FAILED      → (terminal)
 * </pre>
 *
 * <p>{@code IN_PROGRESS → IN_PROGRESS} is the self-loop taken for every accepted chunk
 * after the first one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum TransferStatus {

    /** Created, the download request has not yet been handed to the agent's connection. */
    PENDING("pending"),

    /** The download request was written to the agent's connection, no chunk has arrived yet. */
    DISPATCHED("dispatched"),

    /** At least one chunk was accepted and the end of stream has not been confirmed. */
    IN_PROGRESS("in_progress"),

    /** The final chunk was accepted and the artifact was flushed and closed without gaps. */
    COMPLETED("completed"),

    /** The transfer was abandoned. The record carries the reason. */
    FAILED("failed");

    private static final Map<TransferStatus, Set<TransferStatus>> TRANSITIONS = new EnumMap<>(TransferStatus.class);

    static {
        TRANSITIONS.put(PENDING, Collections.unmodifiableSet(EnumSet.of(DISPATCHED, FAILED)));
        TRANSITIONS.put(DISPATCHED, Collections.unmodifiableSet(EnumSet.of(IN_PROGRESS, FAILED)));
        TRANSITIONS.put(IN_PROGRESS, Collections.unmodifiableSet(EnumSet.of(IN_PROGRESS, COMPLETED, FAILED)));
        TRANSITIONS.put(COMPLETED, Collections.emptySet());
        TRANSITIONS.put(FAILED, Collections.emptySet());
    }

    private final String value;

    TransferStatus(String value) {
        this.value = value;
    }

    /**
     * Returns the wire representation used by the control plane (e.g. {@code in_progress}).
     */
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * A transfer is in flight once its request has been handed to the agent and until it
     * reaches a terminal state. Only in-flight transfers are subject to the inactivity timeout
     * and to disconnect handling.
     */
    public boolean isInFlight() {
        return this == DISPATCHED || this == IN_PROGRESS;
    }

    public boolean canTransitionTo(TransferStatus target) {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet()).contains(target);
    }

    /**
     * Returns all statuses reachable from this one in a single step.
     *
     * @return array of valid targets, empty for terminal states
     */
    public TransferStatus[] getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet()).toArray(new TransferStatus[0]);
    }

    public static TransferStatus fromValue(String value) {
        for (TransferStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown transfer status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
