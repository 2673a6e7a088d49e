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

package dev.mars.outpost.core.exceptions;

import dev.mars.outpost.core.TransferStatus;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Thrown when an operation would move a transfer along an edge its state machine does not
 * have, for example cancelling a transfer that already completed.
 *
 * <p>Carries the current and requested states so the control plane can answer with a
 * 409 Conflict that explains what is still possible.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class InvalidTransitionException extends OutpostException {

    private final String transferId;
    private final TransferStatus currentState;
    private final TransferStatus requestedState;

    public InvalidTransitionException(String transferId, TransferStatus currentState, TransferStatus requestedState) {
        super(String.format("Invalid transition for '%s': %s → %s. Valid targets: %s",
                transferId, currentState, requestedState, formatTransitions(currentState.getValidTransitions())));
        this.transferId = transferId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getTransferId() {
        return transferId;
    }

    public TransferStatus getCurrentState() {
        return currentState;
    }

    public TransferStatus getRequestedState() {
        return requestedState;
    }

    private static String formatTransitions(TransferStatus[] transitions) {
        return Arrays.stream(transitions)
                .map(TransferStatus::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
