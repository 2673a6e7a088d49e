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

/**
 * Raised when concurrent transfers per agent are disabled and the agent already has a
 * non-terminal transfer.
 */
public class AgentBusyException extends OutpostException {

    private final String agentId;
    private final String activeTransferId;

    public AgentBusyException(String agentId, String activeTransferId) {
        super("Client " + agentId + " is busy with download " + activeTransferId);
        this.agentId = agentId;
        this.activeTransferId = activeTransferId;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getActiveTransferId() {
        return activeTransferId;
    }
}
