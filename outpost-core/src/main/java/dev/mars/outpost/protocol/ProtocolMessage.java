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

package dev.mars.outpost.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A message of the chunk stream protocol carried over an agent's persistent connection.
 *
 * <p>Every message travels as one JSON text frame whose {@code type} property selects the
 * concrete message:</p>
 * <ul>
 *   <li>{@code register} / {@code registered} - identity handshake</li>
 *   <li>{@code download_request} - server asks the agent for a file</li>
 *   <li>{@code file_chunk} - one ordered slice of a file, agent to server</li>
 *   <li>{@code error} - agent aborts a download</li>
 *   <li>{@code cancel} - server abandons a download</li>
 * </ul>
 *
 * <p>All download-scoped messages carry the {@code download_id} so that several downloads
 * can be interleaved on the same connection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RegisterMessage.class, name = ProtocolMessage.REGISTER),
        @JsonSubTypes.Type(value = RegisteredMessage.class, name = ProtocolMessage.REGISTERED),
        @JsonSubTypes.Type(value = DownloadRequestMessage.class, name = ProtocolMessage.DOWNLOAD_REQUEST),
        @JsonSubTypes.Type(value = FileChunkMessage.class, name = ProtocolMessage.FILE_CHUNK),
        @JsonSubTypes.Type(value = ErrorMessage.class, name = ProtocolMessage.ERROR),
        @JsonSubTypes.Type(value = CancelMessage.class, name = ProtocolMessage.CANCEL)
})
public interface ProtocolMessage {

    String REGISTER = "register";
    String REGISTERED = "registered";
    String DOWNLOAD_REQUEST = "download_request";
    String FILE_CHUNK = "file_chunk";
    String ERROR = "error";
    String CANCEL = "cancel";
}
