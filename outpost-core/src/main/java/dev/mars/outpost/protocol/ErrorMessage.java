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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Agent to server: the agent cannot complete {@code download_id}. Fails the download at once.
 */
public record ErrorMessage(@JsonProperty("download_id") String downloadId,
                           @JsonProperty("message") String message) implements ProtocolMessage {

    public ErrorMessage {
        Messages.requireText(downloadId, "download_id");
    }
}
