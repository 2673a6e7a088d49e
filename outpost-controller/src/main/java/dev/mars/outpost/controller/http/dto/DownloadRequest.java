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

package dev.mars.outpost.controller.http.dto;

import dev.mars.outpost.controller.http.ErrorCode;
import dev.mars.outpost.controller.http.OutpostApiException;
import io.vertx.core.json.JsonObject;

/**
 * Validated body of {@code POST /api/download}.
 *
 * @param clientId the agent to pull from
 * @param filePath path on the agent; environment references are expanded agent-side
 */
public record DownloadRequest(String clientId, String filePath) {

    public static final String DEFAULT_FILE_PATH = "$HOME/file_to_download.txt";

    /**
     * @throws OutpostApiException if the body is missing or a field is invalid
     */
    public static DownloadRequest fromJson(JsonObject body) {
        if (body == null) {
            throw OutpostApiException.badRequest(ErrorCode.BAD_REQUEST, "request body must be a JSON object");
        }

        Object clientId = body.getValue("client_id");
        if (clientId == null) {
            throw OutpostApiException.badRequest(ErrorCode.VALIDATION_ERROR, "client_id is required");
        }
        if (!(clientId instanceof String) || ((String) clientId).isBlank()) {
            throw OutpostApiException.badRequest(ErrorCode.VALIDATION_ERROR, "client_id must be a non-blank string");
        }

        Object filePath = body.getValue("file_path");
        if (filePath == null) {
            filePath = DEFAULT_FILE_PATH;
        } else if (!(filePath instanceof String) || ((String) filePath).isBlank()) {
            throw OutpostApiException.badRequest(ErrorCode.VALIDATION_ERROR, "file_path must be a non-blank string");
        }

        return new DownloadRequest(((String) clientId).strip(), (String) filePath);
    }
}
