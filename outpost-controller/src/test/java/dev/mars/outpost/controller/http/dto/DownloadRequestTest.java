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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadRequest validation")
class DownloadRequestTest {

    @Test
    @DisplayName("Accepts client_id and file_path")
    void acceptsValidBody() {
        DownloadRequest request = DownloadRequest.fromJson(new JsonObject()
                .put("client_id", " restaurant-1 ")
                .put("file_path", "/var/log/pos.log"));

        assertEquals("restaurant-1", request.clientId());
        assertEquals("/var/log/pos.log", request.filePath());
    }

    @Test
    @DisplayName("Defaults file_path when absent")
    void defaultsFilePath() {
        DownloadRequest request = DownloadRequest.fromJson(new JsonObject().put("client_id", "edge"));

        assertEquals(DownloadRequest.DEFAULT_FILE_PATH, request.filePath());
    }

    @Test
    @DisplayName("Rejects a missing body")
    void rejectsMissingBody() {
        OutpostApiException ex = assertThrows(OutpostApiException.class, () -> DownloadRequest.fromJson(null));
        assertEquals(ErrorCode.BAD_REQUEST, ex.getErrorCode());
    }

    @Test
    @DisplayName("Rejects a missing, blank or non-string client_id")
    void rejectsInvalidClientId() {
        for (JsonObject body : new JsonObject[]{
                new JsonObject(),
                new JsonObject().put("client_id", "   "),
                new JsonObject().put("client_id", 42)}) {
            OutpostApiException ex = assertThrows(OutpostApiException.class, () -> DownloadRequest.fromJson(body));
            assertEquals(ErrorCode.VALIDATION_ERROR, ex.getErrorCode(), body.encode());
            assertEquals(400, ex.getHttpStatus());
        }
    }

    @Test
    @DisplayName("Rejects a non-string file_path")
    void rejectsInvalidFilePath() {
        JsonObject body = new JsonObject().put("client_id", "edge").put("file_path", true);

        OutpostApiException ex = assertThrows(OutpostApiException.class, () -> DownloadRequest.fromJson(body));
        assertTrue(ex.getMessage().contains("file_path"));
    }
}
