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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.mars.outpost.core.exceptions.ProtocolException;

import java.io.IOException;

/**
 * Encodes and decodes chunk stream protocol messages as JSON text frames.
 *
 * <p>Instances are immutable and thread-safe; one codec can be shared by every connection.</p>
 *
 * <p>Decoding is lenient about unknown properties (newer agents may add fields) and strict
 * about the ones it knows: a frame with a missing or ill-typed field is rejected with a
 * {@link ProtocolException}. When the rejected frame still names a {@code download_id}, the
 * exception carries it so the caller can fail that one download.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class ChunkStreamCodec {

    private static final String TYPE_FIELD = "type";
    private static final String DOWNLOAD_ID_FIELD = "download_id";

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final ObjectReader reader;

    public ChunkStreamCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.writer = objectMapper.writerFor(ProtocolMessage.class);
        this.reader = objectMapper.readerFor(ProtocolMessage.class);
    }

    /**
     * Serializes a message to a JSON text frame including its {@code type} discriminator.
     *
     * @throws IllegalArgumentException if the message cannot be serialized
     */
    public String encode(ProtocolMessage message) {
        try {
            return writer.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parses a JSON text frame into the message named by its {@code type}.
     *
     * @throws ProtocolException if the frame is not JSON, has no known type, or violates a
     *                           message's field constraints
     */
    public ProtocolMessage decode(String frame) throws ProtocolException {
        if (frame == null || frame.isBlank()) {
            throw new ProtocolException("empty frame");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("malformed frame: " + describe(e), null, e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("frame is not a JSON object");
        }

        String downloadId = node.hasNonNull(DOWNLOAD_ID_FIELD) ? node.get(DOWNLOAD_ID_FIELD).asText() : null;
        if (!node.hasNonNull(TYPE_FIELD)) {
            throw new ProtocolException("frame has no type", downloadId, null);
        }

        String type = node.get(TYPE_FIELD).asText();
        try {
            return reader.readValue(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("invalid '" + type + "' frame: " + describe(e), downloadId, e);
        } catch (IOException e) {
            throw new ProtocolException("unreadable '" + type + "' frame: " + describe(e), downloadId, e);
        }
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : root.getMessage();
        if (message == null) {
            return root.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
