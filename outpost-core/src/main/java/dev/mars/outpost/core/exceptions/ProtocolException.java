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

import java.util.Optional;

/**
 * Raised when a frame on an agent connection cannot be decoded into a protocol message.
 *
 * <p>When the frame was at least well-formed enough to name a download, the identifier is
 * carried so that the owning transfer can be failed instead of silently dropping the frame.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class ProtocolException extends OutpostException {

    private final String transferId;

    public ProtocolException(String message) {
        this(message, null, null);
    }

    public ProtocolException(String message, String transferId, Throwable cause) {
        super(message, cause);
        this.transferId = transferId;
    }

    /**
     * Returns the download identifier recovered from the offending frame, if any.
     */
    public Optional<String> getTransferId() {
        return Optional.ofNullable(transferId);
    }
}
