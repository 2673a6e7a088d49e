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

package dev.mars.outpost.storage;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Naming of destination artifacts.
 *
 * <p>Artifacts are written to
 * {@code <download dir>/<agent id>_<yyyyMMdd_HHmmss>_<download id>_<source basename>}, with the
 * agent id and basename reduced to {@code [A-Za-z0-9._-]} so that neither can escape the
 * download directory.</p>
 *
 * <p>Names are kept within {@value #MAX_FILE_NAME_LENGTH} characters, the common file system
 * limit: both ids are cut to {@value #MAX_ID_LENGTH} characters and a long basename loses the
 * end of its stem while keeping its extension. After sanitizing every character is ASCII, so
 * characters and bytes agree.</p>
 */
public final class ArtifactPaths {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final String FALLBACK_NAME = "file";

    static final int MAX_FILE_NAME_LENGTH = 255;
    static final int MAX_ID_LENGTH = 64;
    private static final int MAX_EXTENSION_LENGTH = 16;

    private ArtifactPaths() {
    }

    public static Path resolve(Path downloadDirectory, String agentId, String transferId,
                               String sourcePath, Instant createdAt) {
        String prefix = truncate(sanitize(agentId), MAX_ID_LENGTH) + "_" + TIMESTAMP.format(createdAt) + "_"
                + truncate(sanitize(transferId), MAX_ID_LENGTH) + "_";
        return downloadDirectory.resolve(prefix + fit(basename(sourcePath), MAX_FILE_NAME_LENGTH - prefix.length()));
    }

    /**
     * Shortens {@code name} to {@code maxLength} characters by cutting the stem, keeping a short
     * extension intact.
     */
    static String fit(String name, int maxLength) {
        if (name.length() <= maxLength) {
            return name;
        }
        int dot = name.lastIndexOf('.');
        String extension = dot > 0 && name.length() - dot <= MAX_EXTENSION_LENGTH ? name.substring(dot) : "";
        return name.substring(0, maxLength - extension.length()) + extension;
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    /**
     * Returns the last path segment of an agent-side path, sanitized. Both {@code /} and
     * {@code \} are treated as separators because the agent's platform is unknown.
     */
    static String basename(String sourcePath) {
        if (sourcePath == null) {
            return FALLBACK_NAME;
        }
        String trimmed = sourcePath.strip();
        int end = trimmed.length();
        while (end > 0 && isSeparator(trimmed.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && !isSeparator(trimmed.charAt(start - 1))) {
            start--;
        }
        String name = sanitize(trimmed.substring(start, end));
        if (name.isEmpty() || name.chars().allMatch(c -> c == '.')) {
            return FALLBACK_NAME;
        }
        return name;
    }

    static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean allowed = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '_' || c == '-';
            sb.append(allowed ? c : '_');
        }
        return sb.toString();
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }
}
