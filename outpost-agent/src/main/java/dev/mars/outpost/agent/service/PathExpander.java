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

package dev.mars.outpost.agent.service;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands environment references ({@code $VAR}, {@code ${VAR}}) and a leading {@code ~} in a
 * requested path. References to unset variables are left as written.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class PathExpander {

    private static final Pattern VARIABLE = Pattern.compile("\\$(?:\\{([A-Za-z0-9_]+)}|([A-Za-z0-9_]+))");

    private final Map<String, String> environment;
    private final String home;

    public PathExpander(Map<String, String> environment, String home) {
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
        this.home = home;
    }

    /**
     * Expander over the process environment and {@code user.home}.
     */
    public static PathExpander system() {
        return new PathExpander(System.getenv(), System.getProperty("user.home"));
    }

    public String expand(String path) {
        Objects.requireNonNull(path, "path cannot be null");
        Matcher matcher = VARIABLE.matcher(path);
        StringBuilder expanded = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            String value = environment.get(name);
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(expanded);
        return expandHome(expanded.toString());
    }

    private String expandHome(String path) {
        String userHome = home != null ? home : environment.get("HOME");
        if (userHome == null || !path.startsWith("~")) {
            return path;
        }
        if (path.length() == 1) {
            return userHome;
        }
        char next = path.charAt(1);
        if (next == '/' || next == '\\') {
            return userHome + path.substring(1);
        }
        // ~otheruser is not resolved
        return path;
    }
}
