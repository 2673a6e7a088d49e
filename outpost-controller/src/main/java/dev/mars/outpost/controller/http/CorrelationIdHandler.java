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


package dev.mars.outpost.controller.http;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request, agent socket upgrades included, with an id that ties the controller's log
 * lines to the response the caller sees.
 *
 * <p>A caller-supplied {@value #REQUEST_ID_HEADER} is reused when it is at most 64 characters of
 * letters, digits and {@code . _ : -}; anything else is replaced with a fresh {@code req-xxxxxxxx}
 * id, so a client cannot put arbitrary text into the log. The id is echoed in the response
 * header, kept on the routing context for {@link ErrorResponse} and put in the SLF4J MDC under
 * {@code requestId}, which the logback pattern prints.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class CorrelationIdHandler implements Handler<RoutingContext> {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    static final String REQUEST_ID_KEY = "requestId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    public void handle(RoutingContext ctx) {
        String requestId = acceptOrGenerate(ctx.request().getHeader(REQUEST_ID_HEADER));
        ctx.put(REQUEST_ID_KEY, requestId);
        ctx.response().putHeader(REQUEST_ID_HEADER, requestId);

        // the event loop thread serves other requests next
        MDC.put(REQUEST_ID_KEY, requestId);
        ctx.addEndHandler(v -> MDC.remove(REQUEST_ID_KEY));

        ctx.next();
    }

    /**
     * @return the id of the request, or {@code null} when this handler did not run for it
     */
    public static String getRequestId(RoutingContext ctx) {
        return ctx.get(REQUEST_ID_KEY);
    }

    static String acceptOrGenerate(String supplied) {
        if (supplied != null && ACCEPTED_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return newRequestId();
    }

    static String newRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
