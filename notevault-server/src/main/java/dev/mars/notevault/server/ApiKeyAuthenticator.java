/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.notevault.server;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Rejects requests whose API key header does not match the configured secret.
 * <p>
 * With no secret configured every request passes; this is logged once at
 * construction. Keys are compared in constant time.
 */
final class ApiKeyAuthenticator extends Filter {

    private static final Logger LOG = LoggerFactory.getLogger(ApiKeyAuthenticator.class);

    private final byte[] expected;
    private final String headerName;
    private final JsonResponses responses;

    ApiKeyAuthenticator(Optional<String> apiKey, String headerName, JsonResponses responses) {
        this.expected = apiKey.filter(key -> !key.isBlank())
                .map(key -> key.getBytes(StandardCharsets.UTF_8))
                .orElse(null);
        this.headerName = headerName;
        this.responses = responses;
        if (expected == null) {
            LOG.warn("No API key configured; /setup and /notes are unauthenticated");
        }
    }

    boolean isEnabled() {
        return expected != null;
    }

    /** True when auth is disabled or {@code supplied} equals the configured key. */
    boolean accepts(String supplied) {
        if (expected == null) {
            return true;
        }
        if (supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(expected, supplied.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        if (accepts(exchange.getRequestHeaders().getFirst(headerName))) {
            chain.doFilter(exchange);
            return;
        }
        LOG.info("Rejected {} {} from {}: missing or wrong API key",
                exchange.getRequestMethod(), exchange.getRequestURI().getPath(), exchange.getRemoteAddress());
        responses.sendError(exchange, 401, "UNAUTHORIZED", "Missing or invalid API key");
    }

    @Override
    public String description() {
        return "API key check on header " + headerName;
    }
}
