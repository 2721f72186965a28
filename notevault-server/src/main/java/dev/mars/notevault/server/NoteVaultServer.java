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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import dev.mars.notevault.storage.HealthStatus;
import dev.mars.notevault.storage.Note;
import dev.mars.notevault.storage.NoteResult;
import dev.mars.notevault.storage.NoteSession;
import dev.mars.notevault.storage.NoteVaultConfig;
import dev.mars.notevault.storage.StorageMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * HTTP front end for a {@link NoteSession}.
 * <p>
 * Routes:
 * <ul>
 *   <li>{@code POST /setup} {@code {"bucket": "..."}} - select the storage backend</li>
 *   <li>{@code GET /health} - liveness, always 200, no API key</li>
 *   <li>{@code POST /notes} {@code {"title": "...", "content": "..."}} - add a note</li>
 *   <li>{@code GET /notes[?id=N]} - all notes, or one</li>
 *   <li>{@code DELETE /notes?id=N} - delete a note</li>
 * </ul>
 * The session is passed in; the server holds no storage state of its own.
 */
public class NoteVaultServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(NoteVaultServer.class);

    private static final int WORKER_THREADS = 4;

    private final NoteVaultConfig config;
    private final NoteSession session;
    private final JsonResponses responses;
    private final ApiKeyAuthenticator authenticator;

    private HttpServer server;
    private ExecutorService executor;

    public NoteVaultServer(NoteVaultConfig config, NoteSession session) {
        this.config = Objects.requireNonNull(config, "config");
        this.session = Objects.requireNonNull(session, "session");
        this.responses = new JsonResponses(new ObjectMapper());
        this.authenticator = new ApiKeyAuthenticator(config.apiKey(), config.apiKeyHeader(), responses);
    }

    /**
     * Binds the configured port (0 for an ephemeral one) and starts serving.
     */
    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        server = HttpServer.create(new InetSocketAddress(config.port()), 0);

        HttpContext setup = server.createContext("/setup", new SetupHandler());
        setup.getFilters().add(authenticator);
        server.createContext("/health", new HealthHandler());
        HttpContext notes = server.createContext("/notes", new NotesHandler());
        notes.getFilters().add(authenticator);

        executor = Executors.newFixedThreadPool(WORKER_THREADS);
        server.setExecutor(executor);
        server.start();

        LOG.info("NoteVault server listening on port {} (auth {})", port(),
                authenticator.isEnabled() ? "enabled" : "disabled");
    }

    /** Bound port; differs from the configured one when that was 0. */
    public synchronized int port() {
        if (server == null) {
            throw new IllegalStateException("Server not started");
        }
        return server.getAddress().getPort();
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        server.stop(0);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        server = null;
        LOG.info("NoteVault server stopped");
    }

    // ========================================================================
    // Handlers
    // ========================================================================

    /**
     * Common dispatch: exact path match, method check, and a last-resort 500.
     */
    private abstract class JsonHandler implements HttpHandler {

        private final String path;

        JsonHandler(String path) {
            this.path = path;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    responses.sendError(exchange, 404, "NOT_FOUND", "No route for " + exchange.getRequestURI().getPath());
                    return;
                }
                LOG.debug("{} {}", exchange.getRequestMethod(), path);
                dispatch(exchange);
            } catch (RuntimeException e) {
                LOG.error("Unhandled error serving {} {}", exchange.getRequestMethod(), path, e);
                if (!responses.sendServerError(exchange)) {
                    LOG.warn("Response to {} {} already started; closing without an error body",
                            exchange.getRequestMethod(), path);
                }
            } finally {
                exchange.close();
            }
        }

        abstract void dispatch(HttpExchange exchange) throws IOException;

        void methodNotAllowed(HttpExchange exchange, String allowed) throws IOException {
            exchange.getResponseHeaders().set("Allow", allowed);
            responses.sendError(exchange, 405, "METHOD_NOT_ALLOWED",
                    "Method " + exchange.getRequestMethod() + " not allowed");
        }
    }

    private class SetupHandler extends JsonHandler {

        SetupHandler() {
            super("/setup");
        }

        @Override
        void dispatch(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                methodNotAllowed(exchange, "POST");
                return;
            }
            ObjectNode request = readObject(exchange);
            if (request == null) {
                return;
            }
            JsonNode bucket = request.get("bucket");
            if (bucket == null || !bucket.isTextual()) {
                responses.sendError(exchange, 400, "INVALID_INPUT", "Bucket name not provided");
                return;
            }

            NoteResult<StorageMode> result = session.setup(bucket.asText());
            if (!result.isSuccess()) {
                responses.sendFailure(exchange, result);
                return;
            }
            ObjectNode body = responses.success();
            body.put("bucket", bucket.asText().strip());
            body.put("mode", result.value().name());
            if (result.isDegraded()) {
                body.put("warning", result.kind().orElseThrow().name());
                body.put("message", result.message().orElse(""));
            }
            responses.sendJson(exchange, 200, body);
        }
    }

    private class HealthHandler extends JsonHandler {

        HealthHandler() {
            super("/health");
        }

        @Override
        void dispatch(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                methodNotAllowed(exchange, "GET");
                return;
            }
            HealthStatus health = session.healthCheck();
            ObjectNode body = responses.success();
            body.put("setup", health.setUp());
            body.put("mode", health.mode().name());
            body.put("message", health.message());
            responses.sendJson(exchange, 200, body);
        }
    }

    private class NotesHandler extends JsonHandler {

        NotesHandler() {
            super("/notes");
        }

        @Override
        void dispatch(HttpExchange exchange) throws IOException {
            switch (exchange.getRequestMethod()) {
                case "POST" -> addNote(exchange);
                case "GET" -> getNotes(exchange);
                case "DELETE" -> deleteNote(exchange);
                default -> methodNotAllowed(exchange, "GET, POST, DELETE");
            }
        }

        private void addNote(HttpExchange exchange) throws IOException {
            ObjectNode request = readObject(exchange);
            if (request == null) {
                return;
            }
            NoteResult<Long> result = session.add(textOrNull(request, "title"), textOrNull(request, "content"));
            if (!result.isSuccess()) {
                responses.sendFailure(exchange, result);
                return;
            }
            ObjectNode body = responses.success();
            body.put("id", result.value());
            responses.sendJson(exchange, 200, body);
        }

        private void getNotes(HttpExchange exchange) throws IOException {
            Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
            if (!query.containsKey("id")) {
                NoteResult<Map<Long, Note>> result = session.getAll();
                if (!result.isSuccess()) {
                    responses.sendFailure(exchange, result);
                    return;
                }
                ObjectNode body = responses.success();
                ObjectNode notes = body.putObject("notes");
                result.value().forEach((id, note) -> writeNote(notes.putObject(String.valueOf(id)), note));
                responses.sendJson(exchange, 200, body);
                return;
            }

            NoteResult<Note> result = session.get(query.get("id"));
            if (!result.isSuccess()) {
                responses.sendFailure(exchange, result);
                return;
            }
            ObjectNode body = responses.success();
            body.put("id", result.value().id());
            writeNote(body.putObject("notes"), result.value());
            responses.sendJson(exchange, 200, body);
        }

        private void deleteNote(HttpExchange exchange) throws IOException {
            Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
            if (!query.containsKey("id")) {
                responses.sendError(exchange, 400, "INVALID_INPUT", "id was not included");
                return;
            }
            NoteResult<Long> result = session.delete(query.get("id"));
            if (!result.isSuccess()) {
                responses.sendFailure(exchange, result);
                return;
            }
            ObjectNode body = responses.success();
            body.put("id", result.value());
            responses.sendJson(exchange, 200, body);
        }
    }

    // ========================================================================
    // Request Helpers
    // ========================================================================

    /**
     * Reads the body as a JSON object, answering 400 and returning null if it is
     * missing or not an object.
     */
    private ObjectNode readObject(HttpExchange exchange) throws IOException {
        byte[] raw;
        try (InputStream in = exchange.getRequestBody()) {
            raw = in.readAllBytes();
        }
        if (raw.length == 0) {
            responses.sendError(exchange, 400, "INVALID_INPUT", "Payload not provided");
            return null;
        }
        JsonNode node;
        try {
            node = responses.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            LOG.debug("Malformed JSON body: {}", e.getOriginalMessage());
            responses.sendError(exchange, 400, "INVALID_INPUT", "Payload is not valid JSON");
            return null;
        }
        if (node == null || !node.isObject()) {
            responses.sendError(exchange, 400, "INVALID_INPUT", "Payload must be a JSON object");
            return null;
        }
        return (ObjectNode) node;
    }

    private static String textOrNull(ObjectNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static void writeNote(ObjectNode target, Note note) {
        target.put("title", note.title());
        target.put("content", note.content());
    }

    /**
     * Decodes a raw query string. The first occurrence of a repeated key wins; a key
     * without {@code =} maps to the empty string.
     */
    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            params.putIfAbsent(key, value);
        }
        return params;
    }

    // ========================================================================
    // Entry Point
    // ========================================================================

    public static void main(String[] args) throws IOException {
        NoteVaultConfig config = NoteVaultConfig.load();
        LOG.info("Starting NoteVault with {}", config);

        NoteVaultServer server = new NoteVaultServer(config, new NoteSession(config));
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "notevault-shutdown"));
        server.start();
    }
}
