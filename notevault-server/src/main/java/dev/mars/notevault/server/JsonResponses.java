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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import dev.mars.notevault.storage.NoteResult;

import java.io.IOException;
import java.io.OutputStream;

/**
 * JSON envelope writer shared by the handlers.
 * <p>
 * Success bodies are {@code {"success": true, ...}}; failures are
 * {@code {"success": false, "error": KIND, "message": text}}.
 */
final class JsonResponses {

    private final ObjectMapper mapper;

    JsonResponses(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    /** Starts a success envelope for the caller to fill in. */
    ObjectNode success() {
        ObjectNode body = mapper.createObjectNode();
        body.put("success", true);
        return body;
    }

    void sendJson(HttpExchange exchange, int statusCode, ObjectNode body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    void sendError(HttpExchange exchange, int statusCode, String error, String message) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("success", false);
        body.put("error", error);
        body.put("message", message);
        sendJson(exchange, statusCode, body);
    }

    /**
     * Sends a 500 envelope unless response headers have already gone out.
     *
     * @return false if a response was already started and nothing was sent
     */
    boolean sendServerError(HttpExchange exchange) throws IOException {
        if (exchange.getResponseCode() != -1) {
            return false;
        }
        sendError(exchange, 500, "SERVER_ERROR", "Internal server error");
        return true;
    }

    /** Writes a failed {@link NoteResult} with its mapped status code. */
    void sendFailure(HttpExchange exchange, NoteResult<?> result) throws IOException {
        sendError(exchange, result.httpStatus(),
                result.kind().map(Enum::name).orElse("SERVER_ERROR"),
                result.message().orElse(""));
    }
}
