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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.notevault.storage.BackendException;
import dev.mars.notevault.storage.BackendFailure;
import dev.mars.notevault.storage.LocalFileBackend;
import dev.mars.notevault.storage.NoteSession;
import dev.mars.notevault.storage.NoteVaultConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link NoteVaultServer} over real HTTP on an ephemeral port.
 * <p>
 * "Remote" buckets are local files named after the bucket; the bucket name
 * {@code missing} behaves like a bucket that does not exist.
 */
class NoteVaultServerTest {

    private static final String API_KEY = "test-key";
    private static final String HEADER = "X-API-Key";

    @TempDir
    Path tempDir;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private NoteVaultServer server;
    private Path localFile;

    @BeforeEach
    void setUp() throws IOException {
        localFile = tempDir.resolve("local_notes.json");
        server = startServer(API_KEY);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    private NoteVaultServer startServer(String apiKey) throws IOException {
        NoteVaultConfig config = NoteVaultConfig.builder()
                .localFile(localFile)
                .port(0)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .apiKey(apiKey)
                .apiKeyHeader(HEADER)
                .build();
        NoteSession session = new NoteSession(bucket -> {
            if (bucket.equals("missing")) {
                throw new BackendException(BackendFailure.NOT_FOUND, "Bucket " + bucket + " does not exist");
            }
            return new LocalFileBackend(tempDir.resolve("bucket-" + bucket + ".json"), false, 0);
        }, new LocalFileBackend(config));
        NoteVaultServer started = new NoteVaultServer(config, session);
        started.start();
        return started;
    }

    private HttpResponse<String> send(String method, String path, String body, String key)
            throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + server.port() + path))
                .timeout(Duration.ofSeconds(10))
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (key != null) {
            request.header(HEADER, key);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> send(String method, String path, String body)
            throws IOException, InterruptedException {
        return send(method, path, body, API_KEY);
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return objectMapper.readTree(response.body());
    }

    // ========================================================================
    // Health and Auth
    // ========================================================================

    @Nested
    @DisplayName("Health and authentication")
    class HealthAndAuth {

        @Test
        @DisplayName("Health needs no API key and reports setup state")
        void testHealth_BeforeSetup() throws Exception {
            HttpResponse<String> response = send("GET", "/health", null, null);

            assertEquals(200, response.statusCode());
            assertEquals("application/json", response.headers().firstValue("Content-Type").orElse(""));
            JsonNode body = json(response);
            assertTrue(body.get("success").asBoolean());
            assertFalse(body.get("setup").asBoolean());
            assertEquals("UNINITIALIZED", body.get("mode").asText());
        }

        @Test
        @DisplayName("Missing API key is rejected with 401")
        void testNotes_MissingKey() throws Exception {
            HttpResponse<String> response = send("GET", "/notes", null, null);

            assertEquals(401, response.statusCode());
            assertEquals("UNAUTHORIZED", json(response).get("error").asText());
        }

        @Test
        @DisplayName("Wrong API key is rejected on setup")
        void testSetup_WrongKey() throws Exception {
            HttpResponse<String> response = send("POST", "/setup", "{\"bucket\":\"b\"}", "wrong-key");

            assertEquals(401, response.statusCode());
            assertFalse(json(send("GET", "/health", null, null)).get("setup").asBoolean());
        }

        @Test
        @DisplayName("Without a configured key every request passes")
        void testAuthDisabled() throws Exception {
            server.close();
            server = startServer(null);

            HttpResponse<String> response = send("GET", "/notes", null, null);

            assertEquals(403, response.statusCode());
            assertEquals("SETUP_REQUIRED", json(response).get("error").asText());
        }
    }

    // ========================================================================
    // Setup
    // ========================================================================

    @Nested
    @DisplayName("Setup route")
    class SetupRoute {

        @Test
        @DisplayName("Reachable bucket returns ONLINE")
        void testSetup_Online() throws Exception {
            HttpResponse<String> response = send("POST", "/setup", "{\"bucket\":\"b\"}");

            assertEquals(200, response.statusCode());
            JsonNode body = json(response);
            assertTrue(body.get("success").asBoolean());
            assertEquals("b", body.get("bucket").asText());
            assertEquals("ONLINE", body.get("mode").asText());
            assertFalse(body.has("warning"));
            assertTrue(json(send("GET", "/health", null, null)).get("setup").asBoolean());
        }

        @Test
        @DisplayName("Missing bucket is a degraded success on local storage")
        void testSetup_FallsBackToLocal() throws Exception {
            HttpResponse<String> response = send("POST", "/setup", "{\"bucket\":\"missing\"}");

            assertEquals(200, response.statusCode());
            JsonNode body = json(response);
            assertTrue(body.get("success").asBoolean());
            assertEquals("OFFLINE", body.get("mode").asText());
            assertEquals("NOT_FOUND_USE_LOCAL", body.get("warning").asText());
            assertTrue(Files.exists(localFile));
        }

        @Test
        @DisplayName("Body without bucket is 400")
        void testSetup_NoBucket() throws Exception {
            HttpResponse<String> response = send("POST", "/setup", "{\"name\":\"b\"}");

            assertEquals(400, response.statusCode());
            assertEquals("INVALID_INPUT", json(response).get("error").asText());
        }

        @Test
        @DisplayName("Blank bucket is 400")
        void testSetup_BlankBucket() throws Exception {
            assertEquals(400, send("POST", "/setup", "{\"bucket\":\"  \"}").statusCode());
        }

        @Test
        @DisplayName("Malformed, empty and non-object bodies are 400")
        void testSetup_BadBodies() throws Exception {
            assertEquals(400, send("POST", "/setup", "{\"bucket\":").statusCode());
            assertEquals(400, send("POST", "/setup", null).statusCode());
            assertEquals(400, send("POST", "/setup", "[\"b\"]").statusCode());
        }

        @Test
        @DisplayName("GET on setup is 405")
        void testSetup_WrongMethod() throws Exception {
            HttpResponse<String> response = send("GET", "/setup", null);

            assertEquals(405, response.statusCode());
            assertEquals("POST", response.headers().firstValue("Allow").orElse(""));
        }
    }

    // ========================================================================
    // Notes
    // ========================================================================

    @Nested
    @DisplayName("Notes route")
    class NotesRoute {

        @Test
        @DisplayName("Operations before setup are 403 SETUP_REQUIRED")
        void testNotes_BeforeSetup() throws Exception {
            HttpResponse<String> add = send("POST", "/notes", "{\"title\":\"t\",\"content\":\"c\"}");
            HttpResponse<String> delete = send("DELETE", "/notes?id=0", null);

            assertEquals(403, add.statusCode());
            assertEquals("SETUP_REQUIRED", json(add).get("error").asText());
            assertEquals(403, delete.statusCode());
        }

        @Test
        @DisplayName("Add, list, get, delete, get again")
        void testNotes_Lifecycle() throws Exception {
            send("POST", "/setup", "{\"bucket\":\"b\"}");

            HttpResponse<String> added = send("POST", "/notes", "{\"title\":\"Title\",\"content\":\"Body\"}");
            assertEquals(200, added.statusCode());
            assertEquals(0, json(added).get("id").asLong());

            JsonNode all = json(send("GET", "/notes", null));
            assertEquals(1, all.get("notes").size());
            assertFalse(all.get("notes").has("_meta"));
            assertEquals("Title", all.get("notes").get("0").get("title").asText());

            JsonNode one = json(send("GET", "/notes?id=0", null));
            assertEquals("Title", one.get("notes").get("title").asText());
            assertEquals("Body", one.get("notes").get("content").asText());

            HttpResponse<String> deleted = send("DELETE", "/notes?id=0", null);
            assertEquals(200, deleted.statusCode());
            assertEquals(0, json(deleted).get("id").asLong());

            HttpResponse<String> gone = send("GET", "/notes?id=0", null);
            assertEquals(404, gone.statusCode());
            assertEquals("NOT_FOUND", json(gone).get("error").asText());
        }

        @Test
        @DisplayName("Invalid note input is 400")
        void testNotes_Validation() throws Exception {
            send("POST", "/setup", "{\"bucket\":\"b\"}");

            assertEquals(400, send("POST", "/notes", "{\"title\":\"\",\"content\":\"x\"}").statusCode());
            assertEquals(400, send("POST", "/notes", "{\"title\":\"x\",\"content\":5}").statusCode());
            assertEquals(400, send("POST", "/notes", "not json").statusCode());
            assertEquals(400, send("GET", "/notes?id=-1", null).statusCode());
            assertEquals(400, send("GET", "/notes?id=abc", null).statusCode());
            assertEquals(400, send("DELETE", "/notes", null).statusCode());
        }

        @Test
        @DisplayName("Deleting an unknown id succeeds")
        void testNotes_DeleteUnknown() throws Exception {
            send("POST", "/setup", "{\"bucket\":\"b\"}");

            assertEquals(200, send("DELETE", "/notes?id=42", null).statusCode());
            assertEquals(200, send("DELETE", "/notes?id=42", null).statusCode());
        }

        @Test
        @DisplayName("Unsupported method is 405")
        void testNotes_WrongMethod() throws Exception {
            assertEquals(405, send("PUT", "/notes", "{}").statusCode());
        }

        @Test
        @DisplayName("Unknown sub-path is 404")
        void testNotes_UnknownPath() throws Exception {
            assertEquals(404, send("GET", "/notes/0", null).statusCode());
        }
    }

    @Test
    @DisplayName("Query strings are decoded and the first value wins")
    void testParseQuery() {
        Map<String, String> params = NoteVaultServer.parseQuery("id=1&id=2&name=a%20b&flag");

        assertEquals("1", params.get("id"));
        assertEquals("a b", params.get("name"));
        assertEquals("", params.get("flag"));
        assertTrue(NoteVaultServer.parseQuery(null).isEmpty());
    }
}
