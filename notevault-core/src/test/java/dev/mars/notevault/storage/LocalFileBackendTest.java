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
package dev.mars.notevault.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LocalFileBackend}.
 */
class LocalFileBackendTest {

    @TempDir
    Path tempDir;

    private Path file;
    private LocalFileBackend backend;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("notes").resolve("local_notes.json");
        backend = new LocalFileBackend(file, true, 0);
    }

    @Test
    void testFetch_CreatesMissingFileAndReturnsEmpty() throws Exception {
        assertFalse(backend.isAvailable());

        byte[] content = backend.fetch();

        assertEquals(0, content.length);
        assertTrue(Files.isRegularFile(file));
        assertTrue(backend.isAvailable());
    }

    @Test
    void testEnsureExists_KeepsExistingContent() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"0\":{}}");

        backend.ensureExists();

        assertEquals("{\"0\":{}}", Files.readString(file));
    }

    @Test
    void testOverwrite_ReplacesWholeFile() throws Exception {
        backend.overwrite("a much longer first document".getBytes(StandardCharsets.UTF_8));
        backend.overwrite("short".getBytes(StandardCharsets.UTF_8));

        assertEquals("short", new String(backend.fetch(), StandardCharsets.UTF_8));
    }

    @Test
    void testOverwrite_LeavesNoTempFile() throws Exception {
        backend.overwrite("{}".getBytes(StandardCharsets.UTF_8));

        assertFalse(Files.exists(file.resolveSibling("local_notes.json.tmp")));
    }

    @Test
    void testOverwrite_WithoutSync() throws Exception {
        LocalFileBackend unsynced = new LocalFileBackend(file, false, 0);

        unsynced.overwrite("{}".getBytes(StandardCharsets.UTF_8));

        assertEquals("{}", Files.readString(file));
    }

    @Test
    void testOverwrite_InsufficientDiskSpaceFailsWithIo() {
        LocalFileBackend greedy = new LocalFileBackend(file, true, Long.MAX_VALUE / 2);

        BackendException e = assertThrows(BackendException.class,
                () -> greedy.overwrite("{}".getBytes(StandardCharsets.UTF_8)));

        assertEquals(BackendFailure.IO, e.failure());
        assertFalse(Files.exists(file));
    }

    @Test
    void testFetch_PathIsDirectoryFailsWithIo() throws Exception {
        Files.createDirectories(file);

        BackendException e = assertThrows(BackendException.class, backend::fetch);

        assertEquals(BackendFailure.IO, e.failure());
        assertFalse(backend.isAvailable());
    }

    @Test
    void testLayoutAndDescription() {
        assertEquals(DocumentLayout.INDENTED, backend.layout());
        assertTrue(backend.describe().endsWith("local_notes.json"));
        assertEquals(file.toAbsolutePath(), backend.file());
    }

    @Test
    void testConfigConstructor() {
        NoteVaultConfig config = NoteVaultConfig.builder()
                .localFile(file)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build();

        LocalFileBackend fromConfig = new LocalFileBackend(config);

        assertEquals(file.toAbsolutePath(), fromConfig.file());
    }
}
