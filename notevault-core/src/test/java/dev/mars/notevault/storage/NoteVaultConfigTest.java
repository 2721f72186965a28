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

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NoteVaultConfig resolution: system properties, defaults, and builder overrides.
 */
class NoteVaultConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("notevault.localFile");
        System.clearProperty("notevault.blobName");
        System.clearProperty("notevault.projectId");
        System.clearProperty("notevault.syncEnabled");
        System.clearProperty("notevault.minFreeSpaceMb");
        System.clearProperty("notevault.port");
        System.clearProperty("notevault.apiKey");
        System.clearProperty("notevault.apiKeyHeader");
    }

    // ========================================================================
    // System Property Resolution Tests
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property localFile is respected")
        void testLocalFileSystemProperty() {
            Path custom = tempDir.resolve("custom.json");
            System.setProperty("notevault.localFile", custom.toString());

            NoteVaultConfig config = NoteVaultConfig.builder().build();
            assertEquals(custom, config.localFile());
        }

        @Test
        @DisplayName("System property blobName is respected")
        void testBlobNameSystemProperty() {
            System.setProperty("notevault.blobName", "team/notes.json");

            assertEquals("team/notes.json", NoteVaultConfig.load().blobName());
        }

        @Test
        @DisplayName("System property syncEnabled=false is respected")
        void testSyncEnabledSystemPropertyFalse() {
            System.setProperty("notevault.syncEnabled", "false");

            assertFalse(NoteVaultConfig.builder().build().syncEnabled());
        }

        @Test
        @DisplayName("System property port is respected")
        void testPortSystemProperty() {
            System.setProperty("notevault.port", "8081");

            assertEquals(8081, NoteVaultConfig.builder().build().port());
        }

        @Test
        @DisplayName("System property apiKey is trimmed")
        void testApiKeySystemProperty() {
            System.setProperty("notevault.apiKey", "  secret  ");

            assertEquals("secret", NoteVaultConfig.builder().build().apiKey().orElseThrow());
        }

        @Test
        @DisplayName("Invalid integer system property falls back to default")
        void testInvalidIntSystemProperty() {
            System.setProperty("notevault.minFreeSpaceMb", "not-a-number");
            System.setProperty("notevault.port", "80x");

            NoteVaultConfig config = NoteVaultConfig.builder().build();
            assertEquals(1, config.minFreeSpaceMb());
            assertEquals(5000, config.port());
        }

        @Test
        @DisplayName("Blank system property falls back to default")
        void testBlankSystemProperty() {
            System.setProperty("notevault.blobName", "   ");

            assertEquals("notes.json", NoteVaultConfig.builder().build().blobName());
        }
    }

    // ========================================================================
    // Defaults and Builder Tests
    // ========================================================================

    @Nested
    @DisplayName("Defaults and Builder")
    class BuilderTests {

        @Test
        @DisplayName("Defaults are applied when nothing is configured")
        void testDefaults() {
            NoteVaultConfig config = NoteVaultConfig.builder().build();

            assertEquals("notes.json", config.blobName());
            assertTrue(config.syncEnabled());
            assertEquals(1, config.minFreeSpaceMb());
            assertEquals(1024L * 1024, config.minFreeSpaceBytes());
            assertEquals("X-API-Key", config.apiKeyHeader());
        }

        @Test
        @DisplayName("Builder values take priority over system properties")
        void testBuilderOverridesSystemProperty() {
            System.setProperty("notevault.blobName", "from-property.json");
            System.setProperty("notevault.port", "9000");
            Path file = tempDir.resolve("notes.json");

            NoteVaultConfig config = NoteVaultConfig.builder()
                    .localFile(file)
                    .blobName("from-builder.json")
                    .port(0)
                    .syncEnabled(false)
                    .minFreeSpaceMb(0)
                    .apiKeyHeader("X-Token")
                    .build();

            assertEquals(file, config.localFile());
            assertEquals("from-builder.json", config.blobName());
            assertEquals(0, config.port());
            assertFalse(config.syncEnabled());
            assertEquals(0L, config.minFreeSpaceBytes());
            assertEquals("X-Token", config.apiKeyHeader());
        }

        @Test
        @DisplayName("String localFile is converted to a path")
        void testLocalFileFromString() {
            NoteVaultConfig config = NoteVaultConfig.builder().localFile("data/notes.json").build();

            assertEquals(Path.of("data/notes.json"), config.localFile());
        }

        @Test
        @DisplayName("toString masks the API key")
        void testToStringMasksApiKey() {
            NoteVaultConfig config = NoteVaultConfig.builder().apiKey("super-secret").build();

            String text = config.toString();
            assertFalse(text.contains("super-secret"));
            assertTrue(text.contains("apiKey=****"));
        }
    }
}
