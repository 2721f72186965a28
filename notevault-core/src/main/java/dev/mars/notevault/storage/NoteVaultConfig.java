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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for the note service.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dnotevault.localFile=/path})</li>
 *   <li>Environment variables (e.g., {@code NOTEVAULT_LOCAL_FILE})</li>
 *   <li>Properties file ({@code notevault.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>localFile</td><td>notevault.localFile</td><td>NOTEVAULT_LOCAL_FILE, LOCAL</td><td>local_notes.json</td></tr>
 *   <tr><td>blobName</td><td>notevault.blobName</td><td>NOTEVAULT_BLOB_NAME</td><td>notes.json</td></tr>
 *   <tr><td>projectId</td><td>notevault.projectId</td><td>NOTEVAULT_PROJECT_ID</td><td>(client default)</td></tr>
 *   <tr><td>syncEnabled</td><td>notevault.syncEnabled</td><td>NOTEVAULT_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>notevault.minFreeSpaceMb</td><td>NOTEVAULT_MIN_FREE_SPACE_MB</td><td>1</td></tr>
 *   <tr><td>port</td><td>notevault.port</td><td>NOTEVAULT_PORT</td><td>5000</td></tr>
 *   <tr><td>apiKey</td><td>notevault.apiKey</td><td>NOTEVAULT_API_KEY</td><td>(none, auth disabled)</td></tr>
 *   <tr><td>apiKeyHeader</td><td>notevault.apiKeyHeader</td><td>NOTEVAULT_API_KEY_HEADER</td><td>X-API-Key</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # notevault.properties
 * notevault.localFile=/var/lib/notevault/local_notes.json
 * notevault.blobName=notes.json
 * notevault.apiKey=change-me
 * notevault.port=5000
 * </pre>
 */
public final class NoteVaultConfig {

    private static final Logger LOG = LoggerFactory.getLogger(NoteVaultConfig.class);

    private static final String PROPERTIES_FILE = "notevault.properties";

    // Property keys
    private static final String PROP_LOCAL_FILE = "notevault.localFile";
    private static final String PROP_BLOB_NAME = "notevault.blobName";
    private static final String PROP_PROJECT_ID = "notevault.projectId";
    private static final String PROP_SYNC_ENABLED = "notevault.syncEnabled";
    private static final String PROP_MIN_FREE_SPACE_MB = "notevault.minFreeSpaceMb";
    private static final String PROP_PORT = "notevault.port";
    private static final String PROP_API_KEY = "notevault.apiKey";
    private static final String PROP_API_KEY_HEADER = "notevault.apiKeyHeader";

    // Environment variable keys
    private static final String ENV_LOCAL_FILE = "NOTEVAULT_LOCAL_FILE";
    private static final String ENV_LOCAL_FILE_LEGACY = "LOCAL";
    private static final String ENV_BLOB_NAME = "NOTEVAULT_BLOB_NAME";
    private static final String ENV_PROJECT_ID = "NOTEVAULT_PROJECT_ID";
    private static final String ENV_SYNC_ENABLED = "NOTEVAULT_SYNC_ENABLED";
    private static final String ENV_MIN_FREE_SPACE_MB = "NOTEVAULT_MIN_FREE_SPACE_MB";
    private static final String ENV_PORT = "NOTEVAULT_PORT";
    private static final String ENV_API_KEY = "NOTEVAULT_API_KEY";
    private static final String ENV_API_KEY_HEADER = "NOTEVAULT_API_KEY_HEADER";

    // Defaults
    private static final String DEFAULT_LOCAL_FILE = "local_notes.json";
    private static final String DEFAULT_BLOB_NAME = "notes.json";
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 1;
    private static final int DEFAULT_PORT = 5000;
    private static final String DEFAULT_API_KEY_HEADER = "X-API-Key";

    private final Path localFile;
    private final String blobName;
    private final String projectId;
    private final boolean syncEnabled;
    private final int minFreeSpaceMb;
    private final int port;
    private final String apiKey;
    private final String apiKeyHeader;

    private NoteVaultConfig(Builder builder) {
        this.localFile = builder.localFile;
        this.blobName = builder.blobName;
        this.projectId = builder.projectId;
        this.syncEnabled = builder.syncEnabled;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.port = builder.port;
        this.apiKey = builder.apiKey;
        this.apiKeyHeader = builder.apiKeyHeader;
    }

    /** Path of the local fallback document. */
    public Path localFile() {
        return localFile;
    }

    /** Object name of the document inside the bucket. */
    public String blobName() {
        return blobName;
    }

    /** Cloud project for the storage client; empty to use the client default. */
    public Optional<String> projectId() {
        return Optional.ofNullable(projectId);
    }

    /** Whether fsync is enabled for local writes (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Minimum free disk space in MB required before local writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** HTTP listen port; 0 picks an ephemeral port. */
    public int port() {
        return port;
    }

    /** Shared secret expected in {@link #apiKeyHeader()}; empty disables the check. */
    public Optional<String> apiKey() {
        return Optional.ofNullable(apiKey);
    }

    /** Request header carrying the API key. */
    public String apiKeyHeader() {
        return apiKeyHeader;
    }

    @Override
    public String toString() {
        return "NoteVaultConfig{" +
                "localFile=" + localFile +
                ", blobName=" + blobName +
                ", projectId=" + (projectId == null ? "(default)" : projectId) +
                ", syncEnabled=" + syncEnabled +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", port=" + port +
                ", apiKey=" + (apiKey == null ? "(none)" : "****") +
                ", apiKeyHeader=" + apiKeyHeader +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code NoteVaultConfig.builder().build()}.
     */
    public static NoteVaultConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link NoteVaultConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path localFile;
        private String blobName;
        private String projectId;
        private Boolean syncEnabled;
        private Integer minFreeSpaceMb;
        private Integer port;
        private String apiKey;
        private String apiKeyHeader;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        public Builder localFile(Path localFile) {
            this.localFile = localFile;
            return this;
        }

        public Builder localFile(String localFile) {
            this.localFile = Path.of(localFile);
            return this;
        }

        public Builder blobName(String blobName) {
            this.blobName = blobName;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 1). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder apiKeyHeader(String apiKeyHeader) {
            this.apiKeyHeader = apiKeyHeader;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public NoteVaultConfig build() {
            if (localFile == null) {
                localFile = Path.of(resolveString(PROP_LOCAL_FILE, DEFAULT_LOCAL_FILE,
                        ENV_LOCAL_FILE, ENV_LOCAL_FILE_LEGACY));
            }
            if (blobName == null || blobName.isBlank()) {
                blobName = resolveString(PROP_BLOB_NAME, DEFAULT_BLOB_NAME, ENV_BLOB_NAME);
            }
            if (projectId == null || projectId.isBlank()) {
                projectId = resolveString(PROP_PROJECT_ID, null, ENV_PROJECT_ID);
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (port == null) {
                port = resolveInt(PROP_PORT, ENV_PORT, DEFAULT_PORT);
            }
            if (apiKey == null || apiKey.isBlank()) {
                apiKey = resolveString(PROP_API_KEY, null, ENV_API_KEY);
            }
            if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
                apiKeyHeader = resolveString(PROP_API_KEY_HEADER, DEFAULT_API_KEY_HEADER, ENV_API_KEY_HEADER);
            }

            return new NoteVaultConfig(this);
        }

        /**
         * Resolves a string: system property, then each env var in order, then the
         * properties file, then {@code defaultValue}.
         */
        private String resolveString(String sysProp, String defaultValue, String... envVars) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }

            for (String envVar : envVars) {
                value = System.getenv(envVar);
                if (value != null && !value.isBlank()) {
                    return value.strip();
                }
            }

            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }

            return defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = resolveString(sysProp, null, envVar);
            return value == null ? defaultValue : Boolean.parseBoolean(value);
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolveString(sysProp, null, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                LOG.warn("Invalid integer '{}' for {}, using default {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Classpath first
            try (InputStream is = NoteVaultConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Then working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
