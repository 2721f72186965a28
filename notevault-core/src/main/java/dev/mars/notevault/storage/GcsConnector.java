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

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.google.cloud.storage.StorageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link RemoteConnector} for Google Cloud Storage.
 * <p>
 * The client is created lazily on the first {@link #connect(String)} and reused
 * afterwards. Credentials come from Application Default Credentials; a failure to
 * build the client is reported as {@link BackendFailure#SERVER_ERROR}.
 */
public final class GcsConnector implements RemoteConnector {

    private static final Logger LOG = LoggerFactory.getLogger(GcsConnector.class);

    private final Supplier<Storage> storageFactory;
    private final String blobName;
    private Storage storage;

    /**
     * @param storageFactory creates the client; called at most once successfully
     * @param blobName       name of the note object inside the bucket
     */
    public GcsConnector(Supplier<Storage> storageFactory, String blobName) {
        this.storageFactory = Objects.requireNonNull(storageFactory, "storageFactory");
        this.blobName = Objects.requireNonNull(blobName, "blobName");
    }

    /**
     * Connector using the project and object name from {@code config}.
     */
    public static GcsConnector fromConfig(NoteVaultConfig config) {
        return new GcsConnector(() -> {
            StorageOptions.Builder options = StorageOptions.newBuilder();
            config.projectId().ifPresent(options::setProjectId);
            return options.build().getService();
        }, config.blobName());
    }

    @Override
    public synchronized StorageBackend connect(String bucketName) throws BackendException {
        Storage client = client();
        try {
            if (client.get(bucketName) == null) {
                LOG.warn("Bucket not found: {}", bucketName);
                throw new BackendException(BackendFailure.NOT_FOUND, "Bucket not found: " + bucketName);
            }
        } catch (StorageException e) {
            throw GcsBackend.classify("look up bucket " + bucketName, e);
        }
        GcsBackend backend = new GcsBackend(client, BlobId.of(bucketName, blobName));
        LOG.info("Connected to remote document {}", backend.describe());
        return backend;
    }

    private Storage client() throws BackendException {
        if (storage == null) {
            try {
                storage = storageFactory.get();
                LOG.debug("Cloud storage client created");
            } catch (RuntimeException e) {
                LOG.error("Failed to create cloud storage client: {}", e.getMessage(), e);
                throw new BackendException(BackendFailure.SERVER_ERROR,
                        "Failed to create cloud storage client: " + e.getMessage(), e);
            }
        }
        return storage;
    }
}
