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
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link StorageBackend} backed by a single object in a Google Cloud Storage bucket.
 * <p>
 * {@link #fetch()} downloads the whole object and {@link #overwrite(byte[])} uploads a
 * full replacement; there is no generation precondition, so concurrent writers from
 * other processes can overwrite each other.
 * <p>
 * Client failures are classified by HTTP status:
 * <ul>
 *   <li>404 - {@link BackendFailure#NOT_FOUND}</li>
 *   <li>401, 403 - {@link BackendFailure#PERMISSION_DENIED}</li>
 *   <li>anything else - {@link BackendFailure#SERVER_ERROR}</li>
 * </ul>
 */
public final class GcsBackend implements StorageBackend {

    private static final Logger LOG = LoggerFactory.getLogger(GcsBackend.class);

    static final String CONTENT_TYPE = "application/json";
    static final byte[] EMPTY_DOCUMENT = "{}".getBytes(StandardCharsets.UTF_8);

    private final Storage storage;
    private final BlobId blobId;

    public GcsBackend(Storage storage, BlobId blobId) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.blobId = Objects.requireNonNull(blobId, "blobId");
    }

    public BlobId blobId() {
        return blobId;
    }

    @Override
    public void ensureExists() throws BackendException {
        try {
            if (storage.get(blobId) != null) {
                LOG.debug("Remote document exists: {}", describe());
                return;
            }
            storage.create(blobInfo(), EMPTY_DOCUMENT);
            LOG.info("Created empty remote document: {}", describe());
        } catch (StorageException e) {
            throw classify("ensure remote document " + describe(), e);
        }
    }

    @Override
    public byte[] fetch() throws BackendException {
        try {
            byte[] content = storage.readAllBytes(blobId);
            LOG.debug("Downloaded {} bytes from {}", content.length, describe());
            return content;
        } catch (StorageException e) {
            if (e.getCode() == 404 && bucketExists()) {
                LOG.debug("Remote document {} does not exist yet, treating as empty", describe());
                return new byte[0];
            }
            throw classify("download " + describe(), e);
        }
    }

    @Override
    public void overwrite(byte[] content) throws BackendException {
        try {
            storage.create(blobInfo(), content);
            LOG.debug("Uploaded {} bytes to {}", content.length, describe());
        } catch (StorageException e) {
            throw classify("upload " + describe(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public DocumentLayout layout() {
        return DocumentLayout.COMPACT;
    }

    @Override
    public String describe() {
        return "gs://" + blobId.getBucket() + "/" + blobId.getName();
    }

    @Override
    public String toString() {
        return "GcsBackend{" + describe() + '}';
    }

    private BlobInfo blobInfo() {
        return BlobInfo.newBuilder(blobId).setContentType(CONTENT_TYPE).build();
    }

    private boolean bucketExists() throws BackendException {
        try {
            return storage.get(blobId.getBucket()) != null;
        } catch (StorageException e) {
            throw classify("look up bucket " + blobId.getBucket(), e);
        }
    }

    /**
     * Maps a client exception onto a {@link BackendException} of the matching kind.
     */
    static BackendException classify(String action, StorageException e) {
        BackendFailure failure = switch (e.getCode()) {
            case 404 -> BackendFailure.NOT_FOUND;
            case 401, 403 -> BackendFailure.PERMISSION_DENIED;
            default -> BackendFailure.SERVER_ERROR;
        };
        LOG.warn("Failed to {}: {} (code={}, classified as {})", action, e.getMessage(), e.getCode(), failure);
        return new BackendException(failure, "Failed to " + action + ": " + e.getMessage(), e);
    }
}
