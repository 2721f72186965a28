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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The note store: picks the authoritative backend, owns the id allocator, and runs
 * every note operation as one full read-modify-write of the document.
 * <p>
 * <b>Lifecycle:</b>
 * <pre>
 * UNINITIALIZED --setup(ok)--------------------&gt; ONLINE   (remote object)
 *               --setup(remote unusable)-------&gt; OFFLINE  (local file, degraded success)
 * </pre>
 * Every successful transition reloads the allocator from the active backend's
 * {@code _meta} entry (writing a zeroed one first if it is missing). A transition
 * whose metadata bootstrap fails is not applied.
 * <p>
 * <b>Consistency:</b>
 * <ul>
 *   <li>Notes and {@code _meta} are always written together in a single
 *       {@link StorageBackend#overwrite(byte[])}.</li>
 *   <li>Mutations run on a copy of the allocator which replaces the live one only
 *       after the write succeeds, so in-memory state never runs ahead of storage.</li>
 *   <li>All operations hold one lock for their whole read-modify-write cycle. This
 *       removes races within the process only; writers in other processes can still
 *       overwrite each other on the remote object.</li>
 * </ul>
 * <p>
 * No method throws for storage problems; outcomes are reported as {@link NoteResult}.
 */
public final class NoteSession {

    private static final Logger LOG = LoggerFactory.getLogger(NoteSession.class);

    private final RemoteConnector remoteConnector;
    private final StorageBackend localBackend;
    private final DocumentCodec codec;
    private final ReentrantLock lock = new ReentrantLock();

    private StorageMode mode = StorageMode.UNINITIALIZED;
    private StorageBackend active;
    private String bucketName;
    private IdAllocator allocator = new IdAllocator();

    /**
     * Creates a session using Google Cloud Storage and the configured local file.
     */
    public NoteSession(NoteVaultConfig config) {
        this(GcsConnector.fromConfig(config), new LocalFileBackend(config));
    }

    public NoteSession(RemoteConnector remoteConnector, StorageBackend localBackend) {
        this(remoteConnector, localBackend, new DocumentCodec());
    }

    public NoteSession(RemoteConnector remoteConnector, StorageBackend localBackend, DocumentCodec codec) {
        this.remoteConnector = Objects.requireNonNull(remoteConnector, "remoteConnector");
        this.localBackend = Objects.requireNonNull(localBackend, "localBackend");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    // ========================================================================
    // Setup / Health
    // ========================================================================

    /**
     * Selects the authoritative backend.
     * <p>
     * Tries the remote bucket first. If it is missing, forbidden or failing, the
     * session switches to the local file and reports a degraded success
     * ({@link ErrorKind#NOT_FOUND_USE_LOCAL}, {@link ErrorKind#PERMISSION_DENIED_USE_LOCAL}
     * or {@link ErrorKind#SERVER_ERROR_USE_LOCAL}). A blank name fails with
     * {@link ErrorKind#INVALID_INPUT} and leaves the state untouched.
     *
     * @param bucket the bucket name
     * @return the resulting mode
     */
    public NoteResult<StorageMode> setup(String bucket) {
        if (!isPresent(bucket)) {
            LOG.info("Setup rejected: bucket name is missing or blank");
            return NoteResult.failure(ErrorKind.INVALID_INPUT, "Bucket name must be a non-empty string");
        }
        String name = bucket.strip();

        lock.lock();
        try {
            LOG.info("Setting up storage for bucket '{}'", name);
            StorageBackend remote;
            try {
                remote = remoteConnector.connect(name);
                remote.ensureExists();
                activate(StorageMode.ONLINE, remote, name);
            } catch (BackendException e) {
                return fallBackToLocal(e.failure(), e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure while connecting to bucket '{}'", name, e);
                return fallBackToLocal(BackendFailure.SERVER_ERROR, e.getMessage());
            }

            LOG.info("Storage ONLINE: {} ({})", remote.describe(), allocator);
            return NoteResult.ok(StorageMode.ONLINE);
        } finally {
            lock.unlock();
        }
    }

    private NoteResult<StorageMode> fallBackToLocal(BackendFailure failure, String reason) {
        ErrorKind kind = switch (failure) {
            case NOT_FOUND -> ErrorKind.NOT_FOUND_USE_LOCAL;
            case PERMISSION_DENIED -> ErrorKind.PERMISSION_DENIED_USE_LOCAL;
            case SERVER_ERROR, IO -> ErrorKind.SERVER_ERROR_USE_LOCAL;
        };
        LOG.warn("Remote storage unavailable ({}): {}. Falling back to {}", kind, reason, localBackend.describe());

        try {
            localBackend.ensureExists();
            activate(StorageMode.OFFLINE, localBackend, null);
        } catch (BackendException e) {
            LOG.error("Local fallback {} is unusable: {}", localBackend.describe(), e.getMessage());
            return NoteResult.failure(ErrorKind.SERVER_ERROR,
                    "Remote storage unavailable and local storage failed: " + e.getMessage());
        }

        LOG.info("Storage OFFLINE: {} ({})", localBackend.describe(), allocator);
        return NoteResult.degraded(StorageMode.OFFLINE, kind, messageFor(kind));
    }

    /**
     * Loads metadata from {@code backend}, then makes it the active backend. If the
     * metadata bootstrap fails, the previous state is kept.
     */
    private void activate(StorageMode newMode, StorageBackend backend, String bucket) throws BackendException {
        IdAllocator loaded = ensureMeta(backend);
        this.mode = newMode;
        this.active = backend;
        this.bucketName = bucket;
        this.allocator = loaded;
    }

    /**
     * Reads {@code _meta} from {@code backend}, writing a zeroed entry first if the
     * document has none.
     *
     * @return an allocator holding the persisted state
     */
    private IdAllocator ensureMeta(StorageBackend backend) throws BackendException {
        NoteDocument document = load(backend);
        Optional<DocumentMeta> meta = document.meta();
        if (meta.isPresent()) {
            LOG.debug("Loaded metadata from {}: {}", backend.describe(), meta.get());
            return new IdAllocator(meta.get());
        }

        document.setMeta(DocumentMeta.EMPTY);
        write(backend, document);
        LOG.info("Initialized metadata in {}", backend.describe());
        return new IdAllocator();
    }

    /**
     * Liveness probe. Never fails; reports whether note operations can run.
     */
    public HealthStatus healthCheck() {
        lock.lock();
        try {
            if (isReady()) {
                return new HealthStatus(true, mode, "Server is responding. Setup has been run.");
            }
            return new HealthStatus(false, mode, "Server is responding. Setup has not been run.");
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Note Operations
    // ========================================================================

    /**
     * Adds a note under the next id from the allocator.
     *
     * @return the assigned id
     */
    public NoteResult<Long> add(String title, String content) {
        if (!isPresent(title)) {
            LOG.info("Add rejected: title is missing or blank");
            return NoteResult.failure(ErrorKind.INVALID_INPUT, "Title must be a non-empty string");
        }
        if (!isPresent(content)) {
            LOG.info("Add rejected: content is missing or blank");
            return NoteResult.failure(ErrorKind.INVALID_INPUT, "Content must be a non-empty string");
        }

        lock.lock();
        try {
            if (!isReady()) {
                return setupRequired();
            }
            NoteDocument document = load(active);
            IdAllocator working = allocator.copy();
            long id;
            try {
                id = nextFreeId(working, document);
            } catch (IllegalStateException e) {
                LOG.error("Cannot add note: {}", e.getMessage());
                return NoteResult.failure(ErrorKind.SERVER_ERROR, e.getMessage());
            }
            document.put(new Note(id, title, content));
            write(active, document, working);
            allocator = working;

            LOG.info("Added note {}", id);
            return NoteResult.ok(id);
        } catch (BackendException e) {
            return operationFailure("add note", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every note, without the metadata entry.
     */
    public NoteResult<Map<Long, Note>> getAll() {
        lock.lock();
        try {
            if (!isReady()) {
                return setupRequired();
            }
            NoteDocument document = load(active);
            LOG.debug("Listed {} notes", document.size());
            return NoteResult.ok(document.notes());
        } catch (BackendException e) {
            return operationFailure("list notes", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns one note.
     *
     * @param rawId decimal id as supplied by the caller
     */
    public NoteResult<Note> get(String rawId) {
        lock.lock();
        try {
            if (!isReady()) {
                return setupRequired();
            }
            OptionalLong id = IdParser.parse(rawId);
            if (id.isEmpty()) {
                return invalidId(rawId);
            }
            NoteDocument document = load(active);
            Optional<Note> note = document.get(id.getAsLong());
            if (note.isEmpty()) {
                LOG.info("Note {} not found", id.getAsLong());
                return NoteResult.failure(ErrorKind.NOT_FOUND, "Note " + id.getAsLong() + " does not exist");
            }
            LOG.debug("Fetched note {}", id.getAsLong());
            return NoteResult.ok(note.get());
        } catch (BackendException e) {
            return operationFailure("get note", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes a note and recycles its id. Deleting an id that does not exist succeeds
     * without writing anything.
     *
     * @param rawId decimal id as supplied by the caller
     * @return the parsed id
     */
    public NoteResult<Long> delete(String rawId) {
        lock.lock();
        try {
            if (!isReady()) {
                return setupRequired();
            }
            OptionalLong parsed = IdParser.parse(rawId);
            if (parsed.isEmpty()) {
                return invalidId(rawId);
            }
            long id = parsed.getAsLong();

            NoteDocument document = load(active);
            if (document.remove(id).isEmpty()) {
                LOG.info("Note {} not present, nothing to delete", id);
                return NoteResult.ok(id);
            }
            IdAllocator working = allocator.copy();
            working.release(id);
            write(active, document, working);
            allocator = working;

            LOG.info("Deleted note {}", id);
            return NoteResult.ok(id);
        } catch (BackendException e) {
            return operationFailure("delete note", e);
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public StorageMode mode() {
        lock.lock();
        try {
            return mode;
        } finally {
            lock.unlock();
        }
    }

    /** Bound bucket while {@link StorageMode#ONLINE}. */
    public Optional<String> bucketName() {
        lock.lock();
        try {
            return Optional.ofNullable(bucketName);
        } finally {
            lock.unlock();
        }
    }

    /** In-memory allocator state; equals the last persisted {@code _meta}. */
    public DocumentMeta allocatorState() {
        lock.lock();
        try {
            return allocator.snapshot();
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private boolean isReady() {
        if (mode == StorageMode.UNINITIALIZED || active == null) {
            return false;
        }
        return active.isAvailable();
    }

    private NoteDocument load(StorageBackend backend) throws BackendException {
        return codec.decode(backend.fetch());
    }

    private void write(StorageBackend backend, NoteDocument document) throws BackendException {
        backend.overwrite(codec.encode(document, backend.layout()));
    }

    private void write(StorageBackend backend, NoteDocument document, IdAllocator working) throws BackendException {
        document.setMeta(working.snapshot());
        write(backend, document);
    }

    /**
     * Allocates from {@code working}, skipping ids already taken in the document. Only
     * happens when a document without {@code _meta} already held notes.
     */
    private long nextFreeId(IdAllocator working, NoteDocument document) {
        long id = working.allocate();
        while (document.contains(id)) {
            LOG.warn("Allocated id {} is already in use, skipping", id);
            id = working.allocate();
        }
        return id;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static <T> NoteResult<T> setupRequired() {
        LOG.info("Operation rejected: setup has not been run");
        return NoteResult.failure(ErrorKind.SETUP_REQUIRED, "Storage is not set up. Call setup first.");
    }

    private static <T> NoteResult<T> invalidId(String rawId) {
        LOG.info("Operation rejected: invalid id '{}'", rawId);
        return NoteResult.failure(ErrorKind.INVALID_INPUT, "Id must be a non-negative integer");
    }

    private <T> NoteResult<T> operationFailure(String action, BackendException e) {
        LOG.error("Failed to {} on {}: {}", action, active.describe(), e.getMessage(), e);
        ErrorKind kind = e.failure() == BackendFailure.PERMISSION_DENIED
                ? ErrorKind.PERMISSION_DENIED
                : ErrorKind.SERVER_ERROR;
        return NoteResult.failure(kind, "Failed to " + action + ": " + e.getMessage());
    }

    private static String messageFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND_USE_LOCAL -> "Bucket not found. Using local storage.";
            case PERMISSION_DENIED_USE_LOCAL -> "Permission denied for bucket. Using local storage.";
            case SERVER_ERROR_USE_LOCAL -> "Cloud storage unavailable. Using local storage.";
            default -> kind.name();
        };
    }
}
