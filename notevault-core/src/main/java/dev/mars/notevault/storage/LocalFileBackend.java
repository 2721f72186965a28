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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * {@link StorageBackend} backed by a single JSON file on local disk.
 * <p>
 * <b>Files:</b>
 * <pre>
 * local_notes.json       // the document, indented
 * local_notes.json.tmp   // transient, only during overwrite
 * </pre>
 * <p>
 * <b>Durability:</b> {@link #overwrite(byte[])} writes a sibling temp file, fsyncs it,
 * then atomically renames it over the document, so a crash leaves either the old or
 * the new document, never a torn one. A free-space check runs before each write.
 * <p>
 * All failures are reported as {@link BackendFailure#IO}.
 */
public final class LocalFileBackend implements StorageBackend {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFileBackend.class);

    private static final String TMP_SUFFIX = ".tmp";

    private final Path file;
    private final boolean syncEnabled;
    private final long minFreeSpace;

    /**
     * Creates a backend for the local file named in {@code config}.
     */
    public LocalFileBackend(NoteVaultConfig config) {
        this(config.localFile(), config.syncEnabled(), config.minFreeSpaceBytes());
    }

    /**
     * @param file          the document file
     * @param syncEnabled   if false, fsync is skipped (tests only)
     * @param minFreeSpace  bytes that must remain free before a write is attempted
     */
    public LocalFileBackend(Path file, boolean syncEnabled, long minFreeSpace) {
        this.file = file.toAbsolutePath();
        this.syncEnabled = syncEnabled;
        this.minFreeSpace = minFreeSpace;

        LOG.debug("LocalFileBackend initialized: file={}, syncEnabled={}", this.file, syncEnabled);
        if (!syncEnabled) {
            LOG.warn("LocalFileBackend created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /** The document file. */
    public Path file() {
        return file;
    }

    @Override
    public void ensureExists() throws BackendException {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.createFile(file);
            LOG.info("Created empty local document: {}", file);
        } catch (FileAlreadyExistsException e) {
            LOG.trace("Local document already exists: {}", file);
        } catch (IOException e) {
            LOG.error("Failed to create local document {}: {}", file, e.getMessage(), e);
            throw new BackendException(BackendFailure.IO, "Failed to create local document " + file, e);
        }
    }

    @Override
    public byte[] fetch() throws BackendException {
        ensureExists();
        try {
            byte[] content = Files.readAllBytes(file);
            LOG.debug("Read {} bytes from {}", content.length, file);
            return content;
        } catch (IOException e) {
            LOG.error("Failed to read local document {}: {}", file, e.getMessage(), e);
            throw new BackendException(BackendFailure.IO, "Failed to read local document " + file, e);
        }
    }

    @Override
    public void overwrite(byte[] content) throws BackendException {
        Path tmpPath = file.resolveSibling(file.getFileName() + TMP_SUFFIX);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            checkDiskSpace(content.length);

            ByteBuffer buf = ByteBuffer.wrap(content);
            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                    LOG.trace("Synced temp document file");
                }
            }

            moveIntoPlace(tmpPath);

            if (syncEnabled && parent != null) {
                syncDirectory(parent);
            }
            LOG.debug("Wrote {} bytes to {}", content.length, file);

        } catch (IOException e) {
            LOG.error("Failed to write local document {}: {}", file, e.getMessage(), e);
            deleteQuietly(tmpPath);
            throw new BackendException(BackendFailure.IO, "Failed to write local document " + file, e);
        }
    }

    @Override
    public boolean isAvailable() {
        return Files.isRegularFile(file);
    }

    @Override
    public DocumentLayout layout() {
        return DocumentLayout.INDENTED;
    }

    @Override
    public String describe() {
        return "file:" + file;
    }

    @Override
    public String toString() {
        return "LocalFileBackend{" + file + '}';
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void moveIntoPlace(Path tmpPath) throws IOException {
        try {
            Files.move(tmpPath, file,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", tmpPath, file);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic rename not supported for {}, falling back to plain replace", file);
            Files.move(tmpPath, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Fsyncs a directory so the rename is durable. Skipped on Windows.
     */
    private void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some filesystems reject directory fsync
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * @throws IOException if free space would drop below the configured minimum
     */
    private void checkDiskSpace(long incoming) throws IOException {
        Path dir = file.getParent() != null ? file.getParent() : file.toAbsolutePath().getRoot();
        FileStore store = Files.getFileStore(dir);
        long usableSpace = store.getUsableSpace();

        LOG.trace("Disk space check: {} bytes available, {} required", usableSpace, minFreeSpace + incoming);

        if (usableSpace < minFreeSpace + incoming) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpace / 1024 / 1024, (minFreeSpace + incoming) / 1024 / 1024);
            throw new IOException("Insufficient disk space: " + usableSpace / 1024 / 1024
                    + " MB available at " + dir);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not remove temp file {}: {}", path, e.getMessage());
        }
    }
}
