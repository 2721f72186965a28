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

/**
 * A place that holds the single note document: a cloud object or a local file.
 * <p>
 * Backends deal in raw bytes only; encoding is the job of {@link DocumentCodec}.
 * Every write replaces the whole document, there are no partial updates.
 * <p>
 * Implementations are not required to be thread-safe; {@link NoteSession}
 * serialises access.
 *
 * @see LocalFileBackend
 * @see GcsBackend
 */
public interface StorageBackend {

    /**
     * Makes sure the backing document exists, creating an empty one if it does not.
     *
     * @throws BackendException if the document cannot be checked or created
     */
    void ensureExists() throws BackendException;

    /**
     * Reads the full document.
     * <p>
     * A missing or empty document is a valid state and yields an empty array.
     *
     * @return the raw document bytes, never null
     * @throws BackendException if the store cannot be read
     */
    byte[] fetch() throws BackendException;

    /**
     * Replaces the full document.
     *
     * @param content the new document bytes
     * @throws BackendException if the store cannot be written
     */
    void overwrite(byte[] content) throws BackendException;

    /**
     * Whether the backing document is currently reachable without creating it.
     * Must not throw.
     */
    boolean isAvailable();

    /** Formatting used when encoding documents for this backend. */
    DocumentLayout layout();

    /** Human-readable location, for logs and health output. */
    String describe();
}
