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

import java.util.Objects;

/**
 * Thrown by {@link StorageBackend} and {@link RemoteConnector} when the backing store
 * cannot be read or written. {@link NoteSession} translates it into a
 * {@link NoteResult}; it never escapes the session.
 */
public class BackendException extends Exception {

    private final BackendFailure failure;

    public BackendException(BackendFailure failure, String message) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public BackendException(BackendFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public BackendFailure failure() {
        return failure;
    }
}
