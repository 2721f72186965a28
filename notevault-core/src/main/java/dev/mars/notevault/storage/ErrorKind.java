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
 * Outcome kinds reported by {@link NoteSession}.
 * <p>
 * The three {@code *_USE_LOCAL} kinds are <b>degraded successes</b>: they are only
 * produced by {@link NoteSession#setup(String)} when the remote backend could not be
 * used and the session fell back to the local file. Callers treat them as success.
 */
public enum ErrorKind {

    INVALID_INPUT(400, false),
    NOT_FOUND(404, false),
    PERMISSION_DENIED(403, false),
    SERVER_ERROR(500, false),
    SETUP_REQUIRED(403, false),
    NOT_FOUND_USE_LOCAL(200, true),
    PERMISSION_DENIED_USE_LOCAL(200, true),
    SERVER_ERROR_USE_LOCAL(200, true);

    private final int httpStatus;
    private final boolean degraded;

    ErrorKind(int httpStatus, boolean degraded) {
        this.httpStatus = httpStatus;
        this.degraded = degraded;
    }

    /** HTTP status code the kind maps to. */
    public int httpStatus() {
        return httpStatus;
    }

    /** Whether the kind is a degraded success rather than a failure. */
    public boolean isDegraded() {
        return degraded;
    }
}
