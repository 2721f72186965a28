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
 * Failure classification for {@link StorageBackend} calls.
 * <p>
 * The remote backend distinguishes the first three; the local backend only ever
 * reports {@link #IO}.
 */
public enum BackendFailure {
    /** Bucket (or object, where it matters) does not exist. */
    NOT_FOUND,
    /** Caller is not authenticated or not authorised, or billing is disabled. */
    PERMISSION_DENIED,
    /** Any other remote failure, including transient server errors. */
    SERVER_ERROR,
    /** Local filesystem failure. */
    IO
}
