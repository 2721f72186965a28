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
import java.util.Optional;

/**
 * Result of a {@link NoteSession} operation.
 * <p>
 * Exactly one of three shapes:
 * <ul>
 *   <li><b>success</b> - a value, no kind</li>
 *   <li><b>degraded success</b> - a value plus a degraded {@link ErrorKind}</li>
 *   <li><b>failure</b> - a failure {@link ErrorKind} and a message, no value</li>
 * </ul>
 *
 * @param <T> the value type
 */
public final class NoteResult<T> {

    private final T value;
    private final ErrorKind kind;
    private final String message;

    private NoteResult(T value, ErrorKind kind, String message) {
        this.value = value;
        this.kind = kind;
        this.message = message;
    }

    public static <T> NoteResult<T> ok(T value) {
        return new NoteResult<>(value, null, null);
    }

    public static <T> NoteResult<T> degraded(T value, ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        if (!kind.isDegraded()) {
            throw new IllegalArgumentException("Not a degraded kind: " + kind);
        }
        return new NoteResult<>(value, kind, message);
    }

    public static <T> NoteResult<T> failure(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        if (kind.isDegraded()) {
            throw new IllegalArgumentException("Degraded kind is not a failure: " + kind);
        }
        return new NoteResult<>(null, kind, message);
    }

    /** True for plain and degraded successes. */
    public boolean isSuccess() {
        return kind == null || kind.isDegraded();
    }

    public boolean isDegraded() {
        return kind != null && kind.isDegraded();
    }

    /**
     * Returns the value of a successful result.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T value() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + kind + " (" + message + ")");
        }
        return value;
    }

    public Optional<ErrorKind> kind() {
        return Optional.ofNullable(kind);
    }

    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    /** HTTP status for this result: 200 on (degraded) success, the kind's status otherwise. */
    public int httpStatus() {
        return kind == null ? 200 : kind.httpStatus();
    }

    @Override
    public String toString() {
        if (kind == null) {
            return "NoteResult{ok, value=" + value + '}';
        }
        return "NoteResult{" + kind + ", message=" + message + (isSuccess() ? ", value=" + value : "") + '}';
    }
}
