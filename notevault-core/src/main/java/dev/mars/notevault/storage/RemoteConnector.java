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
 * Binds a remote {@link StorageBackend} to a named bucket.
 *
 * @see GcsConnector
 */
@FunctionalInterface
public interface RemoteConnector {

    /**
     * Connects to {@code bucketName}.
     *
     * @param bucketName trimmed, non-empty bucket name
     * @return a backend bound to the bucket's note object
     * @throws BackendException classified as {@link BackendFailure#NOT_FOUND},
     *                          {@link BackendFailure#PERMISSION_DENIED} or
     *                          {@link BackendFailure#SERVER_ERROR}
     */
    StorageBackend connect(String bucketName) throws BackendException;
}
