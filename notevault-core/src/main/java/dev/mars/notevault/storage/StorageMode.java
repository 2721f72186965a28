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
 * Which backend a {@link NoteSession} is using.
 * <p>
 * {@code UNINITIALIZED -> ONLINE | OFFLINE}, and only through
 * {@link NoteSession#setup(String)}. There is no automatic move from
 * {@code OFFLINE} back to {@code ONLINE}.
 */
public enum StorageMode {
    /** {@code setup} has not completed yet. */
    UNINITIALIZED,
    /** The remote bucket object is authoritative. */
    ONLINE,
    /** The local file is authoritative. */
    OFFLINE
}
