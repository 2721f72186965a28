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
 * A single note. Persisted under its decimal id as {@code {"title": ..., "content": ...}}.
 *
 * @param id      non-negative identifier, unique within the document
 * @param title   non-blank title
 * @param content non-blank body
 */
public record Note(long id, String title, String content) {

    public Note {
        if (id < 0) {
            throw new IllegalArgumentException("Note id must be non-negative: " + id);
        }
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(content, "content");
    }
}
