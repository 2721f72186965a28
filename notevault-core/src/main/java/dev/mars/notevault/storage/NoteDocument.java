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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory form of the single persisted JSON document: notes keyed by id plus
 * the optional {@code _meta} entry.
 * <p>
 * Iteration order is insertion order, matching the order keys appear on disk.
 * Not thread-safe; {@link NoteSession} owns each instance for one operation.
 */
public final class NoteDocument {

    /** Reserved key holding {@link DocumentMeta}. Never returned to callers. */
    public static final String META_KEY = "_meta";

    private final Map<Long, Note> notes = new LinkedHashMap<>();
    private DocumentMeta meta;

    public static NoteDocument empty() {
        return new NoteDocument();
    }

    public Optional<DocumentMeta> meta() {
        return Optional.ofNullable(meta);
    }

    public void setMeta(DocumentMeta meta) {
        this.meta = meta;
    }

    public Optional<Note> get(long id) {
        return Optional.ofNullable(notes.get(id));
    }

    public boolean contains(long id) {
        return notes.containsKey(id);
    }

    public void put(Note note) {
        notes.put(note.id(), note);
    }

    public Optional<Note> remove(long id) {
        return Optional.ofNullable(notes.remove(id));
    }

    /** Notes in document order, without the metadata entry. */
    public Map<Long, Note> notes() {
        return Collections.unmodifiableMap(notes);
    }

    public int size() {
        return notes.size();
    }

    @Override
    public String toString() {
        return "NoteDocument{notes=" + notes.size() + ", meta=" + meta + '}';
    }
}
