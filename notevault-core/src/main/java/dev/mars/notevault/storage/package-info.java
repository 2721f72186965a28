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
/**
 * Note storage layer: one JSON document, held remotely or locally.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link dev.mars.notevault.storage.NoteSession} - backend selection and note operations</li>
 *   <li>{@link dev.mars.notevault.storage.StorageBackend} - the backend interface, with
 *       {@link dev.mars.notevault.storage.GcsBackend} and
 *       {@link dev.mars.notevault.storage.LocalFileBackend}</li>
 *   <li>{@link dev.mars.notevault.storage.DocumentCodec} - JSON encoding of the document</li>
 *   <li>{@link dev.mars.notevault.storage.IdAllocator} - FIFO id recycling</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Whole-document writes:</b> notes and {@code _meta} always change in one write</li>
 *   <li><b>Fail soft:</b> an unusable bucket degrades to the local file, a corrupt
 *       document reads as empty</li>
 *   <li><b>Results, not exceptions:</b> the session reports every outcome as a
 *       {@link dev.mars.notevault.storage.NoteResult}</li>
 * </ul>
 * <p>
 * <b>Document Layout:</b>
 * <pre>
 * {
 *   "0":     {"title": "...", "content": "..."},
 *   "_meta": {"id_count": 1, "old_ids": []}
 * }
 * </pre>
 *
 * @see dev.mars.notevault.storage.NoteSession
 */
package dev.mars.notevault.storage;
