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

import java.util.List;

/**
 * Allocator state persisted under the reserved {@code _meta} key.
 *
 * @param idCount next id to mint when the recycle queue is empty
 * @param oldIds  recycled ids, head first (FIFO)
 */
public record DocumentMeta(long idCount, List<Long> oldIds) {

    public static final DocumentMeta EMPTY = new DocumentMeta(0L, List.of());

    public DocumentMeta {
        oldIds = oldIds == null ? List.of() : List.copyOf(oldIds);
    }
}
