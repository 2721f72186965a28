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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Mints and recycles note ids.
 * <p>
 * {@link #allocate()} hands out the oldest released id first (FIFO); only when the
 * recycle queue is empty does it mint a new id from the counter. The allocator does
 * not persist itself: {@link NoteSession} writes {@link #snapshot()} into the
 * document's {@code _meta} together with every note mutation.
 * <p>
 * Not thread-safe.
 */
public final class IdAllocator {

    private long idCount;
    private final Deque<Long> recycled;

    public IdAllocator() {
        this(DocumentMeta.EMPTY);
    }

    public IdAllocator(DocumentMeta meta) {
        this.idCount = meta.idCount();
        this.recycled = new ArrayDeque<>(meta.oldIds());
    }

    /**
     * Returns the next id: head of the recycle queue, or the counter (post-incremented).
     *
     * @throws IllegalStateException if the queue is empty and the counter is exhausted
     */
    public long allocate() {
        Long reused = recycled.pollFirst();
        if (reused != null) {
            return reused;
        }
        if (idCount == Long.MAX_VALUE) {
            throw new IllegalStateException("Note id space exhausted at " + idCount);
        }
        return idCount++;
    }

    /**
     * Appends a freed id to the tail of the recycle queue.
     */
    public void release(long id) {
        recycled.addLast(id);
    }

    /** Current state, suitable for persisting as {@code _meta}. */
    public DocumentMeta snapshot() {
        return new DocumentMeta(idCount, new ArrayList<>(recycled));
    }

    /** Independent copy; mutations on it do not affect this allocator. */
    public IdAllocator copy() {
        return new IdAllocator(snapshot());
    }

    @Override
    public String toString() {
        return "IdAllocator{idCount=" + idCount + ", recycled=" + recycled + '}';
    }
}
