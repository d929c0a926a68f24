/*
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.example.s2s.voicebridge.audio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO of audio chunks. Producers never block: when the queue is full the
 * offered chunk is dropped and counted.
 */
public class BridgeQueue {
    private static final Logger LOG = LoggerFactory.getLogger(BridgeQueue.class);

    public static final int DEFAULT_CAPACITY = 100;

    private final String name;
    private final int capacity;
    private final BlockingQueue<AudioChunk> queue;
    private final AtomicLong dropped = new AtomicLong();

    public BridgeQueue(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues without blocking.
     *
     * @return false if the queue was full and the chunk was dropped
     */
    public boolean offer(AudioChunk chunk) {
        if (queue.offer(chunk)) {
            return true;
        }
        long total = dropped.incrementAndGet();
        LOG.warn("⚠ {} queue full ({} chunks), dropped {} (total dropped: {})", name, capacity, chunk, total);
        return false;
    }

    /**
     * Blocks until a chunk is available.
     */
    public AudioChunk take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Waits up to the given timeout.
     *
     * @return the next chunk, or null on timeout
     */
    public AudioChunk poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public Optional<AudioChunk> tryTake() {
        return Optional.ofNullable(queue.poll());
    }

    /**
     * Removes everything currently queued.
     *
     * @return the number of chunks discarded
     */
    public int drain() {
        List<AudioChunk> discarded = new ArrayList<>();
        queue.drainTo(discarded);
        if (!discarded.isEmpty()) {
            LOG.debug("Drained {} chunks from {} queue", discarded.size(), name);
        }
        return discarded.size();
    }

    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public String getName() {
        return name;
    }
}
