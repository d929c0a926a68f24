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

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Moves audio between the telephony leg and the AI session.
 *
 * Each direction is a {@link BridgeQueue} paired with its own resampler state. Submitting
 * converts the chunk to the consumer's rate and enqueues it without blocking; taking
 * dequeues in FIFO order. The two directions share nothing.
 */
public class DuplexAudioBridge {
    private static final Logger LOG = LoggerFactory.getLogger(DuplexAudioBridge.class);

    private static final int CHANNELS = 1;

    private final Direction toAi;
    private final Direction toTelephony;

    /**
     * @param telephonyRate sample rate of the call media
     * @param aiInputRate sample rate the AI session expects
     * @param aiOutputRate sample rate the AI session produces
     * @param queueCapacity per-direction queue bound in chunks
     */
    public DuplexAudioBridge(int telephonyRate, int aiInputRate, int aiOutputRate, int queueCapacity) {
        Resampler resampler = new Resampler();
        this.toAi = new Direction("telephony->ai", resampler, telephonyRate, aiInputRate, queueCapacity);
        this.toTelephony = new Direction("ai->telephony", resampler, aiOutputRate, telephonyRate, queueCapacity);
        LOG.info("Audio bridge created: telephony {}Hz, AI in {}Hz, AI out {}Hz, queue capacity {}",
                 telephonyRate, aiInputRate, aiOutputRate, queueCapacity);
    }

    public boolean submitFromTelephony(AudioChunk chunk) {
        return toAi.submit(chunk);
    }

    public boolean submitFromAi(AudioChunk chunk) {
        return toTelephony.submit(chunk);
    }

    public AudioChunk takeForAi() throws InterruptedException {
        return toAi.queue.take();
    }

    public AudioChunk takeForTelephony() throws InterruptedException {
        return toTelephony.queue.take();
    }

    /**
     * @return the next chunk for the AI, or null if none arrived within the timeout
     */
    public AudioChunk pollForAi(Duration timeout) throws InterruptedException {
        return toAi.queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return the next chunk for playback, or null if none arrived within the timeout
     */
    public AudioChunk pollForTelephony(Duration timeout) throws InterruptedException {
        return toTelephony.queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Optional<AudioChunk> tryTakeForTelephony() {
        return toTelephony.queue.tryTake();
    }

    /**
     * Forgets both resampler states and discards everything queued in both directions.
     */
    public void resetForNewCall() {
        int fromTelephony = toAi.reset();
        int fromAi = toTelephony.reset();
        LOG.info("Audio bridge reset for new call (discarded {} inbound, {} outbound chunks)",
                 fromTelephony, fromAi);
    }

    /**
     * Discards audio waiting for playback. The AI-side resampler state is kept so that the
     * next response continues seamlessly.
     */
    public int clearPlayback() {
        int discarded = toTelephony.queue.drain();
        if (discarded > 0) {
            LOG.info("Cleared {} pending playback chunks", discarded);
        }
        return discarded;
    }

    public long getDroppedFromTelephony() {
        return toAi.queue.getDroppedCount();
    }

    public long getDroppedFromAi() {
        return toTelephony.queue.getDroppedCount();
    }

    public int pendingForAi() {
        return toAi.queue.size();
    }

    public int pendingForTelephony() {
        return toTelephony.queue.size();
    }

    private static final class Direction {
        private final Resampler resampler;
        private final int fromRate;
        private final int toRate;
        private final BridgeQueue queue;
        private ResamplerState state;

        Direction(String name, Resampler resampler, int fromRate, int toRate, int capacity) {
            this.resampler = resampler;
            this.fromRate = fromRate;
            this.toRate = toRate;
            this.queue = new BridgeQueue(name, capacity);
        }

        synchronized boolean submit(AudioChunk chunk) {
            if (chunk.isEmpty()) {
                return true;
            }
            Resampler.Result result = resampler.convert(chunk, state, fromRate, toRate,
                                                        Resampler.PCM16_SAMPLE_WIDTH, CHANNELS);
            state = result.getState();
            if (result.getChunk().isEmpty()) {
                return true;
            }
            return queue.offer(result.getChunk());
        }

        synchronized int reset() {
            state = null;
            return queue.drain();
        }
    }
}
