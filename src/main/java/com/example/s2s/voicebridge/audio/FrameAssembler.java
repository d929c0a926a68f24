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

import com.example.s2s.voicebridge.telephony.MediaPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Adapts the call's fixed-size media frames to the bridge.
 *
 * Captured frames go straight to the bridge. Playback audio arrives in chunks of any
 * size and is buffered here; each frame request takes exactly one frame off the front,
 * or returns silence while less than a frame is buffered.
 */
public class FrameAssembler implements MediaPort {
    private static final Logger LOG = LoggerFactory.getLogger(FrameAssembler.class);

    private static final int INITIAL_BUFFER_BYTES = 8192;

    private final DuplexAudioBridge bridge;
    private final int sampleRate;
    private final int frameBytes;

    private final ReentrantLock lock = new ReentrantLock();
    private byte[] buffer = new byte[INITIAL_BUFFER_BYTES];
    private int head;
    private int tail;
    private long playbackEpoch;

    private long audioFrames;
    private long silenceFrames;
    private boolean starved = true;

    /**
     * @param bridge the bridge captured audio is submitted to
     * @param sampleRate telephony sample rate, used to label captured chunks
     * @param samplesPerFrame samples in one telephony frame (160 for 20 ms at 8 kHz)
     * @param bytesPerSample 2 for PCM16
     */
    public FrameAssembler(DuplexAudioBridge bridge, int sampleRate, int samplesPerFrame, int bytesPerSample) {
        if (samplesPerFrame <= 0 || bytesPerSample <= 0) {
            throw new IllegalArgumentException("frame size must be positive");
        }
        this.bridge = bridge;
        this.sampleRate = sampleRate;
        this.frameBytes = samplesPerFrame * bytesPerSample;
    }

    @Override
    public void onFrameReceived(byte[] frame) {
        if (frame == null || frame.length == 0) {
            return;
        }
        bridge.submitFromTelephony(AudioChunk.of(frame, sampleRate));
    }

    @Override
    public byte[] requestFrame() {
        lock.lock();
        try {
            if (tail - head >= frameBytes) {
                byte[] frame = Arrays.copyOfRange(buffer, head, head + frameBytes);
                head += frameBytes;
                if (head == tail) {
                    head = 0;
                    tail = 0;
                }
                audioFrames++;
                if (starved) {
                    starved = false;
                    LOG.debug("Playback resumed after {} silent frames", silenceFrames);
                }
                return frame;
            }
            silenceFrames++;
            if (!starved) {
                starved = true;
                LOG.debug("Playback buffer underrun ({} bytes buffered)", tail - head);
            }
            return new byte[frameBytes];
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends audio for playback. The buffer grows as needed.
     */
    public void appendPlaybackAudio(AudioChunk chunk) {
        if (chunk.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            append(chunk);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends audio for playback unless {@link #clear()} has run since {@code expectedEpoch}
     * was read from {@link #playbackEpoch()}.
     *
     * @return false if the chunk was dropped as stale
     */
    public boolean appendPlaybackAudio(AudioChunk chunk, long expectedEpoch) {
        lock.lock();
        try {
            if (playbackEpoch != expectedEpoch) {
                LOG.debug("Dropped {} bytes of playback queued before a clear", chunk.length());
                return false;
            }
            if (!chunk.isEmpty()) {
                append(chunk);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return a counter bumped by every {@link #clear()}
     */
    public long playbackEpoch() {
        lock.lock();
        try {
            return playbackEpoch;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops all buffered playback audio. Chunks read before this call and appended with
     * {@link #appendPlaybackAudio(AudioChunk, long)} are dropped too.
     */
    public void clear() {
        lock.lock();
        try {
            playbackEpoch++;
            int dropped = tail - head;
            head = 0;
            tail = 0;
            if (dropped > 0) {
                LOG.debug("Cleared {} bytes of buffered playback", dropped);
            }
        } finally {
            lock.unlock();
        }
    }

    public int bufferedBytes() {
        lock.lock();
        try {
            return tail - head;
        } finally {
            lock.unlock();
        }
    }

    public int getFrameBytes() {
        return frameBytes;
    }

    public long getAudioFrameCount() {
        lock.lock();
        try {
            return audioFrames;
        } finally {
            lock.unlock();
        }
    }

    public long getSilenceFrameCount() {
        lock.lock();
        try {
            return silenceFrames;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private void append(AudioChunk chunk) {
        ensureCapacity(chunk.length());
        chunk.copyTo(buffer, tail);
        tail += chunk.length();
    }

    // Caller holds the lock.
    private void ensureCapacity(int extra) {
        int used = tail - head;
        if (tail + extra <= buffer.length) {
            return;
        }
        if (used + extra <= buffer.length) {
            System.arraycopy(buffer, head, buffer, 0, used);
        } else {
            byte[] grown = new byte[Math.max(buffer.length * 2, used + extra)];
            System.arraycopy(buffer, head, grown, 0, used);
            buffer = grown;
        }
        head = 0;
        tail = used;
    }
}
