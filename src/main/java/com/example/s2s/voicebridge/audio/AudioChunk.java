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

import java.util.Arrays;

/**
 * Immutable chunk of 16-bit little-endian mono PCM at a declared sample rate.
 * A zero-length chunk is valid and carries no audio.
 */
public final class AudioChunk {
    private static final byte[] NO_BYTES = new byte[0];

    private final byte[] data;
    private final int sampleRate;

    private AudioChunk(byte[] data, int sampleRate) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        this.data = data;
        this.sampleRate = sampleRate;
    }

    /**
     * Creates a chunk holding a private copy of the given bytes.
     */
    public static AudioChunk of(byte[] pcm, int sampleRate) {
        if (pcm == null || pcm.length == 0) {
            return empty(sampleRate);
        }
        return new AudioChunk(pcm.clone(), sampleRate);
    }

    /**
     * Creates a chunk from a slice of the given array.
     */
    public static AudioChunk of(byte[] pcm, int offset, int length, int sampleRate) {
        if (length == 0) {
            return empty(sampleRate);
        }
        return new AudioChunk(Arrays.copyOfRange(pcm, offset, offset + length), sampleRate);
    }

    public static AudioChunk empty(int sampleRate) {
        return new AudioChunk(NO_BYTES, sampleRate);
    }

    /**
     * Wraps an array the caller hands over and never touches again.
     */
    static AudioChunk wrap(byte[] pcm, int sampleRate) {
        return new AudioChunk(pcm, sampleRate);
    }

    /**
     * @return a copy of the PCM bytes
     */
    public byte[] toByteArray() {
        return data.clone();
    }

    /**
     * Copies the PCM bytes into {@code dest} starting at {@code destOffset}.
     */
    public void copyTo(byte[] dest, int destOffset) {
        System.arraycopy(data, 0, dest, destOffset, data.length);
    }

    public int length() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    /**
     * Returns the same audio relabelled with another rate. Used by the resampler
     * fail-soft path, where the bytes are passed through unconverted.
     */
    AudioChunk withSampleRate(int rate) {
        return rate == sampleRate ? this : new AudioChunk(data, rate);
    }

    /**
     * Byte-wise comparison helper for callers that only need equality of audio content.
     */
    public boolean sameBytes(AudioChunk other) {
        return other != null && Arrays.equals(data, other.data);
    }

    @Override
    public String toString() {
        return "AudioChunk{" + data.length + " bytes @" + sampleRate + "Hz}";
    }
}
