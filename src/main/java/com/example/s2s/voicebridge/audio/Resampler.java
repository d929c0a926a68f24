/*
 * Copyright (c) 2024 Amazon.com, Inc. or its affiliates.
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

import java.util.Arrays;

/**
 * Stateful sample-rate converter for 16-bit little-endian PCM.
 *
 * Uses linear interpolation between neighbouring input frames. The phase accumulator and
 * the last two input frames are returned as a {@link ResamplerState} so that the next chunk
 * of the same stream continues exactly where this one stopped; feeding {@code null} starts a
 * fresh stream. Conversion problems never stop the audio path: the input chunk is returned
 * unconverted and the state is left as it was.
 */
public class Resampler {
    private static final Logger LOG = LoggerFactory.getLogger(Resampler.class);

    public static final int PCM16_SAMPLE_WIDTH = 2;

    /**
     * Converted audio plus the state to feed into the next call.
     */
    public static final class Result {
        private final AudioChunk chunk;
        private final ResamplerState state;

        Result(AudioChunk chunk, ResamplerState state) {
            this.chunk = chunk;
            this.state = state;
        }

        public AudioChunk getChunk() {
            return chunk;
        }

        /**
         * @return the state for the next chunk, or null if no audio has been converted yet
         */
        public ResamplerState getState() {
            return state;
        }
    }

    /**
     * Converts {@code chunk} from {@code fromRate} to {@code toRate}.
     *
     * @param chunk PCM audio at {@code fromRate}
     * @param state state returned by the previous call of this stream, or null
     * @param fromRate input sample rate in Hz
     * @param toRate output sample rate in Hz
     * @param sampleWidth bytes per sample, only 2 (PCM16) is supported
     * @param channels interleaved channel count
     */
    public Result convert(AudioChunk chunk, ResamplerState state, int fromRate, int toRate,
                          int sampleWidth, int channels) {
        if (fromRate == toRate) {
            return new Result(chunk, state);
        }
        if (chunk.isEmpty()) {
            return new Result(AudioChunk.empty(toRate), state);
        }

        try {
            return ratecv(chunk, state, fromRate, toRate, sampleWidth, channels);
        } catch (RuntimeException e) {
            LOG.error("Resampling {}Hz -> {}Hz failed for {}, passing audio through unconverted",
                      fromRate, toRate, chunk, e);
            return new Result(chunk.withSampleRate(toRate), state);
        }
    }

    private Result ratecv(AudioChunk chunk, ResamplerState state, int fromRate, int toRate,
                          int sampleWidth, int channels) {
        if (sampleWidth != PCM16_SAMPLE_WIDTH) {
            throw new IllegalArgumentException("Unsupported sample width: " + sampleWidth);
        }
        if (channels < 1) {
            throw new IllegalArgumentException("Channel count must be positive: " + channels);
        }
        if (fromRate <= 0 || toRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive: " + fromRate + " -> " + toRate);
        }
        int frameBytes = sampleWidth * channels;
        byte[] in = chunk.toByteArray();
        if (in.length % frameBytes != 0) {
            throw new IllegalArgumentException("Chunk of " + in.length + " bytes is not a whole number of "
                    + frameBytes + "-byte frames");
        }

        int gcd = gcd(fromRate, toRate);
        int inRate = fromRate / gcd;
        int outRate = toRate / gcd;

        int phase;
        int[] previous = new int[channels];
        int[] current = new int[channels];
        if (state == null) {
            phase = -outRate;
        } else {
            if (state.channels() != channels) {
                throw new IllegalArgumentException("State has " + state.channels()
                        + " channels, chunk has " + channels);
            }
            phase = state.phase();
            for (int ch = 0; ch < channels; ch++) {
                previous[ch] = state.previous(ch);
                current[ch] = state.current(ch);
            }
        }

        int framesLeft = in.length / frameBytes;
        long maxOutFrames = (long) framesLeft * outRate / inRate + 2;
        byte[] out = new byte[(int) (maxOutFrames * frameBytes)];
        int inPos = 0;
        int outPos = 0;

        while (true) {
            while (phase < 0) {
                if (framesLeft == 0) {
                    byte[] converted = Arrays.copyOf(out, outPos);
                    return new Result(AudioChunk.wrap(converted, toRate),
                                      new ResamplerState(phase, previous, current));
                }
                for (int ch = 0; ch < channels; ch++) {
                    previous[ch] = current[ch];
                    current[ch] = readSample(in, inPos);
                    inPos += sampleWidth;
                }
                framesLeft--;
                phase += outRate;
            }
            while (phase >= 0) {
                for (int ch = 0; ch < channels; ch++) {
                    long mixed = ((long) previous[ch] * phase + (long) current[ch] * (outRate - phase)) / outRate;
                    writeSample(out, outPos, (int) mixed);
                    outPos += sampleWidth;
                }
                phase -= inRate;
            }
        }
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    /**
     * Read a 16-bit sample from byte array (little-endian)
     */
    private static int readSample(byte[] data, int byteIndex) {
        return (short) ((data[byteIndex] & 0xFF) | ((data[byteIndex + 1] & 0xFF) << 8));
    }

    /**
     * Write a 16-bit sample to byte array (little-endian)
     */
    private static void writeSample(byte[] data, int byteIndex, int sample) {
        data[byteIndex] = (byte) (sample & 0xFF);
        data[byteIndex + 1] = (byte) ((sample >> 8) & 0xFF);
    }
}
