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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class FrameAssemblerTest {

    private static final int FRAME_BYTES = 320;

    private DuplexAudioBridge bridge;
    private FrameAssembler assembler;

    @BeforeEach
    void setUp() {
        bridge = new DuplexAudioBridge(8000, 8000, 8000, 10);
        assembler = new FrameAssembler(bridge, 8000, 160, 2);
    }

    private static byte[] filled(int length, int value) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }

    @Test
    void shouldReturnSilenceWhenBufferEmpty() {
        byte[] frame = assembler.requestFrame();

        assertThat(frame).hasSize(FRAME_BYTES).containsOnly((byte) 0);
        assertThat(assembler.getSilenceFrameCount()).isEqualTo(1);
    }

    @Test
    void shouldReturnExactlyOneAppendedFrame() {
        byte[] audio = filled(FRAME_BYTES, 7);
        assembler.appendPlaybackAudio(AudioChunk.of(audio, 8000));

        assertThat(assembler.requestFrame()).isEqualTo(audio);
        assertThat(assembler.bufferedBytes()).isZero();
        assertThat(assembler.getAudioFrameCount()).isEqualTo(1);
    }

    @Test
    void shouldKeepPartialResidueBehindSilence() {
        assembler.appendPlaybackAudio(AudioChunk.of(filled(100, 3), 8000));

        assertThat(assembler.requestFrame()).containsOnly((byte) 0);
        assertThat(assembler.bufferedBytes()).isEqualTo(100);

        assembler.appendPlaybackAudio(AudioChunk.of(filled(FRAME_BYTES, 4), 8000));
        byte[] frame = assembler.requestFrame();
        assertThat(Arrays.copyOfRange(frame, 0, 100)).containsOnly((byte) 3);
        assertThat(Arrays.copyOfRange(frame, 100, FRAME_BYTES)).containsOnly((byte) 4);
        assertThat(assembler.bufferedBytes()).isEqualTo(100);
    }

    @Test
    void shouldSplitLargeChunksIntoFrames() {
        assembler.appendPlaybackAudio(AudioChunk.of(filled(FRAME_BYTES * 40 + 10, 9), 8000));

        for (int i = 0; i < 40; i++) {
            assertThat(assembler.requestFrame()).containsOnly((byte) 9);
        }
        assertThat(assembler.requestFrame()).containsOnly((byte) 0);
        assertThat(assembler.bufferedBytes()).isEqualTo(10);
    }

    @Test
    void shouldEmptyBufferOnClear() {
        assembler.appendPlaybackAudio(AudioChunk.of(filled(FRAME_BYTES * 2, 5), 8000));

        assembler.clear();

        assertThat(assembler.bufferedBytes()).isZero();
        assertThat(assembler.requestFrame()).containsOnly((byte) 0);
    }

    @Test
    void shouldDropChunkTakenBeforeClear() {
        bridge.submitFromAi(AudioChunk.of(filled(FRAME_BYTES, 5), 8000));
        long epoch = assembler.playbackEpoch();
        AudioChunk stale = bridge.tryTakeForTelephony().orElseThrow();

        bridge.clearPlayback();
        assembler.clear();

        assertThat(assembler.appendPlaybackAudio(stale, epoch)).isFalse();
        assertThat(assembler.bufferedBytes()).isZero();
        assertThat(assembler.requestFrame()).containsOnly((byte) 0);
    }

    @Test
    void shouldAppendChunkTakenAfterClear() {
        assembler.clear();
        long epoch = assembler.playbackEpoch();
        byte[] audio = filled(FRAME_BYTES, 9);

        assertThat(assembler.appendPlaybackAudio(AudioChunk.of(audio, 8000), epoch)).isTrue();
        assertThat(assembler.requestFrame()).isEqualTo(audio);
    }

    @Test
    void shouldForwardCapturedFramesUnmodified() throws Exception {
        byte[] captured = filled(FRAME_BYTES, 11);

        assembler.onFrameReceived(captured);

        AudioChunk forwarded = bridge.pollForAi(Duration.ofMillis(100));
        assertThat(forwarded).isNotNull();
        assertThat(forwarded.toByteArray()).isEqualTo(captured);
    }
}
