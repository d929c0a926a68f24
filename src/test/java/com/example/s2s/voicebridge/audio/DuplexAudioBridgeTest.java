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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static com.example.s2s.voicebridge.audio.ResamplerTest.samples;
import static org.assertj.core.api.Assertions.assertThat;

class DuplexAudioBridgeTest {

    private static byte[] constant(int value, int sampleCount) {
        int[] values = new int[sampleCount];
        Arrays.fill(values, value);
        return ResamplerTest.pcm(values);
    }

    @Test
    void shouldUpsampleTenTelephonyChunksInOrder() throws Exception {
        DuplexAudioBridge bridge = new DuplexAudioBridge(8000, 16000, 24000, 100);

        for (int i = 0; i < 10; i++) {
            bridge.submitFromTelephony(AudioChunk.of(constant((i + 1) * 100, 80), 8000));
        }

        for (int i = 0; i < 10; i++) {
            AudioChunk out = bridge.takeForAi();
            assertThat(out.getSampleRate()).isEqualTo(16000);
            assertThat(out.length()).isBetween(318, 320);
            int[] s = samples(out.toByteArray());
            assertThat(s[s.length - 1]).isEqualTo((i + 1) * 100);
        }
        assertThat(bridge.pendingForAi()).isZero();
    }

    @Test
    void shouldDownsampleAiAudioToTelephonyRate() throws Exception {
        DuplexAudioBridge bridge = new DuplexAudioBridge(8000, 16000, 24000, 100);

        bridge.submitFromAi(AudioChunk.of(new byte[960], 24000));

        AudioChunk out = bridge.takeForTelephony();
        assertThat(out.getSampleRate()).isEqualTo(8000);
        assertThat(out.length()).isEqualTo(320);
    }

    @Test
    void shouldProduceSameOutputAfterResetAsFreshBridge() throws Exception {
        byte[] first = ResamplerTest.pcm(3000, -3000, 3000, -3000);
        byte[] second = ResamplerTest.pcm(100, 200, 300, 400);

        DuplexAudioBridge used = new DuplexAudioBridge(8000, 16000, 24000, 100);
        used.submitFromTelephony(AudioChunk.of(first, 8000));
        used.submitFromAi(AudioChunk.of(first, 24000));
        used.resetForNewCall();
        used.submitFromTelephony(AudioChunk.of(second, 8000));

        DuplexAudioBridge fresh = new DuplexAudioBridge(8000, 16000, 24000, 100);
        fresh.submitFromTelephony(AudioChunk.of(second, 8000));

        assertThat(used.pendingForTelephony()).isZero();
        assertThat(used.takeForAi().toByteArray()).isEqualTo(fresh.takeForAi().toByteArray());
    }

    @Test
    void shouldCountDropsPerDirection() {
        DuplexAudioBridge bridge = new DuplexAudioBridge(8000, 8000, 8000, 2);

        for (int i = 0; i < 5; i++) {
            bridge.submitFromTelephony(AudioChunk.of(new byte[320], 8000));
        }
        bridge.submitFromAi(AudioChunk.of(new byte[320], 8000));

        assertThat(bridge.getDroppedFromTelephony()).isEqualTo(3);
        assertThat(bridge.getDroppedFromAi()).isZero();
        assertThat(bridge.pendingForAi()).isEqualTo(2);
    }

    @Test
    void shouldClearOnlyPlaybackDirection() {
        DuplexAudioBridge bridge = new DuplexAudioBridge(8000, 8000, 8000, 10);
        bridge.submitFromTelephony(AudioChunk.of(new byte[320], 8000));
        bridge.submitFromAi(AudioChunk.of(new byte[320], 8000));
        bridge.submitFromAi(AudioChunk.of(new byte[320], 8000));

        assertThat(bridge.clearPlayback()).isEqualTo(2);
        assertThat(bridge.pendingForTelephony()).isZero();
        assertThat(bridge.pendingForAi()).isEqualTo(1);
    }

    @Test
    void shouldNotWaitInTryTakeOrPollWhenEmpty() throws Exception {
        DuplexAudioBridge bridge = new DuplexAudioBridge(8000, 16000, 24000, 10);

        assertThat(bridge.tryTakeForTelephony()).isEmpty();
        assertThat(bridge.pollForAi(Duration.ofMillis(5))).isNull();
        assertThat(bridge.pollForTelephony(Duration.ofMillis(5))).isNull();
    }

    @Test
    void shouldIgnoreEmptyChunks() {
        DuplexAudioBridge bridge = new DuplexAudioBridge(8000, 16000, 24000, 10);

        bridge.submitFromTelephony(AudioChunk.empty(8000));
        bridge.submitFromAi(AudioChunk.empty(24000));

        assertThat(bridge.pendingForAi()).isZero();
        assertThat(bridge.pendingForTelephony()).isZero();
    }
}
