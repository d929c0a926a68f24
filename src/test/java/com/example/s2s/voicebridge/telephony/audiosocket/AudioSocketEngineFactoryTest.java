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

package com.example.s2s.voicebridge.telephony.audiosocket;

import com.example.s2s.voicebridge.telephony.TelephonyEngine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AudioSocketEngineFactoryTest {

    @Test
    void shouldDescribeEightKilohertzTwentyMillisecondFrames() {
        AudioSocketEngineFactory factory = new AudioSocketEngineFactory("127.0.0.1", 0, 1);

        assertThat(factory.getSampleRate()).isEqualTo(8000);
        assertThat(factory.getSamplesPerFrame()).isEqualTo(160);
    }

    @Test
    void shouldCreateFreshUnregisteredEngines() {
        AudioSocketEngineFactory factory = new AudioSocketEngineFactory("127.0.0.1", 0, 1);

        TelephonyEngine first = factory.create(null);
        TelephonyEngine second = factory.create(null);
        try {
            assertThat(first).isInstanceOf(AudioSocketEngine.class).isNotSameAs(second);
            assertThat(first.isRegistered()).isFalse();
        } finally {
            first.shutdown();
            second.shutdown();
        }
    }
}
