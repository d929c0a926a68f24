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

import com.example.s2s.voicebridge.telephony.CallEventListener;
import com.example.s2s.voicebridge.telephony.TelephonyEngine;
import com.example.s2s.voicebridge.telephony.TelephonyEngineFactory;

/**
 * Builds AudioSocket engines listening on a fixed address.
 */
public class AudioSocketEngineFactory implements TelephonyEngineFactory {
    private final String bindAddress;
    private final int port;
    private final int maxCalls;

    public AudioSocketEngineFactory(String bindAddress, int port, int maxCalls) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.maxCalls = maxCalls;
    }

    @Override
    public TelephonyEngine create(CallEventListener callListener) {
        return new AudioSocketEngine(bindAddress, port, maxCalls, callListener);
    }

    @Override
    public int getSampleRate() {
        return AudioSocketEngine.SAMPLE_RATE;
    }

    @Override
    public int getSamplesPerFrame() {
        return AudioSocketEngine.SAMPLES_PER_FRAME;
    }
}
