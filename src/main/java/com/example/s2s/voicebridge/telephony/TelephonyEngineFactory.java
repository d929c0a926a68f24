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

package com.example.s2s.voicebridge.telephony;

/**
 * Creates a fresh engine for every registration attempt. All engines from one factory share
 * the same media format, so the audio path can be sized before the first engine exists.
 */
public interface TelephonyEngineFactory {

    TelephonyEngine create(CallEventListener callListener);

    /**
     * @return sample rate of the media frames
     */
    int getSampleRate();

    /**
     * @return samples in one media frame
     */
    int getSamplesPerFrame();
}
