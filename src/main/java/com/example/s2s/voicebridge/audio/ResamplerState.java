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

/**
 * Filter memory carried between consecutive {@link Resampler#convert} calls of one direction.
 * Opaque to callers; {@code null} stands for "no audio converted yet in this call".
 */
public final class ResamplerState {
    private final int phase;
    private final int[] previous;
    private final int[] current;

    ResamplerState(int phase, int[] previous, int[] current) {
        this.phase = phase;
        this.previous = previous;
        this.current = current;
    }

    int phase() {
        return phase;
    }

    int previous(int channel) {
        return previous[channel];
    }

    int current(int channel) {
        return current[channel];
    }

    int channels() {
        return current.length;
    }

    @Override
    public String toString() {
        return "ResamplerState{phase=" + phase + ", channels=" + current.length + '}';
    }
}
