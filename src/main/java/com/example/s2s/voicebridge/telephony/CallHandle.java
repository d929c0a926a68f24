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
 * One call as seen by the engine.
 */
public interface CallHandle {

    String getCallId();

    /**
     * @param statusCode 200 to accept the call
     */
    void answer(int statusCode);

    void hangup();

    /**
     * Connects the call's audio to the given port. Replaces any earlier port.
     */
    void attachMedia(MediaPort port);

    boolean isConnected();
}
