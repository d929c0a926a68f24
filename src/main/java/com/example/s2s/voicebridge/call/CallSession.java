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

package com.example.s2s.voicebridge.call;

import com.example.s2s.voicebridge.ai.AiSessionController;
import com.example.s2s.voicebridge.audio.FrameAssembler;
import com.example.s2s.voicebridge.telephony.CallHandle;
import reactor.core.Disposable;

/**
 * The active call: its handle, media adapter, AI controller and playback pump.
 * Mutated only on the orchestrator's lifecycle scheduler.
 */
public class CallSession {
    private final CallHandle call;
    private final long generation;
    private final FrameAssembler frameAssembler;
    private volatile CallState state = CallState.RINGING;
    private volatile AiSessionController controller;
    private Disposable playbackPump;

    CallSession(CallHandle call, long generation, FrameAssembler frameAssembler) {
        this.call = call;
        this.generation = generation;
        this.frameAssembler = frameAssembler;
    }

    public CallHandle getCall() {
        return call;
    }

    public long getGeneration() {
        return generation;
    }

    public FrameAssembler getFrameAssembler() {
        return frameAssembler;
    }

    public CallState getState() {
        return state;
    }

    public AiSessionController getController() {
        return controller;
    }

    boolean isFor(CallHandle other) {
        return call == other || call.getCallId().equals(other.getCallId());
    }

    void setState(CallState state) {
        this.state = state;
    }

    void setController(AiSessionController controller) {
        this.controller = controller;
    }

    Disposable getPlaybackPump() {
        return playbackPump;
    }

    void setPlaybackPump(Disposable playbackPump) {
        this.playbackPump = playbackPump;
    }

    @Override
    public String toString() {
        return "CallSession{call=" + call.getCallId() + ", generation=" + generation + ", state=" + state + '}';
    }
}
