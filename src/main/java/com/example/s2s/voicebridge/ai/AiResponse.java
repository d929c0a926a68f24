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

package com.example.s2s.voicebridge.ai;

import com.example.s2s.voicebridge.audio.AudioChunk;
import com.google.gson.JsonObject;

/**
 * One item read from an AI session.
 */
public sealed interface AiResponse {

    /**
     * Speech to play to the caller, at the provider's output rate.
     */
    record Audio(AudioChunk chunk) implements AiResponse {
    }

    /**
     * Text produced alongside or instead of audio (transcripts, thoughts).
     */
    record Text(String text) implements AiResponse {
    }

    /**
     * The AI wants a tool run. The answer goes back through
     * {@link AiTransport#respondToTool} with the same call id.
     */
    record ToolCall(String callId, String name, JsonObject arguments) implements AiResponse {
        public ToolCall {
            arguments = arguments != null ? arguments : new JsonObject();
        }
    }

    /**
     * The caller started speaking over the AI; audio not yet played is stale.
     */
    record Interrupted() implements AiResponse {
    }

    /**
     * A message with nothing the bridge acts on.
     */
    record Empty() implements AiResponse {
    }

    AiResponse EMPTY = new Empty();

    AiResponse INTERRUPTED = new Interrupted();
}
