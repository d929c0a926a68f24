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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * An open realtime AI session.
 */
public interface AiTransport {

    /**
     * Streams caller audio, already at the provider's input rate.
     */
    Mono<Void> sendAudio(AudioChunk chunk);

    /**
     * Asks the AI to open the conversation.
     */
    Mono<Void> sendGreeting(String prompt);

    /**
     * Responses from the AI. Completes when the session ends on the provider's side.
     * May be subscribed again after an error.
     */
    Flux<AiResponse> receive();

    Mono<Void> respondToTool(String callId, String name, ToolResult result);

    Mono<Void> close();

    boolean isOpen();
}
