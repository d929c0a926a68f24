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

package com.example.s2s.voicebridge.ai.gemini;

import com.example.s2s.voicebridge.ai.AiResponse;
import com.example.s2s.voicebridge.ai.AiTransport;
import com.example.s2s.voicebridge.ai.ToolResult;
import com.example.s2s.voicebridge.audio.AudioChunk;
import com.google.genai.AsyncSession;
import com.google.genai.types.Blob;
import com.google.genai.types.Content;
import com.google.genai.types.LiveSendClientContentParameters;
import com.google.genai.types.LiveSendRealtimeInputParameters;
import com.google.genai.types.LiveSendToolResponseParameters;
import com.google.genai.types.LiveServerMessage;
import com.google.genai.types.Part;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Duration;
import java.util.List;

/**
 * An open Gemini Live session.
 *
 * The SDK delivers server messages to a single callback; they are mapped and pushed into a
 * multicast sink so {@link #receive()} can be subscribed to again after a reader gives up.
 */
class GeminiLiveTransport implements AiTransport {
    private static final Logger LOG = LoggerFactory.getLogger(GeminiLiveTransport.class);

    private static final Duration EMIT_RETRY = Duration.ofMillis(100);

    private final AsyncSession session;
    private final int inputSampleRate;
    private final int outputSampleRate;
    private final String audioMimeType;
    private final Sinks.Many<AiResponse> responses =
        Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);
    private volatile boolean open = true;

    GeminiLiveTransport(AsyncSession session, int inputSampleRate, int outputSampleRate) {
        this.session = session;
        this.inputSampleRate = inputSampleRate;
        this.outputSampleRate = outputSampleRate;
        this.audioMimeType = "audio/pcm;rate=" + inputSampleRate;
    }

    /**
     * Starts delivering server messages. Called once, right after the session connects.
     */
    void startReceiving() {
        session.receive(this::onMessage)
            .whenComplete((unused, error) -> {
                open = false;
                if (error != null) {
                    LOG.warn("Gemini receive stream failed: {}", error.getMessage());
                    responses.emitError(error, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
                } else {
                    LOG.info("Gemini receive stream completed");
                    responses.emitComplete(Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
                }
            });
    }

    private void onMessage(LiveServerMessage message) {
        for (AiResponse response : GeminiMessages.toResponses(message, outputSampleRate)) {
            responses.emitNext(response, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
        }
    }

    @Override
    public Mono<Void> sendAudio(AudioChunk chunk) {
        if (chunk.getSampleRate() != inputSampleRate) {
            LOG.debug("Sending {} Hz audio labelled as {}", chunk.getSampleRate(), audioMimeType);
        }
        LiveSendRealtimeInputParameters params = LiveSendRealtimeInputParameters.builder()
            .media(Blob.builder().mimeType(audioMimeType).data(chunk.toByteArray()))
            .build();
        return Mono.fromFuture(() -> session.sendRealtimeInput(params));
    }

    @Override
    public Mono<Void> sendGreeting(String prompt) {
        LiveSendClientContentParameters params = LiveSendClientContentParameters.builder()
            .turns(Content.fromParts(Part.fromText(prompt)))
            .turnComplete(true)
            .build();
        return Mono.fromFuture(() -> session.sendClientContent(params));
    }

    @Override
    public Flux<AiResponse> receive() {
        return responses.asFlux();
    }

    @Override
    public Mono<Void> respondToTool(String callId, String name, ToolResult result) {
        LiveSendToolResponseParameters params = LiveSendToolResponseParameters.builder()
            .functionResponses(List.of(GeminiMessages.toFunctionResponse(callId, name, result)))
            .build();
        return Mono.fromFuture(() -> session.sendToolResponse(params));
    }

    @Override
    public Mono<Void> close() {
        return Mono.defer(() -> {
            open = false;
            return Mono.fromFuture(session.close());
        });
    }

    @Override
    public boolean isOpen() {
        return open;
    }
}
