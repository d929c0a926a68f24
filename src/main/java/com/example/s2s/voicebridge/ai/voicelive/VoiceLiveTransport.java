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

package com.example.s2s.voicebridge.ai.voicelive;

import com.azure.ai.voicelive.VoiceLiveSessionAsyncClient;
import com.azure.ai.voicelive.models.ClientEventConversationItemCreate;
import com.azure.ai.voicelive.models.ClientEventResponseCreate;
import com.azure.ai.voicelive.models.SessionUpdate;
import com.azure.ai.voicelive.models.SessionUpdateError;
import com.azure.ai.voicelive.models.SessionUpdateSessionUpdated;
import com.azure.core.util.BinaryData;
import com.example.s2s.voicebridge.ai.AiResponse;
import com.example.s2s.voicebridge.ai.AiTransport;
import com.example.s2s.voicebridge.ai.ToolResult;
import com.example.s2s.voicebridge.audio.AudioChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * An open Voice Live session.
 *
 * Events are read by one subscription made before the session is configured; the session
 * counts as ready once the service confirms the configuration. Caller audio is accumulated
 * into 100 ms chunks before it is sent.
 */
class VoiceLiveTransport implements AiTransport {
    private static final Logger LOG = LoggerFactory.getLogger(VoiceLiveTransport.class);

    private static final Duration EMIT_RETRY = Duration.ofMillis(100);
    private static final int MIN_CHUNK_SIZE_MS = 100;
    private static final int BYTES_PER_SAMPLE = 2;

    private final VoiceLiveSessionAsyncClient session;
    private final int outputSampleRate;
    private final Sinks.Many<AiResponse> responses =
        Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);
    private final CompletableFuture<Void> sessionReady = new CompletableFuture<>();
    private final byte[] audioBuffer;
    private int bufferPos;
    private volatile Disposable events;
    private volatile boolean open = true;

    VoiceLiveTransport(VoiceLiveSessionAsyncClient session, int inputSampleRate, int outputSampleRate) {
        this.session = session;
        this.outputSampleRate = outputSampleRate;
        this.audioBuffer = new byte[MIN_CHUNK_SIZE_MS * inputSampleRate * BYTES_PER_SAMPLE / 1000];
    }

    void startReceiving() {
        events = session.receiveEvents()
            .subscribe(
                this::handleEvent,
                error -> {
                    open = false;
                    LOG.error("Error receiving Voice Live events", error);
                    sessionReady.completeExceptionally(error);
                    responses.emitError(error, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
                },
                () -> {
                    open = false;
                    LOG.info("Voice Live event stream completed");
                    sessionReady.completeExceptionally(new IllegalStateException("Event stream ended before session was ready"));
                    responses.emitComplete(Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
                });
    }

    /**
     * Completes once the service has confirmed the session configuration.
     */
    Mono<Void> awaitReady(Duration timeout) {
        return Mono.fromFuture(sessionReady).timeout(timeout);
    }

    private void handleEvent(SessionUpdate event) {
        LOG.debug("📩 Received event: {}", event.getType());
        if (event instanceof SessionUpdateSessionUpdated) {
            LOG.info("✓ Voice Live session configured successfully");
            sessionReady.complete(null);
            return;
        }
        if (event instanceof SessionUpdateError error) {
            LOG.error("❌ Voice Live error: {}", error.getError() != null ? error.getError().toString() : "Unknown error");
            return;
        }
        AiResponse response = VoiceLiveEvents.toResponse(event, outputSampleRate);
        if (!(response instanceof AiResponse.Empty)) {
            responses.emitNext(response, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
        }
    }

    @Override
    public Mono<Void> sendAudio(AudioChunk chunk) {
        byte[] ready = buffer(chunk.toByteArray());
        if (ready == null) {
            return Mono.empty();
        }
        return session.sendInputAudio(BinaryData.fromBytes(ready))
            .onErrorResume(error -> {
                // Reported while a response is streaming; the audio is simply dropped.
                if (error.getMessage() != null && error.getMessage().contains("standalone audio chunk")) {
                    LOG.debug("Audio streaming conflict: {}", error.getMessage());
                    return Mono.empty();
                }
                return Mono.error(error);
            });
    }

    /**
     * @return a full chunk to send, or null while still filling. Input beyond a full chunk
     *     stays buffered for the next call.
     */
    private synchronized byte[] buffer(byte[] pcm) {
        int offset = 0;
        byte[] full = null;
        while (offset < pcm.length) {
            int n = Math.min(pcm.length - offset, audioBuffer.length - bufferPos);
            System.arraycopy(pcm, offset, audioBuffer, bufferPos, n);
            bufferPos += n;
            offset += n;
            if (bufferPos == audioBuffer.length) {
                byte[] chunk = audioBuffer.clone();
                bufferPos = 0;
                if (full == null) {
                    full = chunk;
                } else {
                    byte[] joined = new byte[full.length + chunk.length];
                    System.arraycopy(full, 0, joined, 0, full.length);
                    System.arraycopy(chunk, 0, joined, full.length, chunk.length);
                    full = joined;
                }
            }
        }
        return full;
    }

    /**
     * Voice Live has the instructions already; the greeting only asks for a response.
     */
    @Override
    public Mono<Void> sendGreeting(String prompt) {
        LOG.info("📢 Sending proactive greeting request");
        return session.sendEvent(new ClientEventResponseCreate());
    }

    @Override
    public Flux<AiResponse> receive() {
        return responses.asFlux();
    }

    @Override
    public Mono<Void> respondToTool(String callId, String name, ToolResult result) {
        ClientEventConversationItemCreate item = new ClientEventConversationItemCreate()
            .setItem(VoiceLiveEvents.toOutputItem(callId, result));
        return session.sendEvent(item)
            .then(session.sendEvent(new ClientEventResponseCreate()));
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
            open = false;
            Disposable subscription = events;
            if (subscription != null) {
                subscription.dispose();
            }
            session.close();
            responses.tryEmitComplete();
        });
    }

    @Override
    public boolean isOpen() {
        return open;
    }
}
