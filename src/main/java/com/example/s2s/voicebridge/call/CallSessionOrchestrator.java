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
import com.example.s2s.voicebridge.ai.AiSessionControllerFactory;
import com.example.s2s.voicebridge.ai.AiSessionListener;
import com.example.s2s.voicebridge.audio.AudioChunk;
import com.example.s2s.voicebridge.audio.DuplexAudioBridge;
import com.example.s2s.voicebridge.audio.FrameAssembler;
import com.example.s2s.voicebridge.telephony.CallEventListener;
import com.example.s2s.voicebridge.telephony.CallHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Glues call-state events from the telephony engine to the AI session of the call.
 *
 * <p>Engine callbacks are never handled on the engine's thread: each is handed to the
 * single-threaded lifecycle scheduler, which owns all orchestrator state. The blocking
 * playback pump runs on the pump scheduler.
 *
 * <p>Every call gets a new generation number, and the generation moves on again when the
 * call ends. Work scheduled for a call (the delayed answer, the playback pump, AI session
 * callbacks) carries the generation it was created for and does nothing once it is stale,
 * so a late event can never start a second AI session or touch the next call.
 */
public class CallSessionOrchestrator implements CallEventListener {
    private static final Logger LOG = LoggerFactory.getLogger(CallSessionOrchestrator.class);

    private static final Duration PLAYBACK_POLL_TIMEOUT = Duration.ofMillis(100);
    private static final long PLAYBACK_ERROR_BACKOFF_MS = 100;

    private final DuplexAudioBridge bridge;
    private final AiSessionControllerFactory controllerFactory;
    private final Scheduler lifecycleScheduler;
    private final Scheduler pumpScheduler;
    private final Duration answerDelay;
    private final int sampleRate;
    private final int samplesPerFrame;

    private final AtomicLong generation = new AtomicLong();
    private volatile CallSession current;
    private CallHandle lastEndedCall;

    /**
     * @param sampleRate telephony media sample rate
     * @param samplesPerFrame samples per telephony media frame
     */
    public CallSessionOrchestrator(DuplexAudioBridge bridge, AiSessionControllerFactory controllerFactory,
                                   Scheduler lifecycleScheduler, Scheduler pumpScheduler, Duration answerDelay,
                                   int sampleRate, int samplesPerFrame) {
        this.bridge = bridge;
        this.controllerFactory = controllerFactory;
        this.lifecycleScheduler = lifecycleScheduler;
        this.pumpScheduler = pumpScheduler;
        this.answerDelay = answerDelay;
        this.sampleRate = sampleRate;
        this.samplesPerFrame = samplesPerFrame;
    }

    // ********************* Engine callbacks (engine threads) *********************

    @Override
    public void onIncomingCall(CallHandle call) {
        lifecycleScheduler.schedule(() -> handleIncomingCall(call));
    }

    @Override
    public void onCallMediaActive(CallHandle call) {
        lifecycleScheduler.schedule(() -> handleMediaActive(call));
    }

    @Override
    public void onCallDisconnected(CallHandle call) {
        lifecycleScheduler.schedule(() -> handleCallEnded(call));
    }

    // ********************* Lifecycle scheduler *********************

    private void handleIncomingCall(CallHandle call) {
        CallSession session = current;
        if (session != null) {
            LOG.warn("Refusing call {}: call {} is still in progress", call.getCallId(), session.getCall().getCallId());
            call.hangup();
            return;
        }
        session = newSession(call);
        LOG.info("📞 Incoming call {} - answering in {} ms", call.getCallId(), answerDelay.toMillis());

        long gen = session.getGeneration();
        if (answerDelay.isZero() || answerDelay.isNegative()) {
            answerIfCurrent(gen);
        } else {
            lifecycleScheduler.schedule(() -> answerIfCurrent(gen), answerDelay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void answerIfCurrent(long gen) {
        CallSession session = current;
        if (session == null || session.getGeneration() != gen || session.getState() != CallState.RINGING) {
            LOG.debug("Skipping answer for call generation {}, call has moved on", gen);
            return;
        }
        LOG.info("Answering call {}", session.getCall().getCallId());
        try {
            session.getCall().answer(200);
        } catch (RuntimeException e) {
            LOG.error("Failed to answer call {}", session.getCall().getCallId(), e);
        }
    }

    private void handleMediaActive(CallHandle call) {
        if (!call.isConnected() || call == lastEndedCall) {
            LOG.info("Ignoring media-active for call {}, it has already ended", call.getCallId());
            return;
        }
        CallSession session = current;
        if (session == null) {
            session = newSession(call);
        } else if (!session.isFor(call)) {
            LOG.warn("Ignoring media-active for call {}, call {} is in progress",
                     call.getCallId(), session.getCall().getCallId());
            return;
        }
        if (session.getController() != null) {
            LOG.info("Call media-active event received, but AI session already exists - skipping");
            return;
        }

        LOG.info("Call {} connected - starting AI session", call.getCallId());
        bridge.resetForNewCall();
        FrameAssembler assembler = session.getFrameAssembler();
        assembler.clear();
        call.attachMedia(assembler);
        session.setState(CallState.MEDIA_ACTIVE);

        long gen = session.getGeneration();
        AiSessionController controller = controllerFactory.create(new SessionListener(gen));
        session.setController(controller);
        controller.start();

        CallSession owner = session;
        session.setPlaybackPump(pumpScheduler.schedule(() -> runPlaybackPump(owner)));
    }

    private void handleCallEnded(CallHandle call) {
        CallSession session = current;
        if (session == null || !session.isFor(call)) {
            LOG.debug("Disconnect for call {} with no matching session", call.getCallId());
            return;
        }
        endSession(session);
    }

    private void endSession(CallSession session) {
        LOG.info("Call {} ended - stopping AI session", session.getCall().getCallId());
        session.setState(CallState.ENDED);
        generation.incrementAndGet();
        current = null;
        lastEndedCall = session.getCall();

        AiSessionController controller = session.getController();
        if (controller != null) {
            controller.stop();
        }
        if (session.getPlaybackPump() != null) {
            session.getPlaybackPump().dispose();
        }
        session.getFrameAssembler().clear();
        session.getCall().attachMedia(null);
        LOG.info("AI session stopped");
    }

    private CallSession newSession(CallHandle call) {
        long gen = generation.incrementAndGet();
        FrameAssembler assembler = new FrameAssembler(bridge, sampleRate, samplesPerFrame, 2);
        CallSession session = new CallSession(call, gen, assembler);
        current = session;
        return session;
    }

    private boolean isCurrent(long gen) {
        CallSession session = current;
        return session != null && session.getGeneration() == gen && generation.get() == gen;
    }

    // ********************* Pump scheduler *********************

    private void runPlaybackPump(CallSession session) {
        long gen = session.getGeneration();
        FrameAssembler assembler = session.getFrameAssembler();
        LOG.debug("Starting playback loop");
        while (isCurrent(gen) && !Thread.currentThread().isInterrupted()) {
            try {
                // A barge-in clear between poll and append bumps the epoch and drops the chunk.
                long epoch = assembler.playbackEpoch();
                AudioChunk chunk = bridge.pollForTelephony(PLAYBACK_POLL_TIMEOUT);
                if (chunk != null && isCurrent(gen)) {
                    assembler.appendPlaybackAudio(chunk, epoch);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                LOG.error("Playback loop error", e);
                try {
                    Thread.sleep(PLAYBACK_ERROR_BACKOFF_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        LOG.debug("Playback loop ended");
    }

    // ********************* Queries and shutdown *********************

    /**
     * @return the state of the current call, {@link CallState#NO_CALL} if there is none
     */
    public CallState getCallState() {
        CallSession session = current;
        return session != null ? session.getState() : CallState.NO_CALL;
    }

    public CallSession getCurrentSession() {
        return current;
    }

    /**
     * Hangs up and tears down the current call, if any. Waits for the teardown to run on the
     * lifecycle scheduler.
     */
    public void shutdown(Duration timeout) {
        Mono.fromRunnable(() -> {
                CallSession session = current;
                if (session != null) {
                    endSession(session);
                    session.getCall().hangup();
                }
            })
            .subscribeOn(lifecycleScheduler)
            .block(timeout);
    }

    private final class SessionListener implements AiSessionListener {
        private final long gen;

        SessionListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onSessionActive() {
            LOG.info("✓ AI session active for call generation {}", gen);
        }

        @Override
        public void onInterrupted() {
            lifecycleScheduler.schedule(() -> {
                CallSession session = current;
                if (isCurrent(gen) && session != null) {
                    bridge.clearPlayback();
                    session.getFrameAssembler().clear();
                }
            });
        }

        @Override
        public void onSessionEnded() {
            lifecycleScheduler.schedule(() -> {
                if (isCurrent(gen)) {
                    LOG.warn("AI session ended while the call is still up, caller will hear silence");
                }
            });
        }
    }
}
