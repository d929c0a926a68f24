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
import com.example.s2s.voicebridge.audio.DuplexAudioBridge;
import com.example.s2s.voicebridge.tools.ToolExecutionException;
import com.example.s2s.voicebridge.tools.ToolExecutor;
import com.example.s2s.voicebridge.tools.UnknownToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one AI session for one call.
 *
 * <p>{@link #start()} connects asynchronously, sends the greeting and then runs two pumps on
 * the pump scheduler: the outbound pump moves caller audio from the bridge to the AI, the
 * inbound pump moves AI responses into the bridge and answers tool calls. {@link #stop()}
 * cancels both pumps and closes the transport without waiting for the close to finish.
 *
 * <p>State moves {@code IDLE -> STARTING -> ACTIVE -> STOPPING -> IDLE}. Every start bumps a
 * session epoch and every stop bumps it again, so work scheduled for an earlier session
 * (a slow connect, a pump that has not noticed cancellation yet) recognises itself as stale
 * and backs out.
 */
public class AiSessionController {
    private static final Logger LOG = LoggerFactory.getLogger(AiSessionController.class);

    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(100);

    public enum State {
        IDLE, STARTING, ACTIVE, STOPPING
    }

    private final AiSessionConnector connector;
    private final AiSessionOptions options;
    private final DuplexAudioBridge bridge;
    private final ToolExecutor tools;
    private final AiSessionListener listener;
    private final Scheduler pumpScheduler;
    private final Duration pollTimeout;
    private final Duration retryBackoff;

    private final Object lock = new Object();
    private final AtomicLong epoch = new AtomicLong();
    private volatile State state = State.IDLE;

    // guarded by lock
    private AiTransport transport;
    private Disposable connecting;
    private Disposable outboundPump;
    private Disposable inboundPump;

    public AiSessionController(AiSessionConnector connector, AiSessionOptions options, DuplexAudioBridge bridge,
                               ToolExecutor tools, AiSessionListener listener, Scheduler pumpScheduler) {
        this(connector, options, bridge, tools, listener, pumpScheduler, DEFAULT_POLL_TIMEOUT, DEFAULT_RETRY_BACKOFF);
    }

    public AiSessionController(AiSessionConnector connector, AiSessionOptions options, DuplexAudioBridge bridge,
                               ToolExecutor tools, AiSessionListener listener, Scheduler pumpScheduler,
                               Duration pollTimeout, Duration retryBackoff) {
        this.connector = connector;
        this.options = options;
        this.bridge = bridge;
        this.tools = tools;
        this.listener = listener != null ? listener : AiSessionListener.NOOP;
        this.pumpScheduler = pumpScheduler;
        this.pollTimeout = pollTimeout;
        this.retryBackoff = retryBackoff;
    }

    /**
     * Starts the session. Does nothing, apart from a warning, if a session is already
     * starting or running.
     */
    public void start() {
        long session;
        synchronized (lock) {
            if (state != State.IDLE) {
                LOG.warn("AI session start ignored, controller is already {}", state);
                return;
            }
            state = State.STARTING;
            session = epoch.incrementAndGet();
        }
        LOG.info("Starting {} AI session with {}", connector.getProviderName(), options);

        Disposable subscription = connector.connect(options)
            .subscribeOn(pumpScheduler)
            .publishOn(pumpScheduler)
            .subscribe(
                t -> onConnected(t, session),
                error -> onConnectFailed(error, session));

        synchronized (lock) {
            if (epoch.get() == session && state == State.STARTING) {
                connecting = subscription;
                return;
            }
        }
        // stop() got in while connect was being subscribed
        subscription.dispose();
    }

    /**
     * Stops the session. Safe to call in any state and more than once.
     */
    public void stop() {
        if (teardown(-1, false)) {
            LOG.info("AI session stopped");
        } else {
            LOG.debug("AI session stop ignored, controller is {}", state);
        }
    }

    public State getState() {
        return state;
    }

    /**
     * @return true while a session is starting or running
     */
    public boolean isActive() {
        State current = state;
        return current == State.STARTING || current == State.ACTIVE;
    }

    private void onConnected(AiTransport connected, long session) {
        boolean stale;
        synchronized (lock) {
            stale = epoch.get() != session || state != State.STARTING;
            if (!stale) {
                transport = connected;
                connecting = null;
            }
        }
        if (stale) {
            LOG.info("AI session connected after it was stopped, closing it");
            closeQuietly(connected);
            return;
        }
        LOG.info("✓ {} AI session connected", connector.getProviderName());

        String greeting = options.getGreetingPrompt();
        if (greeting != null && !greeting.isBlank()) {
            try {
                connected.sendGreeting(greeting).block();
                LOG.info("Greeting trigger sent");
            } catch (RuntimeException e) {
                LOG.warn("Failed to send greeting trigger: {}", e.getMessage());
            }
        }

        synchronized (lock) {
            if (epoch.get() != session || state != State.STARTING) {
                return;
            }
            state = State.ACTIVE;
            outboundPump = pumpScheduler.schedule(() -> runOutboundPump(connected, session));
            inboundPump = pumpScheduler.schedule(() -> runInboundPump(connected, session));
        }
        listener.onSessionActive();
    }

    private void onConnectFailed(Throwable error, long session) {
        boolean current;
        synchronized (lock) {
            current = epoch.get() == session && state == State.STARTING;
            if (current) {
                state = State.IDLE;
                connecting = null;
            }
        }
        if (current) {
            LOG.error("Failed to connect {} AI session", connector.getProviderName(), error);
            listener.onSessionEnded();
        } else {
            LOG.debug("Connect failure of a stopped AI session: {}", error.getMessage());
        }
    }

    private void runOutboundPump(AiTransport t, long session) {
        LOG.debug("Outbound audio pump started");
        long sent = 0;
        while (isRunning(session)) {
            try {
                AudioChunk chunk = bridge.pollForAi(pollTimeout);
                if (chunk == null) {
                    continue;
                }
                t.sendAudio(chunk).block();
                sent++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                if (!isRunning(session)) {
                    break;
                }
                LOG.warn("Error sending audio to AI session, retrying: {}", e.getMessage());
                if (!backOff()) {
                    break;
                }
            }
        }
        LOG.debug("Outbound audio pump finished after {} chunks", sent);
    }

    private void runInboundPump(AiTransport t, long session) {
        LOG.debug("Inbound response pump started");
        while (isRunning(session)) {
            try {
                t.receive()
                    .doOnNext(response -> handleResponse(t, response))
                    .blockLast();
                if (isRunning(session)) {
                    LOG.info("AI session closed by the provider");
                    endSession(session);
                }
                break;
            } catch (RuntimeException e) {
                if (!isRunning(session)) {
                    break;
                }
                if (!t.isOpen()) {
                    LOG.warn("AI transport closed: {}", e.getMessage());
                    endSession(session);
                    break;
                }
                LOG.warn("Error reading from AI session, retrying", e);
                if (!backOff()) {
                    break;
                }
            }
        }
        LOG.debug("Inbound response pump finished");
    }

    private void handleResponse(AiTransport t, AiResponse response) {
        try {
            if (response instanceof AiResponse.Audio audio) {
                bridge.submitFromAi(audio.chunk());
            } else if (response instanceof AiResponse.ToolCall call) {
                handleToolCall(t, call);
            } else if (response instanceof AiResponse.Text text) {
                LOG.info("AI text: {}", text.text());
            } else if (response instanceof AiResponse.Interrupted) {
                LOG.info("AI reported barge-in");
                listener.onInterrupted();
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to handle {} from AI session", response.getClass().getSimpleName(), e);
        }
    }

    private void handleToolCall(AiTransport t, AiResponse.ToolCall call) {
        LOG.info("AI requested tool {} (call id {})", call.name(), call.callId());
        ToolResult result;
        try {
            result = ToolResult.success(tools.execute(call.name(), call.arguments()));
        } catch (UnknownToolException | ToolExecutionException e) {
            result = ToolResult.failure(e.getMessage());
        }
        t.respondToTool(call.callId(), call.name(), result).block();
        LOG.debug("Tool response sent for {}: {}", call.name(), result);
    }

    private void endSession(long session) {
        if (teardown(session, true)) {
            LOG.info("AI session ended");
            listener.onSessionEnded();
        }
    }

    /**
     * @param expectedSession only tear down this session, or any session if negative
     * @param fromInboundPump the caller is the inbound pump, which must not interrupt itself
     * @return true if a session was torn down
     */
    private boolean teardown(long expectedSession, boolean fromInboundPump) {
        AiTransport t;
        Disposable pendingConnect;
        Disposable outbound;
        Disposable inbound;
        synchronized (lock) {
            if (state == State.IDLE || state == State.STOPPING) {
                return false;
            }
            if (expectedSession >= 0 && epoch.get() != expectedSession) {
                return false;
            }
            state = State.STOPPING;
            epoch.incrementAndGet();
            t = transport;
            pendingConnect = connecting;
            outbound = outboundPump;
            inbound = inboundPump;
            transport = null;
            connecting = null;
            outboundPump = null;
            inboundPump = null;
        }

        if (pendingConnect != null) {
            pendingConnect.dispose();
        }
        if (outbound != null) {
            outbound.dispose();
        }
        if (inbound != null && !fromInboundPump) {
            inbound.dispose();
        }
        if (t != null) {
            closeQuietly(t);
        }

        synchronized (lock) {
            state = State.IDLE;
        }
        return true;
    }

    private boolean isRunning(long session) {
        return state == State.ACTIVE && epoch.get() == session && !Thread.currentThread().isInterrupted();
    }

    private boolean backOff() {
        try {
            Thread.sleep(retryBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void closeQuietly(AiTransport t) {
        t.close().subscribe(
            v -> { },
            error -> LOG.warn("Error closing AI transport: {}", error.getMessage()));
    }
}
