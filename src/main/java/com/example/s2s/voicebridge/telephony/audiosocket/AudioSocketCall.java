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

package com.example.s2s.voicebridge.telephony.audiosocket;

import com.example.s2s.voicebridge.telephony.CallEventListener;
import com.example.s2s.voicebridge.telephony.CallHandle;
import com.example.s2s.voicebridge.telephony.MediaPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One AudioSocket connection. The connection's reader thread runs {@link #run()}; once the
 * call is answered a transmit clock writes one frame to Asterisk every frame period.
 */
class AudioSocketCall implements CallHandle, Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(AudioSocketCall.class);

    private final Socket socket;
    private final CallEventListener listener;
    private final ScheduledExecutorService clock;
    private final int frameBytes;
    private final long frameMillis;
    private final Consumer<AudioSocketCall> onFinished;

    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean disconnectReported = new AtomicBoolean();
    private volatile String callId;
    private volatile MediaPort media;
    private volatile boolean offered;
    private volatile boolean answered;
    private volatile ScheduledFuture<?> transmitTask;
    private OutputStream out;

    AudioSocketCall(Socket socket, CallEventListener listener, ScheduledExecutorService clock,
                    int frameBytes, long frameMillis, Consumer<AudioSocketCall> onFinished) {
        this.socket = socket;
        this.listener = listener;
        this.clock = clock;
        this.frameBytes = frameBytes;
        this.frameMillis = frameMillis;
        this.onFinished = onFinished;
        this.callId = String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public void run() {
        try {
            DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            synchronized (writeLock) {
                out = new BufferedOutputStream(socket.getOutputStream());
            }

            AudioSocketFrame first = AudioSocketFrame.read(in);
            if (first == null || first.getKind() != AudioSocketFrame.Kind.UUID) {
                LOG.error("AudioSocket connection from {} did not start with a UUID frame ({}), closing",
                          socket.getRemoteSocketAddress(), first);
                close();
                return;
            }
            callId = first.asUuid().toString();
            LOG.info("Incoming call {} from {}", callId, socket.getRemoteSocketAddress());
            offered = true;
            listener.onIncomingCall(this);

            readLoop(in);
        } catch (IOException e) {
            if (!closed.get()) {
                LOG.warn("AudioSocket connection for call {} failed: {}", callId, e.getMessage());
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected error on call {}", callId, e);
        } finally {
            close();
            reportDisconnected();
            onFinished.accept(this);
        }
    }

    private void readLoop(DataInputStream in) throws IOException {
        while (!closed.get()) {
            AudioSocketFrame frame = AudioSocketFrame.read(in);
            if (frame == null) {
                LOG.info("Call {} connection closed by Asterisk", callId);
                return;
            }
            switch (frame.getKind()) {
                case AUDIO:
                    MediaPort port = media;
                    if (answered && port != null) {
                        port.onFrameReceived(frame.getPayload());
                    }
                    break;
                case HANGUP:
                    LOG.info("Call {} hung up by caller", callId);
                    return;
                case ERROR:
                    LOG.warn("Asterisk reported error {} on call {}", frame.errorCode(), callId);
                    return;
                case DTMF:
                    LOG.info("DTMF '{}' on call {}", frame.asDtmf(), callId);
                    break;
                default:
                    LOG.debug("Ignoring {} on call {}", frame, callId);
                    break;
            }
        }
    }

    @Override
    public String getCallId() {
        return callId;
    }

    @Override
    public void answer(int statusCode) {
        if (closed.get()) {
            LOG.warn("Cannot answer call {}, it is already gone", callId);
            return;
        }
        if (statusCode != 200) {
            LOG.info("Rejecting call {} with status {}", callId, statusCode);
            hangup();
            return;
        }
        if (answered) {
            return;
        }
        answered = true;
        transmitTask = clock.scheduleAtFixedRate(this::transmitFrame, 0, frameMillis, TimeUnit.MILLISECONDS);
        LOG.info("Call {} answered", callId);
        listener.onCallMediaActive(this);
    }

    @Override
    public void hangup() {
        if (closed.get()) {
            return;
        }
        LOG.info("Hanging up call {}", callId);
        try {
            send(AudioSocketFrame.hangup());
        } catch (IOException e) {
            LOG.debug("Could not send hangup frame for call {}: {}", callId, e.getMessage());
        }
        close();
    }

    @Override
    public void attachMedia(MediaPort port) {
        this.media = port;
    }

    @Override
    public boolean isConnected() {
        return !closed.get();
    }

    private void transmitFrame() {
        if (closed.get()) {
            return;
        }
        MediaPort port = media;
        byte[] frame = port != null ? port.requestFrame() : new byte[frameBytes];
        try {
            send(AudioSocketFrame.audio(frame));
        } catch (IOException e) {
            LOG.debug("Transmit failed on call {}: {}", callId, e.getMessage());
            close();
        } catch (RuntimeException e) {
            LOG.error("Error producing playback frame for call {}", callId, e);
        }
    }

    private void send(AudioSocketFrame frame) throws IOException {
        synchronized (writeLock) {
            if (out == null) {
                throw new IOException("connection not ready");
            }
            frame.writeTo(out);
            out.flush();
        }
    }

    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> task = transmitTask;
        if (task != null) {
            task.cancel(false);
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Error closing socket for call {}: {}", callId, e.getMessage());
        }
    }

    // Only calls that were offered to the listener are reported.
    private void reportDisconnected() {
        if (offered && disconnectReported.compareAndSet(false, true)) {
            LOG.info("Call {} disconnected", callId);
            listener.onCallDisconnected(this);
        }
    }
}
