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
import com.example.s2s.voicebridge.telephony.RegistrationListener;
import com.example.s2s.voicebridge.telephony.SipIdentity;
import com.example.s2s.voicebridge.telephony.TelephonyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Telephony engine fed by Asterisk's {@code AudioSocket()} dialplan application.
 *
 * <p>Asterisk owns the SIP side (registration with the PBX, codecs, RTP) and connects to this
 * engine over TCP for every call it routes here, streaming signed linear 16-bit audio at
 * 8 kHz in 20 ms frames. "Registering" therefore means listening: the engine is registered
 * while its server socket accepts connections.
 *
 * <pre>
 *   PBX (SIP/RTP) → Asterisk AudioSocket() (TCP client) → AudioSocketEngine (TCP server)
 *                                                          ↓
 *                                                   realtime AI session
 * </pre>
 */
public class AudioSocketEngine implements TelephonyEngine {
    private static final Logger LOG = LoggerFactory.getLogger(AudioSocketEngine.class);

    public static final int SAMPLE_RATE = 8000;
    public static final int FRAME_MILLIS = 20;
    public static final int SAMPLES_PER_FRAME = SAMPLE_RATE * FRAME_MILLIS / 1000;
    public static final int FRAME_BYTES = SAMPLES_PER_FRAME * 2;

    private final String bindAddress;
    private final int port;
    private final int maxCalls;
    private final CallEventListener callListener;
    private final ExecutorService connectionExecutor;
    private final ScheduledExecutorService clock;
    private final Set<AudioSocketCall> calls = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private volatile boolean running;
    private boolean shutDown;

    public AudioSocketEngine(String bindAddress, int port, int maxCalls, CallEventListener callListener) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.maxCalls = maxCalls;
        this.callListener = callListener;
        AtomicInteger connectionCount = new AtomicInteger();
        this.connectionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "AudioSocket-Call-" + connectionCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.clock = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "AudioSocket-Transmit-Clock");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized void register(SipIdentity identity, RegistrationListener listener) {
        if (shutDown) {
            listener.onRegistrationState(503, "Engine has been shut down");
            return;
        }
        if (running) {
            listener.onRegistrationState(200, "Already listening on " + describeAddress());
            return;
        }
        LOG.info("Opening AudioSocket listener on {}:{} for {}", bindAddress, port, identity.getAddressOfRecord());
        try {
            ServerSocket socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(InetAddress.getByName(bindAddress), port));
            serverSocket = socket;
            running = true;
        } catch (IOException e) {
            LOG.error("Failed to open AudioSocket listener on {}:{}", bindAddress, port, e);
            listener.onRegistrationState(503, "Cannot listen on " + bindAddress + ":" + port + ": " + e.getMessage());
            return;
        }

        Thread acceptor = new Thread(this::acceptLoop, "AudioSocket-Acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        LOG.info("AudioSocket engine listening on {}", describeAddress());
        listener.onRegistrationState(200, "Listening on " + describeAddress());
    }

    private void acceptLoop() {
        ServerSocket server = serverSocket;
        while (running) {
            try {
                Socket client = server.accept();
                client.setTcpNoDelay(true);
                if (calls.size() >= maxCalls) {
                    LOG.warn("Refusing AudioSocket connection from {}: {} call(s) already active",
                             client.getRemoteSocketAddress(), calls.size());
                    refuse(client);
                    continue;
                }
                LOG.info("Accepted AudioSocket connection from {}", client.getRemoteSocketAddress());
                AudioSocketCall call = new AudioSocketCall(client, callListener, clock, FRAME_BYTES, FRAME_MILLIS,
                                                           calls::remove);
                calls.add(call);
                connectionExecutor.submit(call);
            } catch (IOException e) {
                if (running) {
                    LOG.error("Error accepting AudioSocket connection", e);
                }
            }
        }
        LOG.info("AudioSocket acceptor stopped");
    }

    private static void refuse(Socket client) {
        try (Socket s = client) {
            AudioSocketFrame.hangup().writeTo(s.getOutputStream());
            s.getOutputStream().flush();
        } catch (IOException e) {
            LOG.debug("Error refusing connection: {}", e.getMessage());
        }
    }

    @Override
    public boolean isRegistered() {
        ServerSocket socket = serverSocket;
        return running && socket != null && !socket.isClosed();
    }

    @Override
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        LOG.info("Shutting down AudioSocket engine...");
        running = false;
        ServerSocket socket = serverSocket;
        serverSocket = null;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                LOG.error("Error closing AudioSocket listener", e);
            }
        }
        for (AudioSocketCall call : calls) {
            call.hangup();
        }
        connectionExecutor.shutdown();
        clock.shutdownNow();
        LOG.info("AudioSocket engine shutdown complete");
    }

    /**
     * @return the port actually bound, useful when configured with port 0
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : -1;
    }

    private String describeAddress() {
        ServerSocket socket = serverSocket;
        return bindAddress + ":" + (socket != null ? socket.getLocalPort() : port);
    }
}
