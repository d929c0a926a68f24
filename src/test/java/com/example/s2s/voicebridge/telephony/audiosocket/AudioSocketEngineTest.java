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
import com.example.s2s.voicebridge.telephony.SipIdentity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class AudioSocketEngineTest {

    private static final SipIdentity IDENTITY = new SipIdentity("1001", "pbx.local", 5060);

    private final RecordingCallListener listener = new RecordingCallListener();
    private final List<Integer> registrationStatus = new CopyOnWriteArrayList<>();
    private AudioSocketEngine engine;
    private final List<Socket> clients = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        engine = new AudioSocketEngine("127.0.0.1", 0, 1, listener);
        engine.register(IDENTITY, (status, reason) -> registrationStatus.add(status));
    }

    @AfterEach
    void tearDown() throws IOException {
        engine.shutdown();
        for (Socket client : clients) {
            client.close();
        }
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket("127.0.0.1", engine.getLocalPort());
        socket.setSoTimeout(2000);
        clients.add(socket);
        return socket;
    }

    private Socket connectCall(UUID id) throws IOException {
        Socket socket = connect();
        send(socket, AudioSocketFrame.uuid(id));
        return socket;
    }

    private static void send(Socket socket, AudioSocketFrame frame) throws IOException {
        OutputStream out = socket.getOutputStream();
        frame.writeTo(out);
        out.flush();
    }

    private static DataInputStream in(Socket socket) throws IOException {
        return new DataInputStream(new BufferedInputStream(socket.getInputStream()));
    }

    @Test
    void shouldReportSuccessfulRegistrationWhenListening() {
        assertThat(registrationStatus).containsExactly(200);
        assertThat(engine.isRegistered()).isTrue();
        assertThat(engine.getLocalPort()).isPositive();
    }

    @Test
    void shouldReportServiceUnavailableWhenPortTaken() {
        List<Integer> statuses = new CopyOnWriteArrayList<>();
        AudioSocketEngine second = new AudioSocketEngine("127.0.0.1", engine.getLocalPort(), 1, listener);
        try {
            second.register(IDENTITY, (status, reason) -> statuses.add(status));

            assertThat(statuses).containsExactly(503);
            assertThat(second.isRegistered()).isFalse();
        } finally {
            second.shutdown();
        }
    }

    @Test
    void shouldOfferCallIdentifiedByUuid() throws IOException {
        UUID id = UUID.randomUUID();

        connectCall(id);

        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.incoming.size() == 1);
        assertThat(listener.incoming.get(0).getCallId()).isEqualTo(id.toString());
        assertThat(listener.incoming.get(0).isConnected()).isTrue();
    }

    @Test
    void shouldExchangeAudioAfterAnswer() throws IOException {
        Socket client = connectCall(UUID.randomUUID());
        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.incoming.size() == 1);
        CallHandle call = listener.incoming.get(0);
        RecordingPort port = new RecordingPort((byte) 5);
        call.attachMedia(port);

        call.answer(200);

        assertThat(listener.mediaActive).containsExactly(call);
        DataInputStream in = in(client);
        AudioSocketFrame played = AudioSocketFrame.read(in);
        assertThat(played.getKind()).isEqualTo(AudioSocketFrame.Kind.AUDIO);
        assertThat(played.getPayload()).hasSize(AudioSocketEngine.FRAME_BYTES).containsOnly((byte) 5);

        byte[] captured = new byte[AudioSocketEngine.FRAME_BYTES];
        Arrays.fill(captured, (byte) 9);
        send(client, AudioSocketFrame.audio(captured));
        await().atMost(2, TimeUnit.SECONDS).until(() -> !port.received.isEmpty());
        assertThat(port.received.get(0)).isEqualTo(captured);
    }

    @Test
    void shouldReportDisconnectWhenCallerHangsUp() throws IOException {
        Socket client = connectCall(UUID.randomUUID());
        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.incoming.size() == 1);

        send(client, AudioSocketFrame.hangup());

        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.disconnected.size() == 1);
        assertThat(listener.disconnected.get(0).isConnected()).isFalse();
    }

    @Test
    void shouldReportDisconnectWhenConnectionDrops() throws IOException {
        Socket client = connectCall(UUID.randomUUID());
        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.incoming.size() == 1);

        client.close();

        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.disconnected.size() == 1);
    }

    @Test
    void shouldSendHangupFrameWhenGatewayHangsUp() throws IOException {
        Socket client = connectCall(UUID.randomUUID());
        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.incoming.size() == 1);

        listener.incoming.get(0).hangup();

        DataInputStream in = in(client);
        AudioSocketFrame frame = AudioSocketFrame.read(in);
        assertThat(frame.getKind()).isEqualTo(AudioSocketFrame.Kind.HANGUP);
        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.disconnected.size() == 1);
    }

    @Test
    void shouldHangUpConnectionsBeyondMaxCalls() throws IOException {
        connectCall(UUID.randomUUID());
        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.incoming.size() == 1);

        Socket extra = connect();

        AudioSocketFrame frame = AudioSocketFrame.read(in(extra));
        assertThat(frame.getKind()).isEqualTo(AudioSocketFrame.Kind.HANGUP);
        assertThat(listener.incoming).hasSize(1);
    }

    @Test
    void shouldCloseConnectionWithoutUuid() throws IOException {
        Socket client = connect();

        send(client, AudioSocketFrame.audio(new byte[320]));

        assertThat(in(client).read()).isEqualTo(-1);
        assertThat(listener.incoming).isEmpty();
        assertThat(listener.disconnected).isEmpty();
    }

    @Test
    void shouldStopListeningOnShutdown() {
        engine.shutdown();

        assertThat(engine.isRegistered()).isFalse();
    }

    private static final class RecordingCallListener implements CallEventListener {
        final List<CallHandle> incoming = new CopyOnWriteArrayList<>();
        final List<CallHandle> mediaActive = new CopyOnWriteArrayList<>();
        final List<CallHandle> disconnected = new CopyOnWriteArrayList<>();

        @Override
        public void onIncomingCall(CallHandle call) {
            incoming.add(call);
        }

        @Override
        public void onCallMediaActive(CallHandle call) {
            mediaActive.add(call);
        }

        @Override
        public void onCallDisconnected(CallHandle call) {
            disconnected.add(call);
        }
    }

    private static final class RecordingPort implements MediaPort {
        final List<byte[]> received = new CopyOnWriteArrayList<>();
        private final byte fill;

        RecordingPort(byte fill) {
            this.fill = fill;
        }

        @Override
        public void onFrameReceived(byte[] frame) {
            received.add(frame);
        }

        @Override
        public byte[] requestFrame() {
            byte[] frame = new byte[AudioSocketEngine.FRAME_BYTES];
            Arrays.fill(frame, fill);
            return frame;
        }
    }
}
