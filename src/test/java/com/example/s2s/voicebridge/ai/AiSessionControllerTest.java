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

import com.example.s2s.voicebridge.ai.AiTestDoubles.FakeConnector;
import com.example.s2s.voicebridge.ai.AiTestDoubles.FakeTransport;
import com.example.s2s.voicebridge.ai.AiTestDoubles.RecordingListener;
import com.example.s2s.voicebridge.audio.AudioChunk;
import com.example.s2s.voicebridge.audio.DuplexAudioBridge;
import com.example.s2s.voicebridge.tools.ToolRegistry;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;

class AiSessionControllerTest {

    private static final Duration FAST = Duration.ofMillis(10);

    private Scheduler pumps;
    private DuplexAudioBridge bridge;
    private FakeConnector connector;
    private RecordingListener listener;
    private AiSessionController controller;

    @BeforeEach
    void setUp() {
        pumps = Schedulers.newBoundedElastic(8, 100, "test-pumps");
        bridge = new DuplexAudioBridge(8000, 8000, 8000, 100);
        connector = new FakeConnector();
        listener = new RecordingListener();
        controller = newController("Say hello");
    }

    @AfterEach
    void tearDown() {
        controller.stop();
        pumps.dispose();
    }

    private AiSessionController newController(String greeting) {
        AiSessionOptions options = new AiSessionOptions("model", "voice", "be brief", greeting, List.of());
        return new AiSessionController(connector, options, bridge, ToolRegistry.withDefaultTools(), listener,
                                       pumps, FAST, FAST);
    }

    private void startAndAwaitActive() {
        controller.start();
        await().atMost(2, TimeUnit.SECONDS)
               .until(() -> controller.getState() == AiSessionController.State.ACTIVE);
    }

    @Test
    void shouldConnectAndGreetOnceWhenStartedTwice() {
        startAndAwaitActive();

        controller.start();

        assertThat(connector.connects.get()).isEqualTo(1);
        assertThat(connector.last().greetings).containsExactly("Say hello");
        assertThat(controller.isActive()).isTrue();
        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.active.get() == 1);
    }

    @Test
    void shouldIgnoreStartWhileStillConnecting() {
        connector.holdConnects();
        controller.start();

        controller.start();

        assertThat(controller.getState()).isEqualTo(AiSessionController.State.STARTING);
        connector.completePending();
        await().atMost(2, TimeUnit.SECONDS)
               .until(() -> controller.getState() == AiSessionController.State.ACTIVE);
        assertThat(connector.connects.get()).isEqualTo(1);
    }

    @Test
    void shouldTreatStopOnIdleAsNoOp() {
        assertThatCode(controller::stop).doesNotThrowAnyException();
        assertThatCode(controller::stop).doesNotThrowAnyException();

        assertThat(controller.getState()).isEqualTo(AiSessionController.State.IDLE);
        assertThat(connector.connects.get()).isZero();
    }

    @Test
    void shouldSkipGreetingWhenNoneConfigured() {
        controller = newController(null);

        startAndAwaitActive();

        assertThat(connector.last().greetings).isEmpty();
    }

    @Test
    void shouldForwardCallerAudioToTransport() {
        startAndAwaitActive();
        AudioChunk chunk = AudioChunk.of(new byte[320], 8000);

        bridge.submitFromTelephony(chunk);

        FakeTransport transport = connector.last();
        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.sentAudio.size() == 1);
        assertThat(transport.sentAudio.get(0).sameBytes(chunk)).isTrue();
    }

    @Test
    void shouldKeepPumpingAfterSendFailure() {
        startAndAwaitActive();
        FakeTransport transport = connector.last();
        transport.sendFailures.set(1);

        bridge.submitFromTelephony(AudioChunk.of(new byte[320], 8000));
        bridge.submitFromTelephony(AudioChunk.of(new byte[320], 8000));

        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.sentAudio.size() == 1);
        assertThat(controller.isActive()).isTrue();
    }

    @Test
    void shouldSubmitAiAudioToBridge() throws Exception {
        startAndAwaitActive();

        connector.last().emit(new AiResponse.Audio(AudioChunk.of(new byte[640], 8000)));

        AudioChunk played = bridge.pollForTelephony(Duration.ofSeconds(2));
        assertThat(played).isNotNull();
        assertThat(played.length()).isEqualTo(640);
    }

    @Test
    void shouldAnswerToolCallWithResult() {
        startAndAwaitActive();
        FakeTransport transport = connector.last();

        transport.emit(new AiResponse.ToolCall("call-1", "get_service_status", new JsonObject()));

        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.toolResponses.size() == 1);
        AiTestDoubles.ToolResponse response = transport.toolResponses.get(0);
        assertThat(response.callId()).isEqualTo("call-1");
        assertThat(response.name()).isEqualTo("get_service_status");
        assertThat(response.result().isSuccess()).isTrue();
        assertThat(response.result().getResult()).contains("online");
    }

    @Test
    void shouldAnswerUnknownToolWithError() {
        startAndAwaitActive();
        FakeTransport transport = connector.last();

        transport.emit(new AiResponse.ToolCall("call-2", "open_pod_bay_doors", null));

        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.toolResponses.size() == 1);
        ToolResult result = transport.toolResponses.get(0).result();
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("open_pod_bay_doors");
        assertThat(controller.isActive()).isTrue();
    }

    @Test
    void shouldNotifyListenerOnInterruption() {
        startAndAwaitActive();

        connector.last().emit(AiResponse.INTERRUPTED);
        connector.last().emit(new AiResponse.Text("ignored"));

        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.interrupted.get() == 1);
    }

    @Test
    void shouldResubscribeAfterReceiveErrorWhileOpen() throws Exception {
        FakeConnector failingOnce = new FakeConnector() {
            @Override
            public Mono<AiTransport> connect(AiSessionOptions options) {
                return super.connect(options).doOnNext(t -> ((FakeTransport) t).receiveFailures.set(1));
            }
        };
        connector = failingOnce;
        controller = newController(null);
        startAndAwaitActive();

        failingOnce.last().emit(new AiResponse.Audio(AudioChunk.of(new byte[320], 8000)));

        assertThat(bridge.pollForTelephony(Duration.ofSeconds(2))).isNotNull();
        assertThat(controller.isActive()).isTrue();
    }

    @Test
    void shouldEndSessionWhenStreamCompletes() {
        startAndAwaitActive();
        FakeTransport transport = connector.last();

        transport.completeStream();

        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.ended.get() == 1);
        assertThat(controller.getState()).isEqualTo(AiSessionController.State.IDLE);
        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.closeCalls.get() == 1);
    }

    @Test
    void shouldCloseTransportAndReturnToIdleOnStop() {
        startAndAwaitActive();
        FakeTransport transport = connector.last();

        controller.stop();
        controller.stop();

        assertThat(controller.getState()).isEqualTo(AiSessionController.State.IDLE);
        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.closeCalls.get() == 1);
        assertThat(listener.ended.get()).isZero();
    }

    @Test
    void shouldStartFreshSessionAfterStop() {
        startAndAwaitActive();
        controller.stop();

        startAndAwaitActive();

        assertThat(connector.connects.get()).isEqualTo(2);
        assertThat(connector.transports).hasSize(2);
    }

    @Test
    void shouldCloseLateTransportWhenStopWinsRaceWithStart() {
        connector.holdConnects();
        controller.start();

        controller.stop();
        FakeTransport late = connector.completePending();

        assertThat(controller.getState()).isEqualTo(AiSessionController.State.IDLE);
        assertThat(late.greetings).isEmpty();
        assertThat(listener.active.get()).isZero();
    }

    @Test
    void shouldReturnToIdleWhenConnectFails() {
        connector.failConnects(new IllegalStateException("no network"));

        controller.start();

        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.ended.get() == 1);
        assertThat(controller.getState()).isEqualTo(AiSessionController.State.IDLE);
    }
}
