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

package com.example.s2s.voicebridge;

import com.example.s2s.voicebridge.ai.AiTestDoubles.FakeConnector;
import com.example.s2s.voicebridge.ai.gemini.GeminiLiveConnector;
import com.example.s2s.voicebridge.ai.voicelive.VoiceLiveConnector;
import com.example.s2s.voicebridge.config.GatewayConfig;
import com.example.s2s.voicebridge.telephony.TelephonyTestDoubles.FakeCall;
import com.example.s2s.voicebridge.telephony.TelephonyTestDoubles.FakeEngineFactory;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class VoiceBridgeGatewayTest {

    private static Map<String, String> environment() {
        Map<String, String> env = new HashMap<>();
        env.put("SIP_EXTENSION", "1001");
        env.put("SIP_SERVER", "pbx.local");
        env.put("GEMINI_API_KEY", "gemini-key");
        env.put("AUDIOSOCKET_BIND_ADDRESS", "127.0.0.1");
        env.put("AUDIOSOCKET_PORT", "0");
        return env;
    }

    @Test
    void shouldCreateConnectorForConfiguredProvider() {
        Map<String, String> env = environment();
        assertThat(VoiceBridgeGateway.createConnector(GatewayConfig.fromEnvironment(env)))
            .isInstanceOf(GeminiLiveConnector.class);

        env.put("AI_PROVIDER", "voicelive");
        env.put("VOICE_LIVE_API_KEY", "vl-key");
        env.put("VOICE_LIVE_ENDPOINT", "https://example.services.ai.azure.com");
        assertThat(VoiceBridgeGateway.createConnector(GatewayConfig.fromEnvironment(env)))
            .isInstanceOf(VoiceLiveConnector.class);
    }

    @Test
    void shouldRegisterAndShutDown() {
        VoiceBridgeGateway gateway = new VoiceBridgeGateway(GatewayConfig.fromEnvironment(environment()),
                                                            new FakeConnector(16000, 24000));
        try {
            gateway.start();

            await().atMost(5, TimeUnit.SECONDS).until(gateway::isRegistered);
        } finally {
            gateway.shutdown();
        }

        assertThat(gateway.isShuttingDown()).isTrue();
        assertThat(gateway.isRegistered()).isFalse();
    }

    @Test
    void shouldSizeMediaFramesFromEngineFactory() {
        FakeEngineFactory engines = new FakeEngineFactory(0, 16000, 320);
        VoiceBridgeGateway gateway = new VoiceBridgeGateway(GatewayConfig.fromEnvironment(environment()),
                                                            new FakeConnector(16000, 24000), engines);
        try {
            gateway.start();
            await().atMost(5, TimeUnit.SECONDS).until(gateway::isRegistered);

            FakeCall call = new FakeCall("call-1");
            engines.engines.get(0).callListener.onCallMediaActive(call);

            await().atMost(5, TimeUnit.SECONDS).until(() -> call.media != null);
            assertThat(call.media.requestFrame()).hasSize(640);
        } finally {
            gateway.shutdown();
        }
    }
}
