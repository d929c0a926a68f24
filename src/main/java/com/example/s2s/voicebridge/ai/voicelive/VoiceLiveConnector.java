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

import com.azure.ai.voicelive.VoiceLiveAsyncClient;
import com.azure.ai.voicelive.VoiceLiveClientBuilder;
import com.azure.ai.voicelive.VoiceLiveServiceVersion;
import com.azure.ai.voicelive.models.AudioEchoCancellation;
import com.azure.ai.voicelive.models.AudioNoiseReduction;
import com.azure.ai.voicelive.models.AudioNoiseReductionType;
import com.azure.ai.voicelive.models.AzureSemanticVadTurnDetection;
import com.azure.ai.voicelive.models.AzureStandardVoice;
import com.azure.ai.voicelive.models.ClientEventSessionUpdate;
import com.azure.ai.voicelive.models.InputAudioFormat;
import com.azure.ai.voicelive.models.InteractionModality;
import com.azure.ai.voicelive.models.OutputAudioFormat;
import com.azure.ai.voicelive.models.VoiceLiveSessionOptions;
import com.azure.ai.voicelive.models.VoiceLiveToolDefinition;
import com.azure.core.credential.KeyCredential;
import com.azure.core.util.BinaryData;
import com.example.s2s.voicebridge.ai.AiSessionConnector;
import com.example.s2s.voicebridge.ai.AiSessionOptions;
import com.example.s2s.voicebridge.ai.AiTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Opens Azure Voice Live sessions using the official Azure SDK.
 *
 * Voice Live runs semantic VAD, deep noise suppression and echo cancellation server-side,
 * and takes and returns PCM16 at 24 kHz.
 */
public class VoiceLiveConnector implements AiSessionConnector {
    private static final Logger LOG = LoggerFactory.getLogger(VoiceLiveConnector.class);

    public static final String DEFAULT_MODEL = "gpt-4o";
    public static final String DEFAULT_VOICE = "en-US-Ava:DragonHDLatestNeural";
    public static final int SAMPLE_RATE = 24000;

    private static final Duration SESSION_READY_TIMEOUT = Duration.ofSeconds(10);

    private final VoiceLiveAsyncClient client;

    public VoiceLiveConnector(String endpoint, String apiKey) {
        this.client = new VoiceLiveClientBuilder()
            .endpoint(endpoint)
            .credential(new KeyCredential(apiKey))
            .serviceVersion(VoiceLiveServiceVersion.V2025_10_01)
            .buildAsyncClient();
        LOG.info("Voice Live client initialized with endpoint: {}", endpoint);
    }

    @Override
    public Mono<AiTransport> connect(AiSessionOptions options) {
        String model = options.getModel() != null ? options.getModel() : DEFAULT_MODEL;
        LOG.info("Starting Voice Live session with model: {}", model);
        return client.startSession(model)
            .flatMap(session -> {
                VoiceLiveTransport transport = new VoiceLiveTransport(session, SAMPLE_RATE, SAMPLE_RATE);
                transport.startReceiving();
                return session.sendEvent(new ClientEventSessionUpdate(createSessionOptions(options)))
                    .doOnSuccess(v -> LOG.info("Session configuration sent successfully"))
                    .then(transport.awaitReady(SESSION_READY_TIMEOUT))
                    .thenReturn((AiTransport) transport)
                    .onErrorResume(error -> transport.close().then(Mono.error(error)));
            })
            .doOnError(error -> LOG.error("Failed to start Voice Live session", error));
    }

    static VoiceLiveSessionOptions createSessionOptions(AiSessionOptions options) {
        AzureSemanticVadTurnDetection vad = new AzureSemanticVadTurnDetection()
            .setThreshold(0.3)
            .setPrefixPaddingMs(300)
            .setSilenceDurationMs(500)
            .setInterruptResponse(true)
            .setAutoTruncate(true)
            .setCreateResponse(true);

        String voice = options.getVoice() != null ? options.getVoice() : DEFAULT_VOICE;
        VoiceLiveSessionOptions sessionOptions = new VoiceLiveSessionOptions()
            .setInstructions(options.getSystemInstruction())
            .setModalities(Arrays.asList(InteractionModality.TEXT, InteractionModality.AUDIO))
            .setVoice(BinaryData.fromObject(new AzureStandardVoice(voice)))
            .setInputAudioFormat(InputAudioFormat.PCM16)
            .setOutputAudioFormat(OutputAudioFormat.PCM16)
            .setInputAudioSamplingRate(SAMPLE_RATE)
            .setTurnDetection(vad)
            .setInputAudioNoiseReduction(new AudioNoiseReduction(AudioNoiseReductionType.AZURE_DEEP_NOISE_SUPPRESSION))
            .setInputAudioEchoCancellation(new AudioEchoCancellation());

        if (!options.getTools().isEmpty()) {
            List<VoiceLiveToolDefinition> tools = new ArrayList<>();
            options.getTools().forEach(tool -> tools.add(VoiceLiveEvents.toFunctionDefinition(tool)));
            sessionOptions.setTools(tools);
            LOG.info("✓ Session configured with {} tools", tools.size());
        }
        return sessionOptions;
    }

    @Override
    public int getInputSampleRate() {
        return SAMPLE_RATE;
    }

    @Override
    public int getOutputSampleRate() {
        return SAMPLE_RATE;
    }

    @Override
    public String getProviderName() {
        return "Voice Live";
    }
}
