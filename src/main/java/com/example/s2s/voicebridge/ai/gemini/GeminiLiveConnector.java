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

import com.example.s2s.voicebridge.ai.AiSessionConnector;
import com.example.s2s.voicebridge.ai.AiSessionOptions;
import com.example.s2s.voicebridge.ai.AiTransport;
import com.google.genai.Client;
import com.google.genai.types.Content;
import com.google.genai.types.FunctionDeclaration;
import com.google.genai.types.LiveConnectConfig;
import com.google.genai.types.Modality;
import com.google.genai.types.Part;
import com.google.genai.types.PrebuiltVoiceConfig;
import com.google.genai.types.SpeechConfig;
import com.google.genai.types.Tool;
import com.google.genai.types.VoiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Opens Gemini Live sessions through the google-genai client.
 *
 * Gemini takes 16 kHz PCM16 and answers with 24 kHz PCM16.
 */
public class GeminiLiveConnector implements AiSessionConnector {
    private static final Logger LOG = LoggerFactory.getLogger(GeminiLiveConnector.class);

    public static final String DEFAULT_MODEL = "gemini-2.5-flash-native-audio-preview-09-2025";
    public static final String DEFAULT_VOICE = "Aoede";
    public static final int INPUT_SAMPLE_RATE = 16000;
    public static final int OUTPUT_SAMPLE_RATE = 24000;

    private final Client client;

    public GeminiLiveConnector(String apiKey) {
        this.client = Client.builder().apiKey(apiKey).build();
        LOG.info("Gemini Live client initialized");
    }

    @Override
    public Mono<AiTransport> connect(AiSessionOptions options) {
        String model = options.getModel() != null ? options.getModel() : DEFAULT_MODEL;
        LiveConnectConfig config = buildConfig(options);
        LOG.info("Connecting to Gemini Live with model: {}", model);
        return Mono.fromFuture(() -> client.async.live.connect(model, config))
            .map(session -> {
                GeminiLiveTransport transport =
                    new GeminiLiveTransport(session, INPUT_SAMPLE_RATE, OUTPUT_SAMPLE_RATE);
                transport.startReceiving();
                return (AiTransport) transport;
            })
            .doOnError(error -> LOG.error("Failed to connect to Gemini Live", error));
    }

    static LiveConnectConfig buildConfig(AiSessionOptions options) {
        String voice = options.getVoice() != null ? options.getVoice() : DEFAULT_VOICE;
        LiveConnectConfig.Builder builder = LiveConnectConfig.builder()
            .responseModalities(Modality.Known.AUDIO)
            .speechConfig(SpeechConfig.builder()
                .voiceConfig(VoiceConfig.builder()
                    .prebuiltVoiceConfig(PrebuiltVoiceConfig.builder().voiceName(voice))));

        String instruction = options.getSystemInstruction();
        if (instruction != null && !instruction.isBlank()) {
            builder.systemInstruction(Content.fromParts(Part.fromText(instruction)));
        }

        if (!options.getTools().isEmpty()) {
            List<FunctionDeclaration> declarations = options.getTools().stream()
                .map(GeminiMessages::toFunctionDeclaration)
                .collect(Collectors.toCollection(ArrayList::new));
            builder.tools(List.of(Tool.builder().functionDeclarations(declarations).build()));
        }
        return builder.build();
    }

    @Override
    public int getInputSampleRate() {
        return INPUT_SAMPLE_RATE;
    }

    @Override
    public int getOutputSampleRate() {
        return OUTPUT_SAMPLE_RATE;
    }

    @Override
    public String getProviderName() {
        return "Gemini";
    }
}
