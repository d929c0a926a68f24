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

package com.example.s2s.voicebridge.config;

import com.example.s2s.voicebridge.exception.ConfigurationException;
import com.example.s2s.voicebridge.telephony.SipIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gateway configuration, read from environment variables.
 *
 * Required:
 * - GEMINI_API_KEY when AI_PROVIDER is gemini (the default)
 * - VOICE_LIVE_API_KEY and VOICE_LIVE_ENDPOINT when AI_PROVIDER is voicelive
 *
 * Everything else has a default, see {@link #fromEnvironment(Map)}. SIP_EXTENSION, SIP_SERVER
 * and SIP_PORT only label the gateway in the logs.
 */
public class GatewayConfig {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayConfig.class);

    public static final String DEFAULT_SIP_EXTENSION = "voicebridge";
    public static final String DEFAULT_SIP_SERVER = "localhost";
    public static final String SYSTEM_INSTRUCTION_RESOURCE = "system_instruction.txt";
    public static final String DEFAULT_SYSTEM_INSTRUCTION =
        "You are a helpful AI voice assistant answering a phone call. Keep responses brief and "
        + "conversational, one or two sentences at a time.";
    public static final String DEFAULT_GREETING_PROMPT = "The call has just connected. Greet the caller!";

    private final SipIdentity sipIdentity;
    private final String audioSocketBindAddress;
    private final int audioSocketPort;
    private final AiProvider aiProvider;
    private final String geminiApiKey;
    private final String voiceLiveEndpoint;
    private final String voiceLiveApiKey;
    private final String model;
    private final String voice;
    private final String systemInstruction;
    private final String greetingPrompt;
    private final int audioQueueCapacity;
    private final Duration registrationRetryDelay;
    private final int maxRegistrationRetries;
    private final Duration answerDelay;

    private GatewayConfig(Reader env) {
        this.aiProvider = AiProvider.fromKey(env.optional("AI_PROVIDER", AiProvider.GEMINI.getKey()));

        if (aiProvider == AiProvider.GEMINI) {
            this.geminiApiKey = env.required("GEMINI_API_KEY");
            this.voiceLiveEndpoint = null;
            this.voiceLiveApiKey = null;
        } else {
            this.geminiApiKey = null;
            this.voiceLiveApiKey = env.required("VOICE_LIVE_API_KEY");
            this.voiceLiveEndpoint = env.required("VOICE_LIVE_ENDPOINT");
        }
        env.failIfMissing();

        if (aiProvider == AiProvider.VOICELIVE
            && !voiceLiveEndpoint.startsWith("https://") && !voiceLiveEndpoint.startsWith("wss://")) {
            throw new ConfigurationException("VOICE_LIVE_ENDPOINT must start with https:// or wss://");
        }

        this.sipIdentity = new SipIdentity(
            env.optional("SIP_EXTENSION", DEFAULT_SIP_EXTENSION),
            env.optional("SIP_SERVER", DEFAULT_SIP_SERVER),
            env.integer("SIP_PORT", 5060));
        this.audioSocketBindAddress = env.optional("AUDIOSOCKET_BIND_ADDRESS", "0.0.0.0");
        this.audioSocketPort = env.integer("AUDIOSOCKET_PORT", 9092);
        this.model = env.optional("AI_MODEL", null);
        this.voice = env.optional("AI_VOICE", null);
        this.systemInstruction = loadSystemInstruction(env.optional("SYSTEM_INSTRUCTION_FILE", null));
        this.greetingPrompt = env.optional("AI_GREETING_PROMPT", DEFAULT_GREETING_PROMPT);
        this.audioQueueCapacity = env.integer("AUDIO_QUEUE_CAPACITY", 100);
        this.registrationRetryDelay = Duration.ofSeconds(env.integer("REGISTRATION_RETRY_DELAY_SECONDS", 10));
        this.maxRegistrationRetries = env.integer("MAX_REGISTRATION_RETRIES", 0);
        this.answerDelay = Duration.ofMillis(env.integer("ANSWER_DELAY_MS", 200));

        if (audioQueueCapacity <= 0) {
            throw new ConfigurationException("AUDIO_QUEUE_CAPACITY must be positive");
        }
        if (maxRegistrationRetries < 0) {
            throw new ConfigurationException("MAX_REGISTRATION_RETRIES must be 0 (unlimited) or positive");
        }
        if (registrationRetryDelay.isNegative()) {
            throw new ConfigurationException("REGISTRATION_RETRY_DELAY_SECONDS must not be negative");
        }
    }

    /**
     * Reads the configuration from the process environment.
     */
    public static GatewayConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the configuration from the given variables.
     *
     * @throws ConfigurationException listing every missing required variable, or naming the
     *     first malformed one
     */
    public static GatewayConfig fromEnvironment(Map<String, String> environment) {
        return new GatewayConfig(new Reader(environment));
    }

    /**
     * @return the variables a given provider needs, for start-up error reports
     */
    public static List<String> requiredVariables(AiProvider provider) {
        List<String> required = new ArrayList<>();
        if (provider == AiProvider.GEMINI) {
            required.add("GEMINI_API_KEY");
        } else {
            required.add("VOICE_LIVE_API_KEY");
            required.add("VOICE_LIVE_ENDPOINT");
        }
        return required;
    }

    private static String loadSystemInstruction(String file) {
        if (file != null) {
            try {
                return Files.readString(Path.of(file), StandardCharsets.UTF_8).strip();
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read SYSTEM_INSTRUCTION_FILE " + file, e);
            }
        }
        try (InputStream in = GatewayConfig.class.getClassLoader().getResourceAsStream(SYSTEM_INSTRUCTION_RESOURCE)) {
            if (in != null) {
                String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        } catch (IOException e) {
            LOG.warn("Failed to read {} from classpath: {}", SYSTEM_INSTRUCTION_RESOURCE, e.getMessage());
        }
        return DEFAULT_SYSTEM_INSTRUCTION;
    }

    public SipIdentity getSipIdentity() {
        return sipIdentity;
    }

    public String getAudioSocketBindAddress() {
        return audioSocketBindAddress;
    }

    public int getAudioSocketPort() {
        return audioSocketPort;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public String getGeminiApiKey() {
        return geminiApiKey;
    }

    public String getVoiceLiveEndpoint() {
        return voiceLiveEndpoint;
    }

    public String getVoiceLiveApiKey() {
        return voiceLiveApiKey;
    }

    /**
     * @return the configured model, or null for the provider's default
     */
    public String getModel() {
        return model;
    }

    /**
     * @return the configured voice, or null for the provider's default
     */
    public String getVoice() {
        return voice;
    }

    public String getSystemInstruction() {
        return systemInstruction;
    }

    public String getGreetingPrompt() {
        return greetingPrompt;
    }

    public int getAudioQueueCapacity() {
        return audioQueueCapacity;
    }

    public Duration getRegistrationRetryDelay() {
        return registrationRetryDelay;
    }

    public int getMaxRegistrationRetries() {
        return maxRegistrationRetries;
    }

    public Duration getAnswerDelay() {
        return answerDelay;
    }

    @Override
    public String toString() {
        return "GatewayConfig{" +
               "sip=" + sipIdentity +
               ", audioSocket='" + audioSocketBindAddress + ':' + audioSocketPort + '\'' +
               ", aiProvider=" + aiProvider.getKey() +
               (voiceLiveEndpoint != null ? ", endpoint='" + voiceLiveEndpoint + '\'' : "") +
               ", model='" + model + '\'' +
               ", voice='" + voice + '\'' +
               ", apiKey='***'" +
               ", audioQueueCapacity=" + audioQueueCapacity +
               ", maxRegistrationRetries=" + maxRegistrationRetries +
               '}';
    }

    /**
     * Collects missing required variables so they can be reported together.
     */
    private static final class Reader {
        private final Map<String, String> environment;
        private final List<String> missing = new ArrayList<>();

        Reader(Map<String, String> environment) {
            this.environment = environment;
        }

        String required(String key) {
            String value = environment.get(key);
            if (value == null || value.isBlank()) {
                missing.add(key);
                return null;
            }
            return value.trim();
        }

        String optional(String key, String defaultValue) {
            String value = environment.get(key);
            return value == null || value.isBlank() ? defaultValue : value.trim();
        }

        int integer(String key, int defaultValue) {
            String value = optional(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
            }
        }

        void failIfMissing() {
            if (!missing.isEmpty()) {
                throw new ConfigurationException(missing);
            }
        }
    }
}
