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

import com.example.s2s.voicebridge.ai.AiSessionConnector;
import com.example.s2s.voicebridge.ai.AiSessionController;
import com.example.s2s.voicebridge.ai.AiSessionControllerFactory;
import com.example.s2s.voicebridge.ai.AiSessionOptions;
import com.example.s2s.voicebridge.ai.gemini.GeminiLiveConnector;
import com.example.s2s.voicebridge.ai.voicelive.VoiceLiveConnector;
import com.example.s2s.voicebridge.audio.DuplexAudioBridge;
import com.example.s2s.voicebridge.call.CallSessionOrchestrator;
import com.example.s2s.voicebridge.config.AiProvider;
import com.example.s2s.voicebridge.config.GatewayConfig;
import com.example.s2s.voicebridge.exception.ConfigurationException;
import com.example.s2s.voicebridge.telephony.RegistrationSupervisor;
import com.example.s2s.voicebridge.telephony.TelephonyEngineFactory;
import com.example.s2s.voicebridge.telephony.audiosocket.AudioSocketEngineFactory;
import com.example.s2s.voicebridge.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;

/**
 * Voice bridge gateway: answers telephony calls and hands each one to a realtime AI session.
 */
public class VoiceBridgeGateway {
    private static final Logger LOG = LoggerFactory.getLogger(VoiceBridgeGateway.class);

    private static final Duration REGISTRATION_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration MONITOR_INTERVAL = Duration.ofSeconds(1);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
    private static final int MAX_CONCURRENT_CALLS = 1;

    private final Scheduler lifecycleScheduler;
    private final Scheduler pumpScheduler;
    private final CallSessionOrchestrator orchestrator;
    private final RegistrationSupervisor supervisor;
    private volatile boolean shuttingDown;

    public VoiceBridgeGateway(GatewayConfig config, AiSessionConnector connector) {
        this(config, connector, new AudioSocketEngineFactory(
            config.getAudioSocketBindAddress(), config.getAudioSocketPort(), MAX_CONCURRENT_CALLS));
    }

    VoiceBridgeGateway(GatewayConfig config, AiSessionConnector connector, TelephonyEngineFactory engineFactory) {
        this.lifecycleScheduler = Schedulers.newSingle("call-orchestrator", true);
        this.pumpScheduler = Schedulers.newBoundedElastic(
            Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "audio-pump", 60, true);

        DuplexAudioBridge bridge = new DuplexAudioBridge(
            engineFactory.getSampleRate(),
            connector.getInputSampleRate(),
            connector.getOutputSampleRate(),
            config.getAudioQueueCapacity());
        ToolRegistry tools = ToolRegistry.withDefaultTools();
        AiSessionOptions options = new AiSessionOptions(
            config.getModel(),
            config.getVoice(),
            config.getSystemInstruction(),
            config.getGreetingPrompt(),
            tools.declarations());
        AiSessionControllerFactory controllerFactory = listener ->
            new AiSessionController(connector, options, bridge, tools, listener, pumpScheduler);

        this.orchestrator = new CallSessionOrchestrator(
            bridge, controllerFactory, lifecycleScheduler, pumpScheduler, config.getAnswerDelay(),
            engineFactory.getSampleRate(), engineFactory.getSamplesPerFrame());
        this.supervisor = new RegistrationSupervisor(
            engineFactory,
            orchestrator,
            config.getSipIdentity(),
            config.getRegistrationRetryDelay(),
            config.getMaxRegistrationRetries(),
            REGISTRATION_TIMEOUT,
            MONITOR_INTERVAL);

        LOG.info("✓ Audio bridge initialized");
        LOG.info("  - Audio flow: telephony (PCM16 {}Hz) ↔ {} (in {}Hz / out {}Hz)",
                 engineFactory.getSampleRate(), connector.getProviderName(),
                 connector.getInputSampleRate(), connector.getOutputSampleRate());
    }

    public void start() {
        supervisor.start();
    }

    /**
     * Stops registration, ends any call in progress and releases the schedulers.
     */
    public void shutdown() {
        shuttingDown = true;
        LOG.info("Shutting down...");
        supervisor.shutdown();
        try {
            orchestrator.shutdown(SHUTDOWN_TIMEOUT);
        } catch (RuntimeException e) {
            LOG.warn("Error ending call during shutdown: {}", e.getMessage());
        }
        pumpScheduler.dispose();
        lifecycleScheduler.dispose();
        LOG.info("Shutdown complete");
    }

    /**
     * Blocks until the registration supervisor gives up.
     */
    public void awaitTermination() throws InterruptedException {
        while (!supervisor.awaitTermination(Duration.ofMinutes(1))) {
            LOG.debug("Gateway running, registered: {}", supervisor.isRegistered());
        }
    }

    public boolean isRegistered() {
        return supervisor.isRegistered();
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    static AiSessionConnector createConnector(GatewayConfig config) {
        if (config.getAiProvider() == AiProvider.VOICELIVE) {
            return new VoiceLiveConnector(config.getVoiceLiveEndpoint(), config.getVoiceLiveApiKey());
        }
        return new GeminiLiveConnector(config.getGeminiApiKey());
    }

    /**
     * The main method.
     */
    public static void main(String[] args) {
        println("╔═══════════════════════════════════════════════════════════╗");
        println("║         Voice Bridge Gateway                              ║");
        println("║         Telephony ↔ Realtime AI                           ║");
        println("╚═══════════════════════════════════════════════════════════╝");

        Map<String, String> environ = System.getenv();
        GatewayConfig config;
        try {
            config = GatewayConfig.fromEnvironment(environ);
        } catch (ConfigurationException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            AiProvider provider = AiProvider.GEMINI;
            try {
                provider = AiProvider.fromKey(environ.getOrDefault("AI_PROVIDER", AiProvider.GEMINI.getKey()));
            } catch (ConfigurationException unsupported) {
                LOG.debug("Reporting Gemini requirements, provider is not recognised");
            }
            LOG.error("Required environment variables: {}",
                      String.join(", ", GatewayConfig.requiredVariables(provider)));
            System.exit(1);
            return;
        }
        LOG.info("Configuration: {}", config);

        VoiceBridgeGateway gateway;
        try {
            gateway = new VoiceBridgeGateway(config, createConnector(config));
        } catch (RuntimeException e) {
            LOG.error("Failed to initialize gateway", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(gateway::shutdown, "Shutdown-Hook"));
        gateway.start();

        try {
            gateway.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (gateway.isShuttingDown()) {
            return;
        }
        LOG.error("Gateway stopped: registration could not be established");
        System.exit(1);
    }

    /**
     * Prints a message to standard output.
     */
    protected static void println(String str) {
        System.out.println(str);
    }
}
