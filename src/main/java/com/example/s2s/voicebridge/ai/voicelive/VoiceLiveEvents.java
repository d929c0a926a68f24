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

import com.azure.ai.voicelive.models.FunctionCallOutputItem;
import com.azure.ai.voicelive.models.SessionUpdate;
import com.azure.ai.voicelive.models.SessionUpdateConversationItemInputAudioTranscriptionCompleted;
import com.azure.ai.voicelive.models.SessionUpdateInputAudioBufferSpeechStarted;
import com.azure.ai.voicelive.models.SessionUpdateResponseAudioDelta;
import com.azure.ai.voicelive.models.SessionUpdateResponseFunctionCallArgumentsDone;
import com.azure.ai.voicelive.models.SessionUpdateResponseTextDelta;
import com.azure.ai.voicelive.models.VoiceLiveFunctionDefinition;
import com.azure.core.util.BinaryData;
import com.example.s2s.voicebridge.ai.AiResponse;
import com.example.s2s.voicebridge.ai.ToolResult;
import com.example.s2s.voicebridge.audio.AudioChunk;
import com.example.s2s.voicebridge.tools.ToolDeclaration;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between Voice Live SDK events and the bridge's own types.
 */
final class VoiceLiveEvents {
    private static final Logger LOG = LoggerFactory.getLogger(VoiceLiveEvents.class);

    private VoiceLiveEvents() {
    }

    /**
     * Maps a session event to a bridge response, {@link AiResponse#EMPTY} for events the
     * bridge does not act on.
     */
    static AiResponse toResponse(SessionUpdate event, int outputSampleRate) {
        if (event instanceof SessionUpdateResponseAudioDelta audioDelta) {
            byte[] audio = audioDelta.getDelta();
            if (audio == null || audio.length == 0) {
                return AiResponse.EMPTY;
            }
            return new AiResponse.Audio(AudioChunk.of(audio, outputSampleRate));
        } else if (event instanceof SessionUpdateResponseTextDelta textDelta) {
            String delta = textDelta.getDelta();
            return delta == null || delta.isEmpty() ? AiResponse.EMPTY : new AiResponse.Text(delta);
        } else if (event instanceof SessionUpdateInputAudioBufferSpeechStarted) {
            LOG.info("🎤 Speech detected - caller is talking over the response");
            return AiResponse.INTERRUPTED;
        } else if (event instanceof SessionUpdateResponseFunctionCallArgumentsDone call) {
            return new AiResponse.ToolCall(call.getCallId(), call.getName(), parseArguments(call.getArguments()));
        } else if (event instanceof SessionUpdateConversationItemInputAudioTranscriptionCompleted transcription) {
            LOG.info("✓ User said: {}", transcription.getTranscript());
        }
        return AiResponse.EMPTY;
    }

    /**
     * Parses function call arguments. Blank or malformed arguments become an empty object.
     */
    static JsonObject parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return new JsonObject();
        }
        try {
            JsonElement parsed = JsonParser.parseString(arguments);
            if (parsed.isJsonObject()) {
                return parsed.getAsJsonObject();
            }
            LOG.warn("Function call arguments are not a JSON object: {}", arguments);
        } catch (JsonParseException e) {
            LOG.warn("Malformed function call arguments: {}", e.getMessage());
        }
        return new JsonObject();
    }

    /**
     * @return the function output as sent back to the session, {"result": ...} or {"error": ...}
     */
    static String toOutput(ToolResult result) {
        JsonObject output = new JsonObject();
        if (result.isSuccess()) {
            output.addProperty("result", result.getResult());
        } else {
            output.addProperty("error", result.getError());
        }
        return output.toString();
    }

    static FunctionCallOutputItem toOutputItem(String callId, ToolResult result) {
        return new FunctionCallOutputItem(callId, toOutput(result));
    }

    static VoiceLiveFunctionDefinition toFunctionDefinition(ToolDeclaration declaration) {
        return new VoiceLiveFunctionDefinition(declaration.getName())
            .setDescription(declaration.getDescription())
            .setParameters(BinaryData.fromString(declaration.getParameters().toString()));
    }
}
