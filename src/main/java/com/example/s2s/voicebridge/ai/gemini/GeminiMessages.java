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

import com.example.s2s.voicebridge.ai.AiResponse;
import com.example.s2s.voicebridge.ai.ToolResult;
import com.example.s2s.voicebridge.audio.AudioChunk;
import com.example.s2s.voicebridge.tools.ToolDeclaration;
import com.google.genai.types.Blob;
import com.google.genai.types.FunctionCall;
import com.google.genai.types.FunctionDeclaration;
import com.google.genai.types.FunctionResponse;
import com.google.genai.types.LiveServerContent;
import com.google.genai.types.LiveServerMessage;
import com.google.genai.types.Part;
import com.google.genai.types.Schema;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Conversions between Gemini Live wire types and the bridge's own types.
 */
final class GeminiMessages {
    private static final Gson GSON = new Gson();

    private GeminiMessages() {
    }

    /**
     * Maps one server message to the responses it carries, in order: interruption first,
     * then model turn parts, then tool calls. Messages with none of these yield nothing.
     */
    static List<AiResponse> toResponses(LiveServerMessage message, int outputSampleRate) {
        List<AiResponse> responses = new ArrayList<>();
        message.serverContent().ifPresent(content -> addContent(content, outputSampleRate, responses));
        message.toolCall()
            .flatMap(toolCall -> toolCall.functionCalls())
            .ifPresent(calls -> calls.forEach(call -> responses.add(toToolCall(call))));
        return responses;
    }

    private static void addContent(LiveServerContent content, int outputSampleRate, List<AiResponse> out) {
        if (content.interrupted().orElse(false)) {
            out.add(AiResponse.INTERRUPTED);
            return;
        }
        content.modelTurn()
            .flatMap(turn -> turn.parts())
            .ifPresent(parts -> {
                for (Part part : parts) {
                    byte[] audio = part.inlineData().flatMap(Blob::data).orElse(null);
                    if (audio != null && audio.length > 0) {
                        out.add(new AiResponse.Audio(AudioChunk.of(audio, outputSampleRate)));
                    }
                    part.text()
                        .filter(text -> !text.isBlank())
                        .ifPresent(text -> out.add(new AiResponse.Text(text)));
                }
            });
    }

    static AiResponse.ToolCall toToolCall(FunctionCall call) {
        String name = call.name().orElse("");
        String id = call.id().orElse(name);
        JsonObject args = call.args()
            .map(map -> GSON.toJsonTree(map).getAsJsonObject())
            .orElseGet(JsonObject::new);
        return new AiResponse.ToolCall(id, name, args);
    }

    static FunctionResponse toFunctionResponse(String callId, String name, ToolResult result) {
        Map<String, Object> payload = result.isSuccess()
            ? Map.of("result", result.getResult())
            : Map.of("error", result.getError());
        return FunctionResponse.builder()
            .id(callId)
            .name(name)
            .response(payload)
            .build();
    }

    static FunctionDeclaration toFunctionDeclaration(ToolDeclaration declaration) {
        JsonObject schema = declaration.getParameters();
        upperCaseTypes(schema);
        return FunctionDeclaration.builder()
            .name(declaration.getName())
            .description(declaration.getDescription())
            .parameters(Schema.fromJson(schema.toString()))
            .build();
    }

    // Gemini's schema enum spells types in upper case ("OBJECT", "STRING").
    private static void upperCaseTypes(JsonObject schema) {
        JsonElement type = schema.get("type");
        if (type != null && type.isJsonPrimitive()) {
            schema.addProperty("type", type.getAsString().toUpperCase(Locale.ROOT));
        }
        JsonElement properties = schema.get("properties");
        if (properties != null && properties.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : properties.getAsJsonObject().entrySet()) {
                if (entry.getValue().isJsonObject()) {
                    upperCaseTypes(entry.getValue().getAsJsonObject());
                }
            }
        }
        JsonElement items = schema.get("items");
        if (items != null && items.isJsonObject()) {
            upperCaseTypes(items.getAsJsonObject());
        }
    }
}
