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

import com.azure.ai.voicelive.models.VoiceLiveFunctionDefinition;
import com.azure.ai.voicelive.models.VoiceLiveSessionOptions;
import com.example.s2s.voicebridge.ai.AiSessionOptions;
import com.example.s2s.voicebridge.ai.ToolResult;
import com.example.s2s.voicebridge.tools.GetServiceStatusTool;
import com.example.s2s.voicebridge.tools.ToolRegistry;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceLiveEventsTest {

    @Test
    void shouldParseFunctionArguments() {
        JsonObject args = VoiceLiveEvents.parseArguments("{\"text\":\"water the plants\"}");

        assertThat(args.get("text").getAsString()).isEqualTo("water the plants");
    }

    @Test
    void shouldTreatBlankOrMalformedArgumentsAsEmpty() {
        assertThat(VoiceLiveEvents.parseArguments(null).size()).isZero();
        assertThat(VoiceLiveEvents.parseArguments("  ").size()).isZero();
        assertThat(VoiceLiveEvents.parseArguments("{not json").size()).isZero();
        assertThat(VoiceLiveEvents.parseArguments("[1,2]").size()).isZero();
    }

    @Test
    void shouldEncodeToolOutput() {
        JsonObject ok = JsonParser.parseString(VoiceLiveEvents.toOutput(ToolResult.success("Success"))).getAsJsonObject();
        JsonObject failed = JsonParser.parseString(VoiceLiveEvents.toOutput(ToolResult.failure("boom"))).getAsJsonObject();

        assertThat(ok.get("result").getAsString()).isEqualTo("Success");
        assertThat(ok.has("error")).isFalse();
        assertThat(failed.get("error").getAsString()).isEqualTo("boom");
    }

    @Test
    void shouldDefineFunctionFromDeclaration() {
        VoiceLiveFunctionDefinition definition =
            VoiceLiveEvents.toFunctionDefinition(new GetServiceStatusTool().declaration());

        assertThat(definition.getName()).isEqualTo("get_service_status");
    }

    @Test
    void shouldConfigureSessionWithInstructionsAndTools() {
        AiSessionOptions options = new AiSessionOptions(null, null, "Be brief.", null,
                                                        ToolRegistry.withDefaultTools().declarations());

        VoiceLiveSessionOptions sessionOptions = VoiceLiveConnector.createSessionOptions(options);

        assertThat(sessionOptions.getInstructions()).isEqualTo("Be brief.");
        assertThat(sessionOptions.getInputAudioSamplingRate()).isEqualTo(24000);
        assertThat(sessionOptions.getTools()).hasSize(2);
    }

    @Test
    void shouldLeaveToolsUnsetWhenNoneDeclared() {
        VoiceLiveSessionOptions sessionOptions = VoiceLiveConnector.createSessionOptions(
            new AiSessionOptions(null, null, "Be brief.", null, List.of()));

        assertThat(sessionOptions.getTools()).isNull();
    }
}
