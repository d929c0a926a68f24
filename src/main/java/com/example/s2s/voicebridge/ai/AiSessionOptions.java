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

import com.example.s2s.voicebridge.tools.ToolDeclaration;

import java.util.List;

/**
 * Per-session settings handed to an {@link AiSessionConnector}.
 */
public class AiSessionOptions {
    private final String model;
    private final String voice;
    private final String systemInstruction;
    private final String greetingPrompt;
    private final List<ToolDeclaration> tools;

    public AiSessionOptions(String model, String voice, String systemInstruction, String greetingPrompt,
                            List<ToolDeclaration> tools) {
        this.model = model;
        this.voice = voice;
        this.systemInstruction = systemInstruction;
        this.greetingPrompt = greetingPrompt;
        this.tools = tools != null ? List.copyOf(tools) : List.of();
    }

    public String getModel() {
        return model;
    }

    public String getVoice() {
        return voice;
    }

    public String getSystemInstruction() {
        return systemInstruction;
    }

    /**
     * @return the prompt sent when the session opens, or null for no greeting
     */
    public String getGreetingPrompt() {
        return greetingPrompt;
    }

    public List<ToolDeclaration> getTools() {
        return tools;
    }

    @Override
    public String toString() {
        return "AiSessionOptions{" +
               "model='" + model + '\'' +
               ", voice='" + voice + '\'' +
               ", tools=" + tools.size() +
               '}';
    }
}
