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

package com.example.s2s.voicebridge.tools;

import com.google.gson.JsonObject;

/**
 * A function the AI may call during a conversation.
 */
public interface Tool {

    ToolDeclaration declaration();

    /**
     * @param arguments the arguments sent by the AI, never null
     * @return the result text handed back to the AI
     * @throws ToolExecutionException if the call cannot be completed
     */
    String execute(JsonObject arguments);
}
