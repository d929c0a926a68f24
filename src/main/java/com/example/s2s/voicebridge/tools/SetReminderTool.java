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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Acknowledges a reminder the caller asks for. The reminder is only logged.
 */
public class SetReminderTool implements Tool {
    private static final Logger LOG = LoggerFactory.getLogger(SetReminderTool.class);

    public static final String NAME = "set_reminder";

    private static final ToolDeclaration DECLARATION = new ToolDeclaration(
            NAME,
            "Set a reminder with the given text. Use this when the user wants to be reminded about something.",
            schema());

    private static JsonObject schema() {
        JsonObject text = new JsonObject();
        text.addProperty("type", "string");
        text.addProperty("description", "The reminder text describing what the user wants to be reminded about.");

        JsonObject properties = new JsonObject();
        properties.add("text", text);

        JsonArray required = new JsonArray();
        required.add("text");

        JsonObject schema = new JsonObject();
        schema.addProperty("type", "object");
        schema.add("properties", properties);
        schema.add("required", required);
        return schema;
    }

    @Override
    public ToolDeclaration declaration() {
        return DECLARATION;
    }

    @Override
    public String execute(JsonObject arguments) {
        JsonElement text = arguments.get("text");
        if (text == null || text.isJsonNull()) {
            throw new ToolExecutionException(NAME, "missing required argument 'text'");
        }
        if (!(text instanceof JsonPrimitive)) {
            throw new ToolExecutionException(NAME, "argument 'text' must be a string");
        }
        String reminder = text.getAsString();
        LOG.info("⏰ Reminder set: {}", reminder);
        return "Success";
    }
}
