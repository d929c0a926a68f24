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

import java.util.Objects;

/**
 * Name, description and JSON-schema parameters of a tool, as advertised to the AI session.
 */
public final class ToolDeclaration {
    private final String name;
    private final String description;
    private final JsonObject parameters;

    public ToolDeclaration(String name, String description, JsonObject parameters) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description != null ? description : "";
        this.parameters = parameters != null ? parameters.deepCopy() : emptyObjectSchema();
    }

    public static JsonObject emptyObjectSchema() {
        JsonObject schema = new JsonObject();
        schema.addProperty("type", "object");
        schema.add("properties", new JsonObject());
        return schema;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return a copy of the parameter schema
     */
    public JsonObject getParameters() {
        return parameters.deepCopy();
    }

    @Override
    public String toString() {
        return "ToolDeclaration{name='" + name + "'}";
    }
}
