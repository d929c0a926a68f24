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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports the health of the monitored services. The values are fixed.
 */
public class GetServiceStatusTool implements Tool {
    private static final Logger LOG = LoggerFactory.getLogger(GetServiceStatusTool.class);

    public static final String NAME = "get_service_status";

    private static final ToolDeclaration DECLARATION = new ToolDeclaration(
            NAME,
            "Get the current status of all monitored services including servers and database. "
                    + "Use this when the user asks about service health, server status, or system uptime.",
            ToolDeclaration.emptyObjectSchema());

    @Override
    public ToolDeclaration declaration() {
        return DECLARATION;
    }

    @Override
    public String execute(JsonObject arguments) {
        LOG.info("Tool called: {}()", NAME);
        JsonObject status = new JsonObject();
        status.addProperty("server_1", "online");
        status.addProperty("database", "online");
        status.addProperty("uptime", "99%");
        String result = status.toString();
        LOG.debug("Service status: {}", result);
        return result;
    }
}
