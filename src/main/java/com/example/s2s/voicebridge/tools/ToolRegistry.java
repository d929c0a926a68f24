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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the tools offered to the AI and dispatches calls to them by name.
 */
public class ToolRegistry implements ToolExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    /**
     * @return a registry with the built-in tools
     */
    public static ToolRegistry withDefaultTools() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new GetServiceStatusTool());
        registry.register(new SetReminderTool());
        return registry;
    }

    public synchronized void register(Tool tool) {
        String name = tool.declaration().getName();
        if (tools.containsKey(name)) {
            throw new IllegalArgumentException("Tool already registered: " + name);
        }
        tools.put(name, tool);
        LOG.debug("Registered tool {}", name);
    }

    @Override
    public String execute(String name, JsonObject arguments) {
        Tool tool;
        synchronized (this) {
            tool = tools.get(name);
        }
        if (tool == null) {
            LOG.error("Unknown tool requested: {}", name);
            throw new UnknownToolException(name);
        }
        JsonObject args = arguments != null ? arguments : new JsonObject();
        LOG.debug("Executing tool {} with args: {}", name, args);
        try {
            String result = tool.execute(args);
            LOG.debug("Tool {} returned: {}", name, result);
            return result;
        } catch (ToolExecutionException e) {
            LOG.error("Tool {} failed: {}", name, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            LOG.error("Tool {} failed", name, e);
            throw new ToolExecutionException(name, e);
        }
    }

    @Override
    public synchronized List<ToolDeclaration> declarations() {
        List<ToolDeclaration> declarations = new ArrayList<>(tools.size());
        for (Tool tool : tools.values()) {
            declarations.add(tool.declaration());
        }
        return Collections.unmodifiableList(declarations);
    }

    public synchronized boolean contains(String name) {
        return tools.containsKey(name);
    }
}
