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

import java.util.Objects;

/**
 * Outcome of a tool call as reported back to the AI: either a result or an error message.
 */
public final class ToolResult {
    private final String result;
    private final String error;

    private ToolResult(String result, String error) {
        this.result = result;
        this.error = error;
    }

    public static ToolResult success(String result) {
        return new ToolResult(Objects.requireNonNull(result, "result"), null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ToolResult{result=" + result + '}' : "ToolResult{error=" + error + '}';
    }
}
