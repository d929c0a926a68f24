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

package com.example.s2s.voicebridge.telephony;

import java.util.Objects;

/**
 * Identity the gateway answers as. Used to label registrations and calls in the logs.
 */
public final class SipIdentity {
    private final String extension;
    private final String server;
    private final int port;

    public SipIdentity(String extension, String server, int port) {
        this.extension = Objects.requireNonNull(extension, "extension");
        this.server = Objects.requireNonNull(server, "server");
        this.port = port;
    }

    public String getExtension() {
        return extension;
    }

    public String getServer() {
        return server;
    }

    public int getPort() {
        return port;
    }

    /**
     * @return the address of record, e.g. {@code sip:1001@pbx.example.com}
     */
    public String getAddressOfRecord() {
        return "sip:" + extension + "@" + server;
    }

    @Override
    public String toString() {
        return "SipIdentity{" + getAddressOfRecord() + ':' + port + '}';
    }
}
