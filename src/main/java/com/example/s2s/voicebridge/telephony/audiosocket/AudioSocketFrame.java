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

package com.example.s2s.voicebridge.telephony.audiosocket;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * One message of the Asterisk AudioSocket protocol: a kind byte, a big-endian 16-bit
 * payload length and the payload.
 */
public final class AudioSocketFrame {

    public static final int MAX_PAYLOAD = 0xFFFF;

    public enum Kind {
        HANGUP(0x00),
        UUID(0x01),
        SILENCE(0x02),
        DTMF(0x03),
        AUDIO(0x10),
        ERROR(0xFF);

        private final int code;

        Kind(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }

        static Kind fromCode(int code) {
            for (Kind kind : values()) {
                if (kind.code == code) {
                    return kind;
                }
            }
            return null;
        }
    }

    private static final byte[] NO_PAYLOAD = new byte[0];

    private final Kind kind;
    private final byte[] payload;

    private AudioSocketFrame(Kind kind, byte[] payload) {
        if (payload.length > MAX_PAYLOAD) {
            throw new IllegalArgumentException("AudioSocket payload too large: " + payload.length);
        }
        this.kind = kind;
        this.payload = payload;
    }

    public static AudioSocketFrame audio(byte[] pcm) {
        return new AudioSocketFrame(Kind.AUDIO, pcm);
    }

    public static AudioSocketFrame hangup() {
        return new AudioSocketFrame(Kind.HANGUP, NO_PAYLOAD);
    }

    public static AudioSocketFrame uuid(UUID id) {
        ByteBuffer buffer = ByteBuffer.allocate(16);
        buffer.putLong(id.getMostSignificantBits());
        buffer.putLong(id.getLeastSignificantBits());
        return new AudioSocketFrame(Kind.UUID, buffer.array());
    }

    public static AudioSocketFrame dtmf(char digit) {
        return new AudioSocketFrame(Kind.DTMF, new byte[]{(byte) digit});
    }

    /**
     * Reads the next frame.
     *
     * @return the frame, or null if the peer closed the connection between frames
     * @throws IOException on a truncated frame, an unknown kind or a socket error
     */
    public static AudioSocketFrame read(DataInputStream in) throws IOException {
        int code = in.read();
        if (code < 0) {
            return null;
        }
        Kind kind = Kind.fromCode(code);
        if (kind == null) {
            throw new IOException(String.format("Unknown AudioSocket frame kind 0x%02x", code));
        }
        int length;
        try {
            length = in.readUnsignedShort();
        } catch (EOFException e) {
            throw new IOException("Truncated AudioSocket frame header", e);
        }
        byte[] payload = length == 0 ? NO_PAYLOAD : new byte[length];
        try {
            in.readFully(payload);
        } catch (EOFException e) {
            throw new IOException("Truncated AudioSocket " + kind + " payload", e);
        }
        return new AudioSocketFrame(kind, payload);
    }

    public void writeTo(OutputStream out) throws IOException {
        byte[] header = {(byte) kind.code, (byte) (payload.length >>> 8), (byte) payload.length};
        out.write(header);
        out.write(payload);
    }

    public Kind getKind() {
        return kind;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    int payloadLength() {
        return payload.length;
    }

    /**
     * @return the call id carried by a UUID frame
     */
    public UUID asUuid() {
        if (kind != Kind.UUID || payload.length != 16) {
            throw new IllegalStateException("Not a UUID frame: " + this);
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    /**
     * @return the error code of an ERROR frame, or -1 if it carries none
     */
    /**
     * @return the DTMF digits carried by this frame, decoded as ASCII
     */
    public String asDtmf() {
        if (kind != Kind.DTMF) {
            throw new IllegalStateException("Not a DTMF frame: " + this);
        }
        return new String(payload, StandardCharsets.US_ASCII);
    }

    public int errorCode() {
        return kind == Kind.ERROR && payload.length > 0 ? payload[0] & 0xFF : -1;
    }

    @Override
    public String toString() {
        return "AudioSocketFrame{" + kind + ", " + payload.length + " bytes}";
    }
}
