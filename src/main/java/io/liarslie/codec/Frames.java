package io.liarslie.codec;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * Length-prefixed framing: {@code [4-byte big-endian length][body]}.
 */
public final class Frames {
    public static final int PREFIX_BYTES = 4;

    private Frames() {
    }

    public static byte[] frame(byte[] body) {
        if (body == null) {
            throw new IllegalArgumentException("frame body cannot be null");
        }
        return ByteBuffer.allocate(PREFIX_BYTES + body.length)
                .putInt(body.length)
                .put(body)
                .array();
    }

    public static void write(OutputStream out, byte[] body) throws IOException {
        out.write(frame(body));
        out.flush();
    }

    // Blocks until the prefix and exactly that many body bytes have arrived.
    public static byte[] deframe(InputStream in, int maxFrameBytes) throws IOException {
        DataInputStream data = new DataInputStream(in);
        int length;
        try {
            length = data.readInt();
        } catch (EOFException e) {
            throw new DecodeException("stream closed before length prefix was complete", e);
        }
        if (length < 0 || length > maxFrameBytes) {
            throw new DecodeException("frame length out of range: " + length + " (max " + maxFrameBytes + ")");
        }
        byte[] body = new byte[length];
        try {
            data.readFully(body);
        } catch (EOFException e) {
            throw new DecodeException("stream closed before " + length + " frame bytes were read", e);
        }
        return body;
    }
}
