package io.liarslie.codec;

import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.ValueType;

import java.io.IOException;

/**
 * Strict MessagePack read helpers shared by the envelope and message codecs.
 *
 * <p>Every helper turns msgpack runtime failures (truncation, type mismatch, overflow)
 * into {@link DecodeException} so callers only deal with one failure type.
 */
public final class MsgPack {
    private MsgPack() {
    }

    public static MessageUnpacker reader(byte[] bytes) {
        return MessagePack.newDefaultUnpacker(bytes);
    }

    public static void expectArray(MessageUnpacker in, int expectedSize, String what) throws DecodeException {
        int size = readArrayHeader(in, what);
        if (size != expectedSize) {
            throw new DecodeException(what + ": expected " + expectedSize + " fields, found " + size);
        }
    }

    public static int readArrayHeader(MessageUnpacker in, String what) throws DecodeException {
        try {
            return in.unpackArrayHeader();
        } catch (IOException | MessagePackException e) {
            throw new DecodeException(what + ": expected array header", e);
        }
    }

    public static int readInt(MessageUnpacker in, String what) throws DecodeException {
        try {
            return in.unpackInt();
        } catch (IOException | MessagePackException e) {
            throw new DecodeException(what + ": expected int", e);
        }
    }

    public static long readLong(MessageUnpacker in, String what) throws DecodeException {
        try {
            return in.unpackLong();
        } catch (IOException | MessagePackException e) {
            throw new DecodeException(what + ": expected long", e);
        }
    }

    public static String readString(MessageUnpacker in, String what) throws DecodeException {
        try {
            return in.unpackString();
        } catch (IOException | MessagePackException e) {
            throw new DecodeException(what + ": expected string", e);
        }
    }

    // The declared length is checked against what is left in the buffer before allocating.
    public static byte[] readBinary(MessageUnpacker in, int totalBytes, String what) throws DecodeException {
        try {
            int length = in.unpackBinaryHeader();
            long remaining = totalBytes - in.getTotalReadBytes();
            if (length < 0 || length > remaining) {
                throw new DecodeException(what + ": binary length " + length + " exceeds remaining " + remaining + " bytes");
            }
            return in.readPayload(length);
        } catch (IOException | MessagePackException e) {
            if (e instanceof DecodeException) {
                throw (DecodeException) e;
            }
            throw new DecodeException(what + ": expected binary", e);
        }
    }

    public static byte[] readOptionalBinary(MessageUnpacker in, int totalBytes, String what) throws DecodeException {
        try {
            if (!in.hasNext()) {
                throw new DecodeException(what + ": truncated");
            }
            MessageFormat format = in.getNextFormat();
            if (format.getValueType() == ValueType.NIL) {
                in.unpackNil();
                return null;
            }
        } catch (IOException | MessagePackException e) {
            if (e instanceof DecodeException) {
                throw (DecodeException) e;
            }
            throw new DecodeException(what + ": unreadable optional binary", e);
        }
        return readBinary(in, totalBytes, what);
    }

    public static void requireFullyConsumed(MessageUnpacker in, String what) throws DecodeException {
        try {
            if (in.hasNext()) {
                throw new DecodeException(what + ": trailing bytes after value");
            }
        } catch (IOException e) {
            if (e instanceof DecodeException) {
                throw (DecodeException) e;
            }
            throw new DecodeException(what + ": unreadable trailer", e);
        }
    }

    public static void writeBinary(MessagePacker out, byte[] bytes) throws IOException {
        out.packBinaryHeader(bytes.length);
        out.writePayload(bytes);
    }

    public static void writeOptionalBinary(MessagePacker out, byte[] bytes) throws IOException {
        if (bytes == null) {
            out.packNil();
        } else {
            writeBinary(out, bytes);
        }
    }
}
