package io.liarslie.codec;

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Binary envelope layout: msgpack array {@code [payload: bin, signature: bin | nil]}.
 */
public final class EnvelopeCodec {
    private static final int FIELD_COUNT = 2;

    private EnvelopeCodec() {
    }

    public static byte[] encode(Envelope envelope) {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            pack(packer, envelope);
            return packer.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to encode envelope", e);
        }
    }

    public static Envelope decode(byte[] bytes) throws DecodeException {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("envelope: empty input");
        }
        try (MessageUnpacker unpacker = MsgPack.reader(bytes)) {
            Envelope envelope = unpack(unpacker, bytes.length);
            MsgPack.requireFullyConsumed(unpacker, "envelope");
            return envelope;
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeException("envelope: unreadable input", e);
        }
    }

    // Nested form, reused when a message carries forwarded envelopes.
    public static void pack(MessagePacker packer, Envelope envelope) throws IOException {
        packer.packArrayHeader(FIELD_COUNT);
        MsgPack.writeBinary(packer, envelope.payload());
        MsgPack.writeOptionalBinary(packer, envelope.signature());
    }

    public static Envelope unpack(MessageUnpacker unpacker, int totalBytes) throws DecodeException {
        MsgPack.expectArray(unpacker, FIELD_COUNT, "envelope");
        byte[] payload = MsgPack.readBinary(unpacker, totalBytes, "envelope.payload");
        byte[] signature = MsgPack.readOptionalBinary(unpacker, totalBytes, "envelope.signature");
        return new Envelope(payload, signature);
    }
}
