package io.liarslie.codec;

import java.util.Arrays;
import java.util.Base64;

/**
 * One protocol message on the wire together with its optional signature.
 *
 * <p>When present, {@code signature} covers exactly the bytes of {@code payload}.
 */
public record Envelope(byte[] payload, byte[] signature) {
    public Envelope {
        if (payload == null) {
            throw new IllegalArgumentException("envelope payload cannot be null");
        }
        payload = payload.clone();
        signature = signature == null ? null : signature.clone();
    }

    public static Envelope unsigned(byte[] payload) {
        return new Envelope(payload, null);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public byte[] signature() {
        return signature == null ? null : signature.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Envelope)) {
            return false;
        }
        Envelope that = (Envelope) other;
        return Arrays.equals(payload, that.payload) && Arrays.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(payload) + Arrays.hashCode(signature);
    }

    @Override
    public String toString() {
        return "Envelope[payload=" + Base64.getEncoder().encodeToString(payload)
                + ", signature=" + (signature == null ? "none" : signature.length + " bytes") + "]";
    }
}
