package io.liarslie.security;

import io.liarslie.codec.Envelope;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.NamedParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Ed25519 key generation, signing and verification on top of the JDK provider.
 *
 * <p>Signatures always cover the serialized message bytes (an envelope's payload), never the
 * envelope itself, so a signature survives being forwarded through a relay unchanged.
 */
public final class Signatures {
    public static final String ALGORITHM = "Ed25519";
    public static final int PUBLIC_KEY_BYTES = 32;
    public static final int SIGNATURE_BYTES = 64;

    // X.509 SubjectPublicKeyInfo prefix for Ed25519; the raw key follows it.
    private static final byte[] X509_PREFIX = new byte[]{
            0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65,
            0x70, 0x03, 0x21, 0x00
    };
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private Signatures() {
    }

    public static SigningKeys generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(ALGORITHM);
            generator.initialize(NamedParameterSpec.ED25519, SECURE_RANDOM);
            KeyPair pair = generator.generateKeyPair();
            byte[] encodedPublic = pair.getPublic().getEncoded();
            byte[] rawPublic = Arrays.copyOfRange(encodedPublic, encodedPublic.length - PUBLIC_KEY_BYTES, encodedPublic.length);
            return new SigningKeys(
                    Base64.getEncoder().encodeToString(pair.getPrivate().getEncoded()),
                    Base64.getEncoder().encodeToString(rawPublic)
            );
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 key generation unavailable", e);
        }
    }

    public static byte[] sign(SigningKeys keys, byte[] data) {
        try {
            byte[] pkcs8 = Base64.getDecoder().decode(keys.privateKey());
            PrivateKey privateKey = KeyFactory.getInstance(ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
            Signature signer = Signature.getInstance(ALGORITHM);
            signer.initSign(privateKey);
            signer.update(data);
            return signer.sign();
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("unable to sign message; private key is unusable", e);
        }
    }

    // Fails closed: any decoding problem is reported the same way as a bad signature.
    public static void verify(byte[] data, byte[] signature, String publicKeyBase64) throws AuthException {
        if (signature == null) {
            throw new AuthException("message requires a signature but none was provided");
        }
        if (signature.length != SIGNATURE_BYTES) {
            throw new AuthException("malformed signature: expected " + SIGNATURE_BYTES + " bytes, got " + signature.length);
        }
        PublicKey publicKey = decodePublicKey(publicKeyBase64);
        boolean valid;
        try {
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(data);
            valid = verifier.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new AuthException("signature verification failed", e);
        }
        if (!valid) {
            throw new AuthException("not a valid signature of the message");
        }
    }

    public static Envelope seal(SigningKeys keys, byte[] payload) {
        return new Envelope(payload, sign(keys, payload));
    }

    public static void verifyEnvelope(Envelope envelope, String publicKeyBase64) throws AuthException {
        verify(envelope.payload(), envelope.signature(), publicKeyBase64);
    }

    private static PublicKey decodePublicKey(String publicKeyBase64) throws AuthException {
        if (publicKeyBase64 == null || publicKeyBase64.isBlank()) {
            throw new AuthException("no public key to verify against");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(publicKeyBase64.trim());
        } catch (IllegalArgumentException e) {
            throw new AuthException("unable to decode public key", e);
        }
        if (raw.length != PUBLIC_KEY_BYTES) {
            throw new AuthException("malformed public key: expected " + PUBLIC_KEY_BYTES + " bytes, got " + raw.length);
        }
        byte[] encoded = Arrays.copyOf(X509_PREFIX, X509_PREFIX.length + PUBLIC_KEY_BYTES);
        System.arraycopy(raw, 0, encoded, X509_PREFIX.length, PUBLIC_KEY_BYTES);
        try {
            return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException e) {
            throw new AuthException("unable to decode public key", e);
        }
    }
}
