package io.liarslie.security;

/**
 * An Ed25519 key pair encoded as base64 text.
 *
 * <p>{@code privateKey} is the PKCS#8 encoding and stays with its owner; {@code publicKey}
 * is the raw 32-byte key and is what gets shared in descriptors.
 */
public record SigningKeys(String privateKey, String publicKey) {
    public SigningKeys {
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalArgumentException("private key cannot be empty");
        }
        if (publicKey == null || publicKey.isBlank()) {
            throw new IllegalArgumentException("public key cannot be empty");
        }
    }

    @Override
    public String toString() {
        return "SigningKeys[publicKey=" + publicKey + "]";
    }
}
