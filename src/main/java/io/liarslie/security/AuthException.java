package io.liarslie.security;

import java.security.GeneralSecurityException;

/**
 * A message failed authentication: no signature, a signature that does not verify,
 * an unusable key, or a directive addressed to another agent.
 */
public final class AuthException extends GeneralSecurityException {
    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
