package io.liarslie.codec;

import java.io.IOException;

/**
 * Raised when bytes read from the wire cannot be turned into an envelope or a message.
 *
 * <p>Always local to the message being processed: callers drop that message and carry on.
 */
public final class DecodeException extends IOException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
