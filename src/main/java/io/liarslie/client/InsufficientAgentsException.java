package io.liarslie.client;

public final class InsufficientAgentsException extends IllegalStateException {
    public InsufficientAgentsException(String category, int requested, int available) {
        super("not enough " + category + " to form the requested subset (requested "
                + requested + ", available " + available + ")");
    }
}
