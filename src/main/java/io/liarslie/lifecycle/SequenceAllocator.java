package io.liarslie.lifecycle;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out agent ids and listening ports. Both sequences only move forward, so a value is
 * never handed out twice by the same allocator, even after the agent that held it is gone.
 */
public final class SequenceAllocator {
    private final AtomicInteger nextAgentId;
    private final AtomicInteger nextPort;

    public SequenceAllocator(int firstAgentId, int firstPort) {
        if (firstAgentId <= 0) {
            throw new IllegalArgumentException("first agent id must be positive: " + firstAgentId);
        }
        if (firstPort <= 0 || firstPort > 65535) {
            throw new IllegalArgumentException("invalid first port: " + firstPort);
        }
        this.nextAgentId = new AtomicInteger(firstAgentId);
        this.nextPort = new AtomicInteger(firstPort);
    }

    public int nextAgentId() {
        return nextAgentId.getAndIncrement();
    }

    public int nextPort() {
        int port = nextPort.getAndIncrement();
        if (port > 65535) {
            throw new IllegalStateException("port range exhausted");
        }
        return port;
    }
}
