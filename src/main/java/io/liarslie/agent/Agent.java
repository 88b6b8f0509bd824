package io.liarslie.agent;

import io.liarslie.lifecycle.SequenceAllocator;
import io.liarslie.model.AgentDescriptor;
import io.liarslie.model.AgentStatus;
import io.liarslie.security.Signatures;

import java.util.concurrent.atomic.AtomicReference;

/**
 * A game participant: an immutable {@link AgentIdentity} plus the lifecycle status that the
 * owning supervisor tracks. Connection handlers only ever see the identity.
 */
public final class Agent {
    private final AgentIdentity identity;
    private final AtomicReference<AgentStatus> status;

    public Agent(AgentIdentity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("agent identity cannot be null");
        }
        this.identity = identity;
        this.status = new AtomicReference<>(AgentStatus.UNINITIALIZED);
    }

    public static Agent honest(SequenceAllocator sequence, String address, long value, String clientPublicKey) {
        return new Agent(new AgentIdentity(
                sequence.nextAgentId(),
                value,
                address,
                sequence.nextPort(),
                Signatures.generateKeyPair(),
                clientPublicKey,
                false,
                0.0d
        ));
    }

    public static Agent liar(
            SequenceAllocator sequence,
            String address,
            long honestValue,
            long maxValue,
            String clientPublicKey,
            double tamperProbability
    ) {
        return new Agent(new AgentIdentity(
                sequence.nextAgentId(),
                LiarValues.liarValue(honestValue, maxValue),
                address,
                sequence.nextPort(),
                Signatures.generateKeyPair(),
                clientPublicKey,
                true,
                tamperProbability
        ));
    }

    public AgentIdentity identity() {
        return identity;
    }

    public int id() {
        return identity.agentId();
    }

    public String address() {
        return identity.address();
    }

    public int port() {
        return identity.port();
    }

    public boolean isLiar() {
        return identity.liar();
    }

    public AgentStatus status() {
        return status.get();
    }

    public AgentDescriptor toDescriptor() {
        return identity.toDescriptor();
    }

    // Only the supervisor moves an agent between states.
    public boolean markReady() {
        return status.compareAndSet(AgentStatus.UNINITIALIZED, AgentStatus.READY);
    }

    public void markKilled() {
        status.set(AgentStatus.KILLED);
    }

    @Override
    public String toString() {
        return "Agent[id=" + identity.agentId() + ", endpoint=" + identity.address() + ":" + identity.port()
                + ", status=" + status.get() + "]";
    }
}
