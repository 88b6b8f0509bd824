package io.liarslie.agent;

import io.liarslie.model.AgentDescriptor;
import io.liarslie.security.SigningKeys;

/**
 * Read-only view of an agent handed to its runtime and connection handlers.
 */
public record AgentIdentity(
        int agentId,
        long reportedValue,
        String address,
        int port,
        SigningKeys keys,
        String trustedClientPublicKey,
        boolean liar,
        double tamperProbability
) {
    public AgentIdentity {
        if (agentId <= 0) {
            throw new IllegalArgumentException("agent id must be positive: " + agentId);
        }
        if (keys == null) {
            throw new IllegalArgumentException("agent keys are required: " + agentId);
        }
        if (trustedClientPublicKey == null || trustedClientPublicKey.isBlank()) {
            throw new IllegalArgumentException("trusted client key is required: " + agentId);
        }
        if (tamperProbability < 0.0d || tamperProbability > 1.0d) {
            throw new IllegalArgumentException("tamper probability must be within [0.0, 1.0]: " + tamperProbability);
        }
    }

    public AgentDescriptor toDescriptor() {
        return new AgentDescriptor(agentId, address, port, keys.publicKey());
    }
}
