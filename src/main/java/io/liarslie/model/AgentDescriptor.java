package io.liarslie.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The shareable identity of an agent: how to reach it and which key signs its answers.
 * Never carries the agent's reported value.
 */
public record AgentDescriptor(
        @JsonProperty("agent_id") int agentId,
        @JsonProperty("address") String address,
        @JsonProperty("port") int port,
        @JsonProperty("public_key") String publicKey
) {
    public AgentDescriptor {
        if (agentId <= 0) {
            throw new IllegalArgumentException("agent id must be positive: " + agentId);
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("agent address cannot be empty: " + agentId);
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("invalid agent port: " + port);
        }
        if (publicKey == null || publicKey.isBlank()) {
            throw new IllegalArgumentException("agent public key cannot be empty: " + agentId);
        }
    }

    public String endpoint() {
        return address + ":" + port;
    }
}
