package io.liarslie.client;

import io.liarslie.model.AgentDescriptor;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The client's view of the agent population, keyed by agent id. It is the trust anchor for
 * forwarded votes: a vote only counts if it verifies against the key registered here.
 */
public final class PeerRegistry {
    private final Map<Integer, AgentDescriptor> peers = new ConcurrentHashMap<>();

    public void register(AgentDescriptor descriptor) {
        peers.put(descriptor.agentId(), descriptor);
    }

    public void replaceAll(Collection<AgentDescriptor> descriptors) {
        peers.clear();
        for (AgentDescriptor descriptor : descriptors) {
            register(descriptor);
        }
    }

    public Optional<AgentDescriptor> findById(int agentId) {
        return Optional.ofNullable(peers.get(agentId));
    }

    public Optional<String> publicKeyOf(int agentId) {
        return findById(agentId).map(AgentDescriptor::publicKey);
    }

    public List<AgentDescriptor> list() {
        return peers.values().stream()
                .sorted(Comparator.comparingInt(AgentDescriptor::agentId))
                .toList();
    }
}
