package io.liarslie.client;

import io.liarslie.agent.Agent;
import io.liarslie.model.AgentDescriptor;
import io.liarslie.model.AgentStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Picks the relays of an expert round: a random selection of running agents with the
 * requested number of honest agents and liars. Availability is checked before anything is
 * drawn, so an impossible request fails without touching the network.
 */
public final class ExpertSubsetSampler {
    private final Random random;

    public ExpertSubsetSampler() {
        this(new Random());
    }

    public ExpertSubsetSampler(Random random) {
        this.random = random;
    }

    public List<AgentDescriptor> sample(List<Agent> agents, int wantHonest, int wantLiars) {
        if (wantHonest < 0 || wantLiars < 0) {
            throw new IllegalArgumentException("subset sizes cannot be negative");
        }
        List<Agent> ready = new ArrayList<>();
        for (Agent agent : agents) {
            if (agent.status() == AgentStatus.READY) {
                ready.add(agent);
            }
        }
        int honestAvailable = (int) ready.stream().filter(agent -> !agent.isLiar()).count();
        int liarsAvailable = ready.size() - honestAvailable;
        if (wantHonest > honestAvailable) {
            throw new InsufficientAgentsException("honest agents", wantHonest, honestAvailable);
        }
        if (wantLiars > liarsAvailable) {
            throw new InsufficientAgentsException("liars", wantLiars, liarsAvailable);
        }

        // Shuffled so repeated rounds with the same sizes do not reuse the same relays.
        Collections.shuffle(ready, random);
        List<AgentDescriptor> subset = new ArrayList<>(wantHonest + wantLiars);
        ready.stream()
                .filter(agent -> !agent.isLiar())
                .limit(wantHonest)
                .map(Agent::toDescriptor)
                .forEach(subset::add);
        ready.stream()
                .filter(Agent::isLiar)
                .limit(wantLiars)
                .map(Agent::toDescriptor)
                .forEach(subset::add);
        return List.copyOf(subset);
    }
}
