package io.liarslie.game;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How many honest agents and liars a request for {@code numAgents} agents with a share of
 * {@code liarRatio} liars yields. The liar count is truncated, so 6 agents at 0.6 give 3 liars.
 */
public record AgentDistribution(int honest, int liars) {
    public AgentDistribution {
        if (honest < 0 || liars < 0) {
            throw new IllegalArgumentException("agent counts cannot be negative");
        }
    }

    public static AgentDistribution of(int numAgents, double liarRatio) {
        if (numAgents <= 0) {
            throw new IllegalArgumentException("number of agents must be greater than 0: " + numAgents);
        }
        if (Double.isNaN(liarRatio) || liarRatio < 0.0d || liarRatio > 1.0d) {
            throw new IllegalArgumentException("liar ratio must be within [0.0, 1.0]: " + liarRatio);
        }
        // Decimal arithmetic keeps 100 x 0.29 at 29 liars.
        int liars = BigDecimal.valueOf(liarRatio)
                .multiply(BigDecimal.valueOf(numAgents))
                .setScale(0, RoundingMode.DOWN)
                .intValueExact();
        return new AgentDistribution(numAgents - liars, liars);
    }

    public int total() {
        return honest + liars;
    }
}
