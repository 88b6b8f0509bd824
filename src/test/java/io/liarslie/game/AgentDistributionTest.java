package io.liarslie.game;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AgentDistributionTest {
    @Test
    void liarCountShouldBeTruncated() {
        assertEquals(new AgentDistribution(3, 3), AgentDistribution.of(6, 0.6d));
        assertEquals(new AgentDistribution(71, 29), AgentDistribution.of(100, 0.29d));
        assertEquals(new AgentDistribution(3, 0), AgentDistribution.of(3, 0.3d));
    }

    @Test
    void ratioBoundsShouldBeInclusive() {
        assertEquals(new AgentDistribution(5, 0), AgentDistribution.of(5, 0.0d));
        assertEquals(new AgentDistribution(0, 5), AgentDistribution.of(5, 1.0d));
        assertEquals(5, AgentDistribution.of(5, 1.0d).total());
    }

    @Test
    void invalidRequestsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> AgentDistribution.of(0, 0.5d));
        assertThrows(IllegalArgumentException.class, () -> AgentDistribution.of(-2, 0.5d));
        assertThrows(IllegalArgumentException.class, () -> AgentDistribution.of(4, -0.1d));
        assertThrows(IllegalArgumentException.class, () -> AgentDistribution.of(4, 1.01d));
        assertThrows(IllegalArgumentException.class, () -> AgentDistribution.of(4, Double.NaN));
    }
}
