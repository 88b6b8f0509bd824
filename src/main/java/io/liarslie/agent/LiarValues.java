package io.liarslie.agent;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

public final class LiarValues {
    private LiarValues() {
    }

    public static long liarValue(long honestValue, long maxValue) {
        return liarValue(honestValue, maxValue, ThreadLocalRandom.current());
    }

    /**
     * Draws uniformly from {@code [1, maxValue]} without {@code honestValue}: a draw from
     * {@code [1, maxValue - 1]} is shifted up by one when it reaches the honest value, so a
     * single draw always suffices.
     */
    public static long liarValue(long honestValue, long maxValue, Random random) {
        if (maxValue <= 1) {
            throw new IllegalArgumentException("max value must be greater than 1: " + maxValue);
        }
        if (honestValue < 1 || honestValue > maxValue) {
            throw new IllegalArgumentException("honest value must be within [1, " + maxValue + "]: " + honestValue);
        }
        long candidate = random.nextLong(1, maxValue);
        if (candidate >= honestValue) {
            candidate++;
        }
        return candidate;
    }
}
