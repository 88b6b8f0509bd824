package io.liarslie.cli;

/**
 * Range checks for shell arguments. Messages name the offending option the way the user
 * typed it.
 */
final class CommandValidation {
    private CommandValidation() {
    }

    static void validateStart(long value, long maxValue, int numAgents, double liarRatio, double tamperProbability) {
        if (value <= 0) {
            throw new IllegalArgumentException("--value must be greater than 0");
        }
        if (value > maxValue) {
            throw new IllegalArgumentException("--value cannot be greater than --max-value");
        }
        if (maxValue <= 1) {
            throw new IllegalArgumentException("--max-value must be greater than 1");
        }
        validateNumAgents(numAgents);
        validateLiarRatio(liarRatio);
        if (!isProbability(tamperProbability)) {
            throw new IllegalArgumentException("--tamper-probability must be within the range of 0.0 to 1.0 (inclusive)");
        }
    }

    static void validateSubset(int numAgents, double liarRatio) {
        validateNumAgents(numAgents);
        validateLiarRatio(liarRatio);
    }

    static void validateAgentId(int agentId) {
        if (agentId <= 0) {
            throw new IllegalArgumentException("--id must be greater than 0");
        }
    }

    private static void validateNumAgents(int numAgents) {
        if (numAgents <= 0) {
            throw new IllegalArgumentException("--num-agents must be greater than 0");
        }
    }

    private static void validateLiarRatio(double liarRatio) {
        if (!isProbability(liarRatio)) {
            throw new IllegalArgumentException("--liar-ratio must be within the range of 0.0 to 1.0 (inclusive)");
        }
    }

    private static boolean isProbability(double value) {
        return !Double.isNaN(value) && value >= 0.0d && value <= 1.0d;
    }
}
