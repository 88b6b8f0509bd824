package io.liarslie.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommandValidationTest {
    @Test
    void validStartArgumentsShouldPass() {
        assertDoesNotThrow(() -> CommandValidation.validateStart(5, 5, 1, 0.0d, 1.0d));
        assertDoesNotThrow(() -> CommandValidation.validateStart(1, 2, 10, 1.0d, 0.0d));
    }

    @Test
    void startErrorsShouldNameTheOption() {
        assertRejected("--value must be greater than 0", () -> CommandValidation.validateStart(0, 5, 1, 0.5d, 0.5d));
        assertRejected("--value cannot be greater than --max-value", () -> CommandValidation.validateStart(6, 5, 1, 0.5d, 0.5d));
        assertRejected("--max-value must be greater than 1", () -> CommandValidation.validateStart(1, 1, 1, 0.5d, 0.5d));
        assertRejected("--num-agents must be greater than 0", () -> CommandValidation.validateStart(1, 5, 0, 0.5d, 0.5d));
        assertRejected("--liar-ratio must be within the range of 0.0 to 1.0 (inclusive)",
                () -> CommandValidation.validateStart(1, 5, 1, 1.1d, 0.5d));
        assertRejected("--tamper-probability must be within the range of 0.0 to 1.0 (inclusive)",
                () -> CommandValidation.validateStart(1, 5, 1, 0.5d, -0.5d));
    }

    @Test
    void subsetAndIdErrorsShouldNameTheOption() {
        assertRejected("--num-agents must be greater than 0", () -> CommandValidation.validateSubset(-1, 0.5d));
        assertRejected("--liar-ratio must be within the range of 0.0 to 1.0 (inclusive)",
                () -> CommandValidation.validateSubset(2, Double.NaN));
        assertRejected("--id must be greater than 0", () -> CommandValidation.validateAgentId(0));
    }

    private static void assertRejected(String message, Executable executable) {
        assertEquals(message, assertThrows(IllegalArgumentException.class, executable).getMessage());
    }
}
