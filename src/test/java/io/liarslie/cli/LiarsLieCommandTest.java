package io.liarslie.cli;

import io.liarslie.config.LiarsLieConfig;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LiarsLieCommandTest {
    @Test
    void defaultsShouldMatchTheStandardGameSetup() {
        LiarsLieCommand command = new LiarsLieCommand();
        new CommandLine(command).parseArgs();

        LiarsLieConfig config = command.config();

        assertEquals("127.0.0.1", config.agentAddress());
        assertEquals(5000, config.basePort());
        assertEquals(Paths.get("agents.config").toAbsolutePath().normalize(), config.rosterFile());
        assertEquals(5000, config.readTimeoutMs());
    }

    @Test
    void optionsShouldOverrideDefaults() {
        LiarsLieCommand command = new LiarsLieCommand();
        new CommandLine(command).parseArgs("--roster", "build/roster.json", "--base-port", "7000", "--timeout-ms", "750");

        LiarsLieConfig config = command.config();

        assertEquals(7000, config.basePort());
        assertEquals(750, config.connectTimeoutMs());
        assertEquals("roster.json", config.rosterFile().getFileName().toString());
    }
}
