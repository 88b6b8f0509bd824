package io.liarslie.cli;

import io.liarslie.TestPorts;
import io.liarslie.config.LiarsLieConfig;
import io.liarslie.game.Game;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GameShellTest {
    @TempDir
    Path tempDir;

    private final StringWriter output = new StringWriter();
    private LiarsLieConfig config;

    @Test
    void helpShouldListGameCommands() throws Exception {
        try (Game game = new Game(config(1))) {
            GameShell shell = shell(game, "");

            assertEquals(0, shell.execute("help"));

            String text = output.toString();
            assertTrue(text.contains("start"));
            assertTrue(text.contains("play-expert"));
            assertTrue(text.contains("kill"));
        }
    }

    @Test
    void commandsBeforeStartShouldPrintNotStarted() throws Exception {
        try (Game game = new Game(config(1))) {
            GameShell shell = shell(game, "");

            shell.execute("play");
            shell.execute("play-expert --num-agents 1 --liar-ratio 0.0");

            assertTrue(output.toString().contains(Game.NOT_STARTED_MESSAGE));
            assertFalse(output.toString().contains(GameShell.ERROR_PREFIX));
        }
    }

    @Test
    void invalidArgumentsShouldPrintErrors() throws Exception {
        try (Game game = new Game(config(1))) {
            GameShell shell = shell(game, "");

            assertEquals(1, shell.execute("start --value 0 --max-value 5 --num-agents 2 --liar-ratio 0.5"));
            assertTrue(output.toString().contains("[!] error: --value must be greater than 0"));

            assertEquals(1, shell.execute("kill --id 0"));
            assertTrue(output.toString().contains("[!] error: --id must be greater than 0"));

            assertEquals(2, shell.execute("start --value 5"));
            assertEquals(2, shell.execute("dance"));
            assertTrue(output.toString().contains("Type 'help' for a list of commands."));
            assertFalse(game.isStarted());
        }
    }

    @Test
    void onlyGameStateNoticesShouldSkipTheErrorPrefix() {
        assertEquals(Game.NOT_STARTED_MESSAGE, GameShell.describe(new IllegalStateException(Game.NOT_STARTED_MESSAGE)));
        assertEquals(Game.ALREADY_STARTED_MESSAGE, GameShell.describe(new IllegalStateException(Game.ALREADY_STARTED_MESSAGE)));
        assertEquals("[!] error: port range exhausted", GameShell.describe(new IllegalStateException("port range exhausted")));
        assertEquals("[!] error: --id must be greater than 0",
                GameShell.describe(new IllegalArgumentException("--id must be greater than 0")));
    }

    @Test
    void blankLineShouldDoNothing() throws Exception {
        try (Game game = new Game(config(1))) {
            GameShell shell = shell(game, "");

            assertEquals(0, shell.execute("   "));
            assertEquals("", output.toString());
        }
    }

    @Test
    void sessionShouldPlayAndStopOnEndOfInput() throws Exception {
        String input = String.join("\n",
                "start --value 5 --max-value 9 --num-agents 2 --liar-ratio 0.0",
                "play",
                "kill --id 2",
                "kill --id 2",
                "");
        try (Game game = new Game(config(2))) {
            GameShell shell = shell(game, input);

            assertEquals(0, shell.run());

            String text = output.toString();
            assertTrue(text.contains("Welcome to Liars Lie!"));
            assertTrue(text.contains("[+] Successfully spawned 2 game agents!"));
            assertTrue(text.contains("[+] Game is ready!"));
            assertTrue(text.contains("[+] Queried 2 agents for their values."));
            assertTrue(text.contains("[+] The network value is: 5"));
            assertTrue(text.contains("[+] Killed agent (Agent ID: 2 - 127.0.0.1:"));
            assertTrue(text.contains("[!] error: the ID '2' does not correspond to any active agent"));
            assertTrue(text.contains("[+] Stopped 1 agents."));
            assertTrue(shell.exitRequested());
            assertFalse(Files.exists(config.rosterFile()));
        }
    }

    @Test
    void stopShouldEndTheSession() throws Exception {
        try (Game game = new Game(config(1))) {
            GameShell shell = shell(game, "stop\nplay\n");

            shell.run();

            assertTrue(shell.exitRequested());
            assertFalse(output.toString().contains(Game.NOT_STARTED_MESSAGE));
        }
    }

    private GameShell shell(Game game, String input) {
        return new GameShell(config, game, new BufferedReader(new StringReader(input)), new PrintWriter(output, true));
    }

    private LiarsLieConfig config(int ports) throws Exception {
        config = new LiarsLieConfig("127.0.0.1", 1, TestPorts.freePortBlock(ports),
                tempDir.resolve("agents.config"), 500, 2000, 3000, 1024 * 1024, 0.0d);
        return config;
    }
}
