package io.liarslie.cli;

import io.liarslie.config.LiarsLieConfig;
import io.liarslie.game.Game;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(
        name = "liarslie",
        mixinStandardHelpOptions = true,
        version = "liarslie 0.1.0",
        description = "Liars Lie: find the network value among agents that may lie"
)
public final class LiarsLieCommand implements Callable<Integer> {
    @Option(names = {"--roster"}, defaultValue = LiarsLieConfig.DEFAULT_ROSTER_FILE,
            description = "Roster file listing the spawned agents")
    String roster;

    @Option(names = {"--address"}, defaultValue = LiarsLieConfig.DEFAULT_AGENT_ADDRESS,
            description = "Address agents bind to")
    String address;

    @Option(names = {"--base-port"}, defaultValue = "5000", description = "Port of the first agent")
    int basePort;

    @Option(names = {"--timeout-ms"}, defaultValue = "5000",
            description = "Connect and read timeout for agent connections in ms")
    int timeoutMs;

    LiarsLieConfig config() {
        return LiarsLieConfig.fromOptions(roster, address, basePort, timeoutMs);
    }

    @Override
    public Integer call() throws Exception {
        LiarsLieConfig config = config();
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        try (Game game = new Game(config)) {
            return new GameShell(config, game, in, out).run();
        }
    }
}
