package io.liarslie.cli;

import io.liarslie.client.InsufficientAgentsException;
import io.liarslie.config.LiarsLieConfig;
import io.liarslie.game.Game;
import io.liarslie.game.RoundResult;
import io.liarslie.game.SpawnResult;
import io.liarslie.game.StopResult;
import io.liarslie.model.AgentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * The interactive game console. Each input line is one command, parsed by picocli against
 * the game subcommands and run against a single {@link Game}. Results go to the console;
 * diagnostics go to the log.
 */
public final class GameShell {
    private static final Logger LOG = LoggerFactory.getLogger(GameShell.class);

    static final String PROMPT = ">> ";
    static final String ERROR_PREFIX = "[!] error: ";

    private final LiarsLieConfig config;
    private final Game game;
    private final BufferedReader in;
    private final PrintWriter out;
    private final CommandLine commands;
    private boolean exitRequested;

    public GameShell(LiarsLieConfig config, Game game, BufferedReader in, PrintWriter out) {
        this.config = config;
        this.game = game;
        this.in = in;
        this.out = out;
        this.commands = new CommandLine(new ShellCommands(this));
        this.commands.setOut(out);
        this.commands.setErr(out);
        this.commands.setParameterExceptionHandler((ex, args) -> {
            out.println(ERROR_PREFIX + ex.getMessage());
            out.println("Type 'help' for a list of commands.");
            return 2;
        });
        this.commands.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            out.println(describe(ex));
            return 1;
        });
    }

    public int run() throws IOException {
        printWelcome();
        while (!exitRequested) {
            out.print(Ansi.AUTO.string("@|bold,green " + PROMPT.trim() + "|@ "));
            out.flush();
            String line = in.readLine();
            if (line == null) {
                // End of input behaves like an explicit stop.
                execute("stop");
                break;
            }
            execute(line);
        }
        return 0;
    }

    int execute(String line) {
        List<String> tokens = ShellCommandParser.parseTokens(line);
        if (tokens.isEmpty()) {
            return 0;
        }
        int code = commands.execute(tokens.toArray(new String[0]));
        out.println();
        out.flush();
        return code;
    }

    boolean exitRequested() {
        return exitRequested;
    }

    private void printWelcome() {
        out.println();
        out.println(Ansi.AUTO.string("@|bold,green >>>>> Welcome to Liars Lie! <<<<<|@"));
        out.println();
        out.println(Ansi.AUTO.string("@|bold Type 'help' for a list of commands.|@"));
        out.println();
        out.flush();
    }

    private void printSpawned(SpawnResult result) {
        out.println("[+] Successfully spawned " + result.spawnedCount() + " game agents!");
        if (!result.failed().isEmpty()) {
            out.println(ERROR_PREFIX + "agents " + joinIds(result.failed()) + " failed to start and were discarded");
        }
    }

    private void printNetworkValue(RoundResult result) {
        Optional<List<Long>> networkValue = result.networkValue();
        if (networkValue.isEmpty()) {
            out.println("[+] Unable to determine the network value; no valid replies were received.");
            return;
        }
        List<Long> winners = networkValue.get();
        if (winners.size() == 1) {
            out.println("[+] The network value is: " + winners.get(0));
            return;
        }
        out.println("[+] Unable to determine a single network value.");
        out.println("[+] The following values are tied: "
                + winners.stream().map(String::valueOf).collect(Collectors.joining(", ")));
    }

    static String describe(Exception ex) {
        if (ex instanceof InsufficientAgentsException) {
            return ERROR_PREFIX + ex.getMessage() + ". Choose a smaller number or extend the game.";
        }
        if (isGameStateMessage(ex)) {
            return ex.getMessage();
        }
        if (ex instanceof IllegalStateException || ex instanceof IllegalArgumentException || ex instanceof IOException) {
            return ERROR_PREFIX + ex.getMessage();
        }
        LOG.error("command failed", ex);
        return ERROR_PREFIX + "unexpected failure - " + ex;
    }

    // The game-state notices are printed as they are, without the error prefix.
    private static boolean isGameStateMessage(Exception ex) {
        return ex instanceof IllegalStateException
                && (Game.NOT_STARTED_MESSAGE.equals(ex.getMessage()) || Game.ALREADY_STARTED_MESSAGE.equals(ex.getMessage()));
    }

    private static String joinIds(List<Integer> ids) {
        return ids.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    @Command(
            name = "game",
            description = "Liars Lie game console",
            subcommands = {
                    StartCommand.class,
                    PlayCommand.class,
                    ExtendCommand.class,
                    PlayExpertCommand.class,
                    KillCommand.class,
                    StopCommand.class,
                    CommandLine.HelpCommand.class
            }
    )
    static final class ShellCommands implements Runnable {
        final GameShell shell;

        ShellCommands(GameShell shell) {
            this.shell = shell;
        }

        @Override
        public void run() {
            shell.out.println("Use commands: start | play | extend | play-expert | kill | stop | help");
        }
    }

    @Command(name = "start", description = "Launches agents and writes the roster file")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        ShellCommands parent;

        @Option(names = {"--value"}, required = true, description = "Value reported by honest agents")
        long value;

        @Option(names = {"--max-value"}, required = true, description = "Largest value a liar may report")
        long maxValue;

        @Option(names = {"--num-agents"}, required = true, description = "Number of agents to spawn")
        int numAgents;

        @Option(names = {"--liar-ratio"}, required = true, description = "Share of liars, 0.0 to 1.0")
        double liarRatio;

        @Option(names = {"--tamper-probability", "--tamper-chance"},
                description = "Chance that a liar corrupts each relayed value, 0.0 to 1.0")
        Double tamperProbability;

        @Override
        public Integer call() {
            GameShell shell = parent.shell;
            if (shell.game.isStarted()) {
                shell.out.println(Game.ALREADY_STARTED_MESSAGE);
                return 1;
            }
            double tamper = tamperProbability == null ? shell.config.defaultTamperProbability() : tamperProbability;
            CommandValidation.validateStart(value, maxValue, numAgents, liarRatio, tamper);
            shell.out.println("[+] Starting game!");
            shell.out.println();
            SpawnResult result;
            try {
                result = shell.game.start(value, maxValue, numAgents, liarRatio, tamper);
            } catch (IOException e) {
                shell.out.println(ERROR_PREFIX + "failed to write " + shell.config.rosterFile().getFileName() + " file - " + e.getMessage());
                return 1;
            }
            shell.printSpawned(result);
            shell.out.println();
            shell.out.println("[+] Game is ready!");
            return 0;
        }
    }

    @Command(name = "play", description = "Plays a round of the game on standard mode")
    static final class PlayCommand implements Callable<Integer> {
        @ParentCommand
        ShellCommands parent;

        @Override
        public Integer call() {
            GameShell shell = parent.shell;
            if (!shell.game.isStarted()) {
                shell.out.println(Game.NOT_STARTED_MESSAGE);
                return 1;
            }
            shell.out.println("[+] Playing a standard round...");
            shell.out.println();
            RoundResult result;
            try {
                result = shell.game.play();
            } catch (IOException e) {
                shell.out.println(ERROR_PREFIX + "failed to load data from " + shell.config.rosterFile().getFileName() + " - " + e.getMessage());
                return 1;
            }
            shell.out.println("[+] Queried " + result.contacted().size() + " agents for their values.");
            shell.printNetworkValue(result);
            return 0;
        }
    }

    @Command(name = "extend", description = "Spawns more agents with the game's original values")
    static final class ExtendCommand implements Callable<Integer> {
        @ParentCommand
        ShellCommands parent;

        @Option(names = {"--num-agents"}, required = true, description = "Number of new agents")
        int numAgents;

        @Option(names = {"--liar-ratio"}, required = true, description = "Share of liars among the new agents, 0.0 to 1.0")
        double liarRatio;

        @Override
        public Integer call() {
            GameShell shell = parent.shell;
            CommandValidation.validateSubset(numAgents, liarRatio);
            SpawnResult result;
            try {
                result = shell.game.extend(numAgents, liarRatio);
            } catch (IOException e) {
                shell.out.println(ERROR_PREFIX + "unable to extend game; failed to write "
                        + shell.config.rosterFile().getFileName() + " file - " + e.getMessage());
                return 1;
            }
            shell.printSpawned(result);
            return 0;
        }
    }

    @Command(name = "play-expert", description = "Plays a round through a random subset of relays")
    static final class PlayExpertCommand implements Callable<Integer> {
        @ParentCommand
        ShellCommands parent;

        @Option(names = {"--num-agents"}, required = true, description = "Number of agents the client may query directly")
        int numAgents;

        @Option(names = {"--liar-ratio"}, required = true, description = "Share of liars in the subset, 0.0 to 1.0")
        double liarRatio;

        @Override
        public Integer call() {
            GameShell shell = parent.shell;
            CommandValidation.validateSubset(numAgents, liarRatio);
            RoundResult result;
            try {
                result = shell.game.playExpert(numAgents, liarRatio);
            } catch (IOException e) {
                shell.out.println(ERROR_PREFIX + "failed to load data from " + shell.config.rosterFile().getFileName() + " - " + e.getMessage());
                return 1;
            }
            shell.out.println("[+] The following agents composed this round's expert subset: " + joinIds(result.contacted()));
            shell.out.println();
            shell.out.println("[+] Received valid, signed replies from " + result.values().size() + " agents!");
            shell.printNetworkValue(result);
            return 0;
        }
    }

    @Command(name = "kill", description = "Kills one agent; the roster file is left unchanged")
    static final class KillCommand implements Callable<Integer> {
        @ParentCommand
        ShellCommands parent;

        @Option(names = {"--id"}, required = true, description = "Id of the agent to kill")
        int agentId;

        @Override
        public Integer call() {
            GameShell shell = parent.shell;
            CommandValidation.validateAgentId(agentId);
            AgentDescriptor killed;
            try {
                killed = shell.game.kill(agentId);
            } catch (IOException e) {
                shell.out.println(ERROR_PREFIX + "unable to reach agent " + agentId + " - " + e.getMessage());
                return 1;
            }
            shell.out.println("[+] Killed agent (Agent ID: " + killed.agentId() + " - " + killed.endpoint() + ")");
            return 0;
        }
    }

    @Command(name = "stop", description = "Stops every agent, removes the roster file and quits")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        ShellCommands parent;

        @Override
        public Integer call() {
            GameShell shell = parent.shell;
            if (shell.game.isStarted()) {
                shell.out.println("[+] Stopping all agents...");
            }
            StopResult result = shell.game.stop();
            for (String failure : result.failures()) {
                shell.out.println(ERROR_PREFIX + failure);
            }
            if (!result.killed().isEmpty()) {
                shell.out.println("[+] Stopped " + result.killed().size() + " agents.");
            }
            shell.exitRequested = true;
            return 0;
        }
    }
}
