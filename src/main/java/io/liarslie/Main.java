package io.liarslie;

import io.liarslie.cli.LiarsLieCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LiarsLieCommand()).execute(args);
        System.exit(code);
    }
}
