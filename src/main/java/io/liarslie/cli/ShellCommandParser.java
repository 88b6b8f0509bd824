package io.liarslie.cli;

import java.util.ArrayList;
import java.util.List;

final class ShellCommandParser {
    private ShellCommandParser() {
    }

    static List<String> parseTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (!token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }
}
