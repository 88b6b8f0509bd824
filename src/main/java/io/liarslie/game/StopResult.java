package io.liarslie.game;

import java.util.List;

/** Outcome of tearing a game down; failures are reported, never thrown. */
public record StopResult(List<Integer> killed, List<String> failures) {
    public StopResult {
        killed = List.copyOf(killed);
        failures = List.copyOf(failures);
    }
}
