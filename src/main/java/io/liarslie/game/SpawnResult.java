package io.liarslie.game;

import java.util.List;

public record SpawnResult(List<Integer> spawned, List<Integer> failed) {
    public SpawnResult {
        spawned = List.copyOf(spawned);
        failed = List.copyOf(failed);
    }

    public int spawnedCount() {
        return spawned.size();
    }
}
