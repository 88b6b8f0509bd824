package io.liarslie.client;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public final class NetworkValue {
    private NetworkValue() {
    }

    /**
     * Plurality vote over the collected values.
     *
     * @return every value whose count equals the highest count, ascending; a single element
     *         means a clear winner, several mean a tie, empty means no votes at all
     */
    public static Optional<List<Long>> inferNetworkValue(List<Long> values) {
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        Map<Long, Integer> counts = new TreeMap<>();
        for (Long value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        int maxCount = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<Long> winners = counts.entrySet().stream()
                .filter(entry -> entry.getValue() == maxCount)
                .map(Map.Entry::getKey)
                .toList();
        return Optional.of(winners);
    }
}
