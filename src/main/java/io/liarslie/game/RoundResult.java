package io.liarslie.game;

import io.liarslie.client.NetworkValue;

import java.util.List;
import java.util.Optional;

/**
 * The votes of one round.
 *
 * @param contacted ids of the agents the client talked to directly
 * @param values    the authenticated values, one per accepted vote
 */
public record RoundResult(List<Integer> contacted, List<Long> values) {
    public RoundResult {
        contacted = List.copyOf(contacted);
        values = List.copyOf(values);
    }

    public Optional<List<Long>> networkValue() {
        return NetworkValue.inferNetworkValue(values);
    }
}
