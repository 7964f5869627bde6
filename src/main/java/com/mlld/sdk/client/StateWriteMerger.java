package com.mlld.sdk.client;

import com.mlld.sdk.protocol.LiveProtocol;
import com.mlld.sdk.types.results.StateWrite;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges two lists of state writes, keeping the first occurrence of each
 * (path, serialized value) pair. Primary entries come first.
 */
final class StateWriteMerger {

    private final LiveProtocol protocol;

    StateWriteMerger(LiveProtocol protocol) {
        this.protocol = protocol;
    }

    List<StateWrite> merge(List<StateWrite> primary, List<StateWrite> secondary) {
        if (secondary.isEmpty()) {
            return new ArrayList<>(primary);
        }
        if (primary.isEmpty()) {
            return new ArrayList<>(secondary);
        }

        List<StateWrite> merged = new ArrayList<>(primary.size() + secondary.size());
        Set<String> seen = new HashSet<>();
        for (List<StateWrite> source : List.of(primary, secondary)) {
            for (StateWrite stateWrite : source) {
                if (seen.add(protocol.stateWriteKey(stateWrite))) {
                    merged.add(stateWrite);
                }
            }
        }
        return merged;
    }
}
