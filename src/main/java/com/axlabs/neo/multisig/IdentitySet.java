package com.axlabs.neo.multisig;

import io.neow3j.types.Hash160;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A sequence of unique identities with constant time membership checks and swap-and-truncate removal. The order of
 * the sequence is not preserved by removals.
 */
final class IdentitySet {

    private final List<Hash160> entries = new ArrayList<>();
    private final Map<Hash160, Integer> positions = new HashMap<>();

    boolean contains(Hash160 identity) {
        return positions.containsKey(identity);
    }

    /**
     * @return false if the identity was already present.
     */
    boolean add(Hash160 identity) {
        if (positions.containsKey(identity)) {
            return false;
        }
        positions.put(identity, entries.size());
        entries.add(identity);
        return true;
    }

    /**
     * @return false if the identity was not present.
     */
    boolean remove(Hash160 identity) {
        Integer index = positions.remove(identity);
        if (index == null) {
            return false;
        }
        int last = entries.size() - 1;
        if (index != last) {
            Hash160 moved = entries.get(last);
            entries.set(index, moved);
            positions.put(moved, index);
        }
        entries.remove(last);
        return true;
    }

    int size() {
        return entries.size();
    }

    List<Hash160> toList() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }
}
