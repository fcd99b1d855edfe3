package com.stg2va.core.model;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable occupancy snapshot of a 1-safe net.
 *
 * <p>Bit {@code i} is set when place {@code i} holds its token. Equality is by value, so
 * markings can be used directly as keys when deduplicating reachable states.
 *
 * @param tokens tokened place indices
 */
public record Marking(
    BitSet tokens
) {
    /**
     * Compact constructor; takes a private copy of the bit set.
     */
    public Marking {
        Objects.requireNonNull(tokens, "tokens must not be null");
        tokens = (BitSet) tokens.clone();
    }

    /**
     * Creates a marking from place indices.
     *
     * @param places tokened place indices
     * @return marking
     */
    public static Marking of(Collection<Integer> places) {
        BitSet bits = new BitSet();
        places.forEach(bits::set);
        return new Marking(bits);
    }

    /**
     * Returns a copy of the underlying bits.
     *
     * @return tokened place indices as a bit set
     */
    @Override
    public BitSet tokens() {
        return (BitSet) tokens.clone();
    }

    /**
     * Checks whether a place holds a token.
     *
     * @param place place index
     * @return true if tokened
     */
    public boolean isMarked(int place) {
        return tokens.get(place);
    }

    /**
     * Returns the tokened place indices in ascending order.
     *
     * @return place indices
     */
    public List<Integer> markedPlaces() {
        return tokens.stream().boxed().toList();
    }

    /**
     * Returns the number of tokens in the marking.
     *
     * @return token count
     */
    public int tokenCount() {
        return tokens.cardinality();
    }
}
