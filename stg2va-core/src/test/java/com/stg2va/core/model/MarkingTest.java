package com.stg2va.core.model;

import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link Marking}.
 */
class MarkingTest {

    @Test
    void of_withPlaces_marksExactlyThosePlaces() {
        Marking marking = Marking.of(List.of(3, 0));

        assertThat(marking.isMarked(0)).isTrue();
        assertThat(marking.isMarked(1)).isFalse();
        assertThat(marking.isMarked(3)).isTrue();
        assertThat(marking.markedPlaces()).containsExactly(0, 3);
        assertThat(marking.tokenCount()).isEqualTo(2);
    }

    @Test
    void equals_withSameTokens_isTrue() {
        assertThat(Marking.of(List.of(1, 2))).isEqualTo(Marking.of(List.of(2, 1)));
        assertThat(Marking.of(List.of(1, 2)).hashCode()).isEqualTo(Marking.of(List.of(2, 1)).hashCode());
        assertThat(Marking.of(List.of(1))).isNotEqualTo(Marking.of(List.of(2)));
    }

    @Test
    void constructor_copiesBits() {
        BitSet bits = new BitSet();
        bits.set(4);
        Marking marking = new Marking(bits);

        bits.set(5);
        marking.tokens().set(6);

        assertThat(marking.markedPlaces()).containsExactly(4);
    }

    @Test
    void constructor_withNullTokens_throwsException() {
        assertThatThrownBy(() -> new Marking(null))
            .isInstanceOf(NullPointerException.class);
    }
}
