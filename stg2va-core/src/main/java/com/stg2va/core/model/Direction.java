package com.stg2va.core.model;

/**
 * Edge direction carried by a transition label.
 */
public enum Direction {
    RISE('+'),
    FALL('-'),
    /** Toggle; also the tag of every dummy transition */
    TOGGLE('~');

    private final char symbol;

    Direction(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the suffix used for this direction in the {@code .g} format.
     *
     * @return {@code '+'}, {@code '-'} or {@code '~'}
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Resolves a {@code .g} suffix character.
     *
     * @param symbol suffix character
     * @return matching direction
     * @throws IllegalArgumentException if the character is not a direction suffix
     */
    public static Direction fromSymbol(char symbol) {
        for (Direction direction : values()) {
            if (direction.symbol == symbol) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown direction symbol: " + symbol);
    }
}
