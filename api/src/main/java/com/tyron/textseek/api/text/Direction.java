package com.tyron.textseek.api.text;

/**
 * Scan direction. {@link #step()} is meant to be added to lines and columns.
 */
public enum Direction {
    FORWARD(1),
    BACKWARD(-1);

    private final int step;

    Direction(int step) {
        this.step = step;
    }

    public int step() {
        return step;
    }

    public Direction opposite() {
        return this == FORWARD ? BACKWARD : FORWARD;
    }
}
