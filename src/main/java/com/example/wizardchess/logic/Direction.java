package com.example.wizardchess.logic;

/**
 * The six lattice directions as offsets in rotated square coordinates. The first-listed
 * side (white) advances toward lower rows, i.e. toward decreasing {@code x + y}.
 */
public enum Direction {
    NORTH_WEST(-1, 0),
    NORTH_EAST(0, -1),
    EAST(1, -1),
    SOUTH_EAST(1, 0),
    SOUTH_WEST(0, 1),
    WEST(-1, 1);

    private final int dx;
    private final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int dx() {
        return dx;
    }

    public int dy() {
        return dy;
    }
}
