package ch.battleship.battleshiparena.domain;

import lombok.Getter;

import java.util.List;

/**
 * Immutable value object representing a cell on a board.
 *
 * <p>Coordinates are 0-based: {@code x} is the column (0..cols-1) and {@code y} the row
 * (0..rows-1). Implements {@link #equals(Object)} and {@link #hashCode()} so coordinates can be
 * collected in sets (ship cells, hit sets, attack history).
 */
@Getter
public final class Coordinate {

    private final int x;
    private final int y;

    /**
     * Creates a coordinate with 0-based indices.
     *
     * @param x 0-based column
     * @param y 0-based row
     */
    public Coordinate(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public Coordinate translate(int dx, int dy) {
        return new Coordinate(x + dx, y + dy);
    }

    /**
     * Returns the four orthogonal neighbours (left, right, up, down) without bounds checking.
     *
     * @return neighbour coordinates, possibly outside any board
     */
    public List<Coordinate> orthogonalNeighbours() {
        return List.of(
                translate(-1, 0),
                translate(1, 0),
                translate(0, -1),
                translate(0, 1)
        );
    }

    /**
     * Checkerboard colour of this cell, {@code (x + y) mod 2}.
     */
    public int parity() {
        return Math.floorMod(x + y, 2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate other)) return false;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
