package ch.battleship.battleshiparena.domain;

/**
 * Cell counts of a placed board.
 *
 * @param emptySpaces cells without a ship
 * @param occupiedSpaces cells covered by a ship
 */
public record BoardStats(int emptySpaces, int occupiedSpaces) {

    public static BoardStats of(Grid grid) {
        int occupied = grid.occupiedCount();
        return new BoardStats(grid.area() - occupied, occupied);
    }
}
