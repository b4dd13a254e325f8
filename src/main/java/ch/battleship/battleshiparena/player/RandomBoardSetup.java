package ch.battleship.battleshiparena.player;

import ch.battleship.battleshiparena.domain.BoardStats;
import ch.battleship.battleshiparena.domain.Grid;
import ch.battleship.battleshiparena.domain.ShipCountRequest;
import ch.battleship.battleshiparena.engine.ShipPlacer;

/**
 * Board setup that places the fleet at random using {@link ShipPlacer}.
 */
public class RandomBoardSetup implements BoardSetup {

    private final int rows;
    private final int cols;
    private final ShipCountRequest shipCounts;
    private final ShipPlacer placer;
    private Grid board;

    public RandomBoardSetup(int rows, int cols, ShipCountRequest shipCounts, ShipPlacer placer) {
        this.rows = rows;
        this.cols = cols;
        this.shipCounts = shipCounts;
        this.placer = placer;
        this.board = new Grid(rows, cols);
    }

    @Override
    public void placeShips() {
        board = placer.place(rows, cols, shipCounts);
    }

    @Override
    public Grid getBoard() {
        return board.copy();
    }

    /**
     * Returns the tag at {@code (x, y)}: 0 for water, 1..7 for a ship id.
     *
     * @throws IndexOutOfBoundsException if the coordinates are outside the board
     */
    public int getTile(int x, int y) {
        return board.get(x, y);
    }

    public BoardStats boardStats() {
        return BoardStats.of(board);
    }

    public void resetBoard() {
        board.clear();
    }
}
