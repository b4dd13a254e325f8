package ch.battleship.battleshiparena.player;

import ch.battleship.battleshiparena.domain.Grid;

/**
 * Ship-placement capability of a battle participant.
 *
 * <p>Instances are created for one battle from (rows, cols, ship counts). The engine calls
 * {@link #placeShips()} once and then reads the result through {@link #getBoard()}; it never depends
 * on how an implementation stores its board.
 */
public interface BoardSetup {

    /**
     * Places the fleet on the internal board.
     *
     * @throws ch.battleship.battleshiparena.domain.exception.InsufficientSpaceException if the fleet
     *         does not fit on the board
     * @throws ch.battleship.battleshiparena.domain.exception.PlacementExhaustedException if no valid
     *         arrangement was found
     */
    void placeShips();

    /**
     * Returns a copy of the board: {@link Grid#EMPTY} for water, 1..7 for ship ids.
     *
     * @return defensive copy; changes to it do not affect the setup
     */
    Grid getBoard();
}
