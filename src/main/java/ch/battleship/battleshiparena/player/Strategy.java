package ch.battleship.battleshiparena.player;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.enums.ShotResult;

/**
 * Attack-selection capability of a battle participant.
 *
 * <p>A strategy only learns about the enemy board through the results passed to
 * {@link #registerAttack(int, int, boolean, boolean)}.
 */
public interface Strategy {

    /**
     * Proposes the next cell to attack. The engine rejects cells outside the board and cells that
     * were attacked before.
     *
     * @return target cell
     */
    Coordinate getNextAttack();

    /**
     * Reports the outcome of the attack that was just resolved.
     *
     * @param x attacked column
     * @param y attacked row
     * @param hit whether a ship was hit
     * @param sunk whether the hit ship is now sunk
     */
    void registerAttack(int x, int y, boolean hit, boolean sunk);

    default void registerAttack(Coordinate target, ShotResult result) {
        registerAttack(target.getX(), target.getY(), result.isHit(), result.isSunk());
    }
}
