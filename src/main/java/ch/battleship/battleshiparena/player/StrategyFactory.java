package ch.battleship.battleshiparena.player;

import ch.battleship.battleshiparena.domain.ShipCountRequest;

@FunctionalInterface
public interface StrategyFactory {

    /**
     * Creates the strategy of one side for one battle.
     *
     * @param rows rows of the enemy board
     * @param cols columns of the enemy board
     * @param shipCounts ships the strategy eventually has to sink
     * @return new strategy
     */
    Strategy create(int rows, int cols, ShipCountRequest shipCounts);
}
