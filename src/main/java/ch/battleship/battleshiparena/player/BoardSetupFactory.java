package ch.battleship.battleshiparena.player;

import ch.battleship.battleshiparena.domain.ShipCountRequest;

import java.util.Random;

@FunctionalInterface
public interface BoardSetupFactory {

    /**
     * Creates the board setup of one side for one battle.
     *
     * @param rows board rows
     * @param cols board columns
     * @param shipCounts ships to place
     * @param random random source owned by this battle
     * @return new board setup
     */
    BoardSetup create(int rows, int cols, ShipCountRequest shipCounts, Random random);
}
