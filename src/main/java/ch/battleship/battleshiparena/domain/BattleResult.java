package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.Side;

/**
 * Summary of a finished battle.
 *
 * @param battleId battle identifier
 * @param winner winning side, {@code null} for a draw
 * @param moves number of moves played by both sides together
 * @param startingSide side that moved first
 */
public record BattleResult(String battleId, Side winner, int moves, Side startingSide) {

    public boolean isDraw() {
        return winner == null;
    }
}
