package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.ShotResult;
import ch.battleship.battleshiparena.domain.enums.Side;

/**
 * A single resolved attack, as reported to event sinks.
 *
 * @param battleId battle the move belongs to
 * @param moveIndex 1-based move number, counted over both sides
 * @param attacker side that attacked
 * @param target attacked cell
 * @param result outcome of the attack
 */
public record MoveEvent(String battleId, int moveIndex, Side attacker, Coordinate target, ShotResult result) {

    public boolean hit() {
        return result.isHit();
    }

    public boolean sunk() {
        return result.isSunk();
    }
}
