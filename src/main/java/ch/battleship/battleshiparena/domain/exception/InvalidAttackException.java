package ch.battleship.battleshiparena.domain.exception;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.enums.Side;
import lombok.Getter;

/**
 * Thrown when a strategy proposes a coordinate outside the board or one it already attacked.
 *
 * <p>The battle state is left untouched when this is raised.
 */
@Getter
public class InvalidAttackException extends IllegalArgumentException {

    private final Side offendingSide;
    private final Coordinate coordinate;

    public InvalidAttackException(Side offendingSide, Coordinate coordinate, String reason) {
        super("Player " + offendingSide.getNumber() + " proposed invalid attack " + coordinate + ": " + reason);
        this.offendingSide = offendingSide;
        this.coordinate = coordinate;
    }
}
