package ch.battleship.battleshiparena.domain.exception;

/**
 * Thrown by a strategy asked for another attack after every cell was attacked.
 *
 * <p>The engine ends a battle as soon as a fleet is destroyed, so this indicates a bug.
 */
public class NoAttacksRemainingException extends IllegalStateException {

    public NoAttacksRemainingException() {
        super("No remaining attack positions");
    }
}
