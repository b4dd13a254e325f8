package ch.battleship.battleshiparena.domain.exception;

/**
 * Thrown when random placement could not fit the fleet within its restart budget.
 */
public class PlacementExhaustedException extends IllegalStateException {

    public PlacementExhaustedException(int rows, int cols, int attempts) {
        super(String.format(
                "Could not place fleet on board %dx%d after %d attempts. Check ship counts vs board size.",
                cols, rows, attempts));
    }
}
