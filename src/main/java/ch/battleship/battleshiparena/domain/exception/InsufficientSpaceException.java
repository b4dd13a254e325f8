package ch.battleship.battleshiparena.domain.exception;

/**
 * Thrown when the requested fleet needs more tiles than the board has cells.
 *
 * <p>Raised before any placement or turn takes place.
 */
public class InsufficientSpaceException extends IllegalArgumentException {

    private final long requiredTiles;
    private final long availableCells;

    public InsufficientSpaceException(long requiredTiles, long availableCells) {
        super("Not enough space to place all ships: " + requiredTiles
                + " tiles requested but the board only has " + availableCells + " cells");
        this.requiredTiles = requiredTiles;
        this.availableCells = availableCells;
    }

    public long getRequiredTiles() {
        return requiredTiles;
    }

    public long getAvailableCells() {
        return availableCells;
    }
}
