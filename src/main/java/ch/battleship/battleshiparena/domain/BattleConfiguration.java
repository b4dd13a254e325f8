package ch.battleship.battleshiparena.domain;

/**
 * Board dimensions and fleet shared by both sides of a battle.
 *
 * @param rows board rows
 * @param cols board columns
 * @param shipCounts ships each side places and has to sink
 */
public record BattleConfiguration(int rows, int cols, ShipCountRequest shipCounts) {

    /**
     * Moves per board cell after which a battle is declared a draw.
     */
    public static final int MOVE_CAP_FACTOR = 100;

    public BattleConfiguration {
        requireValidDimensions(rows, cols);
        if (shipCounts == null) {
            throw new IllegalArgumentException("Ship counts are required");
        }
    }

    /**
     * Returns the classic 10x10 configuration with one ship of each type.
     */
    public static BattleConfiguration defaultConfig() {
        return new BattleConfiguration(10, 10, ShipCountRequest.ofCounts(1, 1, 1, 1, 1, 1, 1));
    }

    /**
     * Checks that a board of the given size is usable: both dimensions positive and the move cap
     * representable as an {@code int}.
     *
     * @throws IllegalArgumentException if the dimensions are not positive or the board is too large
     */
    public static void requireValidDimensions(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Board dimensions must be positive but were " + cols + "x" + rows);
        }
        try {
            Math.multiplyExact(Math.multiplyExact(rows, cols), MOVE_CAP_FACTOR);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Board dimensions too large: " + cols + "x" + rows, e);
        }
    }

    public int area() {
        return rows * cols;
    }

    public int moveCap() {
        return area() * MOVE_CAP_FACTOR;
    }
}
