package ch.battleship.battleshiparena.player;

import ch.battleship.battleshiparena.domain.Coordinate;
import lombok.Getter;

import java.util.Arrays;

/**
 * Per-cell attack priority of a strategy. Values are non-negative; higher means more promising.
 */
public class ProbabilityMap {

    @Getter
    private final int rows;
    @Getter
    private final int cols;
    private final double[][] values;

    /**
     * Creates a map with every cell set to {@code initial}.
     */
    public ProbabilityMap(int rows, int cols, double initial) {
        this.rows = rows;
        this.cols = cols;
        this.values = new double[rows][cols];
        for (double[] row : values) {
            Arrays.fill(row, initial);
        }
    }

    public boolean isInBounds(Coordinate c) {
        return c.getX() >= 0 && c.getX() < cols && c.getY() >= 0 && c.getY() < rows;
    }

    public double get(Coordinate c) {
        return values[c.getY()][c.getX()];
    }

    public void multiply(Coordinate c, double factor) {
        values[c.getY()][c.getX()] *= factor;
    }

    public void zero(Coordinate c) {
        values[c.getY()][c.getX()] = 0.0;
    }
}
