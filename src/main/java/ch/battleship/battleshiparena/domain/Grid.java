package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.ShotResult;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Arrays;
import java.util.Map;

/**
 * Rectangular board of integer cell tags.
 *
 * <p>A placement grid only contains {@link #EMPTY} and ship ids 1..7. The tags {@link #HIT},
 * {@link #SUNK} and {@link #MISS} are display markers and only appear on copies produced by
 * {@link #withShots(Map)}; the canonical hit state lives in the ship instances.
 *
 * <p>The shape is fixed at construction. Each side owns its grid; other code only ever receives
 * copies via {@link #copy()}.
 */
@Getter
public class Grid {

    public static final int EMPTY = 0;
    public static final int HIT = 8;
    public static final int SUNK = 9;
    public static final int MISS = 10;

    private final int rows;
    private final int cols;

    @Getter(AccessLevel.NONE)
    private final int[][] cells;

    public Grid(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Board dimensions must be positive but were " + rows + "x" + cols);
        }
        try {
            Math.multiplyExact(rows, cols);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Board dimensions too large: " + rows + "x" + cols, e);
        }
        this.rows = rows;
        this.cols = cols;
        this.cells = new int[rows][cols];
    }

    private Grid(Grid source) {
        this.rows = source.rows;
        this.cols = source.cols;
        this.cells = new int[rows][];
        for (int y = 0; y < rows; y++) {
            this.cells[y] = source.cells[y].clone();
        }
    }

    /**
     * Builds a grid from row-major tag arrays ({@code rows[y][x]}).
     *
     * @param rows tag rows, all of equal length
     * @return new grid holding a copy of the tags
     */
    public static Grid of(int[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Grid needs at least one row");
        }
        Grid grid = new Grid(rows.length, rows[0].length);
        for (int y = 0; y < rows.length; y++) {
            if (rows[y].length != grid.cols) {
                throw new IllegalArgumentException("Row " + y + " has " + rows[y].length + " cells, expected " + grid.cols);
            }
            for (int x = 0; x < grid.cols; x++) {
                grid.cells[y][x] = rows[y][x];
            }
        }
        return grid;
    }

    public boolean isInBounds(int x, int y) {
        return x >= 0 && x < cols && y >= 0 && y < rows;
    }

    public boolean isInBounds(Coordinate c) {
        return isInBounds(c.getX(), c.getY());
    }

    /**
     * Returns the tag at the given cell.
     *
     * @throws IndexOutOfBoundsException if the cell lies outside the grid
     */
    public int get(int x, int y) {
        if (!isInBounds(x, y)) {
            throw new IndexOutOfBoundsException("Coordinates out of bounds: (" + x + "," + y + ")");
        }
        return cells[y][x];
    }

    public int get(Coordinate c) {
        return get(c.getX(), c.getY());
    }

    public void set(Coordinate c, int tag) {
        if (!isInBounds(c)) {
            throw new IndexOutOfBoundsException("Coordinates out of bounds: " + c);
        }
        cells[c.getY()][c.getX()] = tag;
    }

    public boolean isEmpty(Coordinate c) {
        return get(c) == EMPTY;
    }

    public void clear() {
        for (int[] row : cells) {
            Arrays.fill(row, EMPTY);
        }
    }

    public int area() {
        return rows * cols;
    }

    public int occupiedCount() {
        int occupied = 0;
        for (int[] row : cells) {
            for (int tag : row) {
                if (tag != EMPTY) occupied++;
            }
        }
        return occupied;
    }

    public Grid copy() {
        return new Grid(this);
    }

    /**
     * Returns a display copy with attack markers painted over the ship ids.
     *
     * @param shots attacked cells and their results
     * @return new grid containing {@link #HIT}, {@link #SUNK} and {@link #MISS} markers
     */
    public Grid withShots(Map<Coordinate, ShotResult> shots) {
        Grid display = copy();
        shots.forEach((c, result) -> {
            if (!isInBounds(c)) return;
            switch (result) {
                case MISS -> display.cells[c.getY()][c.getX()] = MISS;
                case HIT -> display.cells[c.getY()][c.getX()] = HIT;
                case SUNK -> display.cells[c.getY()][c.getX()] = SUNK;
            }
        });
        return display;
    }

    /**
     * Renders the grid as text with column and row indices.
     *
     * <p>Symbols: {@code .} water (and intact ship cells when ships are hidden), {@code 1..7} ship
     * id, {@code X} hit, {@code #} sunk, {@code O} miss.
     *
     * @param showShips whether intact ship cells reveal their id
     * @return multi-line ASCII rendering
     */
    public String render(boolean showShips) {
        StringBuilder sb = new StringBuilder();
        sb.append("Board (").append(cols).append("x").append(rows).append(")\n");

        sb.append("   ");
        for (int x = 0; x < cols; x++) sb.append(x % 10).append(' ');
        sb.append('\n');

        for (int y = 0; y < rows; y++) {
            sb.append(String.format("%2d ", y));
            for (int x = 0; x < cols; x++) sb.append(symbol(cells[y][x], showShips)).append(' ');
            sb.append('\n');
        }
        return sb.toString();
    }

    private static char symbol(int tag, boolean showShips) {
        return switch (tag) {
            case EMPTY -> '.';
            case HIT -> 'X';
            case SUNK -> '#';
            case MISS -> 'O';
            default -> showShips ? Character.forDigit(tag, 10) : '.';
        };
    }
}
