package ch.battleship.battleshiparena.engine;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.Grid;
import ch.battleship.battleshiparena.domain.ShapeCatalog;
import ch.battleship.battleshiparena.domain.ShapeDefinition;
import ch.battleship.battleshiparena.domain.ShipCountRequest;
import ch.battleship.battleshiparena.domain.enums.Rotation;
import ch.battleship.battleshiparena.domain.enums.ShipType;
import ch.battleship.battleshiparena.domain.exception.InsufficientSpaceException;
import ch.battleship.battleshiparena.domain.exception.PlacementExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Randomized placement of a fleet onto an empty grid.
 *
 * <p>Ships are placed largest first. For each ship a footprint variant is chosen, then anchors are
 * tried in shuffled order with all four rotations until a valid position is found. A position is
 * valid if every cell is on the board and empty and no cell has an occupied orthogonal neighbour.
 *
 * <p>If any ship cannot be placed, the board is cleared and the whole fleet is placed again. This
 * happens at most {@code maxAttempts} times before {@link PlacementExhaustedException} is thrown.
 *
 * <p>Not thread-safe; one placer (and one {@link Random}) per battle side.
 */
@Slf4j
public class ShipPlacer {

    public static final int DEFAULT_MAX_ATTEMPTS = 100;

    private final Random random;
    private final int maxAttempts;

    public ShipPlacer(Random random) {
        this(random, DEFAULT_MAX_ATTEMPTS);
    }

    public ShipPlacer(Random random, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
        }
        this.random = random;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Places the requested fleet on a new grid.
     *
     * @param rows board rows
     * @param cols board columns
     * @param shipCounts ships to place
     * @return grid painted with ship ids
     * @throws InsufficientSpaceException if the fleet has more tiles than the board has cells
     * @throws PlacementExhaustedException if no valid arrangement was found within the attempt budget
     */
    public Grid place(int rows, int cols, ShipCountRequest shipCounts) {
        Grid grid = new Grid(rows, cols);
        long required = shipCounts.totalTiles();
        if (required > grid.area()) {
            throw new InsufficientSpaceException(required, grid.area());
        }

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (tryPlaceFleet(grid, shipCounts)) {
                log.debug("Placed {} ships on {}x{} board in {} attempt(s)",
                        shipCounts.totalShips(), cols, rows, attempt);
                return grid;
            }
            grid.clear();
        }

        log.warn("Giving up placement of [{}] on {}x{} board after {} attempts", shipCounts, cols, rows, maxAttempts);
        throw new PlacementExhaustedException(rows, cols, maxAttempts);
    }

    private boolean tryPlaceFleet(Grid grid, ShipCountRequest shipCounts) {
        List<Coordinate> anchors = new ArrayList<>(grid.area());
        for (int x = 0; x < grid.getCols(); x++) {
            for (int y = 0; y < grid.getRows(); y++) {
                anchors.add(new Coordinate(x, y));
            }
        }
        Collections.shuffle(anchors, random);

        for (ShipType type : ShipType.bySizeDescending()) {
            for (int i = 0; i < shipCounts.countOf(type); i++) {
                if (!tryPlaceShip(grid, type, anchors)) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean tryPlaceShip(Grid grid, ShipType type, List<Coordinate> anchors) {
        ShapeDefinition shape = ShapeCatalog.randomVariant(type, random);

        for (Coordinate anchor : anchors) {
            for (Rotation rotation : Rotation.values()) {
                List<Coordinate> cells = shape.cellsAt(anchor, rotation);
                if (isValidPlacement(grid, cells)) {
                    cells.forEach(c -> grid.set(c, type.getId()));
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Checks bounds, collisions and the one-cell separation to other ships.
     *
     * @param grid board under construction
     * @param cells candidate ship cells
     * @return {@code true} if the ship may be painted onto these cells
     */
    public static boolean isValidPlacement(Grid grid, List<Coordinate> cells) {
        for (Coordinate c : cells) {
            if (!grid.isInBounds(c) || !grid.isEmpty(c)) {
                return false;
            }
            for (Coordinate n : c.orthogonalNeighbours()) {
                if (grid.isInBounds(n) && !grid.isEmpty(n)) {
                    return false;
                }
            }
        }
        return true;
    }
}
