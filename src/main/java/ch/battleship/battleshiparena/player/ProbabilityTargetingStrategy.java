package ch.battleship.battleshiparena.player;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.ShapeAnalysis;
import ch.battleship.battleshiparena.domain.ShapeCatalog;
import ch.battleship.battleshiparena.domain.ShapeDefinition;
import ch.battleship.battleshiparena.domain.ShipCountRequest;
import ch.battleship.battleshiparena.domain.enums.CellKnowledge;
import ch.battleship.battleshiparena.domain.enums.ShapeFamily;
import ch.battleship.battleshiparena.domain.enums.ShipType;
import ch.battleship.battleshiparena.domain.enums.TargetingMode;
import ch.battleship.battleshiparena.domain.exception.NoAttacksRemainingException;
import ch.battleship.battleshiparena.engine.FloodFill;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Opponent AI driven by a per-cell probability map.
 *
 * <p>All cells start at 1.0. A hit doubles the value of its un-attacked orthogonal neighbours, so
 * the strategy keeps hunting around a damaged ship. When a ship is reported sunk, its hit cells are
 * recovered by flood fill and every un-attacked cell inside the ship's bounding box plus a one-cell
 * margin is set to 0, because ships are never placed next to each other.
 *
 * <p>The strategy also keeps a best-effort count of the enemy ships still afloat. Each sinking is
 * attributed to a ship type by size and footprint; when several surviving types fit, the first one in
 * catalogue order is chosen, which can be wrong. The engine decides the winner from its own state.
 */
@Slf4j
public class ProbabilityTargetingStrategy implements Strategy {

    public static final double INITIAL_PROBABILITY = 1.0;
    public static final double HIT_BOOST = 2.0;

    private final int rows;
    private final int cols;
    private final ProbabilityMap probabilityMap;
    private final CellKnowledge[][] enemyBoard;
    private final Set<Coordinate> attacked = new LinkedHashSet<>();
    private final Set<Coordinate> sunkCells = new HashSet<>();
    private final Map<ShipType, Integer> remainingShips;

    public ProbabilityTargetingStrategy(int rows, int cols, ShipCountRequest shipCounts) {
        this.rows = rows;
        this.cols = cols;
        this.probabilityMap = new ProbabilityMap(rows, cols, INITIAL_PROBABILITY);
        this.enemyBoard = new CellKnowledge[rows][cols];
        for (CellKnowledge[] row : enemyBoard) {
            Arrays.fill(row, CellKnowledge.UNKNOWN);
        }
        this.remainingShips = shipCounts.toMap();
    }

    /**
     * Picks the un-attacked cell with the highest probability.
     *
     * <p>Ties go to cells with {@code (x + y) % 2 == 1}, then to the first cell in row-major order.
     * If the best value is 0 the first un-attacked cell in row-major order is returned.
     *
     * @return next target
     * @throws NoAttacksRemainingException if every cell has been attacked
     */
    @Override
    public Coordinate getNextAttack() {
        double max = -1;
        Coordinate best = null;

        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                Coordinate c = new Coordinate(x, y);
                if (attacked.contains(c)) continue;

                double p = probabilityMap.get(c);
                if (p > max) {
                    max = p;
                    best = c;
                } else if (p == max && best.parity() == 0 && c.parity() == 1) {
                    best = c;
                }
            }
        }

        if (best == null || max <= 0) {
            return fallbackAttack();
        }
        return best;
    }

    @Override
    public void registerAttack(int x, int y, boolean hit, boolean sunk) {
        Coordinate target = new Coordinate(x, y);
        if (!probabilityMap.isInBounds(target)) {
            throw new IllegalArgumentException("Attack " + target + " lies outside the " + cols + "x" + rows + " board");
        }

        attacked.add(target);
        enemyBoard[y][x] = hit ? CellKnowledge.HIT : CellKnowledge.MISS;

        if (hit) {
            boostNeighbours(target);
            if (sunk) {
                Set<Coordinate> shipCells = hitCluster(target);
                sunkCells.addAll(shipCells);
                excludeSurroundings(shipCells);
                updateShipCount(shipCells);
            }
        }
    }

    /**
     * Classifies the cluster of hits connected to {@code (x, y)}.
     *
     * <p>Single rows or columns are {@link ShapeFamily#STRAIGHT}; other clusters are compared with
     * every rotation of the catalogue footprints. Clusters that match nothing (for example a ship
     * that is only partially hit) are {@link ShapeFamily#UNKNOWN}.
     *
     * @param x column of a hit cell
     * @param y row of a hit cell
     * @return cluster size and family; size 0 if {@code (x, y)} is not a known hit
     */
    public ShapeAnalysis analyzeShipShape(int x, int y) {
        Set<Coordinate> cells = hitCluster(new Coordinate(x, y));
        if (cells.isEmpty()) {
            return new ShapeAnalysis(0, ShapeFamily.UNKNOWN);
        }
        return new ShapeAnalysis(cells.size(), classify(cells));
    }

    public boolean allShipsSunk() {
        return remainingShips.values().stream().mapToInt(Integer::intValue).sum() == 0;
    }

    public Map<ShipType, Integer> getRemainingShips() {
        return new EnumMap<>(remainingShips);
    }

    public CellKnowledge[][] getEnemyBoard() {
        CellKnowledge[][] copy = new CellKnowledge[rows][];
        for (int y = 0; y < rows; y++) {
            copy[y] = enemyBoard[y].clone();
        }
        return copy;
    }

    public double getProbability(int x, int y) {
        return probabilityMap.get(new Coordinate(x, y));
    }

    public Set<Coordinate> getAttackHistory() {
        return Collections.unmodifiableSet(attacked);
    }

    /**
     * {@link TargetingMode#HUNT} while a hit exists that does not belong to a sunk ship.
     */
    public TargetingMode getMode() {
        for (Coordinate c : attacked) {
            if (knowledgeAt(c) == CellKnowledge.HIT && !sunkCells.contains(c)) {
                return TargetingMode.HUNT;
            }
        }
        return TargetingMode.SEARCH;
    }

    private void boostNeighbours(Coordinate target) {
        for (Coordinate n : target.orthogonalNeighbours()) {
            if (probabilityMap.isInBounds(n) && !attacked.contains(n)) {
                probabilityMap.multiply(n, HIT_BOOST);
            }
        }
    }

    private Set<Coordinate> hitCluster(Coordinate start) {
        return FloodFill.region(start,
                c -> probabilityMap.isInBounds(c) && knowledgeAt(c) == CellKnowledge.HIT);
    }

    private void excludeSurroundings(Set<Coordinate> shipCells) {
        if (shipCells.isEmpty()) return;

        int minX = shipCells.stream().mapToInt(Coordinate::getX).min().getAsInt();
        int maxX = shipCells.stream().mapToInt(Coordinate::getX).max().getAsInt();
        int minY = shipCells.stream().mapToInt(Coordinate::getY).min().getAsInt();
        int maxY = shipCells.stream().mapToInt(Coordinate::getY).max().getAsInt();

        for (int y = Math.max(0, minY - 1); y <= Math.min(rows - 1, maxY + 1); y++) {
            for (int x = Math.max(0, minX - 1); x <= Math.min(cols - 1, maxX + 1); x++) {
                Coordinate c = new Coordinate(x, y);
                if (!attacked.contains(c)) {
                    probabilityMap.zero(c);
                }
            }
        }
    }

    private void updateShipCount(Set<Coordinate> shipCells) {
        Optional<ShipType> sunkType = identifySunkType(shipCells);
        if (sunkType.isEmpty()) {
            log.debug("Could not attribute sunk ship of size {} to a remaining type", shipCells.size());
            return;
        }
        remainingShips.merge(sunkType.get(), -1, Integer::sum);
    }

    private Optional<ShipType> identifySunkType(Set<Coordinate> shipCells) {
        Set<Coordinate> normalized = ShapeDefinition.normalize(shipCells);

        for (ShipType type : ShipType.values()) {
            if (remainingShips.get(type) > 0 && ShapeCatalog.matches(type, normalized)) {
                return Optional.of(type);
            }
        }
        for (ShipType type : ShipType.values()) {
            if (remainingShips.get(type) > 0 && type.getSize() == shipCells.size()) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private ShapeFamily classify(Set<Coordinate> cells) {
        Set<Coordinate> normalized = ShapeDefinition.normalize(cells);
        int width = normalized.stream().mapToInt(Coordinate::getX).max().getAsInt() + 1;
        int height = normalized.stream().mapToInt(Coordinate::getY).max().getAsInt() + 1;

        if (width == 1 || height == 1) {
            return ShapeFamily.STRAIGHT;
        }
        for (ShipType type : ShipType.values()) {
            if (type.getFamily() != ShapeFamily.STRAIGHT && ShapeCatalog.matches(type, normalized)) {
                return type.getFamily();
            }
        }
        return ShapeFamily.UNKNOWN;
    }

    private CellKnowledge knowledgeAt(Coordinate c) {
        return enemyBoard[c.getY()][c.getX()];
    }

    private Coordinate fallbackAttack() {
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                Coordinate c = new Coordinate(x, y);
                if (!attacked.contains(c)) {
                    return c;
                }
            }
        }
        throw new NoAttacksRemainingException();
    }
}
