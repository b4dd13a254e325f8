package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.Rotation;
import ch.battleship.battleshiparena.domain.enums.ShapeFamily;
import ch.battleship.battleshiparena.domain.enums.ShipType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One geometric variant of a ship type: its cell offsets relative to an anchor at {@code (0,0)}.
 *
 * @param type ship type this footprint belongs to
 * @param offsets canonical cell offsets, unrotated
 */
public record ShapeDefinition(ShipType type, List<Coordinate> offsets) {

    public ShapeDefinition {
        if (offsets.size() != type.getSize()) {
            throw new IllegalArgumentException(
                    "Shape for " + type + " has " + offsets.size() + " cells, expected " + type.getSize());
        }
        offsets = List.copyOf(offsets);
    }

    public int tileCount() {
        return offsets.size();
    }

    public ShapeFamily family() {
        return type.getFamily();
    }

    /**
     * Returns the board cells covered when the shape is rotated and anchored at {@code anchor}.
     *
     * <p>No bounds checking is done; callers validate the result against their grid.
     *
     * @param anchor board cell the origin offset is mapped to
     * @param rotation clockwise rotation applied around the anchor
     * @return covered cells, in offset order
     */
    public List<Coordinate> cellsAt(Coordinate anchor, Rotation rotation) {
        List<Coordinate> cells = new ArrayList<>(offsets.size());
        for (Coordinate offset : offsets) {
            int[] r = rotation.apply(offset.getX(), offset.getY());
            cells.add(anchor.translate(r[0], r[1]));
        }
        return cells;
    }

    /**
     * Returns the rotated footprint shifted so its bounding box starts at {@code (0,0)}.
     */
    public Set<Coordinate> normalized(Rotation rotation) {
        return normalize(cellsAt(new Coordinate(0, 0), rotation));
    }

    /**
     * Shifts a set of cells so that the smallest x and y become 0.
     *
     * @param cells arbitrary non-empty cell collection
     * @return translated copy
     */
    public static Set<Coordinate> normalize(Iterable<Coordinate> cells) {
        int minX = Integer.MAX_VALUE;
        int minY = Integer.MAX_VALUE;
        for (Coordinate c : cells) {
            minX = Math.min(minX, c.getX());
            minY = Math.min(minY, c.getY());
        }
        Set<Coordinate> result = new HashSet<>();
        for (Coordinate c : cells) {
            result.add(c.translate(-minX, -minY));
        }
        return result;
    }
}
