package ch.battleship.battleshiparena.domain.enums;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * The seven ship types of the arena, identified by their board id (1..7).
 *
 * <p>The id is the tag painted into a {@link ch.battleship.battleshiparena.domain.Grid}; the size is
 * the number of cells the ship occupies. Declaration order is the catalogue order used when
 * ambiguous sinkings have to be attributed to a type.
 */
public enum ShipType {

    DESTROYER(1, 2, ShapeFamily.STRAIGHT),
    CRUISER(2, 3, ShapeFamily.STRAIGHT),
    BATTLESHIP(3, 4, ShapeFamily.STRAIGHT),
    T_CRUISER(4, 4, ShapeFamily.T),
    L_CRUISER(5, 4, ShapeFamily.L),
    Z_CRUISER(6, 4, ShapeFamily.Z),
    CARRIER(7, 6, ShapeFamily.DOUBLE_T);

    private final int id;
    private final int size;
    private final ShapeFamily family;

    ShipType(int id, int size, ShapeFamily family) {
        this.id = id;
        this.size = size;
        this.family = family;
    }

    public int getId() {
        return id;
    }

    /**
     * Returns the size of the ship.
     *
     * @return number of board cells occupied by the ship
     */
    public int getSize() {
        return size;
    }

    public ShapeFamily getFamily() {
        return family;
    }

    /**
     * Looks up a ship type by its board id.
     *
     * @param id board tag between 1 and 7
     * @return matching ship type
     * @throws IllegalArgumentException if no ship type has this id
     */
    public static ShipType fromId(int id) {
        return Arrays.stream(values())
                .filter(t -> t.id == id)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown ship id: " + id));
    }

    /**
     * Returns all types ordered largest first; equal sizes keep catalogue order.
     */
    public static List<ShipType> bySizeDescending() {
        return Arrays.stream(values())
                .sorted(Comparator.comparingInt(ShipType::getSize).reversed())
                .toList();
    }
}
