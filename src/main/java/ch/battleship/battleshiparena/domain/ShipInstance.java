package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.ShipType;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single ship physically placed on a board, together with the cells already hit.
 *
 * <p>Invariants: {@code hits ⊆ coords}; the ship is sunk iff every cell has been hit. The hit set
 * only grows; registering the same cell again has no effect.
 */
@Getter
public class ShipInstance {

    private final ShipType type;
    private final Set<Coordinate> coords;

    @Getter(AccessLevel.NONE)
    private final Set<Coordinate> hits = new LinkedHashSet<>();

    public ShipInstance(ShipType type, Set<Coordinate> coords) {
        if (coords.isEmpty()) {
            throw new IllegalArgumentException("A ship needs at least one cell");
        }
        this.type = type;
        this.coords = Collections.unmodifiableSet(new LinkedHashSet<>(coords));
    }

    public boolean occupies(Coordinate c) {
        return coords.contains(c);
    }

    /**
     * Records a hit on one of this ship's cells.
     *
     * @param c attacked cell
     * @return {@code true} if the cell was not hit before
     * @throws IllegalArgumentException if the cell does not belong to this ship
     */
    public boolean registerHit(Coordinate c) {
        if (!occupies(c)) {
            throw new IllegalArgumentException("Cell " + c + " is not part of this ship");
        }
        return hits.add(c);
    }

    public Set<Coordinate> getHits() {
        return Collections.unmodifiableSet(hits);
    }

    public boolean isSunk() {
        return hits.size() == coords.size();
    }

    @Override
    public String toString() {
        return type + coords.toString();
    }
}
