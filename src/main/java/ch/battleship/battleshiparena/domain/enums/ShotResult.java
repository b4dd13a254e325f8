package ch.battleship.battleshiparena.domain.enums;

/**
 * Represents the outcome of an attack against a fleet.
 */
public enum ShotResult {
    /**
     * No ship was hit.
     */
    MISS,

    /**
     * A ship was hit but not sunk.
     */
    HIT,

    /**
     * A ship was hit and all of its cells have now been hit.
     */
    SUNK;

    public boolean isHit() {
        return this != MISS;
    }

    public boolean isSunk() {
        return this == SUNK;
    }
}
