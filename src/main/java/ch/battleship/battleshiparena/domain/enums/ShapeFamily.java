package ch.battleship.battleshiparena.domain.enums;

/**
 * Geometric family of a ship footprint.
 */
public enum ShapeFamily {
    /**
     * A single row or column of cells.
     */
    STRAIGHT,

    /**
     * Three cells in a row plus one cell centred below them.
     */
    T,

    /**
     * Three cells in a row plus one cell at an end, perpendicular.
     */
    L,

    /**
     * Two offset pairs forming a skew tetromino.
     */
    Z,

    /**
     * Two cells centred on top of a row of four.
     */
    DOUBLE_T,

    /**
     * Returned by shape analysis when a hit cluster matches no known footprint.
     */
    UNKNOWN
}
