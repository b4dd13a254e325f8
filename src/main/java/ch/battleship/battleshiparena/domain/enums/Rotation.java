package ch.battleship.battleshiparena.domain.enums;

/**
 * Clockwise quarter turns applied to a shape around its anchor cell.
 */
public enum Rotation {
    R0,
    R90,
    R180,
    R270;

    /**
     * Rotates a single offset around the origin.
     *
     * @param dx x offset
     * @param dy y offset
     * @return rotated offset as {@code {dx, dy}}
     */
    public int[] apply(int dx, int dy) {
        return switch (this) {
            case R0 -> new int[]{dx, dy};
            case R90 -> new int[]{-dy, dx};
            case R180 -> new int[]{-dx, -dy};
            case R270 -> new int[]{dy, -dx};
        };
    }
}
