package ch.battleship.battleshiparena.domain.enums;

/**
 * The two participants of a battle.
 */
public enum Side {
    PLAYER_ONE(1),
    PLAYER_TWO(2);

    private final int number;

    Side(int number) {
        this.number = number;
    }

    /**
     * Player number as shown in logs (1 or 2).
     */
    public int getNumber() {
        return number;
    }

    public Side opponent() {
        return this == PLAYER_ONE ? PLAYER_TWO : PLAYER_ONE;
    }

    public static Side fromNumber(int number) {
        return switch (number) {
            case 1 -> PLAYER_ONE;
            case 2 -> PLAYER_TWO;
            default -> throw new IllegalArgumentException("Player number must be 1 or 2 but was " + number);
        };
    }
}
