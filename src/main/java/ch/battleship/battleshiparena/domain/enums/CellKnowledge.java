package ch.battleship.battleshiparena.domain.enums;

/**
 * What an attacker knows about a single cell of the enemy board.
 */
public enum CellKnowledge {
    UNKNOWN('?'),
    HIT('H'),
    MISS('M');

    private final char symbol;

    CellKnowledge(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }
}
