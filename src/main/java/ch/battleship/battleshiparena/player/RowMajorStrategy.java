package ch.battleship.battleshiparena.player;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.exception.NoAttacksRemainingException;

import java.util.HashSet;
import java.util.Set;

/**
 * Baseline strategy that attacks every cell in row-major order, ignoring all feedback.
 */
public class RowMajorStrategy implements Strategy {

    private final int rows;
    private final int cols;
    private final Set<Coordinate> attacked = new HashSet<>();
    private int cursor;

    public RowMajorStrategy(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
    }

    @Override
    public Coordinate getNextAttack() {
        while (cursor < rows * cols) {
            Coordinate c = new Coordinate(cursor % cols, cursor / cols);
            if (!attacked.contains(c)) {
                return c;
            }
            cursor++;
        }
        throw new NoAttacksRemainingException();
    }

    @Override
    public void registerAttack(int x, int y, boolean hit, boolean sunk) {
        attacked.add(new Coordinate(x, y));
    }
}
