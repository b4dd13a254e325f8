package ch.battleship.battleshiparena.engine;

import ch.battleship.battleshiparena.domain.Coordinate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 4-connected region collection with an explicit worklist.
 *
 * <p>The membership predicate decides which cells belong to the region and must reject cells
 * outside the board.
 */
public final class FloodFill {

    private FloodFill() {
        // utility class
    }

    /**
     * Collects the region reachable from {@code start} through orthogonal steps.
     *
     * @param start first cell; returns an empty set if it is not a member itself
     * @param member membership test (bounds included)
     * @return region cells in visiting order
     */
    public static Set<Coordinate> region(Coordinate start, Predicate<Coordinate> member) {
        Set<Coordinate> region = new LinkedHashSet<>();
        Set<Coordinate> visited = new HashSet<>();
        Deque<Coordinate> worklist = new ArrayDeque<>();
        worklist.push(start);

        while (!worklist.isEmpty()) {
            Coordinate current = worklist.pop();
            if (!visited.add(current) || !member.test(current)) {
                continue;
            }
            region.add(current);
            for (Coordinate next : current.orthogonalNeighbours()) {
                if (!visited.contains(next)) {
                    worklist.push(next);
                }
            }
        }
        return region;
    }
}
