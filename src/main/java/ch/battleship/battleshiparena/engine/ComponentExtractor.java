package ch.battleship.battleshiparena.engine;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.Grid;
import ch.battleship.battleshiparena.domain.ShipInstance;
import ch.battleship.battleshiparena.domain.enums.ShipType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a painted board into ship instances.
 *
 * <p>Cells are scanned row by row; each unvisited non-empty cell starts a 4-connected flood fill
 * over cells carrying the same ship id. The result order is therefore deterministic.
 */
@Component
public class ComponentExtractor {

    /**
     * Labels the grid into ship instances.
     *
     * @param grid board containing only {@link Grid#EMPTY} and ship ids 1..7
     * @return one instance per connected component
     * @throws IllegalArgumentException if a cell holds a tag that is not a ship id
     */
    public List<ShipInstance> extract(Grid grid) {
        Set<Coordinate> visited = new HashSet<>();
        List<ShipInstance> instances = new ArrayList<>();

        for (int y = 0; y < grid.getRows(); y++) {
            for (int x = 0; x < grid.getCols(); x++) {
                Coordinate start = new Coordinate(x, y);
                int tag = grid.get(start);
                if (tag == Grid.EMPTY || visited.contains(start)) {
                    continue;
                }
                ShipType type = ShipType.fromId(tag);
                Set<Coordinate> component = FloodFill.region(start,
                        c -> grid.isInBounds(c) && grid.get(c) == tag);
                visited.addAll(component);
                instances.add(new ShipInstance(type, component));
            }
        }
        return instances;
    }
}
