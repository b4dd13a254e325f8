package ch.battleship.battleshiparena.player;

import ch.battleship.battleshiparena.engine.ShipPlacer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Known contenders by name.
 *
 * <ul>
 *   <li>{@code probability}: random placement + {@link ProbabilityTargetingStrategy}</li>
 *   <li>{@code sequential}: random placement + {@link RowMajorStrategy}</li>
 * </ul>
 */
@Component
public class ContenderRegistry {

    public static final String PROBABILITY = "probability";
    public static final String SEQUENTIAL = "sequential";

    private final Map<String, Contender> contenders = new LinkedHashMap<>();

    public ContenderRegistry(@Value("${arena.placement.max-restarts:100}") int maxPlacementAttempts) {
        BoardSetupFactory randomPlacement = (rows, cols, shipCounts, random) ->
                new RandomBoardSetup(rows, cols, shipCounts, new ShipPlacer(random, maxPlacementAttempts));

        register(new Contender(PROBABILITY, randomPlacement, ProbabilityTargetingStrategy::new));
        register(new Contender(SEQUENTIAL, randomPlacement,
                (rows, cols, shipCounts) -> new RowMajorStrategy(rows, cols)));
    }

    private void register(Contender contender) {
        contenders.put(contender.name(), contender);
    }

    /**
     * Looks up a contender by name (case-insensitive).
     *
     * @param name contender name
     * @return contender
     * @throws IllegalArgumentException if no contender has this name
     */
    public Contender get(String name) {
        Contender contender = name == null ? null : contenders.get(name.trim().toLowerCase());
        if (contender == null) {
            throw new IllegalArgumentException("Unknown contender: " + name + " (known: " + contenders.keySet() + ")");
        }
        return contender;
    }
}
