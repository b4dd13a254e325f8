package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.ShotResult;
import ch.battleship.battleshiparena.domain.enums.Side;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authoritative state of one side: its placed board, its ship instances and the attacks it received.
 *
 * <p>The board is the copy taken right after placement and is never handed to the opposing
 * strategy.
 */
public class Fleet {

    @Getter
    private final Side owner;
    private final Grid board;
    @Getter
    private final List<ShipInstance> ships;
    private final Map<Coordinate, ShotResult> shotsReceived = new LinkedHashMap<>();

    public Fleet(Side owner, Grid board, List<ShipInstance> ships) {
        this.owner = owner;
        this.board = board.copy();
        this.ships = List.copyOf(ships);
    }

    public boolean isInBounds(Coordinate c) {
        return board.isInBounds(c);
    }

    public boolean wasAttacked(Coordinate c) {
        return shotsReceived.containsKey(c);
    }

    public void recordShot(Coordinate c, ShotResult result) {
        shotsReceived.put(c, result);
    }

    public Map<Coordinate, ShotResult> getShotsReceived() {
        return Collections.unmodifiableMap(shotsReceived);
    }

    /**
     * {@code true} if every ship of this fleet has all of its cells hit.
     */
    public boolean isDestroyed() {
        return ships.stream().allMatch(ShipInstance::isSunk);
    }

    /**
     * Renders the board with the received attacks painted over it. Cells of sunk ships are shown
     * as sunk.
     *
     * @param showShips whether intact ship cells are revealed
     * @return ASCII rendering
     */
    public String render(boolean showShips) {
        Map<Coordinate, ShotResult> overlay = new LinkedHashMap<>(shotsReceived);
        for (ShipInstance ship : ships) {
            if (ship.isSunk()) {
                ship.getCoords().forEach(c -> overlay.put(c, ShotResult.SUNK));
            }
        }
        return board.withShots(overlay).render(showShips);
    }
}
