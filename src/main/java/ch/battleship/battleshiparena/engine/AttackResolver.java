package ch.battleship.battleshiparena.engine;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.ShipInstance;
import ch.battleship.battleshiparena.domain.enums.ShotResult;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Applies single attacks to a fleet of ship instances.
 */
@Component
public class AttackResolver {

    /**
     * Resolves an attack against the given ships.
     *
     * <p>Rules:
     * <ul>
     *   <li>If no ship occupies the coordinate, the result is MISS.</li>
     *   <li>Otherwise the cell is added to the ship's hits and the result is SUNK if every cell of
     *       that ship is now hit, HIT if not.</li>
     * </ul>
     * Resolving an already-hit cell again does not add a second hit and reports the ship's current
     * state.
     *
     * @param target attacked cell
     * @param ships defending ships; the matched instance is mutated
     * @return shot result
     */
    public ShotResult resolve(Coordinate target, Collection<ShipInstance> ships) {
        for (ShipInstance ship : ships) {
            if (ship.occupies(target)) {
                ship.registerHit(target);
                return ship.isSunk() ? ShotResult.SUNK : ShotResult.HIT;
            }
        }
        return ShotResult.MISS;
    }
}
