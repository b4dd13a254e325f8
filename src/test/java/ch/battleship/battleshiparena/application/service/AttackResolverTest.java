package ch.battleship.battleshiparena.application.service;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.ShipInstance;
import ch.battleship.battleshiparena.domain.enums.ShipType;
import ch.battleship.battleshiparena.domain.enums.ShotResult;
import ch.battleship.battleshiparena.engine.AttackResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link AttackResolver}.
 *
 * <p>Focus: MISS/HIT/SUNK rules and that repeating an attack never adds a second hit.
 */
class AttackResolverTest {

    private final AttackResolver resolver = new AttackResolver();

    private ShipInstance cruiser;
    private ShipInstance destroyer;
    private List<ShipInstance> fleet;

    @BeforeEach
    void setUp() {
        cruiser = new ShipInstance(ShipType.CRUISER,
                Set.of(new Coordinate(0, 0), new Coordinate(1, 0), new Coordinate(2, 0)));
        destroyer = new ShipInstance(ShipType.DESTROYER,
                Set.of(new Coordinate(4, 4), new Coordinate(4, 5)));
        fleet = List.of(cruiser, destroyer);
    }

    @Test
    void resolve_shouldReturnMiss_whenNoShipOccupiesCell() {
        // Act
        ShotResult result = resolver.resolve(new Coordinate(3, 3), fleet);

        // Assert
        assertThat(result).isEqualTo(ShotResult.MISS);
        assertThat(cruiser.getHits()).isEmpty();
        assertThat(destroyer.getHits()).isEmpty();
    }

    @Test
    void resolve_shouldReturnSunk_onlyWhenEveryCellIsHit() {
        // Act
        ShotResult first = resolver.resolve(new Coordinate(0, 0), fleet);
        ShotResult second = resolver.resolve(new Coordinate(2, 0), fleet);
        ShotResult third = resolver.resolve(new Coordinate(1, 0), fleet);

        // Assert
        assertThat(first).isEqualTo(ShotResult.HIT);
        assertThat(second).isEqualTo(ShotResult.HIT);
        assertThat(third).isEqualTo(ShotResult.SUNK);
        assertThat(cruiser.isSunk()).isTrue();
        assertThat(destroyer.isSunk()).isFalse();
    }

    @Test
    void resolve_shouldBeIdempotent_whenSameCellIsAttackedTwice() {
        // Arrange
        Coordinate target = new Coordinate(4, 4);

        // Act
        ShotResult first = resolver.resolve(target, fleet);
        ShotResult repeated = resolver.resolve(target, fleet);

        // Assert
        assertThat(first).isEqualTo(ShotResult.HIT);
        assertThat(repeated).isEqualTo(ShotResult.HIT);
        assertThat(destroyer.getHits()).containsExactly(target);
        assertThat(destroyer.isSunk()).isFalse();
    }

    @Test
    void registerHit_shouldRejectCellsOutsideTheShip() {
        assertThatThrownBy(() -> destroyer.registerHit(new Coordinate(0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
