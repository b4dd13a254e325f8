package ch.battleship.battleshiparena.application.service;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.Grid;
import ch.battleship.battleshiparena.domain.ShapeCatalog;
import ch.battleship.battleshiparena.domain.ShapeDefinition;
import ch.battleship.battleshiparena.domain.ShipCountRequest;
import ch.battleship.battleshiparena.domain.ShipInstance;
import ch.battleship.battleshiparena.domain.enums.ShipType;
import ch.battleship.battleshiparena.domain.exception.InsufficientSpaceException;
import ch.battleship.battleshiparena.domain.exception.PlacementExhaustedException;
import ch.battleship.battleshiparena.engine.ComponentExtractor;
import ch.battleship.battleshiparena.engine.ShipPlacer;
import ch.battleship.battleshiparena.player.RandomBoardSetup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ShipPlacer}.
 *
 * <p>Focus: the placed board contains exactly the requested fleet, ships never touch orthogonally,
 * and the two failure modes (not enough cells, no arrangement found).
 */
class ShipPlacerTest {

    private final ComponentExtractor extractor = new ComponentExtractor();

    @Test
    void place_shouldPlaceRequestedFleet_withoutAdjacentShips() {
        // Arrange
        ShipCountRequest counts = ShipCountRequest.ofCounts(1, 1, 1, 1, 1, 1, 1);

        for (long seed = 0; seed < 20; seed++) {
            ShipPlacer placer = new ShipPlacer(new Random(seed));

            // Act
            Grid grid = placer.place(10, 10, counts);

            // Assert
            assertThat(counts.totalTiles()).isEqualTo(grid.occupiedCount());

            List<ShipInstance> ships = extractor.extract(grid);
            Map<ShipType, Long> perType = ships.stream()
                    .collect(Collectors.groupingBy(ShipInstance::getType, Collectors.counting()));
            for (ShipType type : ShipType.values()) {
                assertThat(perType.getOrDefault(type, 0L)).isEqualTo(counts.countOf(type));
            }
            assertThat(ships).allSatisfy(ship -> assertThat(ship.getCoords()).hasSize(ship.getType().getSize()));
            assertNoOrthogonalContactBetweenDifferentShips(grid, ships);
        }
    }

    @Test
    void place_shouldPlaceShipsMatchingCatalogueFootprints() {
        // Arrange
        ShipPlacer placer = new ShipPlacer(new Random(7));

        // Act
        Grid grid = placer.place(10, 10, ShipCountRequest.ofCounts(0, 0, 0, 1, 1, 1, 1));

        // Assert
        for (ShipInstance ship : extractor.extract(grid)) {
            assertThat(ShapeCatalog.matches(ship.getType(), ShapeDefinition.normalize(ship.getCoords())))
                    .as("footprint of %s", ship)
                    .isTrue();
        }
    }

    @Test
    void place_shouldBeDeterministic_forSameSeed() {
        ShipCountRequest counts = ShipCountRequest.ofCounts(2, 1, 1, 1, 0, 1, 0);

        Grid first = new ShipPlacer(new Random(123)).place(10, 10, counts);
        Grid second = new ShipPlacer(new Random(123)).place(10, 10, counts);

        assertThat(first.render(true)).isEqualTo(second.render(true));
    }

    @Test
    void place_shouldReturnEmptyGrid_whenNoShipsRequested() {
        Grid grid = new ShipPlacer(new Random(1)).place(3, 3, ShipCountRequest.ofCounts(0, 0, 0, 0, 0, 0, 0));

        assertThat(grid.occupiedCount()).isZero();
    }

    @Test
    void place_shouldThrowInsufficientSpace_whenFleetHasMoreTilesThanBoard() {
        // Arrange
        ShipPlacer placer = new ShipPlacer(new Random(1));

        // Act + Assert
        assertThatThrownBy(() -> placer.place(2, 2, ShipCountRequest.ofCounts(0, 0, 0, 0, 0, 0, 1)))
                .isInstanceOf(InsufficientSpaceException.class);
    }

    @Test
    void place_shouldThrowInsufficientSpace_whenTileTotalExceedsIntRange() {
        // Arrange: 357913942 carriers need 2147483652 tiles
        ShipPlacer placer = new ShipPlacer(new Random(1), 3);
        ShipCountRequest counts = ShipCountRequest.ofCounts(0, 0, 0, 0, 0, 0, 357_913_942);

        // Act
        Throwable thrown = catchThrowable(() -> placer.place(10, 10, counts));

        // Assert
        assertThat(thrown).isInstanceOfSatisfying(InsufficientSpaceException.class,
                e -> assertThat(e.getRequiredTiles()).isEqualTo(2_147_483_652L));
    }

    @Test
    void place_shouldThrowPlacementExhausted_whenFleetCannotBeSeparated() {
        // Arrange: two 3-tile ships fill a 3x2 board exactly, but would touch
        ShipPlacer placer = new ShipPlacer(new Random(1), 5);

        // Act + Assert
        assertThatThrownBy(() -> placer.place(2, 3, ShipCountRequest.ofCounts(0, 2, 0, 0, 0, 0, 0)))
                .isInstanceOf(PlacementExhaustedException.class);
    }

    @Test
    void isValidPlacement_shouldRejectOrthogonalContact_butAllowDiagonalContact() {
        // Arrange
        Grid grid = Grid.of(new int[][]{
                {1, 0, 0},
                {0, 0, 0},
                {0, 0, 0}
        });

        // Act + Assert
        assertThat(ShipPlacer.isValidPlacement(grid, List.of(new Coordinate(1, 0), new Coordinate(2, 0)))).isFalse();
        assertThat(ShipPlacer.isValidPlacement(grid, List.of(new Coordinate(1, 1), new Coordinate(2, 1)))).isTrue();
        assertThat(ShipPlacer.isValidPlacement(grid, List.of(new Coordinate(2, 2), new Coordinate(3, 2)))).isFalse();
    }

    @Test
    void randomBoardSetup_shouldExposeTilesAndStats() {
        // Arrange
        ShipCountRequest counts = ShipCountRequest.ofCounts(1, 1, 0, 0, 0, 0, 0);
        RandomBoardSetup setup = new RandomBoardSetup(6, 6, counts, new ShipPlacer(new Random(3)));

        // Act
        setup.placeShips();

        // Assert
        assertThat(setup.boardStats().occupiedSpaces()).isEqualTo(5);
        assertThat(setup.boardStats().emptySpaces()).isEqualTo(31);
        assertThatThrownBy(() -> setup.getTile(6, 0)).isInstanceOf(IndexOutOfBoundsException.class);

        setup.resetBoard();
        assertThat(setup.boardStats().occupiedSpaces()).isZero();
    }

    private void assertNoOrthogonalContactBetweenDifferentShips(Grid grid, List<ShipInstance> ships) {
        Map<Coordinate, ShipInstance> owner = ships.stream()
                .flatMap(s -> s.getCoords().stream().map(c -> Map.entry(c, s)))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

        for (ShipInstance ship : ships) {
            for (Coordinate c : ship.getCoords()) {
                for (Coordinate n : c.orthogonalNeighbours()) {
                    if (!grid.isInBounds(n) || grid.isEmpty(n)) continue;
                    assertThat(owner.get(n)).as("neighbour %s of %s", n, c).isSameAs(ship);
                }
            }
        }
    }
}
