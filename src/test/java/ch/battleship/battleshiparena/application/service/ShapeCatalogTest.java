package ch.battleship.battleshiparena.application.service;

import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.ShapeCatalog;
import ch.battleship.battleshiparena.domain.ShapeDefinition;
import ch.battleship.battleshiparena.domain.enums.Rotation;
import ch.battleship.battleshiparena.domain.enums.ShipType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ShapeCatalogTest {

    @Test
    void variants_shouldHaveTileCountEqualToShipSize_forEveryType() {
        for (ShipType type : ShipType.values()) {
            assertThat(ShapeCatalog.variants(type))
                    .as("variants of %s", type)
                    .isNotEmpty()
                    .allSatisfy(shape -> assertThat(shape.tileCount()).isEqualTo(type.getSize()));
        }
    }

    @Test
    void variants_shouldMatchCatalogueVariantCounts() {
        assertThat(ShapeCatalog.variants(ShipType.DESTROYER)).hasSize(1);
        assertThat(ShapeCatalog.variants(ShipType.T_CRUISER)).hasSize(1);
        assertThat(ShapeCatalog.variants(ShipType.L_CRUISER)).hasSize(4);
        assertThat(ShapeCatalog.variants(ShipType.Z_CRUISER)).hasSize(2);
        assertThat(ShapeCatalog.variants(ShipType.CARRIER)).hasSize(1);
    }

    @Test
    void cellsAt_shouldRotateClockwiseAroundAnchor() {
        // Arrange
        ShapeDefinition destroyer = ShapeCatalog.variants(ShipType.DESTROYER).get(0);
        Coordinate anchor = new Coordinate(5, 5);

        // Act
        List<Coordinate> r0 = destroyer.cellsAt(anchor, Rotation.R0);
        List<Coordinate> r90 = destroyer.cellsAt(anchor, Rotation.R90);
        List<Coordinate> r180 = destroyer.cellsAt(anchor, Rotation.R180);

        // Assert
        assertThat(r0).containsExactly(new Coordinate(5, 5), new Coordinate(6, 5));
        assertThat(r90).containsExactly(new Coordinate(5, 5), new Coordinate(5, 6));
        assertThat(r180).containsExactly(new Coordinate(5, 5), new Coordinate(4, 5));
    }

    @Test
    void matches_shouldRecognizeRotatedFootprints() {
        // T pointing left:  .*
        //                   **
        //                   .*
        Set<Coordinate> rotatedT = Set.of(
                new Coordinate(1, 0), new Coordinate(0, 1), new Coordinate(1, 1), new Coordinate(1, 2));

        assertThat(ShapeCatalog.matches(ShipType.T_CRUISER, rotatedT)).isTrue();
        assertThat(ShapeCatalog.matches(ShipType.L_CRUISER, rotatedT)).isFalse();
        assertThat(ShapeCatalog.matches(ShipType.BATTLESHIP, rotatedT)).isFalse();
    }

    @Test
    void matches_shouldRejectWrongSize() {
        Set<Coordinate> pair = Set.of(new Coordinate(0, 0), new Coordinate(1, 0));

        assertThat(ShapeCatalog.matches(ShipType.DESTROYER, pair)).isTrue();
        assertThat(ShapeCatalog.matches(ShipType.CRUISER, pair)).isFalse();
    }

    @Test
    void normalize_shouldShiftCellsToOrigin() {
        Set<Coordinate> normalized = ShapeDefinition.normalize(
                List.of(new Coordinate(4, 7), new Coordinate(5, 7), new Coordinate(5, 8)));

        assertThat(normalized).containsExactlyInAnyOrder(
                new Coordinate(0, 0), new Coordinate(1, 0), new Coordinate(1, 1));
    }
}
