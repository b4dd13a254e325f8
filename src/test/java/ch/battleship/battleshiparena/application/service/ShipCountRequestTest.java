package ch.battleship.battleshiparena.application.service;

import ch.battleship.battleshiparena.domain.ShipCountRequest;
import ch.battleship.battleshiparena.domain.enums.ShipType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class ShipCountRequestTest {

    @Test
    void parse_shouldReadSevenCountsInIdOrder() {
        // Act
        ShipCountRequest request = ShipCountRequest.parse("1, 0,2,0,0,0,1");

        // Assert
        assertThat(request.countOf(ShipType.DESTROYER)).isEqualTo(1);
        assertThat(request.countOf(ShipType.BATTLESHIP)).isEqualTo(2);
        assertThat(request.countOf(ShipType.CARRIER)).isEqualTo(1);
        assertThat(request.totalShips()).isEqualTo(4);
        assertThat(request.totalTiles()).isEqualTo(2 + 2 * 4 + 6);
        assertThat(request.toString()).isEqualTo("1,0,2,0,0,0,1");
    }

    @Test
    void totalTiles_shouldStayPositive_forCountsBeyondIntRange() {
        ShipCountRequest request = ShipCountRequest.ofCounts(0, 0, 0, 0, 0, 0, 357_913_942);

        assertThat(request.totalTiles()).isEqualTo(357_913_942L * 6);
    }

    @Test
    void parse_shouldRejectWrongLength_andNonNumbers_andNegativeCounts() {
        assertThatThrownBy(() -> ShipCountRequest.parse("1,1,1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ShipCountRequest.parse("1,1,1,x,1,1,1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ShipCountRequest.parse("1,1,1,-1,1,1,1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ShipCountRequest.parse(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromList_shouldRejectNullEntries() {
        assertThatThrownBy(() -> ShipCountRequest.fromList(Arrays.asList(1, null, 0, 0, 0, 0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ShipCountRequest.fromList(List.of(0, 0, 0, 0, 0, 0, 1)).countOf(ShipType.CARRIER))
                .isEqualTo(1);
    }

    @Test
    void random_shouldReachTargetFill() {
        // Arrange
        Random random = new Random(42);

        // Act
        ShipCountRequest request = ShipCountRequest.random(10, 10, 0.3, random);

        // Assert
        assertThat(request.totalTiles()).isGreaterThanOrEqualTo(30);
        // the last ship drawn adds at most 6 tiles beyond the target
        assertThat(request.totalTiles()).isLessThan(30 + 6);
    }

    @Test
    void toMap_shouldReturnIndependentCopy() {
        // Arrange
        ShipCountRequest request = ShipCountRequest.ofCounts(1, 1, 1, 1, 1, 1, 1);

        // Act
        request.toMap().put(ShipType.DESTROYER, 5);

        // Assert
        assertThat(request.countOf(ShipType.DESTROYER)).isEqualTo(1);
    }
}
