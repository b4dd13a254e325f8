package ch.battleship.battleshiparena.application.service;

import ch.battleship.battleshiparena.domain.BattleConfiguration;
import ch.battleship.battleshiparena.domain.ShipCountRequest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BattleConfigurationTest {

    private static final ShipCountRequest ONE_DESTROYER = ShipCountRequest.ofCounts(1, 0, 0, 0, 0, 0, 0);

    @Test
    void moveCap_shouldBeHundredMovesPerCell() {
        BattleConfiguration config = new BattleConfiguration(4, 5, ONE_DESTROYER);

        assertThat(config.area()).isEqualTo(20);
        assertThat(config.moveCap()).isEqualTo(2000);
    }

    @Test
    void constructor_shouldRejectBoard_whoseMoveCapOverflows() {
        // 25_000_000 cells fit an int, 2_500_000_000 moves do not
        assertThatThrownBy(() -> new BattleConfiguration(1, 25_000_000, ONE_DESTROYER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too large");
    }

    @Test
    void constructor_shouldAcceptLargestBoardWithRepresentableMoveCap() {
        // 21_474_836 * 100 <= Integer.MAX_VALUE
        BattleConfiguration config = new BattleConfiguration(1, 21_474_836, ONE_DESTROYER);

        assertThat(config.moveCap()).isPositive().isEqualTo(2_147_483_600);
    }

    @Test
    void constructor_shouldRejectNonPositiveDimensions_andMissingFleet() {
        assertThatThrownBy(() -> new BattleConfiguration(0, 5, ONE_DESTROYER))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BattleConfiguration(5, 5, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
