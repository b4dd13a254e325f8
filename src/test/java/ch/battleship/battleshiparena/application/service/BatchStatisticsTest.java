package ch.battleship.battleshiparena.application.service;

import ch.battleship.battleshiparena.domain.BatchStatistics;
import ch.battleship.battleshiparena.domain.BattleResult;
import ch.battleship.battleshiparena.domain.enums.Side;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BatchStatisticsTest {

    private final List<BattleResult> results = List.of(
            new BattleResult("a", Side.PLAYER_ONE, 40, Side.PLAYER_ONE),
            new BattleResult("b", Side.PLAYER_TWO, 51, Side.PLAYER_TWO),
            new BattleResult("c", null, 0, Side.PLAYER_ONE),
            new BattleResult("d", Side.PLAYER_ONE, 61, Side.PLAYER_TWO)
    );

    @Test
    void plus_shouldCountWinsDrawsAndMoves() {
        // Act
        BatchStatistics stats = BatchStatistics.empty();
        for (BattleResult result : results) {
            stats = stats.plus(result);
        }

        // Assert
        assertThat(stats).isEqualTo(new BatchStatistics(4, 2, 1, 1, 152));
        assertThat(stats.averageMoves()).isEqualTo(38.0);
    }

    @Test
    void combine_shouldGiveSameTotals_regardlessOfGrouping() {
        // Arrange
        BatchStatistics left = BatchStatistics.empty().plus(results.get(0)).plus(results.get(1));
        BatchStatistics right = BatchStatistics.empty().plus(results.get(2)).plus(results.get(3));
        BatchStatistics sequential = results.stream()
                .reduce(BatchStatistics.empty(), BatchStatistics::plus, BatchStatistics::combine);

        // Act
        BatchStatistics combined = right.combine(left);

        // Assert
        assertThat(combined).isEqualTo(sequential);
    }

    @Test
    void averageMoves_shouldBeZero_forEmptyBatch() {
        assertThat(BatchStatistics.empty().averageMoves()).isZero();
    }
}
