package ch.battleship.battleshiparena.web.api.dto;

import ch.battleship.battleshiparena.domain.BatchStatistics;

import java.util.Arrays;
import java.util.List;

public record BatchResultDto(
        int totalBattles,
        int playerOneWins,
        int playerTwoWins,
        int draws,
        double averageMoves,
        List<Integer> shipCounts,
        long seed
) {
    public static BatchResultDto from(BatchStatistics stats, int[] shipCounts, long seed) {
        return new BatchResultDto(
                stats.totalBattles(),
                stats.playerOneWins(),
                stats.playerTwoWins(),
                stats.draws(),
                stats.averageMoves(),
                Arrays.stream(shipCounts).boxed().toList(),
                seed
        );
    }
}
