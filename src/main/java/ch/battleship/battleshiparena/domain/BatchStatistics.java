package ch.battleship.battleshiparena.domain;

/**
 * Aggregated outcome of a number of battles.
 *
 * <p>Instances are combined with {@link #plus(BattleResult)} and {@link #combine(BatchStatistics)};
 * both operations are associative and commutative, so the order in which battles complete does not
 * influence the totals.
 *
 * @param totalBattles number of battles included
 * @param playerOneWins battles won by player one
 * @param playerTwoWins battles won by player two
 * @param draws battles without winner
 * @param totalMoves moves summed over all battles
 */
public record BatchStatistics(int totalBattles, int playerOneWins, int playerTwoWins, int draws, long totalMoves) {

    public static BatchStatistics empty() {
        return new BatchStatistics(0, 0, 0, 0, 0);
    }

    public BatchStatistics plus(BattleResult result) {
        int p1 = playerOneWins;
        int p2 = playerTwoWins;
        int d = draws;
        if (result.isDraw()) {
            d++;
        } else {
            switch (result.winner()) {
                case PLAYER_ONE -> p1++;
                case PLAYER_TWO -> p2++;
            }
        }
        return new BatchStatistics(totalBattles + 1, p1, p2, d, totalMoves + result.moves());
    }

    public BatchStatistics combine(BatchStatistics other) {
        return new BatchStatistics(
                totalBattles + other.totalBattles,
                playerOneWins + other.playerOneWins,
                playerTwoWins + other.playerTwoWins,
                draws + other.draws,
                totalMoves + other.totalMoves
        );
    }

    /**
     * Average game length in moves; 0 for an empty batch.
     */
    public double averageMoves() {
        return totalBattles == 0 ? 0.0 : (double) totalMoves / totalBattles;
    }
}
