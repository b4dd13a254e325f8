package ch.battleship.battleshiparena.web.api.dto;

import ch.battleship.battleshiparena.domain.BattleConfiguration;
import ch.battleship.battleshiparena.domain.BattleResult;

import java.util.Arrays;
import java.util.List;

/**
 * Outcome of a single battle.
 *
 * @param battleId id of the battle (also used in the STOMP topic)
 * @param winner winning player number, {@code null} for a draw
 * @param draw whether the battle ended without winner
 * @param moves total moves of both players
 * @param startingPlayer player number that attacked first
 * @param rows board rows
 * @param cols board columns
 * @param shipCounts fleet that was played, counts for ids 1..7
 * @param seed seed to replay the battle
 */
public record BattleResultDto(
        String battleId,
        Integer winner,
        boolean draw,
        int moves,
        int startingPlayer,
        int rows,
        int cols,
        List<Integer> shipCounts,
        long seed
) {
    public static BattleResultDto from(BattleResult result, BattleConfiguration config, long seed) {
        return new BattleResultDto(
                result.battleId(),
                result.isDraw() ? null : result.winner().getNumber(),
                result.isDraw(),
                result.moves(),
                result.startingSide().getNumber(),
                config.rows(),
                config.cols(),
                Arrays.stream(config.shipCounts().toArray()).boxed().toList(),
                seed
        );
    }
}
