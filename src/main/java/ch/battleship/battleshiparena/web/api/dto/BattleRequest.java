package ch.battleship.battleshiparena.web.api.dto;

import java.util.List;

/**
 * Request DTO to run a single battle. Every field is optional; missing values fall back to the
 * {@code arena.*} configuration.
 *
 * @param rows board rows
 * @param cols board columns
 * @param shipCounts seven counts for ship ids 1..7; omitted means a random fleet
 * @param startingPlayer 1 or 2, defaults to 1
 * @param playerOne contender name for player one
 * @param playerTwo contender name for player two
 * @param seed seed that makes the battle reproducible
 */
public record BattleRequest(
        Integer rows,
        Integer cols,
        List<Integer> shipCounts,
        Integer startingPlayer,
        String playerOne,
        String playerTwo,
        Long seed
) { }
