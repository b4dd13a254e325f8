package ch.battleship.battleshiparena.web.api.dto;

import java.util.List;

/**
 * Request DTO to run a batch of battles with the same board and fleet.
 *
 * <p>Starting players alternate automatically, so there is no starting player field.
 *
 * @param count number of battles
 * @param rows board rows
 * @param cols board columns
 * @param shipCounts seven counts for ship ids 1..7; omitted means one random fleet for the whole batch
 * @param playerOne contender name for player one
 * @param playerTwo contender name for player two
 * @param seed seed from which all battle seeds are derived
 */
public record BatchRequest(
        Integer count,
        Integer rows,
        Integer cols,
        List<Integer> shipCounts,
        String playerOne,
        String playerTwo,
        Long seed
) { }
