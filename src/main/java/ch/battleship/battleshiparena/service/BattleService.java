package ch.battleship.battleshiparena.service;

import ch.battleship.battleshiparena.domain.BatchStatistics;
import ch.battleship.battleshiparena.domain.BattleConfiguration;
import ch.battleship.battleshiparena.domain.BattleResult;
import ch.battleship.battleshiparena.domain.Grid;
import ch.battleship.battleshiparena.domain.ShipCountRequest;
import ch.battleship.battleshiparena.domain.enums.Side;
import ch.battleship.battleshiparena.player.BoardSetup;
import ch.battleship.battleshiparena.player.Contender;
import ch.battleship.battleshiparena.player.ContenderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point for running battles and batches of battles.
 *
 * <p>Fills in configured defaults (board size, fleet, contenders), derives a dedicated {@link Random}
 * per battle from the caller's seed and delegates the actual play to {@link BattleOrchestrator}.
 * Battles of a batch are submitted to the {@code battleExecutor} and reduced into
 * {@link BatchStatistics} in submission order, so a batch with a fixed seed always yields the same
 * statistics regardless of the pool size.
 */
@Service
@Slf4j
public class BattleService {

    private final BattleOrchestrator orchestrator;
    private final ContenderRegistry contenderRegistry;
    private final Executor battleExecutor;

    private final int defaultRows;
    private final int defaultCols;
    private final double fillRatio;
    private final int defaultBatchCount;
    private final String defaultPlayerOne;
    private final String defaultPlayerTwo;

    public BattleService(BattleOrchestrator orchestrator,
                         ContenderRegistry contenderRegistry,
                         @Qualifier("battleExecutor") Executor battleExecutor,
                         @Value("${arena.board.rows:10}") int defaultRows,
                         @Value("${arena.board.cols:10}") int defaultCols,
                         @Value("${arena.fleet.fill-ratio:0.3}") double fillRatio,
                         @Value("${arena.batch.default-count:100}") int defaultBatchCount,
                         @Value("${arena.player-one.contender:probability}") String defaultPlayerOne,
                         @Value("${arena.player-two.contender:probability}") String defaultPlayerTwo) {
        this.orchestrator = orchestrator;
        this.contenderRegistry = contenderRegistry;
        this.battleExecutor = battleExecutor;
        this.defaultRows = defaultRows;
        this.defaultCols = defaultCols;
        this.fillRatio = fillRatio;
        this.defaultBatchCount = defaultBatchCount;
        this.defaultPlayerOne = defaultPlayerOne;
        this.defaultPlayerTwo = defaultPlayerTwo;
    }

    /**
     * Builds the configuration of a battle from optional request values.
     *
     * <p>Missing dimensions fall back to {@code arena.board.rows} / {@code arena.board.cols}. Without
     * ship counts a random fleet covering {@code arena.fleet.fill-ratio} of the board is generated.
     *
     * @param rows board rows or {@code null}
     * @param cols board columns or {@code null}
     * @param shipCounts fleet or {@code null}
     * @param random source for random fleet generation
     * @return complete configuration
     * @throws IllegalArgumentException if the dimensions are not positive or too large
     */
    public BattleConfiguration resolveConfiguration(Integer rows, Integer cols, ShipCountRequest shipCounts, Random random) {
        int r = rows != null ? rows : defaultRows;
        int c = cols != null ? cols : defaultCols;
        BattleConfiguration.requireValidDimensions(r, c);
        ShipCountRequest counts = shipCounts != null
                ? shipCounts
                : ShipCountRequest.random(r, c, fillRatio, random);
        return new BattleConfiguration(r, c, counts);
    }

    /**
     * Plays a single battle.
     *
     * @param config board and fleet
     * @param playerOne contender name for player one, {@code null} for the configured default
     * @param playerTwo contender name for player two, {@code null} for the configured default
     * @param startingSide side that attacks first
     * @param seed seed of the battle's random source
     * @return outcome of the battle
     */
    public BattleResult runBattle(BattleConfiguration config,
                                  String playerOne,
                                  String playerTwo,
                                  Side startingSide,
                                  long seed) {
        Contender one = contender(playerOne, defaultPlayerOne);
        Contender two = contender(playerTwo, defaultPlayerTwo);
        return orchestrator.runBattle(config, one, two, startingSide, new Random(seed));
    }

    /**
     * Plays {@code count} battles and aggregates the outcomes.
     *
     * <p>Battle {@code k} (1-based) is started by player one when {@code k} is odd and by player two
     * when it is even. The first failing battle fails the whole batch with its exception.
     *
     * @param count number of battles, {@code null} for {@code arena.batch.default-count}
     * @param config board and fleet shared by all battles
     * @param playerOne contender name for player one, {@code null} for the configured default
     * @param playerTwo contender name for player two, {@code null} for the configured default
     * @param seed seed from which the per-battle seeds are derived
     * @return aggregated statistics
     * @throws IllegalArgumentException if {@code count} is not positive or a contender is unknown
     */
    public BatchStatistics runBatch(Integer count,
                                    BattleConfiguration config,
                                    String playerOne,
                                    String playerTwo,
                                    long seed) {
        int battles = count != null ? count : defaultBatchCount;
        if (battles <= 0) {
            throw new IllegalArgumentException("Batch size must be positive but was " + battles);
        }
        Contender one = contender(playerOne, defaultPlayerOne);
        Contender two = contender(playerTwo, defaultPlayerTwo);

        log.info("Starting batch of {} battles: {} vs {} on {}x{} [{}]",
                battles, one.name(), two.name(), config.cols(), config.rows(), config.shipCounts());

        Random seeds = new Random(seed);
        List<CompletableFuture<BattleResult>> futures = new ArrayList<>(battles);
        for (int k = 1; k <= battles; k++) {
            Side start = startingSideOf(k);
            long battleSeed = seeds.nextLong();
            futures.add(CompletableFuture.supplyAsync(
                    () -> orchestrator.runBattle(config, one, two, start, new Random(battleSeed)),
                    battleExecutor));
        }

        BatchStatistics stats = BatchStatistics.empty();
        try {
            for (CompletableFuture<BattleResult> future : futures) {
                stats = stats.plus(await(future));
            }
        } catch (RuntimeException e) {
            // battles that have not started yet are skipped
            futures.forEach(future -> future.cancel(false));
            log.warn("Batch aborted after {} of {} battles: {}", stats.totalBattles(), battles, e.getMessage());
            throw e;
        }

        log.info("Batch finished: {} battles, player 1 won {}, player 2 won {}, {} draws, {} moves on average",
                stats.totalBattles(), stats.playerOneWins(), stats.playerTwoWins(), stats.draws(),
                String.format("%.2f", stats.averageMoves()));
        return stats;
    }

    /**
     * Places a fleet the way the given contender would and returns the resulting board.
     *
     * @param config board and fleet
     * @param contenderName contender whose board setup is used, {@code null} for player one's default
     * @param seed seed of the placement
     * @return placed board
     */
    public Grid randomBoard(BattleConfiguration config, String contenderName, long seed) {
        Contender contender = contender(contenderName, defaultPlayerOne);
        BoardSetup setup = contender.boardSetupFactory()
                .create(config.rows(), config.cols(), config.shipCounts(), new Random(seed));
        setup.placeShips();
        return setup.getBoard();
    }

    /**
     * Player one opens odd-numbered battles, player two even-numbered ones.
     *
     * @param battleNumber 1-based number of the battle within its batch
     */
    public static Side startingSideOf(int battleNumber) {
        return battleNumber % 2 == 1 ? Side.PLAYER_ONE : Side.PLAYER_TWO;
    }

    private Contender contender(String name, String fallback) {
        return contenderRegistry.get(name != null ? name : fallback);
    }

    private static BattleResult await(CompletableFuture<BattleResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
