package ch.battleship.battleshiparena.service;

import ch.battleship.battleshiparena.domain.Battle;
import ch.battleship.battleshiparena.domain.BattleConfiguration;
import ch.battleship.battleshiparena.domain.BattleResult;
import ch.battleship.battleshiparena.domain.Coordinate;
import ch.battleship.battleshiparena.domain.Fleet;
import ch.battleship.battleshiparena.domain.Grid;
import ch.battleship.battleshiparena.domain.MoveEvent;
import ch.battleship.battleshiparena.domain.ShipInstance;
import ch.battleship.battleshiparena.domain.enums.ShotResult;
import ch.battleship.battleshiparena.domain.enums.Side;
import ch.battleship.battleshiparena.domain.exception.InsufficientSpaceException;
import ch.battleship.battleshiparena.engine.AttackResolver;
import ch.battleship.battleshiparena.engine.ComponentExtractor;
import ch.battleship.battleshiparena.player.BoardSetup;
import ch.battleship.battleshiparena.player.Contender;
import ch.battleship.battleshiparena.player.Strategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Runs a single battle between two contenders.
 *
 * <p>Setup per side: board setup places the fleet, the engine takes one copy of the board and labels
 * it into ship instances, and a fresh strategy is created. Then the sides attack alternately:
 * <ol>
 *   <li>the active strategy proposes a cell,</li>
 *   <li>the cell is validated (on the board, not attacked before),</li>
 *   <li>the attack is resolved against the defender's ship instances,</li>
 *   <li>the result is reported back to the strategy and to the event sinks.</li>
 * </ol>
 * The attacker wins as soon as every defending ship is sunk; after {@code rows * cols * 100} moves
 * the battle is a draw. A fleet without ships ends the battle as a draw before the first move.
 *
 * <p>Stateless; concurrent calls with separate {@link Random} instances are independent.
 */
@Service
@Slf4j
public class BattleOrchestrator {

    private final ComponentExtractor componentExtractor;
    private final AttackResolver attackResolver;
    private final List<BattleEventSink> sinks;

    public BattleOrchestrator(ComponentExtractor componentExtractor,
                              AttackResolver attackResolver,
                              List<BattleEventSink> sinks) {
        this.componentExtractor = componentExtractor;
        this.attackResolver = attackResolver;
        this.sinks = sinks;
    }

    /**
     * Plays one battle to completion.
     *
     * @param config board size and fleet of both sides
     * @param playerOne contender for {@link Side#PLAYER_ONE}
     * @param playerTwo contender for {@link Side#PLAYER_TWO}
     * @param startingSide side that attacks first
     * @param random random source owned by this battle
     * @return winner (or draw) and move count
     * @throws InsufficientSpaceException if the fleet does not fit on the board
     * @throws ch.battleship.battleshiparena.domain.exception.PlacementExhaustedException if a side
     *         could not place its fleet
     * @throws ch.battleship.battleshiparena.domain.exception.InvalidAttackException if a strategy
     *         proposes an illegal cell
     */
    public BattleResult runBattle(BattleConfiguration config,
                                  Contender playerOne,
                                  Contender playerTwo,
                                  Side startingSide,
                                  Random random) {
        int area = config.area();
        long required = config.shipCounts().totalTiles();
        if (required > area) {
            throw new InsufficientSpaceException(required, area);
        }

        Map<Side, Strategy> strategies = new EnumMap<>(Side.class);
        Fleet fleetOne = prepareSide(Side.PLAYER_ONE, playerOne, config, new Random(random.nextLong()), strategies);
        Fleet fleetTwo = prepareSide(Side.PLAYER_TWO, playerTwo, config, new Random(random.nextLong()), strategies);

        Battle battle = new Battle(config, fleetOne, fleetTwo, startingSide);
        log.debug("Battle {} started: {}x{}, ships [{}], player {} begins",
                battle.getBattleId(), config.cols(), config.rows(), config.shipCounts(), startingSide.getNumber());
        notifySinks(sink -> sink.onBattleStarted(battle));

        if (config.shipCounts().totalShips() == 0) {
            battle.declareDraw();
        }

        while (!battle.isOver()) {
            playTurn(battle, strategies.get(battle.getCurrentSide()));
        }

        BattleResult result = battle.toResult();
        log.debug("Battle {} ended after {} moves: {}", battle.getBattleId(), result.moves(),
                result.isDraw() ? "draw" : "player " + result.winner().getNumber() + " wins");
        notifySinks(sink -> sink.onBattleFinished(battle, result));
        return result;
    }

    private Fleet prepareSide(Side side,
                              Contender contender,
                              BattleConfiguration config,
                              Random random,
                              Map<Side, Strategy> strategies) {
        BoardSetup setup = contender.boardSetupFactory()
                .create(config.rows(), config.cols(), config.shipCounts(), random);
        setup.placeShips();

        Grid board = setup.getBoard();
        if (board.getRows() != config.rows() || board.getCols() != config.cols()) {
            throw new IllegalStateException(String.format(
                    "Board setup of player %d returned a %dx%d board, expected %dx%d",
                    side.getNumber(), board.getCols(), board.getRows(), config.cols(), config.rows()));
        }
        List<ShipInstance> ships = componentExtractor.extract(board);

        strategies.put(side, contender.strategyFactory()
                .create(config.rows(), config.cols(), config.shipCounts()));
        return new Fleet(side, board, ships);
    }

    private void playTurn(Battle battle, Strategy strategy) {
        Side attacker = battle.getCurrentSide();
        Coordinate target = strategy.getNextAttack();
        battle.validateAttack(attacker, target);

        ShotResult result = attackResolver.resolve(target, battle.fleetOf(attacker.opponent()).getShips());
        MoveEvent event = battle.recordMove(attacker, target, result);

        strategy.registerAttack(target, result);
        notifySinks(sink -> sink.onMove(event));
    }

    private void notifySinks(Consumer<BattleEventSink> notification) {
        for (BattleEventSink sink : sinks) {
            try {
                notification.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Event sink {} failed (ignored): {}", sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
