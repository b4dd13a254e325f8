package ch.battleship.battleshiparena.service;

import ch.battleship.battleshiparena.domain.Battle;
import ch.battleship.battleshiparena.domain.BattleResult;
import ch.battleship.battleshiparena.domain.MoveEvent;
import ch.battleship.battleshiparena.domain.enums.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Battle log written through SLF4J.
 *
 * <p>Moves are logged at INFO when {@code arena.events.log-moves} is enabled and at DEBUG otherwise.
 * At DEBUG level both initial boards and the final boards are rendered as well.
 */
@Component
@Slf4j
public class LoggingBattleEventSink implements BattleEventSink {

    private final boolean logMoves;

    public LoggingBattleEventSink(@Value("${arena.events.log-moves:false}") boolean logMoves) {
        this.logMoves = logMoves;
    }

    @Override
    public void onBattleStarted(Battle battle) {
        if (!log.isDebugEnabled()) return;

        log.debug("New battle {} started: {}x{}, ships: [{}]",
                battle.getBattleId(), battle.getConfig().cols(), battle.getConfig().rows(),
                battle.getConfig().shipCounts());
        for (Side side : Side.values()) {
            log.debug("Player {} board:\n{}", side.getNumber(), battle.fleetOf(side).render(true));
        }
    }

    @Override
    public void onMove(MoveEvent event) {
        if (logMoves) {
            log.info(describe(event));
        } else if (log.isDebugEnabled()) {
            log.debug(describe(event));
        }
    }

    @Override
    public void onBattleFinished(Battle battle, BattleResult result) {
        if (result.isDraw()) {
            log.info("Battle {} ended in a draw after {} moves.", result.battleId(), result.moves());
        } else {
            log.info("Battle {}: player {} wins after {} moves!",
                    result.battleId(), result.winner().getNumber(), result.moves());
        }
        if (log.isDebugEnabled()) {
            for (Side side : Side.values()) {
                log.debug("Player {} final board:\n{}", side.getNumber(), battle.fleetOf(side).render(true));
            }
        }
    }

    /**
     * Formats a move like {@code Move 7: Player 2 attacks (3,4) -> Hit and Sunk}.
     */
    public static String describe(MoveEvent event) {
        return "Move " + event.moveIndex()
                + ": Player " + event.attacker().getNumber()
                + " attacks " + event.target()
                + " -> " + (event.hit() ? "Hit" : "Miss")
                + (event.sunk() ? " and Sunk" : "");
    }
}
