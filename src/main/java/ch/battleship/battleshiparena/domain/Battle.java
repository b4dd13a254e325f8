package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.BattleStatus;
import ch.battleship.battleshiparena.domain.enums.ShotResult;
import ch.battleship.battleshiparena.domain.enums.Side;
import ch.battleship.battleshiparena.domain.exception.InvalidAttackException;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * State of one battle between two sides: both fleets, whose turn it is, the move counter and the
 * outcome.
 *
 * <p>The battle only records moves; asking the strategies and resolving attacks is done by the
 * orchestrator. A battle is created per run and discarded afterwards.
 */
@Getter
public class Battle {

    private final String battleId;
    private final BattleConfiguration config;
    private final Side startingSide;

    @Getter(AccessLevel.NONE)
    private final Map<Side, Fleet> fleets = new EnumMap<>(Side.class);

    private BattleStatus status = BattleStatus.RUNNING;
    private Side currentSide;
    private Side winner;
    private int moveCount;

    public Battle(BattleConfiguration config, Fleet playerOne, Fleet playerTwo, Side startingSide) {
        this(UUID.randomUUID().toString(), config, playerOne, playerTwo, startingSide);
    }

    /**
     * Creates a battle with a predefined id (e.g. for testing or deterministic setups).
     */
    public Battle(String battleId, BattleConfiguration config, Fleet playerOne, Fleet playerTwo, Side startingSide) {
        if (playerOne.getOwner() != Side.PLAYER_ONE || playerTwo.getOwner() != Side.PLAYER_TWO) {
            throw new IllegalArgumentException("Fleets must belong to player one and player two respectively");
        }
        this.battleId = battleId;
        this.config = config;
        this.startingSide = startingSide;
        this.currentSide = startingSide;
        this.fleets.put(Side.PLAYER_ONE, playerOne);
        this.fleets.put(Side.PLAYER_TWO, playerTwo);
    }

    public Fleet fleetOf(Side side) {
        return fleets.get(side);
    }

    public boolean isOver() {
        return status != BattleStatus.RUNNING;
    }

    /**
     * Checks that {@code attacker} may attack {@code target} now.
     *
     * @throws IllegalStateException if the battle is over or it is not the attacker's turn
     * @throws InvalidAttackException if the target is off the board or was attacked before
     */
    public void validateAttack(Side attacker, Coordinate target) {
        if (isOver()) {
            throw new IllegalStateException("Battle " + battleId + " is already over");
        }
        if (attacker != currentSide) {
            throw new IllegalStateException("It is not player " + attacker.getNumber() + "'s turn");
        }
        if (target == null) {
            throw new InvalidAttackException(attacker, null, "no coordinate returned");
        }
        Fleet defender = fleetOf(attacker.opponent());
        if (!defender.isInBounds(target)) {
            throw new InvalidAttackException(attacker, target, "outside the board");
        }
        if (defender.wasAttacked(target)) {
            throw new InvalidAttackException(attacker, target, "cell was already attacked");
        }
    }

    /**
     * Records a resolved attack and advances the battle.
     *
     * <p>Rules implemented here:
     * <ul>
     *   <li>If every ship of the defender is sunk, the attacker wins.</li>
     *   <li>Otherwise, if the move cap is reached, the battle is a draw.</li>
     *   <li>Otherwise the turn passes to the defender.</li>
     * </ul>
     *
     * @param attacker side that attacked
     * @param target attacked cell
     * @param result outcome computed against the defender's ship instances
     * @return event describing the move
     */
    public MoveEvent recordMove(Side attacker, Coordinate target, ShotResult result) {
        validateAttack(attacker, target);

        Fleet defender = fleetOf(attacker.opponent());
        defender.recordShot(target, result);
        moveCount++;

        if (defender.isDestroyed()) {
            status = BattleStatus.FINISHED;
            winner = attacker;
        } else if (moveCount >= config.moveCap()) {
            status = BattleStatus.DRAW;
        } else {
            currentSide = attacker.opponent();
        }
        return new MoveEvent(battleId, moveCount, attacker, target, result);
    }

    /**
     * Ends the battle without a winner before any move was played.
     */
    public void declareDraw() {
        status = BattleStatus.DRAW;
    }

    public BattleResult toResult() {
        return new BattleResult(battleId, winner, moveCount, startingSide);
    }
}
