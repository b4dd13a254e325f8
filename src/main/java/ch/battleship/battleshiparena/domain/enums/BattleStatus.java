package ch.battleship.battleshiparena.domain.enums;

public enum BattleStatus {
    /**
     * Both fleets are placed; sides take turns attacking.
     */
    RUNNING,
    /**
     * One fleet was destroyed.
     */
    FINISHED,
    /**
     * The move cap was reached, or there was nothing to sink.
     */
    DRAW
}
