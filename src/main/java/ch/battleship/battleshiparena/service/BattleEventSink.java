package ch.battleship.battleshiparena.service;

import ch.battleship.battleshiparena.domain.Battle;
import ch.battleship.battleshiparena.domain.BattleResult;
import ch.battleship.battleshiparena.domain.MoveEvent;

/**
 * Write-only observer of battles. Sinks never influence the battle they observe.
 */
public interface BattleEventSink {

    default void onBattleStarted(Battle battle) {
    }

    void onMove(MoveEvent event);

    default void onBattleFinished(Battle battle, BattleResult result) {
    }
}
