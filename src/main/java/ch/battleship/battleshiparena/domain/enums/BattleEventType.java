package ch.battleship.battleshiparena.domain.enums;

public enum BattleEventType
{
    BATTLE_STARTED,
    MOVE_MADE,
    BATTLE_FINISHED
}
