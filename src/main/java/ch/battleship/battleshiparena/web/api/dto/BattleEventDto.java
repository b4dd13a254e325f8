package ch.battleship.battleshiparena.web.api.dto;

import ch.battleship.battleshiparena.domain.Battle;
import ch.battleship.battleshiparena.domain.BattleResult;
import ch.battleship.battleshiparena.domain.MoveEvent;
import ch.battleship.battleshiparena.domain.enums.BattleEventType;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public record BattleEventDto(
        BattleEventType type,
        String battleId,
        Instant timeStamp,
        Map<String, Object> payload
) {
    public static BattleEventDto battleStarted(Battle battle) {
        return new BattleEventDto(
                BattleEventType.BATTLE_STARTED,
                battle.getBattleId(),
                Instant.now(),
                Map.of(
                        "rows", battle.getConfig().rows(),
                        "cols", battle.getConfig().cols(),
                        "shipCounts", battle.getConfig().shipCounts().toString(),
                        "startingPlayer", battle.getStartingSide().getNumber()
                )
        );
    }

    public static BattleEventDto moveMade(MoveEvent event) {
        return new BattleEventDto(
                BattleEventType.MOVE_MADE,
                event.battleId(),
                Instant.now(),
                Map.of(
                        "move", event.moveIndex(),
                        "attackingPlayer", event.attacker().getNumber(),
                        "x", event.target().getX(),
                        "y", event.target().getY(),
                        "result", event.result().name(),
                        "hit", event.hit(),
                        "shipSunk", event.sunk()
                )
        );
    }

    public static BattleEventDto battleFinished(BattleResult result) {
        // Map.of rejects null values, and a draw has no winner
        Map<String, Object> payload = new HashMap<>();
        payload.put("winningPlayer", result.isDraw() ? null : result.winner().getNumber());
        payload.put("draw", result.isDraw());
        payload.put("moves", result.moves());

        return new BattleEventDto(
                BattleEventType.BATTLE_FINISHED,
                result.battleId(),
                Instant.now(),
                payload
        );
    }
}
