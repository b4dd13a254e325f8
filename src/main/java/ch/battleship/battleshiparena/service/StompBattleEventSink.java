package ch.battleship.battleshiparena.service;

import ch.battleship.battleshiparena.domain.Battle;
import ch.battleship.battleshiparena.domain.BattleResult;
import ch.battleship.battleshiparena.config.WebSocketConfig;
import ch.battleship.battleshiparena.domain.MoveEvent;
import ch.battleship.battleshiparena.web.api.dto.BattleEventDto;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes battle events to WebSocket subscribers (STOMP topic
 * {@code /topic/battles/{battleId}/events}) so that a viewer can replay a battle live.
 *
 * <p>Per-move events can be switched off with {@code arena.events.broadcast-moves=false}; start and
 * finish events are always sent.
 */
@Component
public class StompBattleEventSink implements BattleEventSink {

    private final SimpMessagingTemplate messagingTemplate;
    private final boolean broadcastMoves;

    public StompBattleEventSink(SimpMessagingTemplate messagingTemplate,
                                @Value("${arena.events.broadcast-moves:true}") boolean broadcastMoves) {
        this.messagingTemplate = messagingTemplate;
        this.broadcastMoves = broadcastMoves;
    }

    @Override
    public void onBattleStarted(Battle battle) {
        messagingTemplate.convertAndSend(destination(battle.getBattleId()), BattleEventDto.battleStarted(battle));
    }

    @Override
    public void onMove(MoveEvent event) {
        if (!broadcastMoves) return;
        messagingTemplate.convertAndSend(destination(event.battleId()), BattleEventDto.moveMade(event));
    }

    @Override
    public void onBattleFinished(Battle battle, BattleResult result) {
        messagingTemplate.convertAndSend(destination(result.battleId()), BattleEventDto.battleFinished(result));
    }

    public static String destination(String battleId) {
        return WebSocketConfig.TOPIC_PREFIX + "/battles/" + battleId + "/events";
    }
}
