package ch.battleship.battleshiparena.config;

import ch.battleship.battleshiparena.service.StompBattleEventSink;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for live battle viewers.
 *
 * <p>Viewers connect to {@code /ws} (SockJS fallback on {@code /ws/sockjs}) and subscribe to the battle
 * topics published by {@link StompBattleEventSink}. The feed is read-only, so no application
 * destination prefix is registered.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    public static final String ENDPOINT = "/ws";
    public static final String TOPIC_PREFIX = "/topic";

    private final String[] allowedOriginPatterns;

    public WebSocketConfig(@Value("${arena.websocket.allowed-origins:*}") String[] allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker(TOPIC_PREFIX);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(ENDPOINT)
                .setAllowedOriginPatterns(allowedOriginPatterns);

        registry.addEndpoint(ENDPOINT + "/sockjs")
                .setAllowedOriginPatterns(allowedOriginPatterns)
                .withSockJS();
    }
}
