package ch.battleship;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Battleship arena.
 *
 * <p>Starts the simulation engine together with its HTTP API and the WebSocket feed for battle
 * viewers.
 */
@SpringBootApplication
public class BattleshipArenaApplication {

    public static void main(String[] args) {
        SpringApplication.run(BattleshipArenaApplication.class, args);
    }

}
