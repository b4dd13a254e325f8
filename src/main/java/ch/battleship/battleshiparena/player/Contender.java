package ch.battleship.battleshiparena.player;

/**
 * A named pairing of placement and targeting that can be entered into a battle.
 *
 * @param name identifier used in requests and configuration
 * @param boardSetupFactory creates the placement routine per battle
 * @param strategyFactory creates the targeting strategy per battle
 */
public record Contender(String name, BoardSetupFactory boardSetupFactory, StrategyFactory strategyFactory) {
}
