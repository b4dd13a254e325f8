package ch.battleship.battleshiparena.domain.enums;

/**
 * Phase of the probability strategy, derived from its belief state.
 */
public enum TargetingMode {
    /**
     * No hit is waiting to be followed up.
     */
    SEARCH,

    /**
     * At least one hit does not yet belong to a sunk ship; its neighbours are boosted.
     */
    HUNT
}
