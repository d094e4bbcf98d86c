package ch.xavier.crossover.config;

/**
 * Which entries a strategy may open.
 */
public enum TradeDirection {
    BOTH,
    LONG,
    SHORT;

    public boolean allowsLong() {
        return this != SHORT;
    }

    public boolean allowsShort() {
        return this != LONG;
    }
}
