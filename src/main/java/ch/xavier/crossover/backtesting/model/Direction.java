package ch.xavier.crossover.backtesting.model;

public enum Direction {
    LONG,
    SHORT;

    /**
     * +1 for longs, -1 for shorts.
     */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
