package ch.xavier.crossover.strategy;

public enum SignalType {
    BUY,
    SELL,
    EXIT_LONG,
    EXIT_SHORT,
    HOLD;

    public boolean isEntry() {
        return this == BUY || this == SELL;
    }
}
