package ch.xavier.crossover.strategy;

public enum SignalTier {
    STRONG,
    WEAK
}
