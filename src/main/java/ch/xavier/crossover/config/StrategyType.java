package ch.xavier.crossover.config;

public enum StrategyType {
    EMA_CROSSOVER,
    WEIGHTED_INDICATORS
}
