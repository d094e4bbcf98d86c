package ch.xavier.crossover.config;

public enum StopLossMethod {
    FIXED_DISTANCE,
    PERCENTAGE,
    ATR
}
