package ch.xavier.crossover.config;

public enum TakeProfitMethod {
    RISK_REWARD,
    FIXED_DISTANCE,
    PERCENTAGE
}
