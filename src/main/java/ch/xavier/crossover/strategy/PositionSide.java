package ch.xavier.crossover.strategy;

public enum PositionSide {
    FLAT,
    LONG,
    SHORT
}
