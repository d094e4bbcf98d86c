package ch.xavier.crossover.backtesting.model;

public enum ExitReason {
    SL,
    TP,
    SIGNAL,
    END_OF_DATA
}
