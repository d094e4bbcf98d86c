package ch.xavier.crossover.indicator;

public enum IndicatorComputationMode {
    /** Every indicator is computed once over the whole series and read by index. */
    PRECOMPUTED,
    /** Indicators are recomputed over the bars seen so far on every bar. */
    PER_BAR
}
