package ch.xavier.crossover.strategy;

import ch.xavier.crossover.indicator.Indicator;

import java.util.List;

public interface SignalGenerator {
    /**
     * Get strategy name for reporting
     */
    String getName();

    /**
     * Indicators that must be present in the snapshots handed to {@link #generateSignal}.
     */
    List<Indicator> requiredIndicators();

    /**
     * Generate the signal of one bar. Never returns null; "nothing to do" is {@link SignalType#HOLD}.
     */
    Signal generateSignal(SignalInput input, SignalMemory memory);
}
