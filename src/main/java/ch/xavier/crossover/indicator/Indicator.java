package ch.xavier.crossover.indicator;

import ch.xavier.crossover.bar.Bar;

import java.util.List;

public interface Indicator {

    /**
     * Key under which the output is published in an {@link IndicatorSet}.
     */
    String getName();

    /**
     * Number of bars needed before the last value of the output is defined.
     */
    int getWarmupPeriod();

    /**
     * Computes the whole series at once. Values are causal: the value at {@code i} only depends on
     * {@code bars[0..i]}.
     */
    IndicatorOutput calculate(List<Bar> bars);
}
