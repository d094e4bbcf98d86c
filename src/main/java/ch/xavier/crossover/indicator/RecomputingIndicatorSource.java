package ch.xavier.crossover.indicator;

import ch.xavier.crossover.bar.Bar;

import java.util.Collection;
import java.util.List;

/**
 * Recomputes every indicator over {@code bars[0..index]} on each request. Quadratic in the number
 * of bars; kept as the reference path that never sees future bars.
 */
public class RecomputingIndicatorSource implements IndicatorSource {
    private final IndicatorEngine engine;
    private final List<Bar> bars;
    private final Collection<Indicator> indicators;
    private final int warmupPeriod;

    public RecomputingIndicatorSource(IndicatorEngine engine, List<Bar> bars, Collection<Indicator> indicators) {
        this.engine = engine;
        this.bars = bars;
        this.indicators = indicators;
        this.warmupPeriod = IndicatorEngine.warmupOf(indicators);
    }

    @Override
    public int getWarmupPeriod() {
        return warmupPeriod;
    }

    @Override
    public IndicatorSnapshot snapshotAt(int index) {
        return engine.compute(bars.subList(0, index + 1), indicators).snapshotAt(index);
    }
}
