package ch.xavier.crossover.indicator;

public class PrecomputedIndicatorSource implements IndicatorSource {
    private final IndicatorSet indicators;

    public PrecomputedIndicatorSource(IndicatorSet indicators) {
        this.indicators = indicators;
    }

    @Override
    public int getWarmupPeriod() {
        return indicators.getWarmupPeriod();
    }

    @Override
    public IndicatorSnapshot snapshotAt(int index) {
        return indicators.snapshotAt(index);
    }
}
