package ch.xavier.crossover.indicator;

/**
 * Indicator values as seen by the simulation loop, bar by bar.
 */
public interface IndicatorSource {

    int getWarmupPeriod();

    IndicatorSnapshot snapshotAt(int index);
}
