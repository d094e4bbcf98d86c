package ch.xavier.crossover.indicator.trend;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;

/**
 * EMA of the close, seeded with the SMA of the first {@code period} closes.
 */
@Getter
public class ExponentialMovingAverage implements Indicator {
    private final int period;

    public ExponentialMovingAverage(int period) {
        this.period = period;
    }

    public static String nameFor(int period) {
        return "ema_" + period;
    }

    @Override
    public String getName() {
        return nameFor(period);
    }

    @Override
    public int getWarmupPeriod() {
        return period;
    }

    @Override
    public IndicatorOutput calculate(List<Bar> bars) {
        return new IndicatorOutput.Scalar(new IndicatorSeries(SeriesMath.ema(SeriesMath.closes(bars), period)));
    }
}
