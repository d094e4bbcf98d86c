package ch.xavier.crossover.indicator.trend;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;

@Getter
public class SimpleMovingAverage implements Indicator {
    private final int period;

    public SimpleMovingAverage(int period) {
        this.period = period;
    }

    public static String nameFor(int period) {
        return "sma_" + period;
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
        return new IndicatorOutput.Scalar(new IndicatorSeries(SeriesMath.sma(SeriesMath.closes(bars), period)));
    }
}
