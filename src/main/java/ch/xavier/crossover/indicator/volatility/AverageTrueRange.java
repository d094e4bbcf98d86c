package ch.xavier.crossover.indicator.volatility;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;

// The ATR measures the average range between the high and low prices over a given period.
// The first bar has no previous close, its true range is its high-low range.
@Getter
public class AverageTrueRange implements Indicator {
    public static final String NAME = "atr";

    private final int period;

    public AverageTrueRange(int period) {
        this.period = period;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getWarmupPeriod() {
        return period;
    }

    @Override
    public IndicatorOutput calculate(List<Bar> bars) {
        return new IndicatorOutput.Scalar(new IndicatorSeries(SeriesMath.sma(SeriesMath.trueRange(bars), period)));
    }
}
