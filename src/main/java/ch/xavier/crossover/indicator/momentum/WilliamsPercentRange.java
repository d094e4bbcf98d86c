package ch.xavier.crossover.indicator.momentum;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;

@Getter
public class WilliamsPercentRange implements Indicator {
    public static final String NAME = "williams_r";

    private final int period;

    public WilliamsPercentRange(int period) {
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
        double[] values = SeriesMath.undefined(bars.size());

        for (int i = period - 1; i < bars.size(); i++) {
            double highestHigh = SeriesMath.highestHigh(bars, i, period);
            double lowestLow = SeriesMath.lowestLow(bars, i, period);

            values[i] = highestHigh == lowestLow
                    ? -50
                    : -100 * (highestHigh - bars.get(i).getClose()) / (highestHigh - lowestLow);
        }
        return new IndicatorOutput.Scalar(new IndicatorSeries(values));
    }
}
