package ch.xavier.crossover.indicator.volatility;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
public class BollingerBands implements Indicator {
    public static final String NAME = "bollinger";
    public static final String UPPER = "upper";
    public static final String MIDDLE = "middle";
    public static final String LOWER = "lower";

    private final int period;
    private final double stdDevMultiplier;

    public BollingerBands(int period, double stdDevMultiplier) {
        this.period = period;
        this.stdDevMultiplier = stdDevMultiplier;
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
        double[] closes = SeriesMath.closes(bars);
        double[] middle = SeriesMath.sma(closes, period);
        double[] std = SeriesMath.rollingStd(closes, period);

        double[] upper = new double[closes.length];
        double[] lower = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            upper[i] = middle[i] + stdDevMultiplier * std[i];
            lower[i] = middle[i] - stdDevMultiplier * std[i];
        }

        return new IndicatorOutput.Composite(Map.of(
                UPPER, new IndicatorSeries(upper),
                MIDDLE, new IndicatorSeries(middle),
                LOWER, new IndicatorSeries(lower)));
    }
}
