package ch.xavier.crossover.indicator.momentum;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
public class StochasticOscillator implements Indicator {
    public static final String NAME = "stochastic";
    public static final String K = "k";
    public static final String D = "d";

    private final int kPeriod;
    private final int dPeriod;

    /**
     * @param kPeriod lookback for the highest high and lowest low of %K
     * @param dPeriod SMA length applied to %K to get %D
     */
    public StochasticOscillator(int kPeriod, int dPeriod) {
        this.kPeriod = kPeriod;
        this.dPeriod = dPeriod;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getWarmupPeriod() {
        return kPeriod + dPeriod - 1;
    }

    @Override
    public IndicatorOutput calculate(List<Bar> bars) {
        double[] k = SeriesMath.undefined(bars.size());

        for (int i = kPeriod - 1; i < bars.size(); i++) {
            double highestHigh = SeriesMath.highestHigh(bars, i, kPeriod);
            double lowestLow = SeriesMath.lowestLow(bars, i, kPeriod);

            if (highestHigh != lowestLow) {
                k[i] = (bars.get(i).getClose() - lowestLow) / (highestHigh - lowestLow) * 100;
            } else {
                k[i] = 50; // no range
            }
        }

        double[] d = SeriesMath.undefined(bars.size());
        for (int i = kPeriod + dPeriod - 2; i < bars.size(); i++) {
            d[i] = SeriesMath.windowMean(k, i, dPeriod);
        }

        return new IndicatorOutput.Composite(Map.of(
                K, new IndicatorSeries(k),
                D, new IndicatorSeries(d)));
    }
}
