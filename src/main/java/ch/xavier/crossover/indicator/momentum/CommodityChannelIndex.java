package ch.xavier.crossover.indicator.momentum;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;

@Getter
public class CommodityChannelIndex implements Indicator {
    public static final String NAME = "cci";
    private static final double LAMBERT_CONSTANT = 0.015;

    private final int period;

    public CommodityChannelIndex(int period) {
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
        double[] typical = bars.stream().mapToDouble(Bar::getTypicalPrice).toArray();
        double[] cci = SeriesMath.undefined(typical.length);

        for (int i = period - 1; i < typical.length; i++) {
            double mean = SeriesMath.windowMean(typical, i, period);
            double deviation = 0;
            for (int j = i - period + 1; j <= i; j++) {
                deviation += Math.abs(typical[j] - mean);
            }
            deviation /= period;

            cci[i] = deviation == 0 ? 0 : (typical[i] - mean) / (LAMBERT_CONSTANT * deviation);
        }
        return new IndicatorOutput.Scalar(new IndicatorSeries(cci));
    }
}
