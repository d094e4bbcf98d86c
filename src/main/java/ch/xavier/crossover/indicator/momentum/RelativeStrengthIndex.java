package ch.xavier.crossover.indicator.momentum;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;

/**
 * RSI over rolling means of gains and losses. A window without losses reads 100, a window without
 * any movement reads 50.
 */
@Getter
public class RelativeStrengthIndex implements Indicator {
    public static final String NAME = "rsi";

    private final int period;

    public RelativeStrengthIndex(int period) {
        this.period = period;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getWarmupPeriod() {
        return period + 1;
    }

    @Override
    public IndicatorOutput calculate(List<Bar> bars) {
        double[] closes = SeriesMath.closes(bars);
        double[] gains = new double[closes.length];
        double[] losses = new double[closes.length];
        for (int i = 1; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            gains[i] = Math.max(change, 0);
            losses[i] = Math.max(-change, 0);
        }

        double[] rsi = SeriesMath.undefined(closes.length);
        for (int i = period; i < closes.length; i++) {
            double avgGain = SeriesMath.windowMean(gains, i, period);
            double avgLoss = SeriesMath.windowMean(losses, i, period);

            if (avgLoss == 0) {
                rsi[i] = avgGain == 0 ? 50 : 100;
            } else {
                rsi[i] = 100 - 100 / (1 + avgGain / avgLoss);
            }
        }
        return new IndicatorOutput.Scalar(new IndicatorSeries(rsi));
    }
}
