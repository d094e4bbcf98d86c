package ch.xavier.crossover.indicator.trend;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * ADX with plain rolling means for the true range, the directional movements and DX.
 * Directional movement is undefined on the first bar, so DI starts at {@code period} and ADX at
 * {@code 2 * period - 1}.
 */
@Getter
public class AverageDirectionalIndex implements Indicator {
    public static final String NAME = "adx";
    public static final String ADX = "adx";
    public static final String PLUS_DI = "plus_di";
    public static final String MINUS_DI = "minus_di";

    private final int period;

    public AverageDirectionalIndex(int period) {
        this.period = period;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getWarmupPeriod() {
        return 2 * period;
    }

    @Override
    public IndicatorOutput calculate(List<Bar> bars) {
        int size = bars.size();
        double[] trueRange = SeriesMath.trueRange(bars);
        double[] plusDm = SeriesMath.undefined(size);
        double[] minusDm = SeriesMath.undefined(size);

        for (int i = 1; i < size; i++) {
            double upMove = bars.get(i).getHigh() - bars.get(i - 1).getHigh();
            double downMove = bars.get(i - 1).getLow() - bars.get(i).getLow();
            plusDm[i] = upMove > downMove && upMove > 0 ? upMove : 0;
            minusDm[i] = downMove > upMove && downMove > 0 ? downMove : 0;
        }

        double[] plusDi = SeriesMath.undefined(size);
        double[] minusDi = SeriesMath.undefined(size);
        double[] dx = SeriesMath.undefined(size);

        for (int i = period; i < size; i++) {
            double atr = SeriesMath.windowMean(trueRange, i, period);
            double smoothedPlus = SeriesMath.windowMean(plusDm, i, period);
            double smoothedMinus = SeriesMath.windowMean(minusDm, i, period);

            plusDi[i] = atr == 0 ? 0 : 100 * smoothedPlus / atr;
            minusDi[i] = atr == 0 ? 0 : 100 * smoothedMinus / atr;

            double diSum = plusDi[i] + minusDi[i];
            dx[i] = diSum == 0 ? 0 : 100 * Math.abs(plusDi[i] - minusDi[i]) / diSum;
        }

        double[] adx = SeriesMath.undefined(size);
        for (int i = 2 * period - 1; i < size; i++) {
            adx[i] = SeriesMath.windowMean(dx, i, period);
        }

        return new IndicatorOutput.Composite(Map.of(
                ADX, new IndicatorSeries(adx),
                PLUS_DI, new IndicatorSeries(plusDi),
                MINUS_DI, new IndicatorSeries(minusDi)));
    }
}
