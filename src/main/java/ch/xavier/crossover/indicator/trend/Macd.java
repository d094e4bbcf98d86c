package ch.xavier.crossover.indicator.trend;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorOutput;
import ch.xavier.crossover.indicator.IndicatorSeries;
import ch.xavier.crossover.indicator.SeriesMath;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
public class Macd implements Indicator {
    public static final String NAME = "macd";
    public static final String LINE = "macd";
    public static final String SIGNAL = "signal";
    public static final String HISTOGRAM = "histogram";

    private final int fastPeriod;
    private final int slowPeriod;
    private final int signalPeriod;

    public Macd(int fastPeriod, int slowPeriod, int signalPeriod) {
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.signalPeriod = signalPeriod;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getWarmupPeriod() {
        return Math.max(fastPeriod, slowPeriod) + signalPeriod - 1;
    }

    @Override
    public IndicatorOutput calculate(List<Bar> bars) {
        double[] closes = SeriesMath.closes(bars);
        double[] fast = SeriesMath.ema(closes, fastPeriod);
        double[] slow = SeriesMath.ema(closes, slowPeriod);

        double[] line = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            line[i] = fast[i] - slow[i];
        }

        // The signal EMA seeds itself on the first full window of defined MACD values
        double[] signal = SeriesMath.ema(line, signalPeriod);
        double[] histogram = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            histogram[i] = line[i] - signal[i];
        }

        return new IndicatorOutput.Composite(Map.of(
                LINE, new IndicatorSeries(line),
                SIGNAL, new IndicatorSeries(signal),
                HISTOGRAM, new IndicatorSeries(histogram)));
    }
}
