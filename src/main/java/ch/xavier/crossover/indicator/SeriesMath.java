package ch.xavier.crossover.indicator;

import ch.xavier.crossover.bar.Bar;

import java.util.Arrays;
import java.util.List;

/**
 * Rolling-window helpers shared by the indicators. Every window is summed from scratch so that a
 * value only depends on its own window and the result on a prefix matches the full computation.
 */
public final class SeriesMath {

    private SeriesMath() {
    }

    public static double[] closes(List<Bar> bars) {
        return bars.stream().mapToDouble(Bar::getClose).toArray();
    }

    public static double[] undefined(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }

    public static double[] sma(double[] source, int period) {
        double[] result = undefined(source.length);
        for (int i = period - 1; i < source.length; i++) {
            result[i] = windowMean(source, i, period);
        }
        return result;
    }

    /**
     * EMA with multiplier {@code 2/(period+1)}, seeded by the mean of the first {@code period}
     * consecutive defined values.
     */
    public static double[] ema(double[] source, int period) {
        double[] result = undefined(source.length);
        int seedIndex = -1;
        int run = 0;
        for (int i = 0; i < source.length; i++) {
            run = Double.isNaN(source[i]) ? 0 : run + 1;
            if (run == period) {
                seedIndex = i;
                break;
            }
        }
        if (seedIndex < 0) {
            return result;
        }

        double multiplier = 2.0 / (period + 1);
        result[seedIndex] = windowMean(source, seedIndex, period);
        for (int i = seedIndex + 1; i < source.length; i++) {
            result[i] = (source[i] - result[i - 1]) * multiplier + result[i - 1];
        }
        return result;
    }

    /**
     * Sample standard deviation (n - 1 denominator) over a rolling window.
     */
    public static double[] rollingStd(double[] source, int period) {
        double[] result = undefined(source.length);
        if (period < 2) {
            return result;
        }
        for (int i = period - 1; i < source.length; i++) {
            double mean = windowMean(source, i, period);
            double sumSquares = 0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = source[j] - mean;
                sumSquares += diff * diff;
            }
            result[i] = Math.sqrt(sumSquares / (period - 1));
        }
        return result;
    }

    public static double[] trueRange(List<Bar> bars) {
        double[] result = new double[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            Bar current = bars.get(i);
            double range = current.getHigh() - current.getLow();
            if (i == 0) {
                result[i] = range;
                continue;
            }
            double previousClose = bars.get(i - 1).getClose();
            result[i] = Math.max(range, Math.max(
                    Math.abs(current.getHigh() - previousClose),
                    Math.abs(current.getLow() - previousClose)));
        }
        return result;
    }

    public static double highestHigh(List<Bar> bars, int index, int period) {
        double highest = Double.NEGATIVE_INFINITY;
        for (int j = index - period + 1; j <= index; j++) {
            highest = Math.max(highest, bars.get(j).getHigh());
        }
        return highest;
    }

    public static double lowestLow(List<Bar> bars, int index, int period) {
        double lowest = Double.POSITIVE_INFINITY;
        for (int j = index - period + 1; j <= index; j++) {
            lowest = Math.min(lowest, bars.get(j).getLow());
        }
        return lowest;
    }

    public static double windowMean(double[] source, int index, int period) {
        double sum = 0;
        for (int j = index - period + 1; j <= index; j++) {
            sum += source[j];
        }
        return sum / period;
    }
}
