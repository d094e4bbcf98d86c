package ch.xavier.crossover.indicator;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Values aligned with the bar series. Undefined entries are stored as NaN and never returned.
 */
public final class IndicatorSeries {
    private final double[] values;

    public IndicatorSeries(double[] values) {
        this.values = values.clone();
    }

    public static IndicatorSeries undefined(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return new IndicatorSeries(values);
    }

    public int size() {
        return values.length;
    }

    public boolean isAvailable(int index) {
        return index >= 0 && index < values.length && !Double.isNaN(values[index]);
    }

    public OptionalDouble valueAt(int index) {
        return isAvailable(index) ? OptionalDouble.of(values[index]) : OptionalDouble.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndicatorSeries other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }
}
