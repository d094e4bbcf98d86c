package ch.xavier.crossover.indicator;

import lombok.Value;

import java.util.Map;

public sealed interface IndicatorOutput {

    int size();

    @Value
    final class Scalar implements IndicatorOutput {
        IndicatorSeries series;

        @Override
        public int size() {
            return series.size();
        }
    }

    @Value
    final class Composite implements IndicatorOutput {
        Map<String, IndicatorSeries> components;

        public IndicatorSeries component(String name) {
            IndicatorSeries series = components.get(name);
            if (series == null) {
                throw new IllegalArgumentException("Unknown component: " + name);
            }
            return series;
        }

        @Override
        public int size() {
            return components.values().stream().mapToInt(IndicatorSeries::size).max().orElse(0);
        }
    }
}
