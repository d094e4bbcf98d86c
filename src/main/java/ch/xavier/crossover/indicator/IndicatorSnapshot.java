package ch.xavier.crossover.indicator;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Indicator values of a single bar. Only defined values are present.
 */
@EqualsAndHashCode
@ToString
public final class IndicatorSnapshot {
    private static final IndicatorSnapshot EMPTY = new IndicatorSnapshot(Map.of(), Map.of());

    private final Map<String, Double> scalars;
    private final Map<String, Map<String, Double>> composites;

    private IndicatorSnapshot(Map<String, Double> scalars, Map<String, Map<String, Double>> composites) {
        this.scalars = scalars;
        this.composites = composites;
    }

    public static IndicatorSnapshot empty() {
        return EMPTY;
    }

    public static IndicatorSnapshot at(Map<String, IndicatorOutput> outputs, int index) {
        Map<String, Double> scalars = new HashMap<>();
        Map<String, Map<String, Double>> composites = new HashMap<>();

        outputs.forEach((name, output) -> {
            if (output instanceof IndicatorOutput.Scalar scalar) {
                scalar.getSeries().valueAt(index).ifPresent(value -> scalars.put(name, value));
            } else if (output instanceof IndicatorOutput.Composite composite) {
                Map<String, Double> values = new HashMap<>();
                composite.getComponents().forEach((component, series) ->
                        series.valueAt(index).ifPresent(value -> values.put(component, value)));
                if (!values.isEmpty()) {
                    composites.put(name, Collections.unmodifiableMap(values));
                }
            }
        });

        if (scalars.isEmpty() && composites.isEmpty()) {
            return EMPTY;
        }
        return new IndicatorSnapshot(Collections.unmodifiableMap(scalars), Collections.unmodifiableMap(composites));
    }

    public OptionalDouble get(String name) {
        Double value = scalars.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public OptionalDouble get(String name, String component) {
        Map<String, Double> values = composites.get(name);
        if (values == null || !values.containsKey(component)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(values.get(component));
    }

    public boolean isEmpty() {
        return scalars.isEmpty() && composites.isEmpty();
    }
}
