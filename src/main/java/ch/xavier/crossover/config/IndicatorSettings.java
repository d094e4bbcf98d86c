package ch.xavier.crossover.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class IndicatorSettings {
    boolean enabled;
    double weight;
    @Singular
    Map<String, Double> parameters;

    public double param(String name) {
        Double value = parameters.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing indicator parameter: " + name);
        }
        return value;
    }

    public int intParam(String name) {
        return (int) Math.round(param(name));
    }
}
