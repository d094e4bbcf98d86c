package ch.xavier.crossover.indicator;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All indicator outputs of one bar series, keyed by indicator name.
 */
public final class IndicatorSet {
    private final Map<String, IndicatorOutput> outputs;
    @Getter
    private final int warmupPeriod;

    public IndicatorSet(Map<String, IndicatorOutput> outputs, int warmupPeriod) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.warmupPeriod = warmupPeriod;
    }

    public static IndicatorSet empty(int warmupPeriod) {
        return new IndicatorSet(Map.of(), warmupPeriod);
    }

    public boolean isEmpty() {
        return outputs.isEmpty();
    }

    public Optional<IndicatorOutput> get(String name) {
        return Optional.ofNullable(outputs.get(name));
    }

    public Map<String, IndicatorOutput> asMap() {
        return outputs;
    }

    /**
     * Bars before the end of the warm-up yield an empty snapshot, even for indicators with a
     * shorter lookback.
     */
    public IndicatorSnapshot snapshotAt(int index) {
        if (outputs.isEmpty() || index + 1 < warmupPeriod) {
            return IndicatorSnapshot.empty();
        }
        return IndicatorSnapshot.at(outputs, index);
    }
}
