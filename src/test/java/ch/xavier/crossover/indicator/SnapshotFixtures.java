package ch.xavier.crossover.indicator;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds single-bar snapshots without computing any indicator.
 */
public final class SnapshotFixtures {
    private final Map<String, IndicatorOutput> outputs = new HashMap<>();
    private final Map<String, Map<String, IndicatorSeries>> composites = new HashMap<>();

    private SnapshotFixtures() {
    }

    public static SnapshotFixtures snapshot() {
        return new SnapshotFixtures();
    }

    public SnapshotFixtures value(String name, double value) {
        outputs.put(name, new IndicatorOutput.Scalar(new IndicatorSeries(new double[]{value})));
        return this;
    }

    public SnapshotFixtures component(String name, String component, double value) {
        composites.computeIfAbsent(name, key -> new HashMap<>())
                .put(component, new IndicatorSeries(new double[]{value}));
        return this;
    }

    public IndicatorSnapshot build() {
        Map<String, IndicatorOutput> all = new HashMap<>(outputs);
        composites.forEach((name, components) -> all.put(name, new IndicatorOutput.Composite(components)));
        return IndicatorSnapshot.at(all, 0);
    }
}
