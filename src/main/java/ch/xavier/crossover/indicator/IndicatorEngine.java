package ch.xavier.crossover.indicator;

import ch.xavier.crossover.bar.Bar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class IndicatorEngine {

    /**
     * Computes every indicator once over the given bars. Indicators sharing a name are computed
     * once. Returns an empty set when there are fewer bars than the combined warm-up.
     */
    public IndicatorSet compute(List<Bar> bars, Collection<Indicator> indicators) {
        Map<String, Indicator> unique = deduplicate(indicators);
        int warmup = warmupOf(unique.values());

        if (bars.size() < warmup) {
            log.debug("{} bars are not enough for a warm-up of {}", bars.size(), warmup);
            return IndicatorSet.empty(warmup);
        }

        Map<String, IndicatorOutput> outputs = new LinkedHashMap<>();
        for (Indicator indicator : unique.values()) {
            outputs.put(indicator.getName(), indicator.calculate(bars));
        }
        return new IndicatorSet(outputs, warmup);
    }

    public IndicatorSource createSource(IndicatorComputationMode mode, List<Bar> bars,
                                        Collection<Indicator> indicators) {
        Collection<Indicator> unique = deduplicate(indicators).values();
        return switch (mode) {
            case PRECOMPUTED -> new PrecomputedIndicatorSource(compute(bars, unique));
            case PER_BAR -> new RecomputingIndicatorSource(this, bars, unique);
        };
    }

    public static int warmupOf(Collection<Indicator> indicators) {
        return indicators.stream().mapToInt(Indicator::getWarmupPeriod).max().orElse(0);
    }

    private static Map<String, Indicator> deduplicate(Collection<Indicator> indicators) {
        Map<String, Indicator> unique = new LinkedHashMap<>();
        for (Indicator indicator : indicators) {
            unique.putIfAbsent(indicator.getName(), indicator);
        }
        return unique;
    }
}
