package ch.xavier.crossover.strategy;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.indicator.IndicatorSnapshot;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a generator may look at for one bar. The previous snapshot is empty on the first bar
 * after the warm-up.
 */
@Value
@Builder
public class SignalInput {
    String symbol;
    Bar bar;
    IndicatorSnapshot current;
    @Builder.Default
    IndicatorSnapshot previous = IndicatorSnapshot.empty();
    @Builder.Default
    PositionSide positionSide = PositionSide.FLAT;
}
