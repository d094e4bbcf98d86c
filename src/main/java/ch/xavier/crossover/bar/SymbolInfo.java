package ch.xavier.crossover.bar;

import lombok.Builder;
import lombok.Value;

/**
 * Contract specification of a tradable symbol. Spread is the full bid/ask distance in price units.
 */
@Value
@Builder(toBuilder = true)
public class SymbolInfo {
    String symbol;
    @Builder.Default
    double contractMultiplier = 1.0;
    @Builder.Default
    double minVolume = 0.01;
    @Builder.Default
    double maxVolume = 100.0;
    @Builder.Default
    double volumeStep = 0.01;
    @Builder.Default
    int digits = 5;
    @Builder.Default
    double spread = 0.0;

    public static SymbolInfo defaults(String symbol) {
        return SymbolInfo.builder().symbol(symbol).build();
    }
}
