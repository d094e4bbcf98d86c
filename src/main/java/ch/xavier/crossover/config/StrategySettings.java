package ch.xavier.crossover.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class StrategySettings {
    @Builder.Default
    StrategyType type = StrategyType.EMA_CROSSOVER;
    @Builder.Default
    int fastPeriod = 9;
    @Builder.Default
    int slowPeriod = 21;
    @Builder.Default
    TradeDirection direction = TradeDirection.BOTH;
    @Builder.Default
    boolean exitOnCross = true;
    @Builder.Default
    boolean exitOnPriceDeviation = false;
    @Builder.Default
    double priceDeviationPercent = 0.1;
    @Builder.Default
    boolean preventDuplicateSignals = true;
    @Builder.Default
    boolean tradingEnabled = true;
}
