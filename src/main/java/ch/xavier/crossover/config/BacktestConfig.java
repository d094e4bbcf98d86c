package ch.xavier.crossover.config;

import ch.xavier.crossover.indicator.IndicatorComputationMode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Validated, immutable configuration of a backtest. Build it through
 * {@link BacktestConfigValidator} so that missing risk parameters are rejected before a run.
 */
@Value
@Builder(toBuilder = true)
public class BacktestConfig {
    double initialBalance;
    double riskPerTrade;
    @Builder.Default
    double maxPositionSize = 1.0;
    StopLossSettings stopLoss;
    TakeProfitSettings takeProfit;
    @Builder.Default
    ExecutionCostSettings executionCosts = ExecutionCostSettings.free();
    @Builder.Default
    SignalThresholds signalThresholds = SignalThresholds.builder().build();
    @Singular
    Map<IndicatorType, IndicatorSettings> indicators;
    @Builder.Default
    StrategySettings strategy = StrategySettings.builder().build();
    @Builder.Default
    int equitySampleStride = 1;
    @Builder.Default
    IndicatorComputationMode indicatorComputation = IndicatorComputationMode.PRECOMPUTED;

    public Optional<IndicatorSettings> enabledIndicator(IndicatorType type) {
        return Optional.ofNullable(indicators.get(type)).filter(IndicatorSettings::isEnabled);
    }
}
