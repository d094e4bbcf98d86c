package ch.xavier.crossover.config;

import lombok.Builder;
import lombok.Value;

/**
 * Spread and slippage are in price units, commission is per lot and per side.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionCostSettings {
    double commissionPerLot;
    double slippage;
    double spread;
    boolean useSymbolSpread;

    public static ExecutionCostSettings free() {
        return ExecutionCostSettings.builder().build();
    }
}
