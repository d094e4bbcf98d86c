package ch.xavier.crossover.backtesting;

import ch.xavier.crossover.bar.SymbolInfo;
import ch.xavier.crossover.config.ExecutionCostSettings;

/**
 * Fills move against the trader by half the spread plus the slippage, so a round trip at an
 * unchanged quote costs the full spread. Commission is charged per side.
 */
public class ExecutionCostModel {
    private final double spread;
    private final double slippage;
    private final double commissionPerLot;

    public ExecutionCostModel(ExecutionCostSettings settings, SymbolInfo symbolInfo) {
        this.spread = settings.isUseSymbolSpread() ? symbolInfo.getSpread() : settings.getSpread();
        this.slippage = settings.getSlippage();
        this.commissionPerLot = settings.getCommissionPerLot();
    }

    public double fillPrice(boolean buying, double quote) {
        double adjustment = spread / 2 + slippage;
        return buying ? quote + adjustment : quote - adjustment;
    }

    public double commission(double volume) {
        return volume * commissionPerLot;
    }

    public double getSpread() {
        return spread;
    }
}
