package ch.xavier.crossover.backtesting;

import ch.xavier.crossover.bar.SymbolInfo;

/**
 * Risk based sizing: the loss at the stop equals {@code balance * riskPerTrade}, capped by the
 * configured maximum and rounded down to the symbol's volume step.
 */
public class PositionSizer {
    private static final double STEP_EPSILON = 1e-9;

    private final double riskPerTrade;
    private final double maxPositionSize;
    private final SymbolInfo symbolInfo;

    public PositionSizer(double riskPerTrade, double maxPositionSize, SymbolInfo symbolInfo) {
        this.riskPerTrade = riskPerTrade;
        this.maxPositionSize = maxPositionSize;
        this.symbolInfo = symbolInfo;
    }

    /**
     * @return the volume to trade, 0 when no position should be opened
     */
    public double calculateVolume(double balance, double entryPrice, double stopLossPrice) {
        double priceRisk = Math.abs(entryPrice - stopLossPrice);
        if (priceRisk == 0 || !Double.isFinite(priceRisk) || balance <= 0) {
            return 0;
        }

        double riskAmount = balance * riskPerTrade;
        double size = Math.min(riskAmount / (priceRisk * symbolInfo.getContractMultiplier()), maxPositionSize);

        double step = symbolInfo.getVolumeStep();
        if (step > 0) {
            size = Math.floor(size / step + STEP_EPSILON) * step;
            // Strip the floating point residue of the multiplication
            size = Math.round(size * 1e8) / 1e8;
        }
        size = Math.min(size, symbolInfo.getMaxVolume());

        if (size <= 0 || size < symbolInfo.getMinVolume()) {
            return 0;
        }
        return size;
    }
}
