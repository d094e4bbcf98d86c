package ch.xavier.crossover.backtesting;

import ch.xavier.crossover.backtesting.model.Direction;
import ch.xavier.crossover.config.StopLossSettings;
import ch.xavier.crossover.config.TakeProfitSettings;

import java.util.OptionalDouble;

/**
 * Stop-loss and take-profit prices. Percentages are fractions of the entry price (0.02 = 2%).
 */
public class ProtectiveLevelCalculator {
    private final StopLossSettings stopLoss;
    private final TakeProfitSettings takeProfit;

    public ProtectiveLevelCalculator(StopLossSettings stopLoss, TakeProfitSettings takeProfit) {
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
    }

    /**
     * @param atr ATR of the entry bar, only read by the ATR method
     * @return empty when the distance cannot be computed, e.g. ATR still warming up
     */
    public OptionalDouble stopDistance(double entryPrice, OptionalDouble atr) {
        double distance = switch (stopLoss.getMethod()) {
            case FIXED_DISTANCE -> stopLoss.getFixedDistance();
            case PERCENTAGE -> entryPrice * stopLoss.getPercentage();
            case ATR -> atr.isPresent() ? atr.getAsDouble() * stopLoss.getAtrMultiplier() : Double.NaN;
        };
        return Double.isFinite(distance) ? OptionalDouble.of(distance) : OptionalDouble.empty();
    }

    public double takeProfitDistance(double entryPrice, double stopDistance) {
        return switch (takeProfit.getMethod()) {
            case RISK_REWARD -> stopDistance * takeProfit.getRiskRewardRatio();
            case FIXED_DISTANCE -> takeProfit.getFixedDistance();
            case PERCENTAGE -> entryPrice * takeProfit.getPercentage();
        };
    }

    public static double level(Direction direction, double entryPrice, double distance, boolean adverse) {
        int sign = adverse ? -direction.sign() : direction.sign();
        return entryPrice + sign * distance;
    }
}
