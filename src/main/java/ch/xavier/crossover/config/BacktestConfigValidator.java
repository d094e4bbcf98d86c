package ch.xavier.crossover.config;

import ch.xavier.crossover.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns bound properties into a {@link BacktestConfig} and checks a config before it reaches a
 * simulation. Every problem found is reported at once.
 */
@Component
@Slf4j
public class BacktestConfigValidator {

    public BacktestConfig fromProperties(BacktestProperties properties) {
        List<String> problems = new ArrayList<>();

        requirePresent(properties.getInitialBalance(), "initial-balance", problems);
        requirePresent(properties.getRiskPerTrade(), "risk-per-trade", problems);

        BacktestProperties.StopLoss stopLoss = properties.getStopLoss();
        if (stopLoss.getMethod() == null) {
            problems.add("stop-loss.method is required");
        } else {
            switch (stopLoss.getMethod()) {
                case FIXED_DISTANCE -> requirePresent(stopLoss.getFixedDistance(), "stop-loss.fixed-distance", problems);
                case PERCENTAGE -> requirePresent(stopLoss.getPercentage(), "stop-loss.percentage", problems);
                case ATR -> requirePresent(stopLoss.getAtrMultiplier(), "stop-loss.atr-multiplier", problems);
            }
        }

        BacktestProperties.TakeProfit takeProfit = properties.getTakeProfit();
        if (takeProfit.getMethod() == null) {
            problems.add("take-profit.method is required");
        } else {
            switch (takeProfit.getMethod()) {
                case RISK_REWARD -> requirePresent(takeProfit.getRiskRewardRatio(), "take-profit.risk-reward-ratio", problems);
                case FIXED_DISTANCE -> requirePresent(takeProfit.getFixedDistance(), "take-profit.fixed-distance", problems);
                case PERCENTAGE -> requirePresent(takeProfit.getPercentage(), "take-profit.percentage", problems);
            }
        }

        if (!problems.isEmpty()) {
            log.error("Backtest configuration rejected: {}", problems);
            throw new ConfigurationException(problems);
        }

        BacktestConfig.BacktestConfigBuilder builder = BacktestConfig.builder()
                .initialBalance(properties.getInitialBalance())
                .riskPerTrade(properties.getRiskPerTrade())
                .maxPositionSize(properties.getMaxPositionSize() == null ? 1.0 : properties.getMaxPositionSize())
                .stopLoss(StopLossSettings.builder()
                        .method(stopLoss.getMethod())
                        .fixedDistance(orZero(stopLoss.getFixedDistance()))
                        .percentage(orZero(stopLoss.getPercentage()))
                        .atrMultiplier(orZero(stopLoss.getAtrMultiplier()))
                        .build())
                .takeProfit(TakeProfitSettings.builder()
                        .method(takeProfit.getMethod())
                        .riskRewardRatio(orZero(takeProfit.getRiskRewardRatio()))
                        .fixedDistance(orZero(takeProfit.getFixedDistance()))
                        .percentage(orZero(takeProfit.getPercentage()))
                        .build())
                .executionCosts(ExecutionCostSettings.builder()
                        .commissionPerLot(properties.getExecutionCosts().getCommissionPerLot())
                        .slippage(properties.getExecutionCosts().getSlippage())
                        .spread(properties.getExecutionCosts().getSpread())
                        .useSymbolSpread(properties.getExecutionCosts().isUseSymbolSpread())
                        .build())
                .signalThresholds(SignalThresholds.builder()
                        .strongBuy(properties.getSignalThresholds().getStrongBuy())
                        .weakBuy(properties.getSignalThresholds().getWeakBuy())
                        .strongSell(properties.getSignalThresholds().getStrongSell())
                        .weakSell(properties.getSignalThresholds().getWeakSell())
                        .build())
                .strategy(toStrategySettings(properties.getStrategy()))
                .equitySampleStride(properties.getEquitySampleStride())
                .indicatorComputation(properties.getIndicatorComputation());

        for (Map.Entry<IndicatorType, BacktestProperties.Indicator> entry : properties.getIndicators().entrySet()) {
            builder.indicator(entry.getKey(), IndicatorSettings.builder()
                    .enabled(entry.getValue().isEnabled())
                    .weight(entry.getValue().getWeight())
                    .parameters(entry.getValue().getParameters())
                    .build());
        }

        return validate(builder.build());
    }

    /**
     * @return the given config when it is usable
     * @throws ConfigurationException listing every problem found
     */
    public BacktestConfig validate(BacktestConfig config) {
        List<String> problems = new ArrayList<>();

        if (!(config.getInitialBalance() > 0)) {
            problems.add("initial-balance must be positive");
        }
        if (!(config.getRiskPerTrade() > 0 && config.getRiskPerTrade() <= 1)) {
            problems.add("risk-per-trade must be in (0, 1]");
        }
        if (!(config.getMaxPositionSize() > 0)) {
            problems.add("max-position-size must be positive");
        }
        validateStopLoss(config, problems);
        validateTakeProfit(config.getTakeProfit(), problems);
        validateCosts(config.getExecutionCosts(), problems);
        validateThresholds(config.getSignalThresholds(), problems);
        validateIndicators(config, problems);
        validateStrategy(config, problems);

        if (config.getEquitySampleStride() < 1) {
            problems.add("equity-sample-stride must be at least 1");
        }
        if (config.getIndicatorComputation() == null) {
            problems.add("indicator-computation is required");
        }

        if (!problems.isEmpty()) {
            log.error("Backtest configuration rejected: {}", problems);
            throw new ConfigurationException(problems);
        }
        return config;
    }

    private void validateStopLoss(BacktestConfig config, List<String> problems) {
        StopLossSettings stopLoss = config.getStopLoss();
        if (stopLoss == null || stopLoss.getMethod() == null) {
            problems.add("stop-loss.method is required");
            return;
        }
        switch (stopLoss.getMethod()) {
            case FIXED_DISTANCE -> requirePositive(stopLoss.getFixedDistance(), "stop-loss.fixed-distance", problems);
            case PERCENTAGE -> requirePositive(stopLoss.getPercentage(), "stop-loss.percentage", problems);
            case ATR -> {
                requirePositive(stopLoss.getAtrMultiplier(), "stop-loss.atr-multiplier", problems);
                if (config.enabledIndicator(IndicatorType.ATR).isEmpty()) {
                    problems.add("stop-loss.method ATR requires the ATR indicator to be enabled");
                }
            }
        }
    }

    private void validateTakeProfit(TakeProfitSettings takeProfit, List<String> problems) {
        if (takeProfit == null || takeProfit.getMethod() == null) {
            problems.add("take-profit.method is required");
            return;
        }
        switch (takeProfit.getMethod()) {
            case RISK_REWARD -> requirePositive(takeProfit.getRiskRewardRatio(), "take-profit.risk-reward-ratio", problems);
            case FIXED_DISTANCE -> requirePositive(takeProfit.getFixedDistance(), "take-profit.fixed-distance", problems);
            case PERCENTAGE -> requirePositive(takeProfit.getPercentage(), "take-profit.percentage", problems);
        }
    }

    private void validateCosts(ExecutionCostSettings costs, List<String> problems) {
        if (costs == null) {
            problems.add("execution-costs are required");
            return;
        }
        if (costs.getCommissionPerLot() < 0 || costs.getSlippage() < 0 || costs.getSpread() < 0) {
            problems.add("execution-costs must not be negative");
        }
    }

    private void validateThresholds(SignalThresholds thresholds, List<String> problems) {
        if (thresholds == null) {
            problems.add("signal-thresholds are required");
            return;
        }
        if (outOfUnitRange(thresholds.getStrongBuy()) || outOfUnitRange(thresholds.getWeakBuy())
                || outOfUnitRange(thresholds.getStrongSell()) || outOfUnitRange(thresholds.getWeakSell())) {
            problems.add("signal-thresholds must be in [0, 1]");
        }
        if (thresholds.getWeakBuy() > thresholds.getStrongBuy() || thresholds.getWeakSell() > thresholds.getStrongSell()) {
            problems.add("weak signal thresholds must not exceed strong ones");
        }
    }

    private void validateIndicators(BacktestConfig config, List<String> problems) {
        config.getIndicators().forEach((type, settings) -> {
            if (!settings.isEnabled()) {
                return;
            }
            if (settings.getWeight() < 0) {
                problems.add("indicators." + type + ".weight must not be negative");
            }
            for (String parameter : type.getRequiredParameters()) {
                Double value = settings.getParameters().get(parameter);
                if (value == null) {
                    problems.add("indicators." + type + ".parameters." + parameter + " is required");
                } else if (isPeriod(parameter) && value < 1) {
                    problems.add("indicators." + type + ".parameters." + parameter + " must be at least 1");
                }
            }
        });
    }

    private static boolean isPeriod(String parameter) {
        return parameter.toLowerCase(Locale.ROOT).endsWith("period");
    }

    private void validateStrategy(BacktestConfig config, List<String> problems) {
        StrategySettings strategy = config.getStrategy();
        if (strategy == null || strategy.getType() == null || strategy.getDirection() == null) {
            problems.add("strategy type and direction are required");
            return;
        }
        if (strategy.getType() == StrategyType.EMA_CROSSOVER) {
            if (strategy.getFastPeriod() < 1 || strategy.getSlowPeriod() < 1) {
                problems.add("strategy periods must be at least 1");
            } else if (strategy.getFastPeriod() >= strategy.getSlowPeriod()) {
                problems.add("strategy.fast-period must be lower than strategy.slow-period");
            }
        }
        if (strategy.getType() == StrategyType.WEIGHTED_INDICATORS) {
            boolean anyVoting = config.getIndicators().entrySet().stream()
                    .anyMatch(entry -> entry.getKey().isVoting() && entry.getValue().isEnabled());
            if (!anyVoting) {
                problems.add("WEIGHTED_INDICATORS needs at least one enabled voting indicator");
            }
        }
        if (strategy.isExitOnPriceDeviation() && !(strategy.getPriceDeviationPercent() > 0)) {
            problems.add("strategy.price-deviation-percent must be positive");
        }
    }

    private static void requirePresent(Double value, String name, List<String> problems) {
        if (value == null) {
            problems.add(name + " is required");
        }
    }

    private static void requirePositive(double value, String name, List<String> problems) {
        if (!(value > 0)) {
            problems.add(name + " must be positive");
        }
    }

    private static boolean outOfUnitRange(double value) {
        return !(value >= 0 && value <= 1);
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private static StrategySettings toStrategySettings(BacktestProperties.Strategy strategy) {
        return StrategySettings.builder()
                .type(strategy.getType())
                .fastPeriod(strategy.getFastPeriod())
                .slowPeriod(strategy.getSlowPeriod())
                .direction(strategy.getDirection())
                .exitOnCross(strategy.isExitOnCross())
                .exitOnPriceDeviation(strategy.isExitOnPriceDeviation())
                .priceDeviationPercent(strategy.getPriceDeviationPercent())
                .preventDuplicateSignals(strategy.isPreventDuplicateSignals())
                .tradingEnabled(strategy.isTradingEnabled())
                .build();
    }
}
