package ch.xavier.crossover.optimization;

import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.config.ExecutionCostSettings;
import ch.xavier.crossover.config.StopLossSettings;
import ch.xavier.crossover.config.StrategySettings;
import ch.xavier.crossover.config.StrategyType;
import ch.xavier.crossover.config.TakeProfitSettings;
import ch.xavier.crossover.config.TradeDirection;
import ch.xavier.crossover.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

/**
 * Cartesian products of named parameter values and their application onto a base config.
 */
@Slf4j
public final class ParameterGrid {
    public static final Set<String> SUPPORTED_PARAMETERS = Set.of(
            "fastPeriod", "slowPeriod", "direction", "riskPerTrade", "maxPositionSize",
            "stopLossDistance", "stopLossPercentage", "atrMultiplier",
            "riskRewardRatio", "takeProfitDistance", "takeProfitPercentage", "spread");

    private ParameterGrid() {
    }

    public static List<Map<String, Object>> generateAllCombinations(Map<String, List<Object>> parametersGrid) {
        List<Map<String, Object>> result = new ArrayList<>();
        result.add(new HashMap<>());

        for (Map.Entry<String, List<Object>> entry : parametersGrid.entrySet()) {
            String paramName = entry.getKey();
            List<Object> paramValues = entry.getValue();

            List<Map<String, Object>> newCombinations = new ArrayList<>();

            for (Map<String, Object> combination : result) {
                for (Object value : paramValues) {
                    Map<String, Object> newCombination = new HashMap<>(combination);
                    newCombination.put(paramName, value);
                    newCombinations.add(newCombination);
                }
            }

            result = newCombinations;
        }

        log.info("Generated {} parameter combinations.", result.size());
        return result;
    }

    /**
     * @throws ConfigurationException when a key is not a supported sweep parameter
     */
    public static BacktestConfig apply(BacktestConfig base, Map<String, Object> parameters) {
        BacktestConfig.BacktestConfigBuilder config = base.toBuilder();
        StrategySettings.StrategySettingsBuilder strategy = base.getStrategy().toBuilder();
        StopLossSettings.StopLossSettingsBuilder stopLoss = base.getStopLoss().toBuilder();
        TakeProfitSettings.TakeProfitSettingsBuilder takeProfit = base.getTakeProfit().toBuilder();
        ExecutionCostSettings.ExecutionCostSettingsBuilder costs = base.getExecutionCosts().toBuilder();

        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "fastPeriod" -> strategy.fastPeriod(asInt(entry.getKey(), value));
                case "slowPeriod" -> strategy.slowPeriod(asInt(entry.getKey(), value));
                case "direction" -> strategy.direction(TradeDirection.valueOf(String.valueOf(value).toUpperCase(Locale.ROOT)));
                case "riskPerTrade" -> config.riskPerTrade(asDouble(entry.getKey(), value));
                case "maxPositionSize" -> config.maxPositionSize(asDouble(entry.getKey(), value));
                case "stopLossDistance" -> stopLoss.fixedDistance(asDouble(entry.getKey(), value));
                case "stopLossPercentage" -> stopLoss.percentage(asDouble(entry.getKey(), value));
                case "atrMultiplier" -> stopLoss.atrMultiplier(asDouble(entry.getKey(), value));
                case "riskRewardRatio" -> takeProfit.riskRewardRatio(asDouble(entry.getKey(), value));
                case "takeProfitDistance" -> takeProfit.fixedDistance(asDouble(entry.getKey(), value));
                case "takeProfitPercentage" -> takeProfit.percentage(asDouble(entry.getKey(), value));
                case "spread" -> costs.spread(asDouble(entry.getKey(), value));
                default -> throw new ConfigurationException("Unknown sweep parameter: " + entry.getKey()
                        + ", supported: " + SUPPORTED_PARAMETERS);
            }
        }

        return config
                .strategy(strategy.build())
                .stopLoss(stopLoss.build())
                .takeProfit(takeProfit.build())
                .executionCosts(costs.build())
                .build();
    }

    /**
     * A crossover needs a fast EMA strictly shorter than the slow one.
     */
    public static boolean isMeaningful(BacktestConfig config) {
        return config.getStrategy().getType() != StrategyType.EMA_CROSSOVER
                || config.getStrategy().getFastPeriod() < config.getStrategy().getSlowPeriod();
    }

    public static List<Object> generateIntRange(int from, int to, int interval) {
        return IntStream.iterate(from, n -> n <= to, n -> n + interval)
                .boxed()
                .map(i -> (Object) i)
                .toList();
    }

    public static List<Object> generateDoubleRange(double from, double to, double interval) {
        return DoubleStream.iterate(from, n -> n <= to + interval / 1e6, n -> n + interval)
                .boxed()
                .map(i -> (Object) i)
                .toList();
    }

    private static int asInt(String name, Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Sweep parameter " + name + " is not an integer: " + value);
        }
    }

    private static double asDouble(String name, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Sweep parameter " + name + " is not a number: " + value);
        }
    }
}
