package ch.xavier.crossover.backtesting.model;

import lombok.Value;

import java.util.Map;

/**
 * One evaluated sweep combination, ranked by {@code performanceMetric}.
 */
@Value
public class ParameterPerformance {
    Map<String, Object> parameters;
    BacktestResult result;
    double performanceMetric;
}
