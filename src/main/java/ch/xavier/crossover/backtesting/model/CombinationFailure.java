package ch.xavier.crossover.backtesting.model;

import lombok.Value;

import java.util.Map;

@Value
public class CombinationFailure {
    Map<String, Object> parameters;
    String reason;
}
