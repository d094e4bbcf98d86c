package ch.xavier.crossover.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised before any simulation starts when a required parameter is missing or invalid.
 * Always fatal for the whole run or sweep.
 */
@Getter
public class ConfigurationException extends BacktestException {
    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("Invalid backtest configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationException(String problem) {
        this(List.of(problem));
    }
}
