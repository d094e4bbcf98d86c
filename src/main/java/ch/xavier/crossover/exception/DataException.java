package ch.xavier.crossover.exception;

import lombok.Getter;

/**
 * Bar data for one symbol is unusable: empty, malformed, too short for the indicator warm-up,
 * or the provider failed to deliver it.
 */
@Getter
public class DataException extends BacktestException {
    private final String symbol;

    public DataException(String symbol, String message) {
        super("[" + symbol + "] " + message);
        this.symbol = symbol;
    }

    public DataException(String symbol, String message, Throwable cause) {
        super("[" + symbol + "] " + message, cause);
        this.symbol = symbol;
    }
}
