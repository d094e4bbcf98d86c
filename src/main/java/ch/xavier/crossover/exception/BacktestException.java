package ch.xavier.crossover.exception;

public abstract class BacktestException extends RuntimeException {

    protected BacktestException(String message) {
        super(message);
    }

    protected BacktestException(String message, Throwable cause) {
        super(message, cause);
    }
}
