package ch.xavier.crossover.notification;

import ch.xavier.crossover.backtesting.model.Direction;
import ch.xavier.crossover.backtesting.model.ExitReason;
import lombok.Builder;
import lombok.Value;

/**
 * Running totals after a trade closed, in the order trades close within one run.
 */
@Value
@Builder
public class TradeProgress {
    String symbol;
    Direction direction;
    double entryPrice;
    double exitPrice;
    ExitReason exitReason;
    double pnl;
    double cumulativePnl;
    int wins;
    int losses;
    double winRate; // In percent
    long durationMinutes;
}
