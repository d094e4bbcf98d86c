package ch.xavier.crossover.backtesting.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One position from entry to exit. Exit fields stay null until {@link #close} is called, which
 * may happen only once.
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class Trade {
    private String symbol;
    private Direction direction;
    private Instant entryTime;
    private double entryPrice;
    private double volume;
    private double stopLoss;
    private double takeProfit;
    private double commission;
    private List<String> indicatorsUsed;
    private double signalStrength;

    private Instant exitTime;
    private Double exitPrice;
    private Double pnl;
    private Double pnlPct;
    private Long durationMinutes;
    private ExitReason exitReason;

    @Builder
    private Trade(String symbol, Direction direction, Instant entryTime, double entryPrice, double volume,
                  double stopLoss, double takeProfit, double entryCommission, List<String> indicatorsUsed,
                  double signalStrength) {
        this.symbol = symbol;
        this.direction = direction;
        this.entryTime = entryTime;
        this.entryPrice = entryPrice;
        this.volume = volume;
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
        this.commission = entryCommission;
        this.indicatorsUsed = indicatorsUsed == null ? List.of() : List.copyOf(indicatorsUsed);
        this.signalStrength = signalStrength;
    }

    /**
     * @param exitCommission commission of the closing side, added to the entry commission
     * @param netPnl         profit after both commissions
     * @param netPnlPct      net profit relative to the entry notional, in percent
     */
    public void close(Instant exitTime, double exitPrice, double exitCommission, double netPnl, double netPnlPct,
                      ExitReason reason) {
        if (!isOpen()) {
            throw new IllegalStateException("Trade " + symbol + " " + direction + " from " + entryTime
                    + " is already closed");
        }
        if (exitTime.isBefore(entryTime)) {
            throw new IllegalArgumentException("Exit time " + exitTime + " is before entry time " + entryTime);
        }
        this.exitTime = exitTime;
        this.exitPrice = exitPrice;
        this.commission += exitCommission;
        this.pnl = netPnl;
        this.pnlPct = netPnlPct;
        this.durationMinutes = Duration.between(entryTime, exitTime).toMinutes();
        this.exitReason = reason;
    }

    public boolean isOpen() {
        return exitTime == null;
    }

    public boolean isLong() {
        return direction == Direction.LONG;
    }
}
