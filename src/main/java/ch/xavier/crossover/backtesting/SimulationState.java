package ch.xavier.crossover.backtesting;

import ch.xavier.crossover.backtesting.model.EquityPoint;
import ch.xavier.crossover.backtesting.model.Trade;
import ch.xavier.crossover.strategy.PositionSide;
import ch.xavier.crossover.strategy.SignalMemory;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one simulation run for one symbol. Never shared between runs.
 */
public class SimulationState {
    @Getter
    private final String symbol;
    @Getter
    private final double initialBalance;
    @Getter
    private final SignalMemory signalMemory = new SignalMemory();

    @Getter
    private double balance;
    @Getter
    private Trade openTrade;
    private final List<Trade> closedTrades = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    private double peakEquity;
    @Getter
    private double cumulativePnl;
    @Getter
    private int wins;
    @Getter
    private int losses;

    public SimulationState(String symbol, double initialBalance) {
        this.symbol = symbol;
        this.initialBalance = initialBalance;
        this.balance = initialBalance;
        this.peakEquity = initialBalance;
    }

    public boolean hasOpenPosition() {
        return openTrade != null;
    }

    public PositionSide getPositionSide() {
        if (openTrade == null) {
            return PositionSide.FLAT;
        }
        return openTrade.isLong() ? PositionSide.LONG : PositionSide.SHORT;
    }

    void open(Trade trade) {
        if (openTrade != null) {
            throw new IllegalStateException("[" + symbol + "] a position is already open since " + openTrade.getEntryTime());
        }
        this.openTrade = trade;
    }

    /**
     * Moves the closed open trade to the history and books its net pnl.
     */
    void settle(Trade trade) {
        if (trade != openTrade || trade.isOpen()) {
            throw new IllegalStateException("[" + symbol + "] only the closed open trade can be settled");
        }
        double pnl = trade.getPnl();
        balance += pnl;
        cumulativePnl += pnl;
        if (pnl > 0) {
            wins++;
        } else {
            losses++;
        }
        closedTrades.add(trade);
        openTrade = null;
    }

    /**
     * Records the account state, drawdown measured against the running equity peak.
     */
    void recordEquity(Instant timestamp, double equity) {
        peakEquity = Math.max(peakEquity, equity);
        double drawdown = peakEquity > 0 ? (peakEquity - equity) / peakEquity * 100 : 0;
        equityCurve.add(new EquityPoint(timestamp, equity, balance, Math.max(drawdown, 0)));
    }

    void trackPeak(double equity) {
        peakEquity = Math.max(peakEquity, equity);
    }

    public double getWinRate() {
        int closed = wins + losses;
        return closed > 0 ? (double) wins / closed * 100 : 0;
    }

    public List<Trade> getClosedTrades() {
        return Collections.unmodifiableList(closedTrades);
    }

    public List<EquityPoint> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }
}
