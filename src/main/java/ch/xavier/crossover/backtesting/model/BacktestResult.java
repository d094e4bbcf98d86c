package ch.xavier.crossover.backtesting.model;

import lombok.*;

import java.time.Instant;
import java.util.List;

@Builder
@Setter
@Getter
@AllArgsConstructor
@NoArgsConstructor
public class BacktestResult {
    private String symbol;
    private String strategyName;
    private Instant startTime;
    private Instant endTime;
    private int barsProcessed;

    private double initialBalance;
    private double finalBalance;
    private double finalEquity;
    private double totalReturn;
    private double totalReturnPct;

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private double winRate; // In percent
    private double avgWin;
    private double avgLoss;
    private double largestWin;
    private double largestLoss;
    private double grossProfit;
    private double grossLoss;
    private double profitFactor;
    private double avgTradeDurationMinutes;

    private double maxDrawdown;
    private double maxDrawdownPct;
    private double sharpeRatio;
    private double sortinoRatio;
    private double calmarRatio;

    private List<Trade> trades;
    private List<EquityPoint> equityCurve;
    private List<MonthlyReturn> monthlyReturns;
}
