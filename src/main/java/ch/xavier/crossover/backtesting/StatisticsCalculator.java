package ch.xavier.crossover.backtesting;

import ch.xavier.crossover.backtesting.model.BacktestResult;
import ch.xavier.crossover.backtesting.model.EquityPoint;
import ch.xavier.crossover.backtesting.model.MonthlyReturn;
import ch.xavier.crossover.backtesting.model.Trade;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary and risk metrics of a finished run. Drawdown is measured on the realized balance, after
 * each closed trade, while Sharpe and Sortino use the sampled equity including open positions.
 * Degenerate inputs give 0, except the profit factor of a run without losing trades.
 */
@Component
public class StatisticsCalculator {
    private static final double ANNUALIZATION = Math.sqrt(252);

    public BacktestResult calculate(List<Trade> trades, List<EquityPoint> equityCurve, double initialBalance) {
        double netPnl = trades.stream().mapToDouble(Trade::getPnl).sum();
        double finalBalance = initialBalance + netPnl;
        double finalEquity = equityCurve.isEmpty() ? finalBalance : equityCurve.get(equityCurve.size() - 1).getEquity();

        List<Double> wins = trades.stream().map(Trade::getPnl).filter(pnl -> pnl > 0).toList();
        List<Double> losses = trades.stream().map(Trade::getPnl).filter(pnl -> pnl < 0).toList();

        double grossProfit = wins.stream().mapToDouble(Double::doubleValue).sum();
        double grossLoss = Math.abs(losses.stream().mapToDouble(Double::doubleValue).sum());

        double totalReturnPct = initialBalance > 0 ? netPnl / initialBalance * 100 : 0;
        double[] drawdown = maxDrawdown(trades, initialBalance);
        double maxDrawdownPct = drawdown[1];

        return BacktestResult.builder()
                .initialBalance(initialBalance)
                .finalBalance(finalBalance)
                .finalEquity(finalEquity)
                .totalReturn(netPnl)
                .totalReturnPct(totalReturnPct)
                .totalTrades(trades.size())
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .winRate(trades.isEmpty() ? 0 : (double) wins.size() / trades.size() * 100)
                .avgWin(wins.isEmpty() ? 0 : grossProfit / wins.size())
                .avgLoss(losses.isEmpty() ? 0 : -grossLoss / losses.size())
                .largestWin(wins.stream().mapToDouble(Double::doubleValue).max().orElse(0))
                .largestLoss(losses.stream().mapToDouble(Double::doubleValue).min().orElse(0))
                .grossProfit(grossProfit)
                .grossLoss(grossLoss)
                .profitFactor(profitFactor(grossProfit, grossLoss))
                .avgTradeDurationMinutes(trades.stream().mapToLong(Trade::getDurationMinutes).average().orElse(0))
                .maxDrawdown(drawdown[0])
                .maxDrawdownPct(maxDrawdownPct)
                .sharpeRatio(sharpeRatio(equityReturns(equityCurve)))
                .sortinoRatio(sortinoRatio(equityReturns(equityCurve)))
                .calmarRatio(maxDrawdownPct > 0 ? (totalReturnPct / 100) / (maxDrawdownPct / 100) : 0)
                .trades(List.copyOf(trades))
                .equityCurve(List.copyOf(equityCurve))
                .monthlyReturns(monthlyReturns(equityCurve))
                .build();
    }

    static double profitFactor(double grossProfit, double grossLoss) {
        if (grossLoss > 0) {
            return grossProfit / grossLoss;
        }
        return grossProfit > 0 ? Double.POSITIVE_INFINITY : 0;
    }

    /**
     * @return the largest decline from the running balance peak, as {amount, percent}
     */
    static double[] maxDrawdown(List<Trade> trades, double initialBalance) {
        double balance = initialBalance;
        double peak = initialBalance;
        double maxAmount = 0;
        double maxPct = 0;

        for (Trade trade : trades) {
            balance += trade.getPnl();
            peak = Math.max(peak, balance);
            double amount = peak - balance;
            double pct = peak > 0 ? amount / peak * 100 : 0;
            maxAmount = Math.max(maxAmount, amount);
            maxPct = Math.max(maxPct, pct);
        }
        return new double[]{maxAmount, Math.min(Math.max(maxPct, 0), 100)};
    }

    static List<Double> equityReturns(List<EquityPoint> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1).getEquity();
            if (previous > 0) {
                returns.add((equityCurve.get(i).getEquity() - previous) / previous);
            }
        }
        return returns;
    }

    static double sharpeRatio(List<Double> returns) {
        if (returns.size() < 2) {
            return 0;
        }
        double std = sampleStd(returns);
        return std > 0 ? mean(returns) / std * ANNUALIZATION : 0;
    }

    static double sortinoRatio(List<Double> returns) {
        List<Double> downside = returns.stream().filter(r -> r < 0).toList();
        if (downside.size() < 2) {
            return 0;
        }
        double std = sampleStd(downside);
        return std > 0 ? mean(returns) / std * ANNUALIZATION : 0;
    }

    /**
     * Month-end equity (UTC) and its change from the previous month end. The first month has no
     * previous month end and is left out.
     */
    static List<MonthlyReturn> monthlyReturns(List<EquityPoint> equityCurve) {
        Map<YearMonth, Double> monthEnds = new LinkedHashMap<>();
        for (EquityPoint point : equityCurve) {
            monthEnds.put(YearMonth.from(point.getTimestamp().atZone(ZoneOffset.UTC)), point.getEquity());
        }

        List<MonthlyReturn> result = new ArrayList<>();
        Double previous = null;
        for (Map.Entry<YearMonth, Double> entry : monthEnds.entrySet()) {
            if (previous != null) {
                double returnPct = previous > 0 ? (entry.getValue() - previous) / previous * 100 : 0;
                result.add(new MonthlyReturn(entry.getKey(), entry.getValue(), returnPct));
            }
            previous = entry.getValue();
        }
        return result;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static double sampleStd(List<Double> values) {
        double mean = mean(values);
        double sumSquares = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum();
        return Math.sqrt(sumSquares / (values.size() - 1));
    }
}
