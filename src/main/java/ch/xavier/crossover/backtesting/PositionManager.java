package ch.xavier.crossover.backtesting;

import ch.xavier.crossover.backtesting.model.Direction;
import ch.xavier.crossover.backtesting.model.ExitReason;
import ch.xavier.crossover.backtesting.model.Trade;
import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.bar.SymbolInfo;
import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.notification.TradeNotifier;
import ch.xavier.crossover.notification.TradeProgress;
import ch.xavier.crossover.strategy.Signal;
import ch.xavier.crossover.strategy.SignalType;
import lombok.extern.slf4j.Slf4j;

import java.util.OptionalDouble;

/**
 * Opens and closes the single position of a run: sizing, execution costs, protective levels and
 * the balance update on close.
 */
@Slf4j
public class PositionManager {
    private final SymbolInfo symbolInfo;
    private final PositionSizer sizer;
    private final ExecutionCostModel costs;
    private final ProtectiveLevelCalculator levels;
    private final TradeNotifier notifier;

    public PositionManager(BacktestConfig config, SymbolInfo symbolInfo, TradeNotifier notifier) {
        this.symbolInfo = symbolInfo;
        this.sizer = new PositionSizer(config.getRiskPerTrade(), config.getMaxPositionSize(), symbolInfo);
        this.costs = new ExecutionCostModel(config.getExecutionCosts(), symbolInfo);
        this.levels = new ProtectiveLevelCalculator(config.getStopLoss(), config.getTakeProfit());
        this.notifier = notifier;
    }

    /**
     * Opens a position at the bar close for a BUY or SELL signal.
     *
     * @param atr ATR of the bar, needed when stops are ATR based
     * @return false when the entry was rejected and no trade exists
     */
    public boolean openPosition(SimulationState state, Bar bar, Signal signal, OptionalDouble atr) {
        if (state.hasOpenPosition()) {
            throw new IllegalStateException("[" + state.getSymbol() + "] cannot open a second position");
        }
        Direction direction = signal.getType() == SignalType.BUY ? Direction.LONG : Direction.SHORT;
        double entryPrice = costs.fillPrice(direction == Direction.LONG, bar.getClose());

        OptionalDouble stopDistance = levels.stopDistance(entryPrice, atr);
        if (stopDistance.isEmpty()) {
            log.warn("[{}] {} entry at {} rejected: stop distance unavailable", state.getSymbol(), direction,
                    bar.getTimestamp());
            return false;
        }
        double stopLoss = ProtectiveLevelCalculator.level(direction, entryPrice, stopDistance.getAsDouble(), true);
        double takeProfit = ProtectiveLevelCalculator.level(direction, entryPrice,
                levels.takeProfitDistance(entryPrice, stopDistance.getAsDouble()), false);

        double volume = sizer.calculateVolume(state.getBalance(), entryPrice, stopLoss);
        if (volume <= 0) {
            log.warn("[{}] {} entry at {} rejected: position size is zero", state.getSymbol(), direction,
                    bar.getTimestamp());
            return false;
        }

        Trade trade = Trade.builder()
                .symbol(state.getSymbol())
                .direction(direction)
                .entryTime(bar.getTimestamp())
                .entryPrice(entryPrice)
                .volume(volume)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .entryCommission(costs.commission(volume))
                .indicatorsUsed(signal.getIndicatorsUsed())
                .signalStrength(signal.getConfidence())
                .build();

        state.open(trade);
        notifier.onTradeOpened(trade);
        return true;
    }

    /**
     * Closes the open position when the bar touched its stop-loss, then its take-profit. A bar
     * that gaps through a level fills at its open.
     *
     * @return true when the position was closed
     */
    public boolean checkProtectiveLevels(SimulationState state, Bar bar) {
        Trade trade = state.getOpenTrade();
        if (trade == null) {
            return false;
        }

        if (trade.isLong()) {
            if (bar.getLow() <= trade.getStopLoss()) {
                close(state, bar, Math.min(bar.getOpen(), trade.getStopLoss()), ExitReason.SL);
                return true;
            }
            if (bar.getHigh() >= trade.getTakeProfit()) {
                close(state, bar, Math.max(bar.getOpen(), trade.getTakeProfit()), ExitReason.TP);
                return true;
            }
        } else {
            if (bar.getHigh() >= trade.getStopLoss()) {
                close(state, bar, Math.max(bar.getOpen(), trade.getStopLoss()), ExitReason.SL);
                return true;
            }
            if (bar.getLow() <= trade.getTakeProfit()) {
                close(state, bar, Math.min(bar.getOpen(), trade.getTakeProfit()), ExitReason.TP);
                return true;
            }
        }
        return false;
    }

    /**
     * Closes the open position at the bar close.
     */
    public void closeAtClose(SimulationState state, Bar bar, ExitReason reason) {
        close(state, bar, bar.getClose(), reason);
    }

    /**
     * Unrealized pnl of the open position at the given quote, before exit costs.
     */
    public double unrealizedPnl(SimulationState state, double quote) {
        Trade trade = state.getOpenTrade();
        if (trade == null) {
            return 0;
        }
        return trade.getDirection().sign() * (quote - trade.getEntryPrice()) * trade.getVolume()
                * symbolInfo.getContractMultiplier();
    }

    private void close(SimulationState state, Bar bar, double quote, ExitReason reason) {
        Trade trade = state.getOpenTrade();
        double exitPrice = costs.fillPrice(!trade.isLong(), quote);
        double multiplier = symbolInfo.getContractMultiplier();

        double gross = trade.getDirection().sign() * (exitPrice - trade.getEntryPrice()) * trade.getVolume() * multiplier;
        double exitCommission = costs.commission(trade.getVolume());
        double net = gross - trade.getCommission() - exitCommission;
        double notional = trade.getEntryPrice() * trade.getVolume() * multiplier;
        double netPct = notional != 0 ? net / notional * 100 : 0;

        trade.close(bar.getTimestamp(), exitPrice, exitCommission, net, netPct, reason);
        state.settle(trade);

        notifier.onTradeClosed(TradeProgress.builder()
                .symbol(trade.getSymbol())
                .direction(trade.getDirection())
                .entryPrice(trade.getEntryPrice())
                .exitPrice(exitPrice)
                .exitReason(reason)
                .pnl(net)
                .cumulativePnl(state.getCumulativePnl())
                .wins(state.getWins())
                .losses(state.getLosses())
                .winRate(state.getWinRate())
                .durationMinutes(trade.getDurationMinutes())
                .build());
    }
}
