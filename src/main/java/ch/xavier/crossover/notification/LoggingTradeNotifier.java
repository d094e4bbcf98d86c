package ch.xavier.crossover.notification;

import ch.xavier.crossover.backtesting.model.Trade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingTradeNotifier implements TradeNotifier {

    @Override
    public void onTradeOpened(Trade trade) {
        log.info("[{}] OPENED {} at {} volume {} SL {} TP {}", trade.getSymbol(), trade.getDirection(),
                format(trade.getEntryPrice()), trade.getVolume(), format(trade.getStopLoss()),
                format(trade.getTakeProfit()));
    }

    @Override
    public void onTradeClosed(TradeProgress progress) {
        log.info("[{}] CLOSED {} at {} {} P&L {} cumulative {} wins {} losses {} win rate {}% duration {}m",
                progress.getSymbol(), progress.getDirection(), format(progress.getExitPrice()),
                progress.getExitReason(), format(progress.getPnl()), format(progress.getCumulativePnl()),
                progress.getWins(), progress.getLosses(), String.format("%.1f", progress.getWinRate()),
                progress.getDurationMinutes());
    }

    private static String format(double value) {
        return String.format("%.5f", value);
    }
}
