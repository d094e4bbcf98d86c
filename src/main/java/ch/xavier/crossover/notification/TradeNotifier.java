package ch.xavier.crossover.notification;

import ch.xavier.crossover.backtesting.model.Trade;

/**
 * Receives per-trade events of a run. Implementations deliver them to a channel (log, chat,
 * dashboard) and must not throw back into the simulation.
 */
public interface TradeNotifier {

    void onTradeOpened(Trade trade);

    void onTradeClosed(TradeProgress progress);

    TradeNotifier NONE = new TradeNotifier() {
        @Override
        public void onTradeOpened(Trade trade) {
        }

        @Override
        public void onTradeClosed(TradeProgress progress) {
        }
    };
}
