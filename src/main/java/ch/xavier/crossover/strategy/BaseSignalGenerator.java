package ch.xavier.crossover.strategy;

import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.config.StrategySettings;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies the entry filters shared by every generator: trading switch, direction filter and
 * duplicate suppression. Filters only apply while flat; with an open position an opposite signal
 * is an exit request and passes through.
 */
@Slf4j
public abstract class BaseSignalGenerator implements SignalGenerator {
    protected final BacktestConfig config;
    protected final StrategySettings settings;

    protected BaseSignalGenerator(BacktestConfig config) {
        this.config = config;
        this.settings = config.getStrategy();
    }

    @Override
    public final Signal generateSignal(SignalInput input, SignalMemory memory) {
        Signal signal = evaluate(input);

        if (!signal.getType().isEntry() || input.getPositionSide() != PositionSide.FLAT) {
            return signal;
        }

        if (!settings.isTradingEnabled()) {
            return Signal.hold(signal.getBarTime(), signal.getConfidence(), "Trading disabled");
        }
        if (signal.getType() == SignalType.BUY && !settings.getDirection().allowsLong()
                || signal.getType() == SignalType.SELL && !settings.getDirection().allowsShort()) {
            return Signal.hold(signal.getBarTime(), signal.getConfidence(),
                    signal.getType() + " filtered by direction " + settings.getDirection());
        }
        if (settings.isPreventDuplicateSignals() && memory.isDuplicate(signal.getBarTime())) {
            log.debug("[{}] Duplicate {} on bar {} suppressed", input.getSymbol(), signal.getType(), signal.getBarTime());
            return Signal.hold(signal.getBarTime(), signal.getConfidence(), "Duplicate signal on bar");
        }

        memory.record(signal.getBarTime());
        return signal;
    }

    protected abstract Signal evaluate(SignalInput input);
}
