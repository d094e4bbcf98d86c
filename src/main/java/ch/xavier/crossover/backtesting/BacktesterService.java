package ch.xavier.crossover.backtesting;

import ch.xavier.crossover.backtesting.model.BacktestResult;
import ch.xavier.crossover.backtesting.model.ExitReason;
import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.bar.BarSeriesValidator;
import ch.xavier.crossover.bar.SymbolInfo;
import ch.xavier.crossover.bar.SymbolInfoProvider;
import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.config.BacktestConfigValidator;
import ch.xavier.crossover.config.IndicatorType;
import ch.xavier.crossover.config.StopLossMethod;
import ch.xavier.crossover.exception.ConfigurationException;
import ch.xavier.crossover.exception.DataException;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorEngine;
import ch.xavier.crossover.indicator.IndicatorSnapshot;
import ch.xavier.crossover.indicator.IndicatorSource;
import ch.xavier.crossover.indicator.volatility.AverageTrueRange;
import ch.xavier.crossover.notification.TradeNotifier;
import ch.xavier.crossover.strategy.PositionSide;
import ch.xavier.crossover.strategy.Signal;
import ch.xavier.crossover.strategy.SignalGenerator;
import ch.xavier.crossover.strategy.SignalGeneratorFactory;
import ch.xavier.crossover.strategy.SignalInput;
import ch.xavier.crossover.strategy.SignalType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class BacktesterService {
    private final IndicatorEngine indicatorEngine;
    private final StatisticsCalculator statisticsCalculator;
    private final BarSeriesValidator barSeriesValidator;
    private final BacktestConfigValidator configValidator;
    private final SignalGeneratorFactory signalGeneratorFactory;
    private final SymbolInfoProvider symbolInfoProvider;
    private final TradeNotifier notifier;

    public BacktesterService(IndicatorEngine indicatorEngine,
                             StatisticsCalculator statisticsCalculator,
                             BarSeriesValidator barSeriesValidator,
                             BacktestConfigValidator configValidator,
                             SignalGeneratorFactory signalGeneratorFactory,
                             SymbolInfoProvider symbolInfoProvider,
                             TradeNotifier notifier) {
        this.indicatorEngine = indicatorEngine;
        this.statisticsCalculator = statisticsCalculator;
        this.barSeriesValidator = barSeriesValidator;
        this.configValidator = configValidator;
        this.signalGeneratorFactory = signalGeneratorFactory;
        this.symbolInfoProvider = symbolInfoProvider;
        this.notifier = notifier;
    }

    /**
     * Runs one backtest on the parallel scheduler, with the generator and symbol metadata the
     * config and the provider resolve to. An invalid config is rejected before subscription.
     *
     * @throws ConfigurationException when the config is not usable
     */
    public Mono<BacktestResult> backtest(String symbol, List<Bar> bars, BacktestConfig config) {
        configValidator.validate(config);
        return Mono.fromCallable(() -> simulate(symbol, bars, signalGeneratorFactory.create(config), config,
                        symbolInfoProvider.getSymbolInfo(symbol)))
                .subscribeOn(Schedulers.parallel());
    }

    public BacktestResult executeBacktest(String symbol, List<Bar> bars, BacktestConfig config) {
        configValidator.validate(config);
        return simulate(symbol, bars, signalGeneratorFactory.create(config), config,
                symbolInfoProvider.getSymbolInfo(symbol));
    }

    /**
     * @throws ConfigurationException when the config is not usable
     * @throws DataException          when the bars are unusable or shorter than the indicator warm-up
     */
    public BacktestResult executeBacktest(String symbol, List<Bar> bars, SignalGenerator generator,
                                          BacktestConfig config, SymbolInfo symbolInfo) {
        configValidator.validate(config);
        return simulate(symbol, bars, generator, config, symbolInfo);
    }

    /**
     * Core backtesting logic - synchronous, single threaded, all mutable state local to the call.
     * The config has already been validated.
     */
    private BacktestResult simulate(String symbol, List<Bar> bars, SignalGenerator generator,
                                    BacktestConfig config, SymbolInfo symbolInfo) {
        barSeriesValidator.validate(symbol, bars);

        List<Indicator> indicators = new ArrayList<>(generator.requiredIndicators());
        if (config.getStopLoss().getMethod() == StopLossMethod.ATR) {
            config.enabledIndicator(IndicatorType.ATR)
                    .ifPresent(settings -> indicators.add(new AverageTrueRange(settings.intParam("period"))));
        }

        IndicatorSource source = indicatorEngine.createSource(config.getIndicatorComputation(), bars, indicators);
        int warmup = Math.max(source.getWarmupPeriod(), 1);
        if (bars.size() < warmup) {
            throw new DataException(symbol, "insufficient bars: " + bars.size() + " for a warm-up of " + warmup);
        }

        log.info("[{}] Backtesting {} on {} bars ({} computation, warm-up {})", symbol, generator.getName(),
                bars.size(), config.getIndicatorComputation(), warmup);

        SimulationState state = new SimulationState(symbol, config.getInitialBalance());
        PositionManager positionManager = new PositionManager(config, symbolInfo, notifier);

        int first = warmup - 1;
        int last = bars.size() - 1;
        IndicatorSnapshot previous = IndicatorSnapshot.empty();

        for (int i = first; i <= last; i++) {
            Bar bar = bars.get(i);
            IndicatorSnapshot current = source.snapshotAt(i);

            processBar(state, positionManager, generator, bar, current, previous, i == last);

            double equity = state.getBalance() + positionManager.unrealizedPnl(state, bar.getClose());
            if ((i - first) % config.getEquitySampleStride() == 0 || i == last) {
                state.recordEquity(bar.getTimestamp(), equity);
            } else {
                state.trackPeak(equity);
            }
            previous = current;
        }

        BacktestResult result = statisticsCalculator.calculate(state.getClosedTrades(), state.getEquityCurve(),
                config.getInitialBalance());
        result.setSymbol(symbol);
        result.setStrategyName(generator.getName());
        result.setStartTime(bars.get(0).getTimestamp());
        result.setEndTime(bars.get(last).getTimestamp());
        result.setBarsProcessed(last - first + 1);

        log.info("[{}] {} trades, return {}%, win rate {}%, max drawdown {}%, sharpe {}", symbol,
                result.getTotalTrades(), String.format("%.2f", result.getTotalReturnPct()),
                String.format("%.1f", result.getWinRate()), String.format("%.2f", result.getMaxDrawdownPct()),
                String.format("%.2f", result.getSharpeRatio()));
        return result;
    }

    /**
     * Exit priority: stop-loss, take-profit, exit or opposite signal, end of data. A bar that
     * starts with an open position never opens a new one, and nothing opens on the last bar.
     */
    private void processBar(SimulationState state, PositionManager positionManager, SignalGenerator generator,
                            Bar bar, IndicatorSnapshot current, IndicatorSnapshot previous, boolean lastBar) {
        PositionSide side = state.getPositionSide();
        Signal signal = generator.generateSignal(SignalInput.builder()
                .symbol(state.getSymbol())
                .bar(bar)
                .current(current)
                .previous(previous)
                .positionSide(side)
                .build(), state.getSignalMemory());

        if (side != PositionSide.FLAT) {
            if (positionManager.checkProtectiveLevels(state, bar)) {
                return;
            }
            if (isExitSignal(signal, side)) {
                log.debug("[{}] {} closes {} at {}: {}", state.getSymbol(), signal.getType(), side,
                        bar.getTimestamp(), signal.getReasoning());
                positionManager.closeAtClose(state, bar, ExitReason.SIGNAL);
            } else if (lastBar) {
                positionManager.closeAtClose(state, bar, ExitReason.END_OF_DATA);
            }
            return;
        }

        if (!lastBar && signal.getType().isEntry()) {
            positionManager.openPosition(state, bar, signal, current.get(AverageTrueRange.NAME));
        }
    }

    private static boolean isExitSignal(Signal signal, PositionSide side) {
        return switch (side) {
            case LONG -> signal.getType() == SignalType.EXIT_LONG || signal.getType() == SignalType.SELL;
            case SHORT -> signal.getType() == SignalType.EXIT_SHORT || signal.getType() == SignalType.BUY;
            case FLAT -> false;
        };
    }
}
