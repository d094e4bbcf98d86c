package ch.xavier.crossover.backtesting;

import ch.xavier.crossover.backtesting.model.BacktestResult;
import ch.xavier.crossover.backtesting.model.BatchBacktestResult;
import ch.xavier.crossover.backtesting.model.SymbolFailure;
import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.bar.BarDataProvider;
import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.config.BacktestConfigValidator;
import ch.xavier.crossover.exception.DataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Backtests several symbols in parallel, one independent simulation each. A symbol with unusable
 * data is reported as a failure and does not stop the others. An invalid config is rejected
 * when the batch is requested.
 */
@Service
@Slf4j
public class BatchBacktestService {
    private final BacktesterService backtesterService;
    private final BacktestConfigValidator configValidator;

    public BatchBacktestService(BacktesterService backtesterService, BacktestConfigValidator configValidator) {
        this.backtesterService = backtesterService;
        this.configValidator = configValidator;
    }

    public Mono<BatchBacktestResult> backtestSymbols(Map<String, List<Bar>> barsBySymbol, BacktestConfig config) {
        BacktestConfig validConfig = configValidator.validate(config);

        return Flux.fromIterable(barsBySymbol.entrySet())
                .flatMap(entry -> runSymbol(entry.getKey(), Mono.just(entry.getValue()), validConfig))
                .collectList()
                .map(this::aggregate);
    }

    public Mono<BatchBacktestResult> backtestSymbols(BarDataProvider provider, List<String> symbols, String timeframe,
                                                     Instant from, Instant to, BacktestConfig config) {
        BacktestConfig validConfig = configValidator.validate(config);

        return Flux.fromIterable(symbols)
                .flatMap(symbol -> runSymbol(symbol, fetchBars(provider, symbol, timeframe, from, to), validConfig))
                .collectList()
                .map(this::aggregate);
    }

    private Mono<SymbolOutcome> runSymbol(String symbol, Mono<List<Bar>> bars, BacktestConfig config) {
        return bars
                .flatMap(symbolBars -> backtesterService.backtest(symbol, symbolBars, config))
                .map(SymbolOutcome::success)
                .onErrorResume(DataException.class, e -> {
                    log.warn("Skipping {}: {}", symbol, e.getMessage());
                    return Mono.just(SymbolOutcome.failure(new SymbolFailure(symbol, e.getMessage())));
                });
    }

    private Mono<List<Bar>> fetchBars(BarDataProvider provider, String symbol, String timeframe,
                                      Instant from, Instant to) {
        return provider.getBars(symbol, timeframe, from, to)
                .collectList()
                .onErrorMap(e -> !(e instanceof DataException),
                        e -> new DataException(symbol, "bar retrieval failed: " + e.getMessage(), e));
    }

    private BatchBacktestResult aggregate(List<SymbolOutcome> outcomes) {
        List<BacktestResult> results = new ArrayList<>();
        List<SymbolFailure> failures = new ArrayList<>();
        for (SymbolOutcome outcome : outcomes) {
            if (outcome.result != null) {
                results.add(outcome.result);
            } else {
                failures.add(outcome.failure);
            }
        }
        results.sort(Comparator.comparing(BacktestResult::getSymbol));
        failures.sort(Comparator.comparing(SymbolFailure::getSymbol));

        int totalTrades = results.stream().mapToInt(BacktestResult::getTotalTrades).sum();
        int winningTrades = results.stream().mapToInt(BacktestResult::getWinningTrades).sum();
        double totalPnl = results.stream().mapToDouble(BacktestResult::getTotalReturn).sum();

        log.info("Batch finished: {} symbols backtested, {} failed, {} trades, total P&L {}",
                results.size(), failures.size(), totalTrades, String.format("%.2f", totalPnl));

        return BatchBacktestResult.builder()
                .results(results)
                .failures(failures)
                .totalTrades(totalTrades)
                .totalPnl(totalPnl)
                .combinedWinRate(totalTrades > 0 ? (double) winningTrades / totalTrades * 100 : 0)
                .build();
    }

    private static final class SymbolOutcome {
        private final BacktestResult result;
        private final SymbolFailure failure;

        private SymbolOutcome(BacktestResult result, SymbolFailure failure) {
            this.result = result;
            this.failure = failure;
        }

        static SymbolOutcome success(BacktestResult result) {
            return new SymbolOutcome(result, null);
        }

        static SymbolOutcome failure(SymbolFailure failure) {
            return new SymbolOutcome(null, failure);
        }
    }
}
