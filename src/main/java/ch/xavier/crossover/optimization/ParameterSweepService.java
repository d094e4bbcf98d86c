package ch.xavier.crossover.optimization;

import ch.xavier.crossover.backtesting.BacktesterService;
import ch.xavier.crossover.backtesting.model.CombinationFailure;
import ch.xavier.crossover.backtesting.model.ParameterPerformance;
import ch.xavier.crossover.backtesting.model.PerformanceMetricType;
import ch.xavier.crossover.backtesting.model.SweepResult;
import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.config.BacktestConfigValidator;
import ch.xavier.crossover.exception.DataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class ParameterSweepService {
    private final BacktesterService backtesterService;
    private final BacktestConfigValidator configValidator;
    private final int concurrency;

    public ParameterSweepService(BacktesterService backtesterService, BacktestConfigValidator configValidator) {
        this.backtesterService = backtesterService;
        this.configValidator = configValidator;
        this.concurrency = Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Performs grid search backtesting across all parameter combinations. Combinations with a fast
     * period not below the slow one are skipped. Every remaining combination is validated before
     * the first run, so a bad grid fails the whole sweep at once.
     *
     * @param bars            Bars of the symbol to backtest on
     * @param baseConfig      Config the combinations are applied onto
     * @param parametersGrid  Map of parameter names to possible values
     * @param metricType      Metric used to rank the combinations
     * @param topResultsCount Number of top results to return
     * @param control         Cancellation and time budget of the sweep
     * @return top parameter combinations, best first, with the combinations that failed on the data
     */
    public Mono<SweepResult> sweep(String symbol,
                                                  List<Bar> bars,
                                                  BacktestConfig baseConfig,
                                                  Map<String, List<Object>> parametersGrid,
                                                  PerformanceMetricType metricType,
                                                  int topResultsCount,
                                                  SweepControl control) {
        List<Candidate> candidates = new ArrayList<>();
        int skipped = 0;
        for (Map<String, Object> combination : ParameterGrid.generateAllCombinations(parametersGrid)) {
            BacktestConfig config = ParameterGrid.apply(baseConfig, combination);
            if (!ParameterGrid.isMeaningful(config)) {
                skipped++;
                continue;
            }
            candidates.add(new Candidate(combination, configValidator.validate(config)));
        }
        log.info("Sweeping {} combinations on {} ({} skipped)", candidates.size(), symbol, skipped);

        AtomicInteger completed = new AtomicInteger(0);
        List<CombinationFailure> failures = Collections.synchronizedList(new ArrayList<>());
        int skippedCombinations = skipped;

        Flux<ParameterPerformance> runs = Flux.fromIterable(candidates)
                .takeWhile(candidate -> !control.isCancelled())
                .flatMap(candidate -> backtesterService.backtest(symbol, bars, candidate.config)
                        .map(result -> new ParameterPerformance(
                                candidate.parameters,
                                result,
                                metricType.extract(result)
                        ))
                        .onErrorResume(DataException.class, e -> {
                            log.warn("Combination {} failed: {}", candidate.parameters, e.getMessage());
                            failures.add(new CombinationFailure(candidate.parameters, e.getMessage()));
                            return Mono.empty();
                        }), concurrency);

        if (control.timeBudget().isPresent()) {
            runs = runs.take(control.timeBudget().get());
        }

        return runs
                .doOnNext(performance -> log.info("Combination {}/{} {} -> {} {}", completed.incrementAndGet(),
                        candidates.size(), performance.getParameters(), metricType,
                        String.format("%.4f", performance.getPerformanceMetric())))
                .collectList()
                .map(results -> {
                    results.sort(Comparator.comparing(ParameterPerformance::getPerformanceMetric).reversed());
                    log.info("Sweep on {} finished with {} of {} combinations ({} failed)", symbol, results.size(),
                            candidates.size(), failures.size());
                    List<ParameterPerformance> top = results.size() > topResultsCount ?
                            new ArrayList<>(results.subList(0, topResultsCount)) : results;
                    return SweepResult.builder()
                            .topResults(top)
                            .failures(List.copyOf(failures))
                            .combinations(candidates.size())
                            .skipped(skippedCombinations)
                            .completed(results.size())
                            .build();
                });
    }

    private static final class Candidate {
        private final Map<String, Object> parameters;
        private final BacktestConfig config;

        private Candidate(Map<String, Object> parameters, BacktestConfig config) {
            this.parameters = parameters;
            this.config = config;
        }
    }
}
