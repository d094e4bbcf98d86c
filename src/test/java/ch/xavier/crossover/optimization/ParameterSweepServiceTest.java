package ch.xavier.crossover.optimization;

import ch.xavier.crossover.backtesting.BacktesterService;
import ch.xavier.crossover.backtesting.StatisticsCalculator;
import ch.xavier.crossover.backtesting.model.CombinationFailure;
import ch.xavier.crossover.backtesting.model.ParameterPerformance;
import ch.xavier.crossover.backtesting.model.PerformanceMetricType;
import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.bar.BarFixtures;
import ch.xavier.crossover.bar.BarSeriesValidator;
import ch.xavier.crossover.bar.SymbolInfo;
import ch.xavier.crossover.config.BacktestConfigValidator;
import ch.xavier.crossover.config.TestConfigs;
import ch.xavier.crossover.exception.ConfigurationException;
import ch.xavier.crossover.indicator.IndicatorEngine;
import ch.xavier.crossover.notification.TradeNotifier;
import ch.xavier.crossover.strategy.SignalGeneratorFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterSweepServiceTest {
    private final List<Bar> bars = BarFixtures.fromCloses(BarFixtures.twoCycles());

    private ParameterSweepService service;

    @BeforeEach
    void setUp() {
        BacktesterService backtesterService = new BacktesterService(new IndicatorEngine(), new StatisticsCalculator(),
                new BarSeriesValidator(), new BacktestConfigValidator(), new SignalGeneratorFactory(),
                SymbolInfo::defaults, TradeNotifier.NONE);
        service = new ParameterSweepService(backtesterService, new BacktestConfigValidator());
    }

    private static Map<String, List<Object>> periodGrid() {
        Map<String, List<Object>> grid = new LinkedHashMap<>();
        grid.put("fastPeriod", List.of(5, 10, 20));
        grid.put("slowPeriod", List.of(10, 20));
        return grid;
    }

    @Test
    void sweep_skipsCombinationsWithoutAFasterEma_andRanksTheRest() {
        StepVerifier.create(service.sweep("CYCLE", bars, TestConfigs.crossover(9, 21), periodGrid(),
                        PerformanceMetricType.TOTAL_RETURN, 10, SweepControl.unlimited()))
                .assertNext(sweep -> {
                    List<ParameterPerformance> results = sweep.getTopResults();
                    assertThat(results).hasSize(3);
                    assertThat(results).allMatch(performance ->
                            (int) performance.getParameters().get("fastPeriod") < (int) performance.getParameters().get("slowPeriod"));
                    assertThat(results).extracting(ParameterPerformance::getPerformanceMetric)
                            .isSortedAccordingTo((a, b) -> Double.compare(b, a));
                    assertThat(results.get(0).getPerformanceMetric())
                            .isEqualTo(results.get(0).getResult().getTotalReturn());
                    assertThat(sweep.getCombinations()).isEqualTo(3);
                    assertThat(sweep.getSkipped()).isEqualTo(3);
                    assertThat(sweep.getCompleted()).isEqualTo(3);
                    assertThat(sweep.getFailures()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void sweep_keepsOnlyTheTopResults() {
        StepVerifier.create(service.sweep("CYCLE", bars, TestConfigs.crossover(9, 21), periodGrid(),
                        PerformanceMetricType.MAXIMUM_DRAWDOWN, 2, SweepControl.unlimited()))
                .assertNext(sweep -> {
                    assertThat(sweep.getTopResults()).hasSize(2);
                    assertThat(sweep.getCompleted()).isEqualTo(3);
                })
                .verifyComplete();
    }

    @Test
    void sweep_withAnUnknownParameter_failsBeforeRunning() {
        Map<String, List<Object>> grid = Map.of("lookback", List.of(3, 4));

        assertThatThrownBy(() -> service.sweep("CYCLE", bars, TestConfigs.crossover(9, 21), grid,
                PerformanceMetricType.SHARPE_RATIO, 3, SweepControl.unlimited()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void sweep_withAnInvalidValue_failsBeforeRunning() {
        Map<String, List<Object>> grid = Map.of("riskPerTrade", List.of(0.01, 2.0));

        assertThatThrownBy(() -> service.sweep("CYCLE", bars, TestConfigs.crossover(9, 21), grid,
                PerformanceMetricType.SHARPE_RATIO, 3, SweepControl.unlimited()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("risk-per-trade");
    }

    @Test
    void sweep_cancelledBeforeStart_returnsNoResults() {
        SweepControl control = SweepControl.unlimited();
        control.cancel();

        StepVerifier.create(service.sweep("CYCLE", bars, TestConfigs.crossover(9, 21), periodGrid(),
                        PerformanceMetricType.TOTAL_RETURN, 10, control))
                .assertNext(sweep -> {
                    assertThat(sweep.getTopResults()).isEmpty();
                    assertThat(sweep.getCompleted()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void sweep_recordsCombinationsWithTooFewBarsAsFailures() {
        Map<String, List<Object>> grid = new LinkedHashMap<>();
        grid.put("fastPeriod", List.of(5));
        grid.put("slowPeriod", List.of(20, 200));

        StepVerifier.create(service.sweep("CYCLE", bars, TestConfigs.crossover(9, 21), grid,
                        PerformanceMetricType.TOTAL_RETURN, 10, SweepControl.unlimited()))
                .assertNext(sweep -> {
                    assertThat(sweep.getTopResults()).hasSize(1);
                    assertThat(sweep.getTopResults().get(0).getParameters()).containsEntry("slowPeriod", 20);
                    assertThat(sweep.getFailures()).hasSize(1);
                    CombinationFailure failure = sweep.getFailures().get(0);
                    assertThat(failure.getParameters()).containsEntry("slowPeriod", 200);
                    assertThat(failure.getReason()).contains("insufficient bars");
                    assertThat(sweep.getCombinations()).isEqualTo(2);
                })
                .verifyComplete();
    }
}
