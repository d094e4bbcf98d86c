package ch.xavier.crossover;

import ch.xavier.crossover.backtesting.BatchBacktestService;
import ch.xavier.crossover.backtesting.model.BacktestResult;
import ch.xavier.crossover.backtesting.model.BatchBacktestResult;
import ch.xavier.crossover.bar.BarDataProvider;
import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.config.BacktestConfigValidator;
import ch.xavier.crossover.config.BacktestProperties;
import ch.xavier.crossover.report.BacktestReportSerializer;
import ch.xavier.crossover.visualization.EquityCurveChartExporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Runs the configured symbols through a batch backtest at startup, then writes a JSON report and
 * charts for each symbol. Does nothing when no {@link BarDataProvider} is registered.
 */
@Component
@Slf4j
public class BacktestRunner implements CommandLineRunner {
    private final BacktestProperties properties;
    private final BacktestConfigValidator configValidator;
    private final BatchBacktestService batchBacktestService;
    private final BacktestReportSerializer reportSerializer;
    private final EquityCurveChartExporter chartExporter;
    private final ObjectProvider<BarDataProvider> barDataProvider;

    public BacktestRunner(BacktestProperties properties,
                          BacktestConfigValidator configValidator,
                          BatchBacktestService batchBacktestService,
                          BacktestReportSerializer reportSerializer,
                          EquityCurveChartExporter chartExporter,
                          ObjectProvider<BarDataProvider> barDataProvider) {
        this.properties = properties;
        this.configValidator = configValidator;
        this.batchBacktestService = batchBacktestService;
        this.reportSerializer = reportSerializer;
        this.chartExporter = chartExporter;
        this.barDataProvider = barDataProvider;
    }

    @Override
    public void run(String... args) {
        BarDataProvider provider = barDataProvider.getIfAvailable();
        if (provider == null) {
            log.info("No bar data provider registered, skipping startup backtest");
            return;
        }
        if (properties.getSymbols().isEmpty()) {
            log.info("No symbols configured under backtest.symbols, skipping startup backtest");
            return;
        }

        BacktestConfig config = configValidator.fromProperties(properties);
        Instant to = properties.getTo() != null ? properties.getTo() : Instant.now();
        Instant from = properties.getFrom() != null ? properties.getFrom() : to.minus(365, ChronoUnit.DAYS);

        log.info("Starting backtest of {} on {} from {} to {}", properties.getSymbols(), properties.getTimeframe(),
                from, to);

        BatchBacktestResult batch = batchBacktestService
                .backtestSymbols(provider, properties.getSymbols(), properties.getTimeframe(), from, to, config)
                .block();
        if (batch == null) {
            return;
        }

        Path reportDirectory = Path.of(properties.getReportDirectory());
        for (BacktestResult result : batch.getResults()) {
            log.info("{}: {} trades, return {}%, win rate {}%, max drawdown {}%, sharpe {}",
                    result.getSymbol(),
                    result.getTotalTrades(),
                    String.format("%.2f", result.getTotalReturnPct()),
                    String.format("%.2f", result.getWinRate()),
                    String.format("%.2f", result.getMaxDrawdownPct()),
                    String.format("%.2f", result.getSharpeRatio()));
            reportSerializer.write(result, reportDirectory);
            chartExporter.export(result, reportDirectory);
        }
        batch.getFailures().forEach(failure -> log.warn("{} failed: {}", failure.getSymbol(), failure.getReason()));
    }
}
