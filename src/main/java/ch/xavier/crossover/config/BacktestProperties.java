package ch.xavier.crossover.config;

import ch.xavier.crossover.indicator.IndicatorComputationMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw {@code backtest.*} properties. Risk-critical values are boxed and have no default so that
 * {@link BacktestConfigValidator} can report them as missing.
 */
@Data
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {
    private Double initialBalance;
    private Double riskPerTrade;
    private Double maxPositionSize = 1.0;
    private StopLoss stopLoss = new StopLoss();
    private TakeProfit takeProfit = new TakeProfit();
    private ExecutionCosts executionCosts = new ExecutionCosts();
    private Thresholds signalThresholds = new Thresholds();
    private Map<IndicatorType, Indicator> indicators = new LinkedHashMap<>();
    private Strategy strategy = new Strategy();
    private int equitySampleStride = 1;
    private IndicatorComputationMode indicatorComputation = IndicatorComputationMode.PRECOMPUTED;

    // Run selection, only read by the command line runner
    private List<String> symbols = new ArrayList<>();
    private String timeframe = "H1";
    private Instant from;
    private Instant to;
    private String reportDirectory = "./reports";

    @Data
    public static class StopLoss {
        private StopLossMethod method;
        private Double fixedDistance;
        private Double percentage;
        private Double atrMultiplier;
    }

    @Data
    public static class TakeProfit {
        private TakeProfitMethod method;
        private Double riskRewardRatio;
        private Double fixedDistance;
        private Double percentage;
    }

    @Data
    public static class ExecutionCosts {
        private double commissionPerLot = 0.0;
        private double slippage = 0.0;
        private double spread = 0.0;
        private boolean useSymbolSpread = false;
    }

    @Data
    public static class Thresholds {
        private double strongBuy = 0.7;
        private double weakBuy = 0.5;
        private double strongSell = 0.7;
        private double weakSell = 0.5;
    }

    @Data
    public static class Indicator {
        private boolean enabled = true;
        private double weight = 1.0;
        private Map<String, Double> parameters = new LinkedHashMap<>();
    }

    @Data
    public static class Strategy {
        private StrategyType type = StrategyType.EMA_CROSSOVER;
        private int fastPeriod = 9;
        private int slowPeriod = 21;
        private TradeDirection direction = TradeDirection.BOTH;
        private boolean exitOnCross = true;
        private boolean exitOnPriceDeviation = false;
        private double priceDeviationPercent = 0.1;
        private boolean preventDuplicateSignals = true;
        private boolean tradingEnabled = true;
    }
}
