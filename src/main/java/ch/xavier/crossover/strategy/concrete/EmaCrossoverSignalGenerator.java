package ch.xavier.crossover.strategy.concrete;

import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorSnapshot;
import ch.xavier.crossover.indicator.trend.ExponentialMovingAverage;
import ch.xavier.crossover.strategy.BaseSignalGenerator;
import ch.xavier.crossover.strategy.Signal;
import ch.xavier.crossover.strategy.SignalInput;
import ch.xavier.crossover.strategy.SignalTier;
import ch.xavier.crossover.strategy.SignalType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Entries on fast/slow EMA crossovers, exits on the opposite crossover or when the bar trades too
 * far through the slow EMA.
 */
@Slf4j
public class EmaCrossoverSignalGenerator extends BaseSignalGenerator {
    // 0.5% EMA separation gives full confidence
    private static final double FULL_CONFIDENCE_SEPARATION_PCT = 0.5;

    private final int fastPeriod;
    private final int slowPeriod;
    private final String fastName;
    private final String slowName;

    public EmaCrossoverSignalGenerator(BacktestConfig config) {
        super(config);
        this.fastPeriod = settings.getFastPeriod();
        this.slowPeriod = settings.getSlowPeriod();
        this.fastName = ExponentialMovingAverage.nameFor(fastPeriod);
        this.slowName = ExponentialMovingAverage.nameFor(slowPeriod);
    }

    @Override
    public String getName() {
        return "EmaCrossover(" + fastPeriod + "/" + slowPeriod + ")";
    }

    @Override
    public List<Indicator> requiredIndicators() {
        return List.of(new ExponentialMovingAverage(fastPeriod), new ExponentialMovingAverage(slowPeriod));
    }

    @Override
    protected Signal evaluate(SignalInput input) {
        IndicatorSnapshot current = input.getCurrent();
        OptionalDouble fastValue = current.get(fastName);
        OptionalDouble slowValue = current.get(slowName);
        if (fastValue.isEmpty() || slowValue.isEmpty()) {
            return Signal.hold(input.getBar().getTimestamp(), 0, "Indicators warming up");
        }
        double fast = fastValue.getAsDouble();
        double slow = slowValue.getAsDouble();

        // Right after the warm-up there is no previous pair: the prior state counts as neutral
        IndicatorSnapshot previous = input.getPrevious();
        boolean neutralPrior = previous.get(fastName).isEmpty() || previous.get(slowName).isEmpty();
        double prevFast = neutralPrior ? 0 : previous.get(fastName).getAsDouble();
        double prevSlow = neutralPrior ? 0 : previous.get(slowName).getAsDouble();

        boolean bullishCross = prevFast <= prevSlow && fast > slow;
        boolean bearishCross = prevFast >= prevSlow && fast < slow;

        return switch (input.getPositionSide()) {
            case LONG -> checkExitLong(input, slow, bearishCross);
            case SHORT -> checkExitShort(input, slow, bullishCross);
            case FLAT -> checkEntry(input, fast, slow, bullishCross, bearishCross);
        };
    }

    private Signal checkEntry(SignalInput input, double fast, double slow, boolean bullishCross, boolean bearishCross) {
        if (!bullishCross && !bearishCross) {
            return Signal.hold(input.getBar().getTimestamp(), 0, "No signal");
        }

        double confidence = calculateConfidence(fast, slow);
        boolean buy = bullishCross;
        double strongThreshold = buy ? config.getSignalThresholds().getStrongBuy()
                : config.getSignalThresholds().getStrongSell();

        String reasoning = String.format(Locale.ROOT, "%s EMA crossover: Fast(%d)=%.5f %s Slow(%d)=%.5f",
                buy ? "Bullish" : "Bearish", fastPeriod, fast, buy ? ">" : "<", slowPeriod, slow);

        return Signal.builder()
                .type(buy ? SignalType.BUY : SignalType.SELL)
                .tier(confidence >= strongThreshold ? SignalTier.STRONG : SignalTier.WEAK)
                .confidence(confidence)
                .indicatorUsed(fastName)
                .indicatorUsed(slowName)
                .reasoning(reasoning)
                .barTime(input.getBar().getTimestamp())
                .build();
    }

    private Signal checkExitLong(SignalInput input, double slow, boolean bearishCross) {
        List<String> reasons = new ArrayList<>();

        if (settings.isExitOnCross() && bearishCross) {
            reasons.add("Bearish EMA crossover");
        }
        if (settings.isExitOnPriceDeviation()) {
            double threshold = slow * (1 - settings.getPriceDeviationPercent() / 100);
            if (input.getBar().getLow() < threshold) {
                reasons.add(String.format(Locale.ROOT, "Price %.5f below %.2f%% of slow EMA (%.5f)",
                        input.getBar().getLow(), settings.getPriceDeviationPercent(), threshold));
            }
        }
        return exitOrHold(input, SignalType.EXIT_LONG, reasons);
    }

    private Signal checkExitShort(SignalInput input, double slow, boolean bullishCross) {
        List<String> reasons = new ArrayList<>();

        if (settings.isExitOnCross() && bullishCross) {
            reasons.add("Bullish EMA crossover");
        }
        if (settings.isExitOnPriceDeviation()) {
            double threshold = slow * (1 + settings.getPriceDeviationPercent() / 100);
            if (input.getBar().getHigh() > threshold) {
                reasons.add(String.format(Locale.ROOT, "Price %.5f above %.2f%% of slow EMA (%.5f)",
                        input.getBar().getHigh(), settings.getPriceDeviationPercent(), threshold));
            }
        }
        return exitOrHold(input, SignalType.EXIT_SHORT, reasons);
    }

    private Signal exitOrHold(SignalInput input, SignalType exitType, List<String> reasons) {
        if (reasons.isEmpty()) {
            return Signal.hold(input.getBar().getTimestamp(), 0, "No signal");
        }
        log.debug("[{}] {} signal: {}", input.getSymbol(), exitType, reasons);
        return Signal.builder()
                .type(exitType)
                .tier(SignalTier.STRONG)
                .confidence(1.0)
                .indicatorUsed(fastName)
                .indicatorUsed(slowName)
                .reasoning(String.join(" | ", reasons))
                .barTime(input.getBar().getTimestamp())
                .build();
    }

    static double calculateConfidence(double fast, double slow) {
        if (slow == 0) {
            return 0.0;
        }
        double separationPercent = Math.abs(fast - slow) / slow * 100;
        return Math.min(separationPercent / FULL_CONFIDENCE_SEPARATION_PCT, 1.0);
    }
}
