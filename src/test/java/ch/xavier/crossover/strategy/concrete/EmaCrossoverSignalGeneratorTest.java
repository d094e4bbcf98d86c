package ch.xavier.crossover.strategy.concrete;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.bar.BarFixtures;
import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.config.StrategySettings;
import ch.xavier.crossover.config.TestConfigs;
import ch.xavier.crossover.config.TradeDirection;
import ch.xavier.crossover.indicator.IndicatorSnapshot;
import ch.xavier.crossover.indicator.SnapshotFixtures;
import ch.xavier.crossover.strategy.PositionSide;
import ch.xavier.crossover.strategy.Signal;
import ch.xavier.crossover.strategy.SignalInput;
import ch.xavier.crossover.strategy.SignalMemory;
import ch.xavier.crossover.strategy.SignalTier;
import ch.xavier.crossover.strategy.SignalType;
import org.junit.jupiter.api.Test;

import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EmaCrossoverSignalGeneratorTest {
    private static final Bar BAR = BarFixtures.bar(BarFixtures.START, 100, 100);

    private static IndicatorSnapshot emas(double fast, double slow) {
        return SnapshotFixtures.snapshot().value("ema_9", fast).value("ema_21", slow).build();
    }

    private static EmaCrossoverSignalGenerator generator(UnaryOperator<StrategySettings.StrategySettingsBuilder> customizer) {
        BacktestConfig base = TestConfigs.crossover(9, 21);
        return new EmaCrossoverSignalGenerator(base.toBuilder()
                .strategy(customizer.apply(base.getStrategy().toBuilder()).build())
                .build());
    }

    private static Signal evaluate(EmaCrossoverSignalGenerator generator, Bar bar, IndicatorSnapshot current,
                                   IndicatorSnapshot previous, PositionSide side) {
        return generator.generateSignal(SignalInput.builder()
                .symbol("EURUSD")
                .bar(bar)
                .current(current)
                .previous(previous)
                .positionSide(side)
                .build(), new SignalMemory());
    }

    @Test
    void bullishCross_whileFlat_isAStrongBuy() {
        Signal signal = evaluate(generator(s -> s), BAR, emas(101, 100), emas(99, 100), PositionSide.FLAT);

        assertThat(signal.getType()).isEqualTo(SignalType.BUY);
        assertThat(signal.getTier()).isEqualTo(SignalTier.STRONG);
        assertThat(signal.getConfidence()).isEqualTo(1.0);
        assertThat(signal.getIndicatorsUsed()).containsExactly("ema_9", "ema_21");
        assertThat(signal.getReasoning()).startsWith("Bullish EMA crossover");
        assertThat(signal.getBarTime()).isEqualTo(BarFixtures.START);
    }

    @Test
    void narrowCross_isAWeakSignalScaledBySeparation() {
        Signal signal = evaluate(generator(s -> s), BAR, emas(100.1, 100), emas(99.9, 100), PositionSide.FLAT);

        assertThat(signal.getType()).isEqualTo(SignalType.BUY);
        assertThat(signal.getTier()).isEqualTo(SignalTier.WEAK);
        assertThat(signal.getConfidence()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void bearishCross_whileFlat_isASell() {
        Signal signal = evaluate(generator(s -> s), BAR, emas(99, 100), emas(100, 100), PositionSide.FLAT);

        assertThat(signal.getType()).isEqualTo(SignalType.SELL);
        assertThat(signal.getReasoning()).startsWith("Bearish EMA crossover");
    }

    @Test
    void noCross_isAHold() {
        Signal signal = evaluate(generator(s -> s), BAR, emas(101, 100), emas(101, 100), PositionSide.FLAT);

        assertThat(signal.getType()).isEqualTo(SignalType.HOLD);
    }

    @Test
    void missingValues_isAHold() {
        Signal signal = evaluate(generator(s -> s), BAR, IndicatorSnapshot.empty(), IndicatorSnapshot.empty(),
                PositionSide.FLAT);

        assertThat(signal.getType()).isEqualTo(SignalType.HOLD);
        assertThat(signal.getReasoning()).isEqualTo("Indicators warming up");
    }

    @Test
    void missingPreviousValues_countAsANeutralPriorState() {
        Signal signal = evaluate(generator(s -> s), BAR, emas(101, 100), IndicatorSnapshot.empty(), PositionSide.FLAT);

        assertThat(signal.getType()).isEqualTo(SignalType.BUY);
    }

    @Test
    void bearishCross_whileLong_isAnExit() {
        Signal signal = evaluate(generator(s -> s), BAR, emas(99, 100), emas(101, 100), PositionSide.LONG);

        assertThat(signal.getType()).isEqualTo(SignalType.EXIT_LONG);
        assertThat(signal.getConfidence()).isEqualTo(1.0);
        assertThat(signal.getReasoning()).isEqualTo("Bearish EMA crossover");
    }

    @Test
    void bullishCross_whileShort_isAnExit() {
        Signal signal = evaluate(generator(s -> s), BAR, emas(101, 100), emas(99, 100), PositionSide.SHORT);

        assertThat(signal.getType()).isEqualTo(SignalType.EXIT_SHORT);
    }

    @Test
    void crossExits_canBeDisabled() {
        Signal signal = evaluate(generator(s -> s.exitOnCross(false)), BAR, emas(99, 100), emas(101, 100),
                PositionSide.LONG);

        assertThat(signal.getType()).isEqualTo(SignalType.HOLD);
    }

    @Test
    void lowBelowTheDeviationBand_exitsALong() {
        Bar dip = BarFixtures.bar(BarFixtures.START, 100.5, 100.6, 99.8, 100.4);

        Signal signal = evaluate(generator(s -> s.exitOnPriceDeviation(true).priceDeviationPercent(0.1)),
                dip, emas(101, 100), emas(101, 100), PositionSide.LONG);

        assertThat(signal.getType()).isEqualTo(SignalType.EXIT_LONG);
        assertThat(signal.getReasoning()).contains("below");
    }

    @Test
    void highAboveTheDeviationBand_exitsAShort() {
        Bar spike = BarFixtures.bar(BarFixtures.START, 99.5, 100.2, 99.4, 99.6);

        Signal signal = evaluate(generator(s -> s.exitOnPriceDeviation(true).priceDeviationPercent(0.1)),
                spike, emas(99, 100), emas(99, 100), PositionSide.SHORT);

        assertThat(signal.getType()).isEqualTo(SignalType.EXIT_SHORT);
        assertThat(signal.getReasoning()).contains("above");
    }

    @Test
    void directionFilter_dropsEntriesButNotExits() {
        EmaCrossoverSignalGenerator longOnly = generator(s -> s.direction(TradeDirection.LONG));

        Signal entry = evaluate(longOnly, BAR, emas(99, 100), emas(100, 100), PositionSide.FLAT);
        Signal exit = evaluate(longOnly, BAR, emas(99, 100), emas(101, 100), PositionSide.LONG);

        assertThat(entry.getType()).isEqualTo(SignalType.HOLD);
        assertThat(entry.getReasoning()).contains("filtered by direction");
        assertThat(exit.getType()).isEqualTo(SignalType.EXIT_LONG);
    }

    @Test
    void disabledTrading_holds() {
        Signal signal = evaluate(generator(s -> s.tradingEnabled(false)), BAR, emas(101, 100), emas(99, 100),
                PositionSide.FLAT);

        assertThat(signal.getType()).isEqualTo(SignalType.HOLD);
        assertThat(signal.getReasoning()).isEqualTo("Trading disabled");
    }

    @Test
    void secondEntryOnTheSameBar_isSuppressed() {
        EmaCrossoverSignalGenerator generator = generator(s -> s);
        SignalMemory memory = new SignalMemory();
        SignalInput input = SignalInput.builder()
                .symbol("EURUSD")
                .bar(BAR)
                .current(emas(101, 100))
                .previous(emas(99, 100))
                .build();

        Signal first = generator.generateSignal(input, memory);
        Signal second = generator.generateSignal(input, memory);

        assertThat(first.getType()).isEqualTo(SignalType.BUY);
        assertThat(second.getType()).isEqualTo(SignalType.HOLD);
        assertThat(memory.getLastSignalBarTime()).isEqualTo(BarFixtures.START);
    }

    @Test
    void duplicates_areAllowedWhenSuppressionIsOff() {
        EmaCrossoverSignalGenerator generator = generator(s -> s.preventDuplicateSignals(false));
        SignalMemory memory = new SignalMemory();
        SignalInput input = SignalInput.builder()
                .symbol("EURUSD")
                .bar(BAR)
                .current(emas(101, 100))
                .previous(emas(99, 100))
                .build();

        generator.generateSignal(input, memory);

        assertThat(generator.generateSignal(input, memory).getType()).isEqualTo(SignalType.BUY);
    }

    @Test
    void calculateConfidence_isCappedAndSafeForAZeroSlowEma() {
        assertThat(EmaCrossoverSignalGenerator.calculateConfidence(110, 100)).isEqualTo(1.0);
        assertThat(EmaCrossoverSignalGenerator.calculateConfidence(100.25, 100)).isCloseTo(0.5, within(1e-9));
        assertThat(EmaCrossoverSignalGenerator.calculateConfidence(1, 0)).isZero();
    }

    @Test
    void requiredIndicators_areBothEmas() {
        EmaCrossoverSignalGenerator generator = generator(s -> s);

        assertThat(generator.requiredIndicators()).extracting("name").containsExactly("ema_9", "ema_21");
        assertThat(generator.getName()).isEqualTo("EmaCrossover(9/21)");
    }
}
