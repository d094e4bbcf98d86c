package ch.xavier.crossover.indicator;

import ch.xavier.crossover.bar.Bar;
import ch.xavier.crossover.bar.BarFixtures;
import ch.xavier.crossover.indicator.momentum.CommodityChannelIndex;
import ch.xavier.crossover.indicator.momentum.RelativeStrengthIndex;
import ch.xavier.crossover.indicator.momentum.StochasticOscillator;
import ch.xavier.crossover.indicator.momentum.WilliamsPercentRange;
import ch.xavier.crossover.indicator.trend.AverageDirectionalIndex;
import ch.xavier.crossover.indicator.trend.ExponentialMovingAverage;
import ch.xavier.crossover.indicator.trend.Macd;
import ch.xavier.crossover.indicator.trend.SimpleMovingAverage;
import ch.xavier.crossover.indicator.volatility.AverageTrueRange;
import ch.xavier.crossover.indicator.volatility.BollingerBands;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IndicatorsTest {

    private static IndicatorSeries scalar(Indicator indicator, List<Bar> bars) {
        return ((IndicatorOutput.Scalar) indicator.calculate(bars)).getSeries();
    }

    private static IndicatorSeries component(Indicator indicator, List<Bar> bars, String name) {
        return ((IndicatorOutput.Composite) indicator.calculate(bars)).component(name);
    }

    @Test
    void sma_averagesTheLastPeriodCloses() {
        IndicatorSeries sma = scalar(new SimpleMovingAverage(3), BarFixtures.fromCloses(1, 2, 3, 4, 5));

        assertThat(sma.isAvailable(0)).isFalse();
        assertThat(sma.isAvailable(1)).isFalse();
        assertThat(sma.valueAt(2).getAsDouble()).isEqualTo(2.0);
        assertThat(sma.valueAt(4).getAsDouble()).isEqualTo(4.0);
    }

    @Test
    void ema_isSeededWithTheSmaOfTheFirstWindow() {
        IndicatorSeries ema = scalar(new ExponentialMovingAverage(3), BarFixtures.fromCloses(1, 2, 3, 4));

        assertThat(ema.isAvailable(1)).isFalse();
        assertThat(ema.valueAt(2).getAsDouble()).isEqualTo(2.0);
        // multiplier 2 / (3 + 1) = 0.5
        assertThat(ema.valueAt(3).getAsDouble()).isEqualTo(3.0);
    }

    @Test
    void ema_onConstantPrices_equalsThePrice() {
        IndicatorSeries ema = scalar(new ExponentialMovingAverage(9), BarFixtures.flat(50, 100.0));

        for (int i = 8; i < 50; i++) {
            assertThat(ema.valueAt(i).getAsDouble()).isEqualTo(100.0);
        }
    }

    @Test
    void ema_onRisingPrices_risesAndLagsThePrice() {
        List<Bar> bars = BarFixtures.linear(100, 150, 60);
        IndicatorSeries ema = scalar(new ExponentialMovingAverage(10), bars);

        for (int i = 10; i < 60; i++) {
            assertThat(ema.valueAt(i).getAsDouble()).isGreaterThan(ema.valueAt(i - 1).getAsDouble());
            assertThat(ema.valueAt(i).getAsDouble()).isLessThan(bars.get(i).getClose());
        }
    }

    @Test
    void rsi_needsOneMoreBarThanItsPeriod() {
        RelativeStrengthIndex rsi = new RelativeStrengthIndex(14);
        IndicatorSeries series = scalar(rsi, BarFixtures.linear(100, 120, 30));

        assertThat(rsi.getWarmupPeriod()).isEqualTo(15);
        assertThat(series.isAvailable(13)).isFalse();
        assertThat(series.isAvailable(14)).isTrue();
    }

    @Test
    void rsi_withoutLosses_is100_andWithoutMovement_is50() {
        assertThat(scalar(new RelativeStrengthIndex(5), BarFixtures.linear(100, 110, 20)).valueAt(19).getAsDouble())
                .isEqualTo(100.0);
        assertThat(scalar(new RelativeStrengthIndex(5), BarFixtures.flat(20, 100)).valueAt(19).getAsDouble())
                .isEqualTo(50.0);
    }

    @Test
    void rsi_withEqualGainsAndLosses_is50() {
        IndicatorSeries rsi = scalar(new RelativeStrengthIndex(4), BarFixtures.fromCloses(100, 101, 100, 101, 100));

        assertThat(rsi.valueAt(4).getAsDouble()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void macd_onFlatPrices_isZero_andWarmsUpOnSlowPlusSignal() {
        Macd macd = new Macd(12, 26, 9);
        List<Bar> bars = BarFixtures.flat(60, 100);

        assertThat(macd.getWarmupPeriod()).isEqualTo(34);
        assertThat(component(macd, bars, Macd.SIGNAL).isAvailable(32)).isFalse();
        assertThat(component(macd, bars, Macd.SIGNAL).valueAt(33).getAsDouble()).isEqualTo(0.0);
        assertThat(component(macd, bars, Macd.LINE).valueAt(25).getAsDouble()).isEqualTo(0.0);
        assertThat(component(macd, bars, Macd.HISTOGRAM).valueAt(59).getAsDouble()).isEqualTo(0.0);
    }

    @Test
    void macd_onRisingPrices_isPositive() {
        List<Bar> bars = BarFixtures.linear(100, 200, 80);

        assertThat(component(new Macd(12, 26, 9), bars, Macd.LINE).valueAt(79).getAsDouble()).isPositive();
    }

    @Test
    void oscillators_onAFlatRange_returnTheirNeutralValue() {
        List<Bar> bars = BarFixtures.flat(30, 100);

        assertThat(component(new StochasticOscillator(14, 3), bars, StochasticOscillator.K).valueAt(29).getAsDouble())
                .isEqualTo(50.0);
        assertThat(component(new StochasticOscillator(14, 3), bars, StochasticOscillator.D).valueAt(29).getAsDouble())
                .isEqualTo(50.0);
        assertThat(scalar(new WilliamsPercentRange(14), bars).valueAt(29).getAsDouble()).isEqualTo(-50.0);
        assertThat(scalar(new CommodityChannelIndex(20), bars).valueAt(29).getAsDouble()).isEqualTo(0.0);
    }

    @Test
    void stochastic_atTheTopOfTheRange_is100() {
        List<Bar> bars = BarFixtures.linear(100, 120, 20);
        StochasticOscillator stochastic = new StochasticOscillator(5, 3);

        assertThat(stochastic.getWarmupPeriod()).isEqualTo(7);
        assertThat(component(stochastic, bars, StochasticOscillator.K).valueAt(19).getAsDouble()).isEqualTo(100.0);
        assertThat(component(stochastic, bars, StochasticOscillator.D).isAvailable(5)).isFalse();
        assertThat(component(stochastic, bars, StochasticOscillator.D).isAvailable(6)).isTrue();
    }

    @Test
    void williamsR_atTheBottomOfTheRange_isMinus100() {
        IndicatorSeries williams = scalar(new WilliamsPercentRange(5), BarFixtures.linear(120, 100, 20));

        assertThat(williams.valueAt(19).getAsDouble()).isEqualTo(-100.0);
    }

    @Test
    void bollinger_bandsCollapseOnFlatPrices_andWidenWithVolatility() {
        BollingerBands bollinger = new BollingerBands(5, 2.0);
        List<Bar> flat = BarFixtures.flat(10, 100);
        List<Bar> choppy = BarFixtures.fromCloses(100, 102, 98, 103, 97, 104, 96, 105, 95, 106);

        assertThat(component(bollinger, flat, BollingerBands.UPPER).valueAt(9).getAsDouble()).isEqualTo(100.0);
        assertThat(component(bollinger, flat, BollingerBands.LOWER).valueAt(9).getAsDouble()).isEqualTo(100.0);
        assertThat(component(bollinger, choppy, BollingerBands.UPPER).valueAt(9).getAsDouble())
                .isGreaterThan(component(bollinger, choppy, BollingerBands.MIDDLE).valueAt(9).getAsDouble());
        assertThat(component(bollinger, choppy, BollingerBands.LOWER).valueAt(9).getAsDouble())
                .isLessThan(component(bollinger, choppy, BollingerBands.MIDDLE).valueAt(9).getAsDouble());
    }

    @Test
    void atr_averagesTheTrueRange() {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            Instant time = BarFixtures.START.plus(BarFixtures.HOUR.multipliedBy(i));
            bars.add(BarFixtures.bar(time, 100, 101, 99, 100));
        }

        IndicatorSeries atr = scalar(new AverageTrueRange(14), bars);

        assertThat(atr.isAvailable(12)).isFalse();
        assertThat(atr.valueAt(13).getAsDouble()).isCloseTo(2.0, within(1e-12));
        assertThat(atr.valueAt(19).getAsDouble()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void adx_inAnUptrend_favoursPlusDi() {
        AverageDirectionalIndex adx = new AverageDirectionalIndex(7);
        List<Bar> bars = BarFixtures.linear(100, 140, 40);

        assertThat(adx.getWarmupPeriod()).isEqualTo(14);
        assertThat(component(adx, bars, AverageDirectionalIndex.ADX).isAvailable(12)).isFalse();
        assertThat(component(adx, bars, AverageDirectionalIndex.ADX).isAvailable(13)).isTrue();
        assertThat(component(adx, bars, AverageDirectionalIndex.PLUS_DI).valueAt(39).getAsDouble())
                .isGreaterThan(component(adx, bars, AverageDirectionalIndex.MINUS_DI).valueAt(39).getAsDouble());
        assertThat(component(adx, bars, AverageDirectionalIndex.ADX).valueAt(39).getAsDouble()).isGreaterThan(25);
    }

    @Test
    void values_onAPrefix_matchTheFullComputation() {
        List<Bar> bars = BarFixtures.fromCloses(BarFixtures.twoCycles());
        List<Bar> prefix = bars.subList(0, 50);

        assertThat(scalar(new ExponentialMovingAverage(9), prefix).valueAt(49))
                .isEqualTo(scalar(new ExponentialMovingAverage(9), bars).valueAt(49));
        assertThat(scalar(new RelativeStrengthIndex(14), prefix).valueAt(49))
                .isEqualTo(scalar(new RelativeStrengthIndex(14), bars).valueAt(49));
        assertThat(component(new Macd(12, 26, 9), prefix, Macd.SIGNAL).valueAt(49))
                .isEqualTo(component(new Macd(12, 26, 9), bars, Macd.SIGNAL).valueAt(49));
    }
}
