package ch.xavier.crossover.strategy.concrete;

import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.config.IndicatorSettings;
import ch.xavier.crossover.config.IndicatorType;
import ch.xavier.crossover.config.SignalThresholds;
import ch.xavier.crossover.indicator.Indicator;
import ch.xavier.crossover.indicator.IndicatorSnapshot;
import ch.xavier.crossover.indicator.momentum.CommodityChannelIndex;
import ch.xavier.crossover.indicator.momentum.RelativeStrengthIndex;
import ch.xavier.crossover.indicator.momentum.StochasticOscillator;
import ch.xavier.crossover.indicator.momentum.WilliamsPercentRange;
import ch.xavier.crossover.indicator.trend.AverageDirectionalIndex;
import ch.xavier.crossover.indicator.trend.ExponentialMovingAverage;
import ch.xavier.crossover.indicator.trend.Macd;
import ch.xavier.crossover.indicator.trend.SimpleMovingAverage;
import ch.xavier.crossover.indicator.volatility.BollingerBands;
import ch.xavier.crossover.strategy.BaseSignalGenerator;
import ch.xavier.crossover.strategy.Signal;
import ch.xavier.crossover.strategy.SignalInput;
import ch.xavier.crossover.strategy.SignalTier;
import ch.xavier.crossover.strategy.SignalType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Every enabled indicator adds its weight to the total, also while its value is still undefined,
 * and votes buy or sell when its rule fires. The strongest side above a threshold wins.
 * ADX only confirms trend strength and ATR is only used for stops: neither votes.
 */
public class WeightedIndicatorSignalGenerator extends BaseSignalGenerator {

    public WeightedIndicatorSignalGenerator(BacktestConfig config) {
        super(config);
    }

    @Override
    public String getName() {
        return "WeightedIndicators";
    }

    @Override
    public List<Indicator> requiredIndicators() {
        List<Indicator> indicators = new ArrayList<>();

        config.enabledIndicator(IndicatorType.SMA).ifPresent(s -> {
            indicators.add(new SimpleMovingAverage(s.intParam("fastPeriod")));
            indicators.add(new SimpleMovingAverage(s.intParam("slowPeriod")));
        });
        config.enabledIndicator(IndicatorType.EMA).ifPresent(s -> {
            indicators.add(new ExponentialMovingAverage(s.intParam("fastPeriod")));
            indicators.add(new ExponentialMovingAverage(s.intParam("slowPeriod")));
        });
        config.enabledIndicator(IndicatorType.RSI).ifPresent(s ->
                indicators.add(new RelativeStrengthIndex(s.intParam("period"))));
        config.enabledIndicator(IndicatorType.MACD).ifPresent(s ->
                indicators.add(new Macd(s.intParam("fastPeriod"), s.intParam("slowPeriod"), s.intParam("signalPeriod"))));
        config.enabledIndicator(IndicatorType.BOLLINGER).ifPresent(s ->
                indicators.add(new BollingerBands(s.intParam("period"), s.param("stdDev"))));
        config.enabledIndicator(IndicatorType.STOCHASTIC).ifPresent(s ->
                indicators.add(new StochasticOscillator(s.intParam("kPeriod"), s.intParam("dPeriod"))));
        config.enabledIndicator(IndicatorType.WILLIAMS_R).ifPresent(s ->
                indicators.add(new WilliamsPercentRange(s.intParam("period"))));
        config.enabledIndicator(IndicatorType.ADX).ifPresent(s ->
                indicators.add(new AverageDirectionalIndex(s.intParam("period"))));
        config.enabledIndicator(IndicatorType.CCI).ifPresent(s ->
                indicators.add(new CommodityChannelIndex(s.intParam("period"))));

        return indicators;
    }

    @Override
    protected Signal evaluate(SignalInput input) {
        Votes votes = new Votes();
        IndicatorSnapshot snapshot = input.getCurrent();
        double price = input.getBar().getClose();

        config.enabledIndicator(IndicatorType.SMA).ifPresent(s -> voteOnMovingAverages(votes, s, "SMA",
                snapshot.get(SimpleMovingAverage.nameFor(s.intParam("fastPeriod"))),
                snapshot.get(SimpleMovingAverage.nameFor(s.intParam("slowPeriod")))));

        config.enabledIndicator(IndicatorType.EMA).ifPresent(s -> voteOnMovingAverages(votes, s, "EMA",
                snapshot.get(ExponentialMovingAverage.nameFor(s.intParam("fastPeriod"))),
                snapshot.get(ExponentialMovingAverage.nameFor(s.intParam("slowPeriod")))));

        config.enabledIndicator(IndicatorType.RSI).ifPresent(s ->
                voteOnOscillator(votes, s, "RSI", snapshot.get(RelativeStrengthIndex.NAME)));

        config.enabledIndicator(IndicatorType.MACD).ifPresent(s -> {
            votes.total += s.getWeight();
            OptionalDouble line = snapshot.get(Macd.NAME, Macd.LINE);
            OptionalDouble signal = snapshot.get(Macd.NAME, Macd.SIGNAL);
            if (line.isPresent() && signal.isPresent()) {
                votes.used.add("MACD");
                votes.vote(line.getAsDouble() > signal.getAsDouble(), s.getWeight(), "MACD_BULLISH", "MACD_BEARISH");
            }
        });

        config.enabledIndicator(IndicatorType.BOLLINGER).ifPresent(s -> {
            votes.total += s.getWeight();
            OptionalDouble upper = snapshot.get(BollingerBands.NAME, BollingerBands.UPPER);
            OptionalDouble lower = snapshot.get(BollingerBands.NAME, BollingerBands.LOWER);
            if (upper.isPresent() && lower.isPresent()) {
                votes.used.add("BB");
                if (price < lower.getAsDouble()) {
                    votes.buy(s.getWeight(), "BB_OVERSOLD");
                } else if (price > upper.getAsDouble()) {
                    votes.sell(s.getWeight(), "BB_OVERBOUGHT");
                }
            }
        });

        config.enabledIndicator(IndicatorType.STOCHASTIC).ifPresent(s -> {
            votes.total += s.getWeight();
            OptionalDouble k = snapshot.get(StochasticOscillator.NAME, StochasticOscillator.K);
            OptionalDouble d = snapshot.get(StochasticOscillator.NAME, StochasticOscillator.D);
            if (k.isPresent() && d.isPresent()) {
                votes.used.add("STOCH");
                double oversold = s.param("oversold");
                double overbought = s.param("overbought");
                if (k.getAsDouble() < oversold && d.getAsDouble() < oversold) {
                    votes.buy(s.getWeight(), "STOCH_OVERSOLD");
                } else if (k.getAsDouble() > overbought && d.getAsDouble() > overbought) {
                    votes.sell(s.getWeight(), "STOCH_OVERBOUGHT");
                }
            }
        });

        config.enabledIndicator(IndicatorType.WILLIAMS_R).ifPresent(s ->
                voteOnOscillator(votes, s, "WILLIAMS_R", snapshot.get(WilliamsPercentRange.NAME)));

        config.enabledIndicator(IndicatorType.ADX).ifPresent(s -> {
            votes.total += s.getWeight();
            OptionalDouble adx = snapshot.get(AverageDirectionalIndex.NAME, AverageDirectionalIndex.ADX);
            if (adx.isPresent() && adx.getAsDouble() > s.param("strongTrendThreshold")) {
                votes.used.add("ADX");
            }
        });

        config.enabledIndicator(IndicatorType.CCI).ifPresent(s ->
                voteOnOscillator(votes, s, "CCI", snapshot.get(CommodityChannelIndex.NAME)));

        return classify(input, votes);
    }

    private Signal classify(SignalInput input, Votes votes) {
        double buyStrength = votes.total > 0 ? votes.buyWeight / votes.total : 0;
        double sellStrength = votes.total > 0 ? votes.sellWeight / votes.total : 0;
        SignalThresholds thresholds = config.getSignalThresholds();

        SignalType type;
        SignalTier tier;
        double confidence;
        String reasoning;

        if (buyStrength >= thresholds.getStrongBuy()) {
            type = SignalType.BUY;
            tier = SignalTier.STRONG;
            confidence = buyStrength;
            reasoning = "Strong buy signal from " + votes.buyReasons.size() + " indicators";
        } else if (sellStrength >= thresholds.getStrongSell()) {
            type = SignalType.SELL;
            tier = SignalTier.STRONG;
            confidence = sellStrength;
            reasoning = "Strong sell signal from " + votes.sellReasons.size() + " indicators";
        } else if (buyStrength >= thresholds.getWeakBuy()) {
            type = SignalType.BUY;
            tier = SignalTier.WEAK;
            confidence = buyStrength;
            reasoning = "Weak buy signal from " + votes.buyReasons.size() + " indicators";
        } else if (sellStrength >= thresholds.getWeakSell()) {
            type = SignalType.SELL;
            tier = SignalTier.WEAK;
            confidence = sellStrength;
            reasoning = "Weak sell signal from " + votes.sellReasons.size() + " indicators";
        } else {
            type = SignalType.HOLD;
            tier = SignalTier.WEAK;
            confidence = Math.max(buyStrength, sellStrength);
            reasoning = String.format(Locale.ROOT, "No clear signal (buy: %.2f, sell: %.2f)", buyStrength, sellStrength);
        }

        List<String> details = type == SignalType.BUY ? votes.buyReasons
                : type == SignalType.SELL ? votes.sellReasons : List.of();
        if (!details.isEmpty()) {
            reasoning += " " + details;
        }

        return Signal.builder()
                .type(type)
                .tier(tier)
                .confidence(confidence)
                .indicatorsUsed(votes.used)
                .reasoning(reasoning)
                .barTime(input.getBar().getTimestamp())
                .build();
    }

    private void voteOnMovingAverages(Votes votes, IndicatorSettings settings, String label,
                                      OptionalDouble fast, OptionalDouble slow) {
        votes.total += settings.getWeight();
        if (fast.isPresent() && slow.isPresent()) {
            votes.used.add(label);
            votes.vote(fast.getAsDouble() > slow.getAsDouble(), settings.getWeight(),
                    label + "_UPTREND", label + "_DOWNTREND");
        }
    }

    private void voteOnOscillator(Votes votes, IndicatorSettings settings, String label, OptionalDouble value) {
        votes.total += settings.getWeight();
        if (value.isPresent()) {
            votes.used.add(label);
            if (value.getAsDouble() < settings.param("oversold")) {
                votes.buy(settings.getWeight(), label + "_OVERSOLD");
            } else if (value.getAsDouble() > settings.param("overbought")) {
                votes.sell(settings.getWeight(), label + "_OVERBOUGHT");
            }
        }
    }

    private static final class Votes {
        private double total;
        private double buyWeight;
        private double sellWeight;
        private final List<String> used = new ArrayList<>();
        private final List<String> buyReasons = new ArrayList<>();
        private final List<String> sellReasons = new ArrayList<>();

        void buy(double weight, String reason) {
            buyWeight += weight;
            buyReasons.add(reason);
        }

        void sell(double weight, String reason) {
            sellWeight += weight;
            sellReasons.add(reason);
        }

        void vote(boolean bullish, double weight, String buyReason, String sellReason) {
            if (bullish) {
                buy(weight, buyReason);
            } else {
                sell(weight, sellReason);
            }
        }
    }
}
