package ch.xavier.crossover.config;

import lombok.Getter;

import java.util.List;

@Getter
public enum IndicatorType {
    SMA(true, List.of("fastPeriod", "slowPeriod")),
    EMA(true, List.of("fastPeriod", "slowPeriod")),
    RSI(true, List.of("period", "oversold", "overbought")),
    MACD(true, List.of("fastPeriod", "slowPeriod", "signalPeriod")),
    BOLLINGER(true, List.of("period", "stdDev")),
    STOCHASTIC(true, List.of("kPeriod", "dPeriod", "oversold", "overbought")),
    WILLIAMS_R(true, List.of("period", "oversold", "overbought")),
    ADX(true, List.of("period", "strongTrendThreshold")),
    CCI(true, List.of("period", "oversold", "overbought")),
    ATR(false, List.of("period"));

    private final boolean voting;
    private final List<String> requiredParameters;

    IndicatorType(boolean voting, List<String> requiredParameters) {
        this.voting = voting;
        this.requiredParameters = requiredParameters;
    }
}
