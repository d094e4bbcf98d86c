package ch.xavier.crossover.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SignalThresholds {
    @Builder.Default
    double strongBuy = 0.7;
    @Builder.Default
    double weakBuy = 0.5;
    @Builder.Default
    double strongSell = 0.7;
    @Builder.Default
    double weakSell = 0.5;
}
