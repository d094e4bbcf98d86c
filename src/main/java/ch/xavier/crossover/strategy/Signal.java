package ch.xavier.crossover.strategy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class Signal {
    SignalType type;
    SignalTier tier;
    double confidence;
    @Singular("indicatorUsed")
    List<String> indicatorsUsed;
    String reasoning;
    Instant barTime;

    public static Signal hold(Instant barTime, double confidence, String reasoning) {
        return Signal.builder()
                .type(SignalType.HOLD)
                .tier(SignalTier.WEAK)
                .confidence(confidence)
                .reasoning(reasoning)
                .barTime(barTime)
                .build();
    }
}
