package ch.xavier.crossover.config;

import lombok.Builder;
import lombok.Value;

/**
 * Only the parameter matching {@link #method} is read.
 */
@Value
@Builder(toBuilder = true)
public class StopLossSettings {
    StopLossMethod method;
    double fixedDistance;
    double percentage;
    double atrMultiplier;
}
