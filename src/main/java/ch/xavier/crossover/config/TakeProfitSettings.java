package ch.xavier.crossover.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TakeProfitSettings {
    TakeProfitMethod method;
    double riskRewardRatio;
    double fixedDistance;
    double percentage;
}
