package ch.xavier.crossover.strategy;

import ch.xavier.crossover.config.BacktestConfig;
import ch.xavier.crossover.strategy.concrete.EmaCrossoverSignalGenerator;
import ch.xavier.crossover.strategy.concrete.WeightedIndicatorSignalGenerator;
import org.springframework.stereotype.Component;

@Component
public class SignalGeneratorFactory {

    public SignalGenerator create(BacktestConfig config) {
        return switch (config.getStrategy().getType()) {
            case EMA_CROSSOVER -> new EmaCrossoverSignalGenerator(config);
            case WEIGHTED_INDICATORS -> new WeightedIndicatorSignalGenerator(config);
        };
    }
}
