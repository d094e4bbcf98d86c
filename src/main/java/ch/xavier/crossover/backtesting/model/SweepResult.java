package ch.xavier.crossover.backtesting.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a parameter sweep. {@link #topResults} is sorted best first; combinations whose run
 * raised a data error are listed in {@link #failures} and take no part in the ranking.
 */
@Value
@Builder
public class SweepResult {
    List<ParameterPerformance> topResults;
    List<CombinationFailure> failures;
    int combinations;
    int skipped;
    int completed;
}
