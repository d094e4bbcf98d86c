package ch.xavier.crossover.backtesting.model;

import lombok.*;

import java.util.List;

/**
 * Results of a multi-symbol run. Symbols whose data could not be used are listed in
 * {@link #failures} instead of aborting the batch.
 */
@Builder
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BatchBacktestResult {
    private List<BacktestResult> results;
    private List<SymbolFailure> failures;
    private int totalTrades;
    private double totalPnl;
    private double combinedWinRate;
}
