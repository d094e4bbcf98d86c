package ch.xavier.crossover.backtesting.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Account state after a processed bar. Drawdown is in percent of the running equity peak.
 */
@Value
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE)
public class EquityPoint {
    Instant timestamp;
    double equity;
    double balance;
    double drawdown;
}
