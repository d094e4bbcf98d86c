package ch.xavier.crossover.backtesting.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.Value;

import java.time.YearMonth;

@Value
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE)
public class MonthlyReturn {
    YearMonth month;
    double endEquity;
    double returnPct;
}
