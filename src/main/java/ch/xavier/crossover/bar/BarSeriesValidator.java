package ch.xavier.crossover.bar;

import ch.xavier.crossover.exception.DataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@Slf4j
public class BarSeriesValidator {

    /**
     * Rejects series that cannot be simulated: empty, unordered timestamps, non-finite or
     * non-positive prices, or a high below the low.
     */
    public void validate(String symbol, List<Bar> bars) {
        if (bars == null || bars.isEmpty()) {
            throw new DataException(symbol, "no bars available");
        }

        Bar previous = null;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null || bar.getTimestamp() == null) {
                throw new DataException(symbol, "bar " + i + " has no timestamp");
            }
            if (!isValidPrice(bar.getOpen()) || !isValidPrice(bar.getHigh())
                    || !isValidPrice(bar.getLow()) || !isValidPrice(bar.getClose())) {
                throw new DataException(symbol, "bar " + i + " at " + bar.getTimestamp() + " has an invalid price");
            }
            if (bar.getHigh() < bar.getLow()) {
                throw new DataException(symbol, "bar " + i + " at " + bar.getTimestamp() + " has high below low");
            }
            if (previous != null && bar.getTimestamp().isBefore(previous.getTimestamp())) {
                throw new DataException(symbol, "bar " + i + " at " + bar.getTimestamp() + " is out of order");
            }
            previous = bar;
        }
    }

    /**
     * Lists every interval between consecutive bars longer than {@code maxGap}.
     */
    public List<DataGap> detectGaps(List<Bar> bars, Duration maxGap) {
        List<DataGap> gaps = new ArrayList<>();
        for (int i = 1; i < bars.size(); i++) {
            Duration between = Duration.between(bars.get(i - 1).getTimestamp(), bars.get(i).getTimestamp());
            if (between.compareTo(maxGap) > 0) {
                long minutes = between.toMinutes();
                gaps.add(new DataGap(bars.get(i - 1).getTimestamp(), bars.get(i).getTimestamp(), minutes,
                        GapType.classify(minutes)));
            }
        }

        if (!gaps.isEmpty()) {
            log.debug("Detected {} gaps longer than {}", gaps.size(), maxGap);
        }
        return gaps;
    }

    /**
     * Splits the series at gaps longer than {@code maxGap} and keeps only the sessions holding
     * at least {@code minSessionBars} bars.
     */
    public List<List<Bar>> splitIntoSessions(List<Bar> bars, Duration maxGap, int minSessionBars) {
        List<List<Bar>> sessions = new ArrayList<>();
        List<Bar> current = new ArrayList<>();

        for (Bar bar : bars) {
            if (!current.isEmpty()) {
                Duration between = Duration.between(current.get(current.size() - 1).getTimestamp(), bar.getTimestamp());
                if (between.compareTo(maxGap) > 0) {
                    if (current.size() >= minSessionBars) {
                        sessions.add(current);
                    }
                    current = new ArrayList<>();
                }
            }
            current.add(bar);
        }
        if (current.size() >= minSessionBars) {
            sessions.add(current);
        }
        return sessions;
    }

    private boolean isValidPrice(double price) {
        return Double.isFinite(price) && price > 0;
    }
}
