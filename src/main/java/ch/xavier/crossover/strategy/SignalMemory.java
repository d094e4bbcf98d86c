package ch.xavier.crossover.strategy;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-symbol duplicate suppression state. Owned by the caller and handed to the generator on
 * every bar, so one generator instance can serve several independent runs.
 */
public class SignalMemory {
    private Instant lastSignalBarTime;

    public boolean isDuplicate(Instant barTime) {
        return lastSignalBarTime != null && Objects.equals(lastSignalBarTime, barTime);
    }

    public void record(Instant barTime) {
        this.lastSignalBarTime = barTime;
    }

    public Instant getLastSignalBarTime() {
        return lastSignalBarTime;
    }
}
