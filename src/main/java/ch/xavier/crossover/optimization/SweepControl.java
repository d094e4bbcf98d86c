package ch.xavier.crossover.optimization;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop for a running sweep. Cancellation is checked between combinations; a
 * combination already running finishes.
 */
public class SweepControl {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Duration timeBudget;

    private SweepControl(Duration timeBudget) {
        this.timeBudget = timeBudget;
    }

    public static SweepControl unlimited() {
        return new SweepControl(null);
    }

    public static SweepControl withTimeBudget(Duration timeBudget) {
        return new SweepControl(timeBudget);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Optional<Duration> timeBudget() {
        return Optional.ofNullable(timeBudget);
    }
}
