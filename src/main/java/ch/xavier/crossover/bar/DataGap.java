package ch.xavier.crossover.bar;

import lombok.Value;

import java.time.Instant;

@Value
public class DataGap {
    Instant before;
    Instant after;
    long durationMinutes;
    GapType type;
}
