package ch.xavier.crossover.bar;

import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Source of historical bars, implemented by broker or file adapters outside this project.
 * Bars must be emitted in ascending timestamp order.
 */
public interface BarDataProvider {

    Flux<Bar> getBars(String symbol, String timeframe, Instant from, Instant to);
}
