package ch.xavier.crossover.bar;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Builder
@Getter
@ToString
@EqualsAndHashCode
public class Bar {
    private final Instant timestamp;
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final double volume;

    /**
     * Parses a raw kline row: [epochMillis, open, high, low, close, volume].
     */
    public static Bar from(List<String> kline) {
        return Bar.builder()
                .timestamp(Instant.ofEpochMilli(Long.parseLong(kline.get(0))))
                .open(Double.parseDouble(kline.get(1)))
                .high(Double.parseDouble(kline.get(2)))
                .low(Double.parseDouble(kline.get(3)))
                .close(Double.parseDouble(kline.get(4)))
                .volume(Double.parseDouble(kline.get(5)))
                .build();
    }

    /**
     * Typical price used by CCI.
     */
    public double getTypicalPrice() {
        return (high + low + close) / 3.0;
    }
}
