package ch.xavier.crossover.bar;

import ch.xavier.crossover.exception.DataException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static ch.xavier.crossover.bar.BarFixtures.START;
import static ch.xavier.crossover.bar.BarFixtures.bar;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BarSeriesValidatorTest {
    private final BarSeriesValidator validator = new BarSeriesValidator();

    @Test
    void validate_acceptsAWellFormedSeries() {
        assertThatCode(() -> validator.validate("OK", BarFixtures.linear(100, 110, 20))).doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsAnEmptySeries() {
        assertThatThrownBy(() -> validator.validate("EMPTY", List.of()))
                .isInstanceOf(DataException.class)
                .hasMessage("[EMPTY] no bars available");
    }

    @Test
    void validate_rejectsNonPositiveAndNonFinitePrices() {
        List<Bar> zero = List.of(bar(START, 100, 100), bar(START.plusSeconds(3600), 100, 110, 0, 105));
        List<Bar> nan = List.of(bar(START, 100, Double.NaN));

        assertThatThrownBy(() -> validator.validate("ZERO", zero))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("bar 1")
                .hasMessageContaining("invalid price");
        assertThatThrownBy(() -> validator.validate("NAN", nan))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("invalid price");
    }

    @Test
    void validate_rejectsHighBelowLow() {
        List<Bar> bars = List.of(bar(START, 100, 95, 105, 100));

        assertThatThrownBy(() -> validator.validate("INVERTED", bars))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("high below low");
    }

    @Test
    void validate_rejectsOutOfOrderTimestamps() {
        List<Bar> bars = List.of(bar(START.plusSeconds(3600), 100, 101), bar(START, 101, 102));

        assertThatThrownBy(() -> validator.validate("ORDER", bars))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("out of order")
                .extracting(e -> ((DataException) e).getSymbol())
                .isEqualTo("ORDER");
    }

    @Test
    void detectGaps_classifiesEachGapByLength() {
        List<Bar> bars = new ArrayList<>();
        Instant time = START;
        bars.add(bar(time, 100, 100));
        time = time.plus(Duration.ofMinutes(45));
        bars.add(bar(time, 100, 100));
        time = time.plus(Duration.ofHours(3));
        bars.add(bar(time, 100, 100));
        time = time.plus(Duration.ofHours(20));
        bars.add(bar(time, 100, 100));
        time = time.plus(Duration.ofDays(3));
        bars.add(bar(time, 100, 100));
        time = time.plus(Duration.ofMinutes(15));
        bars.add(bar(time, 100, 100));

        List<DataGap> gaps = validator.detectGaps(bars, Duration.ofMinutes(15));

        assertThat(gaps).extracting(DataGap::getType)
                .containsExactly(GapType.SMALL, GapType.MEDIUM, GapType.WEEKEND, GapType.EXTREME);
        assertThat(gaps.get(1).getDurationMinutes()).isEqualTo(180);
        assertThat(gaps.get(1).getBefore()).isEqualTo(bars.get(1).getTimestamp());
        assertThat(gaps.get(1).getAfter()).isEqualTo(bars.get(2).getTimestamp());
    }

    @Test
    void detectGaps_returnsNothingForARegularSeries() {
        assertThat(validator.detectGaps(BarFixtures.flat(50, 100), Duration.ofHours(1))).isEmpty();
    }

    @Test
    void classify_usesTheUpperBoundsExclusively() {
        assertThat(GapType.classify(59)).isEqualTo(GapType.SMALL);
        assertThat(GapType.classify(60)).isEqualTo(GapType.MEDIUM);
        assertThat(GapType.classify(480)).isEqualTo(GapType.WEEKEND);
        assertThat(GapType.classify(2880)).isEqualTo(GapType.EXTREME);
    }

    @Test
    void splitIntoSessions_dropsSessionsThatAreTooShort() {
        List<Bar> bars = new ArrayList<>(BarFixtures.flat(10, 100));
        Instant afterGap = bars.get(9).getTimestamp().plus(Duration.ofDays(2));
        bars.add(bar(afterGap, 100, 101));
        bars.add(bar(afterGap.plus(BarFixtures.HOUR), 101, 102));
        Instant afterSecondGap = afterGap.plus(Duration.ofDays(2));
        for (int i = 0; i < 6; i++) {
            bars.add(bar(afterSecondGap.plus(BarFixtures.HOUR.multipliedBy(i)), 102, 102));
        }

        List<List<Bar>> sessions = validator.splitIntoSessions(bars, Duration.ofHours(4), 5);

        assertThat(sessions).hasSize(2);
        assertThat(sessions.get(0)).hasSize(10);
        assertThat(sessions.get(1)).hasSize(6);
        assertThat(sessions.get(1).get(0).getTimestamp()).isEqualTo(afterSecondGap);
    }
}
