package de.mirkosertic.searchvalidator.report;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link LatencyStats}.
 */
class LatencyStatsTest {

    @Test
    void testEmpty() {
        assertThat(LatencyStats.of(List.of())).isEqualTo(LatencyStats.EMPTY);
    }

    @Test
    void testSingleDuration() {
        final LatencyStats stats = LatencyStats.of(List.of(42L));

        assertThat(stats.count()).isEqualTo(1);
        assertThat(stats.minMs()).isEqualTo(42L);
        assertThat(stats.maxMs()).isEqualTo(42L);
        assertThat(stats.averageMs()).isCloseTo(42.0, within(0.001));
        assertThat(stats.p50()).isEqualTo(42L);
        assertThat(stats.p99()).isEqualTo(42L);
    }

    @Test
    void testPercentileCalculation() {
        // Durations 1..100 in reverse order
        final List<Long> durations = new ArrayList<>();
        for (long i = 1; i <= 100; i++) {
            durations.add(i);
        }
        Collections.reverse(durations);

        final LatencyStats stats = LatencyStats.of(durations);

        assertThat(stats.minMs()).isEqualTo(1L);
        assertThat(stats.maxMs()).isEqualTo(100L);
        assertThat(stats.averageMs()).isCloseTo(50.5, within(0.001));
        assertThat(stats.p50()).isEqualTo(50L);
        assertThat(stats.p90()).isEqualTo(90L);
        assertThat(stats.p95()).isEqualTo(95L);
        assertThat(stats.p99()).isEqualTo(99L);
    }
}
