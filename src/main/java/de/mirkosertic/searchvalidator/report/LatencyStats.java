package de.mirkosertic.searchvalidator.report;

import java.util.Arrays;
import java.util.Collection;

/**
 * Duration statistics over the cases of one run.
 *
 * <p>Computed once from the complete set of durations, so the values do not depend on the order
 * in which cases finished. All values are in milliseconds and {@code 0} for an empty run.</p>
 *
 * @param count     number of recorded durations
 * @param minMs     fastest case
 * @param maxMs     slowest case
 * @param averageMs arithmetic mean
 * @param p50       median
 * @param p90       90th percentile
 * @param p95       95th percentile
 * @param p99       99th percentile
 */
public record LatencyStats(int count, long minMs, long maxMs, double averageMs, long p50, long p90, long p95, long p99) {

    public static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0.0, 0, 0, 0, 0);

    public static LatencyStats of(final Collection<Long> durationsMs) {
        if (durationsMs.isEmpty()) {
            return EMPTY;
        }
        final long[] sorted = durationsMs.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(sorted);
        final int count = sorted.length;

        long total = 0;
        for (final long value : sorted) {
            total += value;
        }

        return new LatencyStats(
                count,
                sorted[0],
                sorted[count - 1],
                (double) total / count,
                percentileValue(sorted, 50),
                percentileValue(sorted, 90),
                percentileValue(sorted, 95),
                percentileValue(sorted, 99));
    }

    // nearest-rank percentile
    static long percentileValue(final long[] sortedData, final int percentile) {
        final int count = sortedData.length;
        final int index = (int) Math.ceil(percentile / 100.0 * count) - 1;
        return sortedData[Math.max(0, Math.min(index, count - 1))];
    }
}
