package de.mirkosertic.searchvalidator.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pass statistics for the cases of one category.
 */
public record CategoryStats(int total, int passed) {

    /**
     * Fraction of passed cases in {@code [0, 1]}.
     */
    @JsonProperty("passRate")
    public double passRate() {
        return total == 0 ? 0.0 : (double) passed / total;
    }
}
