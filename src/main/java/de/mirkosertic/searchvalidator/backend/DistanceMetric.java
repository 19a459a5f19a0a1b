package de.mirkosertic.searchvalidator.backend;

import de.mirkosertic.searchvalidator.config.ConfigurationException;

import java.util.Locale;

/**
 * Distance metric of a collection. Defines the scale of {@link SearchCandidate#score()}.
 */
public enum DistanceMetric {

    COSINE("Cosine", true),
    DOT("Dot", true),
    EUCLID("Euclid", false),
    MANHATTAN("Manhattan", false);

    private final String backendName;
    private final boolean higherIsBetter;

    DistanceMetric(final String backendName, final boolean higherIsBetter) {
        this.backendName = backendName;
        this.higherIsBetter = higherIsBetter;
    }

    public String getBackendName() {
        return backendName;
    }

    /**
     * True for similarity metrics. For distance metrics the backend reports the distance,
     * so a smaller score is the better match.
     */
    public boolean isHigherBetter() {
        return higherIsBetter;
    }

    /**
     * Parses both the backend spelling ({@code "Cosine"}) and config spelling ({@code "cosine"}).
     */
    public static DistanceMetric fromName(final String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Distance metric must not be empty");
        }
        final String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (final DistanceMetric metric : values()) {
            if (metric.backendName.toLowerCase(Locale.ROOT).equals(normalized)
                    || metric.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return metric;
            }
        }
        if ("euclidean".equals(normalized)) {
            return EUCLID;
        }
        throw new ConfigurationException("Unknown distance metric: " + name);
    }
}
