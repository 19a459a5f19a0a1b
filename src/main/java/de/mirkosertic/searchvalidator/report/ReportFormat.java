package de.mirkosertic.searchvalidator.report;

import de.mirkosertic.searchvalidator.config.ConfigurationException;

import java.util.Locale;

public enum ReportFormat {

    /** Structured record: summary plus per-case detail. */
    JSON("json"),
    /** Flat table: one row per case. */
    CSV("csv");

    private final String extension;

    ReportFormat(final String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static ReportFormat fromName(final String name) {
        final String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (final ReportFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new ConfigurationException("Unknown report format: " + name);
    }
}
