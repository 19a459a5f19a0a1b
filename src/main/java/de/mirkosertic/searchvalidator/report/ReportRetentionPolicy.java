package de.mirkosertic.searchvalidator.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes report files older than the configured number of days.
 * <p>
 * Only entries following the report naming scheme are considered. Failures, including entries
 * that cannot be deleted, are logged and never affect the outcome of the run.
 */
public class ReportRetentionPolicy {

    private static final Logger logger = LoggerFactory.getLogger(ReportRetentionPolicy.class);

    private final int retentionDays;
    private final Clock clock;

    public ReportRetentionPolicy(final int retentionDays) {
        this(retentionDays, Clock.systemUTC());
    }

    ReportRetentionPolicy(final int retentionDays, final Clock clock) {
        this.retentionDays = retentionDays;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return retentionDays > 0;
    }

    /**
     * @return number of deleted files
     */
    public int apply(final Path reportDir) {
        if (!isEnabled()) {
            logger.debug("Report retention disabled");
            return 0;
        }
        if (!Files.isDirectory(reportDir)) {
            return 0;
        }

        final Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int deleted = 0;
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(reportDir, ReportService.FILE_PREFIX + "*")) {
            for (final Path file : stream) {
                try {
                    final FileTime modified = Files.getLastModifiedTime(file);
                    if (modified.toInstant().isBefore(cutoff)) {
                        Files.delete(file);
                        deleted++;
                        logger.debug("Deleted expired report {}", file);
                    }
                } catch (final IOException e) {
                    logger.warn("Could not delete expired report {}: {}", file, e.getMessage());
                }
            }
        } catch (final IOException | DirectoryIteratorException e) {
            logger.warn("Could not apply report retention in {}: {}", reportDir, e.getMessage());
        }

        if (deleted > 0) {
            logger.info("Deleted {} report file(s) older than {} days", deleted, retentionDays);
        }
        return deleted;
    }
}
