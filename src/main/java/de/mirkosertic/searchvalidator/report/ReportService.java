package de.mirkosertic.searchvalidator.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Writes the reports of a run in every requested format and applies retention afterwards.
 */
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    static final String FILE_PREFIX = "validation-report_";

    private final Path reportDir;
    private final List<ReportWriter> writers;
    private final ReportRetentionPolicy retentionPolicy;

    public ReportService(final Path reportDir, final Collection<ReportFormat> formats, final ReportRetentionPolicy retentionPolicy) {
        this.reportDir = reportDir;
        this.retentionPolicy = retentionPolicy;
        this.writers = new ArrayList<>();
        for (final ReportFormat format : formats) {
            writers.add(switch (format) {
                case JSON -> new JsonReportWriter();
                case CSV -> new CsvReportWriter();
            });
        }
    }

    public static Path reportFile(final Path reportDir, final String runId, final ReportFormat format) {
        return reportDir.resolve(FILE_PREFIX + runId + "." + format.getExtension());
    }

    /**
     * Write all reports for the given summary.
     *
     * @return paths of the written files, in format order
     * @throws UncheckedIOException if the report directory or a report file cannot be written
     */
    public List<Path> writeReports(final RunSummary summary) {
        final List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(reportDir);
            for (final ReportWriter writer : writers) {
                final Path target = reportFile(reportDir, summary.runId(), writer.format());
                writer.write(summary, target);
                written.add(target);
                logger.info("Wrote {} report to {}", writer.format(), target);
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to write report to " + reportDir, e);
        }

        retentionPolicy.apply(reportDir);
        return written;
    }
}
