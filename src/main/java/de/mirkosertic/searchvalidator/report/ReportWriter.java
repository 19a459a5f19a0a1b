package de.mirkosertic.searchvalidator.report;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders a {@link RunSummary} into one report file.
 */
public interface ReportWriter {

    ReportFormat format();

    void write(RunSummary summary, Path target) throws IOException;
}
