package de.mirkosertic.searchvalidator.report;

import de.mirkosertic.searchvalidator.backend.SearchCandidate;
import de.mirkosertic.searchvalidator.engine.CaseResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Writes one row per case. Summary figures are left to the JSON report.
 */
public class CsvReportWriter implements ReportWriter {

    static final String[] HEADER = {
            "test_id",
            "category",
            "query",
            "expected_document_id",
            "outcome",
            "observed_rank",
            "observed_score",
            "duration_ms",
            "message",
            "error_detail",
            "top_document_ids"
    };

    private final CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .setRecordSeparator('\n')
            .build();

    @Override
    public ReportFormat format() {
        return ReportFormat.CSV;
    }

    @Override
    public void write(final RunSummary summary, final Path target) throws IOException {
        try (final Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             final CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (final CaseResult result : summary.results()) {
                printer.printRecord(
                        result.testCaseId(),
                        result.category(),
                        result.queryText(),
                        result.expectedDocumentId(),
                        result.outcome().name(),
                        result.observedRank(),
                        result.observedScore(),
                        result.durationMs(),
                        result.message(),
                        result.errorDetail(),
                        result.topCandidates().stream()
                                .map(SearchCandidate::documentId)
                                .collect(Collectors.joining(";")));
            }
        }
    }
}
