package de.mirkosertic.searchvalidator;

import de.mirkosertic.searchvalidator.backend.CollectionHandle;
import de.mirkosertic.searchvalidator.backend.QdrantSearchBackend;
import de.mirkosertic.searchvalidator.backend.SearchBackend;
import de.mirkosertic.searchvalidator.config.ApplicationConfig;
import de.mirkosertic.searchvalidator.config.BuildInfo;
import de.mirkosertic.searchvalidator.config.LoggingConfigurator;
import de.mirkosertic.searchvalidator.embedding.Embedder;
import de.mirkosertic.searchvalidator.embedding.EmbedderFactory;
import de.mirkosertic.searchvalidator.engine.CaseOutcome;
import de.mirkosertic.searchvalidator.engine.CaseResult;
import de.mirkosertic.searchvalidator.engine.FailureEscalationMonitor;
import de.mirkosertic.searchvalidator.engine.RetryPolicy;
import de.mirkosertic.searchvalidator.engine.ValidationEngine;
import de.mirkosertic.searchvalidator.http.JsonHttpClient;
import de.mirkosertic.searchvalidator.report.ReportFormat;
import de.mirkosertic.searchvalidator.report.ReportRetentionPolicy;
import de.mirkosertic.searchvalidator.report.ReportService;
import de.mirkosertic.searchvalidator.report.RunSummary;
import de.mirkosertic.searchvalidator.run.PreflightCheck;
import de.mirkosertic.searchvalidator.run.RunOrchestrator;
import de.mirkosertic.searchvalidator.testcase.TestCase;
import de.mirkosertic.searchvalidator.testcase.TestCaseRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command line entry point. Loads configuration and test cases, verifies the backend, runs all
 * cases and writes the reports.
 * <p>
 * Exit status: {@code 0} every case passed, {@code 1} at least one case did not pass,
 * {@code 2} the run was aborted and no report was written.
 */
@CommandLine.Command(
        name = "search-validator",
        description = "Runs relevance test cases against a vector search collection and reports pass/fail results.",
        mixinStandardHelpOptions = true,
        versionProvider = SearchValidatorApplication.VersionProvider.class)
public class SearchValidatorApplication implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(SearchValidatorApplication.class);

    static final int EXIT_PASSED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_ABORTED = 2;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Config file (default: ~/.searchvalidator/config.yaml)")
    private Path configFile;

    @CommandLine.Option(names = {"-t", "--tests-file"}, description = "Test case file, JSON or YAML")
    private String testsFile;

    @CommandLine.Option(names = "--collection", description = "Collection to validate")
    private String collection;

    @CommandLine.Option(names = "--test", description = "Run only the test case with this id (repeatable)")
    private List<String> testIds = new ArrayList<>();

    @CommandLine.Option(names = "--concurrency", description = "Number of cases run in parallel")
    private Integer concurrency;

    @CommandLine.Option(names = "--report-dir", description = "Directory for report files")
    private String reportDir;

    @CommandLine.Option(names = "--format", split = ",", description = "Report formats: json, csv")
    private List<String> formats = new ArrayList<>();

    private final Map<String, String> environment;

    public SearchValidatorApplication() {
        this(System.getenv());
    }

    SearchValidatorApplication(final Map<String, String> environment) {
        this.environment = environment;
    }

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{BuildInfo.current().describe()};
        }
    }

    @Override
    public Integer call() {
        try {
            final ApplicationConfig config = ApplicationConfig.load(configFile, environment);
            applyCommandLineOverrides(config);
            config.validate();

            final RunSummary summary = runValidation(config);
            return summary.allPassed() ? EXIT_PASSED : EXIT_FAILED;
        } catch (final ValidatorException e) {
            logger.error("Validation aborted: {}", e.getMessage());
            logger.debug("Abort cause", e);
            return EXIT_ABORTED;
        } catch (final UncheckedIOException e) {
            logger.error("Failed to write reports: {}", e.getMessage(), e);
            return EXIT_ABORTED;
        }
    }

    private void applyCommandLineOverrides(final ApplicationConfig config) {
        if (testsFile != null) {
            config.setTestsFile(testsFile);
        }
        if (collection != null) {
            config.setCollectionName(collection);
        }
        if (concurrency != null) {
            config.setConcurrency(concurrency);
        }
        if (reportDir != null) {
            config.setReportDir(reportDir);
        }
        if (!formats.isEmpty()) {
            final Set<ReportFormat> selected = EnumSet.noneOf(ReportFormat.class);
            for (final String format : formats) {
                selected.add(ReportFormat.fromName(format));
            }
            config.setReportFormats(selected);
        }
    }

    RunSummary runValidation(final ApplicationConfig config) {
        final JsonHttpClient httpClient = new JsonHttpClient(Duration.ofMillis(config.getConnectTimeoutMs()));

        // Test cases are validated before any network call
        List<TestCase> testCases = new TestCaseRegistry(httpClient.getObjectMapper()).load(Paths.get(config.getTestsFile()));
        if (!testIds.isEmpty()) {
            testCases = TestCaseRegistry.select(testCases, testIds);
        }

        final Embedder embedder = EmbedderFactory.create(config, httpClient);
        final CollectionHandle handle = CollectionHandle.of(
                config.getBackendUrl(),
                config.getBackendHost(),
                config.getBackendPort(),
                config.getBackendApiKey(),
                config.getCollectionName(),
                config.getVectorName(),
                config.getExpectedVectorSize(),
                config.getDistanceMetric());
        final SearchBackend backend = new QdrantSearchBackend(
                handle, httpClient, config.getDocumentIdFields(), config.getLabelFields());
        logger.info("Validating {} case(s) against {}", testCases.size(), handle);

        final RetryPolicy retryPolicy = new RetryPolicy(
                config.getRetryMaxAttempts(),
                config.getRetryInitialBackoffMs(),
                config.getRetryMaxBackoffMs());

        new PreflightCheck(backend, embedder, retryPolicy).verify(Duration.ofSeconds(config.getTestTimeoutSeconds()));

        final ValidationEngine engine = new ValidationEngine(
                config,
                embedder,
                backend,
                retryPolicy,
                new FailureEscalationMonitor(
                        config.getEscalationThreshold(),
                        Duration.ofSeconds(config.getEscalationWindowSeconds())));

        final RunSummary summary = new RunOrchestrator(engine, config.getProgressIntervalMs())
                .run(testCases, config.getConcurrency(), Duration.ofSeconds(config.getRunTimeoutSeconds()));

        final ReportService reportService = new ReportService(
                Paths.get(config.getReportDir()),
                config.getReportFormats(),
                new ReportRetentionPolicy(config.getReportRetentionDays()));
        reportService.writeReports(summary);

        logSummary(summary);
        return summary;
    }

    private static void logSummary(final RunSummary summary) {
        logger.info("==== Run {} ====", summary.runId());
        logger.info("Result: {}, {}/{} passed ({}%)", summary.status(), summary.passCount(), summary.totalCases(),
                String.format("%.1f", summary.passRate() * 100));
        summary.failCounts().forEach((outcome, count) -> {
            if (count > 0) {
                logger.info("  {}: {}", outcome, count);
            }
        });
        summary.perCategoryStats().forEach((category, stats) ->
                logger.info("  [{}] {}/{} passed", category, stats.passed(), stats.total()));
        logger.info("Latency: avg {}ms, p50 {}ms, p95 {}ms, max {}ms",
                String.format("%.0f", summary.latency().averageMs()),
                summary.latency().p50(), summary.latency().p95(), summary.latency().maxMs());
        for (final CaseResult result : summary.results()) {
            if (result.outcome() != CaseOutcome.PASS) {
                logger.info("  {} {}: {}", result.outcome(), result.testCaseId(), result.message());
            }
        }
    }

    public static void main(final String[] args) {
        // Configure logging first, before any other code that might log
        LoggingConfigurator.configure(System.getProperty(LoggingConfigurator.PROFILE_PROPERTY));

        final int exitCode = new CommandLine(new SearchValidatorApplication())
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    logger.error("Validation aborted by unexpected error", e);
                    return EXIT_ABORTED;
                })
                .execute(args);
        System.exit(exitCode);
    }
}
