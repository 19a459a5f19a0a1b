package de.mirkosertic.searchvalidator.config;

import de.mirkosertic.searchvalidator.backend.DistanceMetric;
import de.mirkosertic.searchvalidator.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Central configuration for the search validator.
 * Loads configuration from YAML files and environment variables once at startup; every
 * component receives this object instead of reading the environment itself.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. User config file (--config or ~/.searchvalidator/config.yaml)
 * 3. Application defaults (application.yaml in classpath)
 * <p>
 * YAML values may reference variables as {@code ${VAR:default}}, resolved against the
 * environment first and system properties second.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_TESTS_FILE = "SEARCH_VALIDATOR_TESTS_FILE";
    private static final String ENV_REPORT_DIR = "SEARCH_VALIDATOR_REPORT_DIR";
    private static final String CONFIG_DIR = ".searchvalidator";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final Map<String, String> environment;

    // Search backend
    private String backendUrl;
    private String backendHost = "localhost";
    private int backendPort = 6333;
    private String backendApiKey;
    private String collectionName = "distill_hybrid_v2";
    private String vectorName = "dense";
    private int expectedVectorSize = 1024;
    private DistanceMetric distanceMetric = DistanceMetric.COSINE;
    private List<String> documentIdFields = List.of("recipe_id", "id");
    private List<String> labelFields = List.of("recipe_name", "name");
    private long connectTimeoutMs = 5000;

    // Embedding provider
    private String embeddingModel = "bgm-m3";
    private int embeddingTimeoutSeconds = 60;
    private String bgmM3Url = "http://localhost";
    private int bgmM3Port = 8000;
    private String bgmM3Endpoint = "/embed";
    private String openAiBaseUrl = "https://api.openai.com/v1";
    private String openAiApiKey;
    private String openAiModelName = "text-embedding-3-small";

    // Run settings
    private String testsFile = "tests.json";
    private int maxAllowedRank = 3;
    private double minScoreThreshold = 0.3;
    private int topK = 10;
    private int testTimeoutSeconds = 30;
    private int runTimeoutSeconds = 600;
    private int concurrency = 4;
    private long progressIntervalMs = 10000;
    private int retryMaxAttempts = 3;
    private long retryInitialBackoffMs = 200;
    private long retryMaxBackoffMs = 2000;
    private int escalationThreshold = 10;
    private int escalationWindowSeconds = 60;

    // Reports
    private Set<ReportFormat> reportFormats = EnumSet.of(ReportFormat.JSON, ReportFormat.CSV);
    private String reportDir = "reports";
    private int reportRetentionDays = 30;

    private ApplicationConfig(final Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Load configuration from all sources with proper priority.
     *
     * @param userConfigFile explicit user config file, or {@code null} for ~/.searchvalidator/config.yaml
     * @param environment    environment variables to resolve placeholders and overrides against
     */
    public static ApplicationConfig load(final Path userConfigFile, final Map<String, String> environment) {
        final ApplicationConfig config = new ApplicationConfig(Map.copyOf(environment));

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig(userConfigFile);

        // Step 3: Apply environment variables (highest priority)
        config.applyEnvironmentOverrides();

        config.validate();

        logger.info("Configuration loaded: backend={}, collection={}, embedding={}, concurrency={}",
                config.backendUrl != null ? config.backendUrl : config.backendHost + ":" + config.backendPort,
                config.collectionName, config.embeddingModel, config.concurrency);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path explicitPath) {
        final Path userConfigPath = explicitPath != null ? explicitPath : getUserConfigPath();
        if (!Files.exists(userConfigPath)) {
            if (explicitPath != null) {
                throw new ConfigurationException("Config file not found: " + explicitPath);
            }
            return;
        }
        try (final InputStream is = Files.newInputStream(userConfigPath)) {
            final Yaml yaml = new Yaml();
            final Map<String, Object> config = yaml.load(is);
            if (config != null) {
                applyYamlConfig(config);
                logger.debug("Loaded user config from: {}", userConfigPath);
            }
        } catch (final IOException | YAMLException | ClassCastException e) {
            throw new ConfigurationException("Failed to load config file " + userConfigPath + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to validator section
        final Map<String, Object> validatorConfig = (Map<String, Object>) config.get("validator");
        if (validatorConfig == null) {
            return;
        }

        final Map<String, Object> backendConfig = (Map<String, Object>) validatorConfig.get("backend");
        if (backendConfig != null) {
            applyBackendConfig(backendConfig);
        }

        final Map<String, Object> embeddingConfig = (Map<String, Object>) validatorConfig.get("embedding");
        if (embeddingConfig != null) {
            applyEmbeddingConfig(embeddingConfig);
        }

        final Map<String, Object> runConfig = (Map<String, Object>) validatorConfig.get("run");
        if (runConfig != null) {
            applyRunConfig(runConfig);
        }

        final Map<String, Object> reportConfig = (Map<String, Object>) validatorConfig.get("report");
        if (reportConfig != null) {
            applyReportConfig(reportConfig);
        }
    }

    private void applyBackendConfig(final Map<String, Object> backendConfig) {
        if (backendConfig.containsKey("url")) {
            this.backendUrl = blankToNull(text(backendConfig.get("url")));
        }
        if (backendConfig.containsKey("host")) {
            this.backendHost = text(backendConfig.get("host"));
        }
        if (backendConfig.containsKey("port")) {
            this.backendPort = toInt(backendConfig.get("port"), "backend.port");
        }
        if (backendConfig.containsKey("api-key")) {
            this.backendApiKey = blankToNull(text(backendConfig.get("api-key")));
        }
        if (backendConfig.containsKey("collection")) {
            this.collectionName = text(backendConfig.get("collection"));
        }
        if (backendConfig.containsKey("vector-name")) {
            this.vectorName = blankToNull(text(backendConfig.get("vector-name")));
        }
        if (backendConfig.containsKey("expected-vector-size")) {
            this.expectedVectorSize = toInt(backendConfig.get("expected-vector-size"), "backend.expected-vector-size");
        }
        if (backendConfig.containsKey("distance-metric")) {
            this.distanceMetric = DistanceMetric.fromName(text(backendConfig.get("distance-metric")));
        }
        if (backendConfig.containsKey("document-id-fields")) {
            this.documentIdFields = toStringList(backendConfig.get("document-id-fields"), "backend.document-id-fields");
        }
        if (backendConfig.containsKey("label-fields")) {
            this.labelFields = toStringList(backendConfig.get("label-fields"), "backend.label-fields");
        }
        if (backendConfig.containsKey("connect-timeout-ms")) {
            this.connectTimeoutMs = toLong(backendConfig.get("connect-timeout-ms"), "backend.connect-timeout-ms");
        }
    }

    @SuppressWarnings("unchecked")
    private void applyEmbeddingConfig(final Map<String, Object> embeddingConfig) {
        if (embeddingConfig.containsKey("model")) {
            this.embeddingModel = text(embeddingConfig.get("model"));
        }
        if (embeddingConfig.containsKey("timeout-seconds")) {
            this.embeddingTimeoutSeconds = toInt(embeddingConfig.get("timeout-seconds"), "embedding.timeout-seconds");
        }
        final Map<String, Object> bgmConfig = (Map<String, Object>) embeddingConfig.get("bgm-m3");
        if (bgmConfig != null) {
            if (bgmConfig.containsKey("url")) {
                this.bgmM3Url = text(bgmConfig.get("url"));
            }
            if (bgmConfig.containsKey("port")) {
                this.bgmM3Port = toInt(bgmConfig.get("port"), "embedding.bgm-m3.port");
            }
            if (bgmConfig.containsKey("endpoint")) {
                this.bgmM3Endpoint = text(bgmConfig.get("endpoint"));
            }
        }
        final Map<String, Object> openAiConfig = (Map<String, Object>) embeddingConfig.get("openai");
        if (openAiConfig != null) {
            if (openAiConfig.containsKey("base-url")) {
                this.openAiBaseUrl = text(openAiConfig.get("base-url"));
            }
            if (openAiConfig.containsKey("api-key")) {
                this.openAiApiKey = blankToNull(text(openAiConfig.get("api-key")));
            }
            if (openAiConfig.containsKey("model-name")) {
                this.openAiModelName = text(openAiConfig.get("model-name"));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyRunConfig(final Map<String, Object> runConfig) {
        if (runConfig.containsKey("tests-file")) {
            this.testsFile = text(runConfig.get("tests-file"));
        }
        if (runConfig.containsKey("max-allowed-rank")) {
            this.maxAllowedRank = toInt(runConfig.get("max-allowed-rank"), "run.max-allowed-rank");
        }
        if (runConfig.containsKey("min-score-threshold")) {
            this.minScoreThreshold = toDouble(runConfig.get("min-score-threshold"), "run.min-score-threshold");
        }
        if (runConfig.containsKey("top-k")) {
            this.topK = toInt(runConfig.get("top-k"), "run.top-k");
        }
        if (runConfig.containsKey("test-timeout-seconds")) {
            this.testTimeoutSeconds = toInt(runConfig.get("test-timeout-seconds"), "run.test-timeout-seconds");
        }
        if (runConfig.containsKey("run-timeout-seconds")) {
            this.runTimeoutSeconds = toInt(runConfig.get("run-timeout-seconds"), "run.run-timeout-seconds");
        }
        if (runConfig.containsKey("concurrency")) {
            this.concurrency = toInt(runConfig.get("concurrency"), "run.concurrency");
        }
        if (runConfig.containsKey("progress-interval-ms")) {
            this.progressIntervalMs = toLong(runConfig.get("progress-interval-ms"), "run.progress-interval-ms");
        }
        final Map<String, Object> retryConfig = (Map<String, Object>) runConfig.get("retry");
        if (retryConfig != null) {
            if (retryConfig.containsKey("max-attempts")) {
                this.retryMaxAttempts = toInt(retryConfig.get("max-attempts"), "run.retry.max-attempts");
            }
            if (retryConfig.containsKey("initial-backoff-ms")) {
                this.retryInitialBackoffMs = toLong(retryConfig.get("initial-backoff-ms"), "run.retry.initial-backoff-ms");
            }
            if (retryConfig.containsKey("max-backoff-ms")) {
                this.retryMaxBackoffMs = toLong(retryConfig.get("max-backoff-ms"), "run.retry.max-backoff-ms");
            }
        }
        final Map<String, Object> escalationConfig = (Map<String, Object>) runConfig.get("failure-escalation");
        if (escalationConfig != null) {
            if (escalationConfig.containsKey("threshold")) {
                this.escalationThreshold = toInt(escalationConfig.get("threshold"), "run.failure-escalation.threshold");
            }
            if (escalationConfig.containsKey("window-seconds")) {
                this.escalationWindowSeconds = toInt(escalationConfig.get("window-seconds"), "run.failure-escalation.window-seconds");
            }
        }
    }

    private void applyReportConfig(final Map<String, Object> reportConfig) {
        if (reportConfig.containsKey("formats")) {
            final Set<ReportFormat> formats = EnumSet.noneOf(ReportFormat.class);
            for (final String name : toStringList(reportConfig.get("formats"), "report.formats")) {
                formats.add(ReportFormat.fromName(name));
            }
            this.reportFormats = formats;
        }
        if (reportConfig.containsKey("dir")) {
            this.reportDir = text(reportConfig.get("dir"));
        }
        if (reportConfig.containsKey("retention-days")) {
            this.reportRetentionDays = toInt(reportConfig.get("retention-days"), "report.retention-days");
        }
    }

    private void applyEnvironmentOverrides() {
        final String envTestsFile = environment.get(ENV_TESTS_FILE);
        if (envTestsFile != null && !envTestsFile.trim().isEmpty()) {
            this.testsFile = envTestsFile.trim();
            logger.info("Tests file from environment: {}", this.testsFile);
        }

        final String envReportDir = environment.get(ENV_REPORT_DIR);
        if (envReportDir != null && !envReportDir.trim().isEmpty()) {
            this.reportDir = envReportDir.trim();
            logger.info("Report directory from environment: {}", this.reportDir);
        }
    }

    /**
     * Checks value ranges. Called after loading and again after command line overrides.
     *
     * @throws ConfigurationException on the first invalid value
     */
    public void validate() {
        if (collectionName == null || collectionName.isBlank()) {
            throw new ConfigurationException("backend.collection must not be empty");
        }
        if (backendUrl == null && (backendHost == null || backendHost.isBlank())) {
            throw new ConfigurationException("Either backend.url or backend.host must be set");
        }
        if (backendPort < 1 || backendPort > 65535) {
            throw new ConfigurationException("backend.port out of range: " + backendPort);
        }
        requirePositive(expectedVectorSize, "backend.expected-vector-size");
        requirePositive(maxAllowedRank, "run.max-allowed-rank");
        requirePositive(topK, "run.top-k");
        requirePositive(testTimeoutSeconds, "run.test-timeout-seconds");
        requirePositive(runTimeoutSeconds, "run.run-timeout-seconds");
        requirePositive(concurrency, "run.concurrency");
        requirePositive(retryMaxAttempts, "run.retry.max-attempts");
        requirePositive(escalationThreshold, "run.failure-escalation.threshold");
        requirePositive(escalationWindowSeconds, "run.failure-escalation.window-seconds");
        requirePositive(embeddingTimeoutSeconds, "embedding.timeout-seconds");
        if (Double.isNaN(minScoreThreshold) || Double.isInfinite(minScoreThreshold)) {
            throw new ConfigurationException("run.min-score-threshold must be a finite number");
        }
        if (documentIdFields.isEmpty()) {
            throw new ConfigurationException("backend.document-id-fields must name at least one payload field");
        }
        if (reportFormats.isEmpty()) {
            throw new ConfigurationException("report.formats must name at least one format");
        }
        if (testsFile == null || testsFile.isBlank()) {
            throw new ConfigurationException("run.tests-file must not be empty");
        }
    }

    private static void requirePositive(final long value, final String key) {
        if (value < 1) {
            throw new ConfigurationException(key + " must be positive, got " + value);
        }
    }

    private String text(final Object value) {
        return value == null ? null : resolveVariables(value.toString());
    }

    private int toInt(final Object value, final String key) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(text(value).trim());
        } catch (final RuntimeException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }

    private long toLong(final Object value, final String key) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(text(value).trim());
        } catch (final RuntimeException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }

    private double toDouble(final Object value, final String key) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(text(value).trim());
        } catch (final RuntimeException e) {
            throw new ConfigurationException(key + " is not a number: " + value, e);
        }
    }

    private List<String> toStringList(final Object value, final String key) {
        final List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (final Object element : (Collection<?>) value) {
                final String item = blankToNull(text(element));
                if (item != null) {
                    result.add(item.trim());
                }
            }
            return List.copyOf(result);
        }
        if (value instanceof String) {
            for (final String part : text(value).split(",")) {
                final String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
            return List.copyOf(result);
        }
        throw new ConfigurationException(key + " must be a list");
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = environment.get(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    /**
     * Per-user directory holding the config file and, in deployed mode, the log files.
     */
    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Overrides from the command line

    public void setTestsFile(final String testsFile) {
        this.testsFile = testsFile;
    }

    public void setCollectionName(final String collectionName) {
        this.collectionName = collectionName;
    }

    public void setConcurrency(final int concurrency) {
        this.concurrency = concurrency;
    }

    public void setReportDir(final String reportDir) {
        this.reportDir = reportDir;
    }

    public void setReportFormats(final Set<ReportFormat> reportFormats) {
        this.reportFormats = reportFormats.isEmpty() ? EnumSet.noneOf(ReportFormat.class) : EnumSet.copyOf(reportFormats);
    }

    // Getters
    public String getBackendUrl() {
        return backendUrl;
    }

    public String getBackendHost() {
        return backendHost;
    }

    public int getBackendPort() {
        return backendPort;
    }

    public String getBackendApiKey() {
        return backendApiKey;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public String getVectorName() {
        return vectorName;
    }

    public int getExpectedVectorSize() {
        return expectedVectorSize;
    }

    public DistanceMetric getDistanceMetric() {
        return distanceMetric;
    }

    public List<String> getDocumentIdFields() {
        return documentIdFields;
    }

    public List<String> getLabelFields() {
        return labelFields;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public int getEmbeddingTimeoutSeconds() {
        return embeddingTimeoutSeconds;
    }

    public String getBgmM3Url() {
        return bgmM3Url;
    }

    public int getBgmM3Port() {
        return bgmM3Port;
    }

    public String getBgmM3Endpoint() {
        return bgmM3Endpoint;
    }

    public String getOpenAiBaseUrl() {
        return openAiBaseUrl;
    }

    public String getOpenAiApiKey() {
        return openAiApiKey;
    }

    public String getOpenAiModelName() {
        return openAiModelName;
    }

    public String getTestsFile() {
        return testsFile;
    }

    public int getMaxAllowedRank() {
        return maxAllowedRank;
    }

    public double getMinScoreThreshold() {
        return minScoreThreshold;
    }

    public int getTopK() {
        return topK;
    }

    public int getTestTimeoutSeconds() {
        return testTimeoutSeconds;
    }

    public int getRunTimeoutSeconds() {
        return runTimeoutSeconds;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public long getProgressIntervalMs() {
        return progressIntervalMs;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public long getRetryInitialBackoffMs() {
        return retryInitialBackoffMs;
    }

    public long getRetryMaxBackoffMs() {
        return retryMaxBackoffMs;
    }

    public int getEscalationThreshold() {
        return escalationThreshold;
    }

    public int getEscalationWindowSeconds() {
        return escalationWindowSeconds;
    }

    public Set<ReportFormat> getReportFormats() {
        return reportFormats;
    }

    public String getReportDir() {
        return reportDir;
    }

    public int getReportRetentionDays() {
        return reportRetentionDays;
    }
}
