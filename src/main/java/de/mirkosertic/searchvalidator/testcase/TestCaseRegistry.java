package de.mirkosertic.searchvalidator.testcase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.searchvalidator.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads and validates test cases.
 * <p>
 * Sources are JSON (an object with a {@code tests} array, or a bare array) or YAML
 * ({@code .yaml}/{@code .yml}) with the same structure. All validation, including the
 * duplicate id check, happens here, before any network call is made.
 */
public class TestCaseRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TestCaseRegistry.class);

    private static final String TESTS_KEY = "tests";

    private final ObjectMapper objectMapper;

    public TestCaseRegistry() {
        this(new ObjectMapper());
    }

    public TestCaseRegistry(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load all test cases of a source file, in source order.
     *
     * @throws ConfigurationException if the file is missing, unreadable or contains invalid or duplicate entries
     */
    public List<TestCase> load(final Path source) {
        if (!Files.isRegularFile(source)) {
            throw new ConfigurationException("Test case file not found: " + source);
        }
        final JsonNode root;
        try (final Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            if (isYaml(source)) {
                final Object document = new Yaml().load(reader);
                root = objectMapper.valueToTree(document);
            } else {
                root = objectMapper.readTree(reader);
            }
        } catch (final IOException | YAMLException | IllegalArgumentException e) {
            throw new ConfigurationException("Cannot read test cases from " + source + ": " + e.getMessage(), e);
        }

        final List<TestCase> testCases = parse(root, source.toString());
        logger.info("Loaded {} test cases from {}", testCases.size(), source);
        return testCases;
    }

    /**
     * Validate an already parsed source document.
     */
    public List<TestCase> parse(final JsonNode root, final String sourceName) {
        final JsonNode entries;
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new ConfigurationException("Test case source " + sourceName + " is empty");
        } else if (root.isArray()) {
            entries = root;
        } else if (root.isObject() && root.path(TESTS_KEY).isArray()) {
            entries = root.path(TESTS_KEY);
        } else {
            throw new ConfigurationException("Test case source " + sourceName + " has no '" + TESTS_KEY + "' array");
        }
        if (entries.isEmpty()) {
            throw new ConfigurationException("Test case source " + sourceName + " contains no test cases");
        }

        final Map<String, TestCase> byId = new LinkedHashMap<>();
        int index = 0;
        for (final JsonNode node : entries) {
            final TestCaseEntry entry;
            try {
                entry = objectMapper.treeToValue(node, TestCaseEntry.class);
            } catch (final JsonProcessingException | IllegalArgumentException e) {
                throw new ConfigurationException("Invalid test case #" + index + " in " + sourceName + ": "
                        + e.getMessage(), e);
            }
            final TestCase testCase = validate(entry, index, sourceName);
            if (byId.putIfAbsent(testCase.id(), testCase) != null) {
                throw new DuplicateTestCaseException(testCase.id(), sourceName);
            }
            index++;
        }
        return List.copyOf(byId.values());
    }

    /**
     * Restrict a loaded set to the given ids, keeping source order.
     *
     * @throws ConfigurationException if an id is not part of the loaded set
     */
    public static List<TestCase> select(final List<TestCase> testCases, final Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return testCases;
        }
        final Set<String> wanted = new LinkedHashSet<>(ids);
        final List<TestCase> selected = new ArrayList<>();
        for (final TestCase testCase : testCases) {
            if (wanted.remove(testCase.id())) {
                selected.add(testCase);
            }
        }
        if (!wanted.isEmpty()) {
            throw new ConfigurationException("Unknown test case ids: " + wanted);
        }
        return List.copyOf(selected);
    }

    private static TestCase validate(final TestCaseEntry entry, final int index, final String sourceName) {
        if (entry == null) {
            throw new ConfigurationException("Test case #" + index + " in " + sourceName + " is null");
        }
        final String where = "Test case #" + index + (entry.id() != null ? " ('" + entry.id() + "')" : "") + " in " + sourceName;
        final String id = requireText(entry.id(), where, "id");
        final String queryText = requireText(entry.queryText(), where, "query");
        final List<String> alternatives = new ArrayList<>();
        if (entry.alternativeDocumentIds() != null) {
            for (final String alternative : entry.alternativeDocumentIds()) {
                alternatives.add(requireText(alternative, where, "every entry of expected_result_ids"));
            }
        }
        // A case may list its accepted documents only in expected_result_ids
        final String expectedDocumentId;
        if (entry.expectedDocumentId() == null && !alternatives.isEmpty()) {
            expectedDocumentId = alternatives.remove(0);
        } else {
            expectedDocumentId = requireText(entry.expectedDocumentId(), where, "expected_result_id");
        }
        alternatives.removeIf(expectedDocumentId::equals);

        String collection = entry.collection();
        if (collection != null) {
            collection = requireText(collection, where, "collection");
        }

        String category = entry.category();
        if (category != null) {
            if (category.isBlank()) {
                throw new ConfigurationException(where + ": category must not be empty when present");
            }
            category = category.trim();
        }
        if (entry.maxAllowedRank() != null && entry.maxAllowedRank() < 1) {
            throw new ConfigurationException(where + ": max_rank must be at least 1, got " + entry.maxAllowedRank());
        }
        if (entry.minScoreThreshold() != null
                && (entry.minScoreThreshold().isNaN() || entry.minScoreThreshold().isInfinite())) {
            throw new ConfigurationException(where + ": min_score must be a finite number");
        }

        return new TestCase(
                id,
                queryText,
                expectedDocumentId,
                alternatives.stream().distinct().toList(),
                category,
                entry.maxAllowedRank(),
                entry.minScoreThreshold(),
                collection,
                entry.name(),
                entry.description());
    }

    private static String requireText(final String value, final String where, final String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(where + ": " + field + " must not be empty");
        }
        return value.trim();
    }

    private static boolean isYaml(final Path source) {
        final String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
