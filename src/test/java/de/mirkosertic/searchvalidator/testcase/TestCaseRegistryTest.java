package de.mirkosertic.searchvalidator.testcase;

import de.mirkosertic.searchvalidator.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TestCaseRegistry Tests")
class TestCaseRegistryTest {

    @TempDir
    Path tempDir;

    private final TestCaseRegistry registry = new TestCaseRegistry();

    private Path write(final String name, final String content) throws Exception {
        return Files.writeString(tempDir.resolve(name), content);
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Should load the test manager JSON format in source order")
        void shouldLoadTestManagerJson() throws Exception {
            // Given: the format written by the dashboard test manager
            final Path source = write("tests.json", """
                    {
                      "tests": [
                        {"id": "t2", "name": "Lasagne", "query": "vegan lasagne", "expected_result_id": 42,
                         "category": "recipes", "max_rank": 5, "min_score": 0.5, "created_at": "2024-01-01"},
                        {"id": "t1", "query": "tomato soup", "expected_result_id": "doc-7"}
                      ]
                    }
                    """);

            // When
            final List<TestCase> testCases = registry.load(source);

            // Then
            assertThat(testCases).extracting(TestCase::id).containsExactly("t2", "t1");
            final TestCase first = testCases.get(0);
            assertThat(first.expectedDocumentId()).isEqualTo("42");
            assertThat(first.category()).isEqualTo("recipes");
            assertThat(first.maxAllowedRank()).isEqualTo(5);
            assertThat(first.minScoreThreshold()).isEqualTo(0.5);
            assertThat(first.name()).isEqualTo("Lasagne");
            assertThat(testCases.get(1).category()).isNull();
            assertThat(testCases.get(1).maxAllowedRank()).isNull();
        }

        @Test
        @DisplayName("Should accept a bare array with camelCase keys")
        void shouldLoadBareArray() throws Exception {
            final Path source = write("tests.json", """
                    [{"id": "a", "queryText": "pizza", "expectedDocumentId": "doc-1", "maxAllowedRank": 2}]
                    """);

            final List<TestCase> testCases = registry.load(source);

            assertThat(testCases).singleElement()
                    .satisfies(tc -> {
                        assertThat(tc.queryText()).isEqualTo("pizza");
                        assertThat(tc.maxAllowedRank()).isEqualTo(2);
                    });
        }

        @Test
        @DisplayName("Should load YAML sources")
        void shouldLoadYaml() throws Exception {
            final Path source = write("tests.yaml", """
                    tests:
                      - id: curry
                        query: green curry
                        expected_result_id: doc-9
                        category: asian
                      - id: soup
                        query: miso soup
                        expected_result_id: doc-10
                        min_score: 0.25
                    """);

            final List<TestCase> testCases = registry.load(source);

            assertThat(testCases).extracting(TestCase::id).containsExactly("curry", "soup");
            assertThat(testCases.get(1).minScoreThreshold()).isEqualTo(0.25);
        }

        @Test
        @DisplayName("Should fail for a missing file")
        void shouldFailForMissingFile() {
            assertThatThrownBy(() -> registry.load(tempDir.resolve("missing.json")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("Should fail for malformed JSON")
        void shouldFailForMalformedJson() throws Exception {
            final Path source = write("tests.json", "{\"tests\": [");

            assertThatThrownBy(() -> registry.load(source)).isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Should load alternative expected ids and a collection override")
        void shouldLoadAlternativesAndCollection() throws Exception {
            // Given: one case accepts several documents and searches its own collection
            final Path source = write("tests.json", """
                    {"tests": [
                      {"id": "multi", "query": "pasta", "expected_result_id": "doc-1",
                       "expected_result_ids": ["doc-2", "doc-1", "doc-3", "doc-2"], "collection": "recipes-v2"},
                      {"id": "plain", "query": "soup", "expected_result_id": "doc-9"}
                    ]}
                    """);

            // When
            final List<TestCase> testCases = registry.load(source);

            // Then: the expected id leads, duplicates are dropped
            final TestCase multi = testCases.get(0);
            assertThat(multi.expectedDocumentId()).isEqualTo("doc-1");
            assertThat(multi.alternativeDocumentIds()).containsExactly("doc-2", "doc-3");
            assertThat(multi.acceptedDocumentIds()).containsExactly("doc-1", "doc-2", "doc-3");
            assertThat(multi.collection()).isEqualTo("recipes-v2");
            assertThat(testCases.get(1).alternativeDocumentIds()).isEmpty();
            assertThat(testCases.get(1).collection()).isNull();
        }

        @Test
        @DisplayName("Should take the expected id from the alternatives list when it is the only one given")
        void shouldUseFirstAlternativeAsExpected() throws Exception {
            final Path source = write("tests.yaml", """
                    - id: either
                      query: ramen
                      expected_result_ids: [doc-5, doc-6]
                    """);

            final TestCase testCase = registry.load(source).get(0);

            assertThat(testCase.expectedDocumentId()).isEqualTo("doc-5");
            assertThat(testCase.alternativeDocumentIds()).containsExactly("doc-6");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject duplicate ids")
        void shouldRejectDuplicateIds() throws Exception {
            final Path source = write("tests.json", """
                    {"tests": [
                      {"id": "dup", "query": "a", "expected_result_id": "1"},
                      {"id": "other", "query": "b", "expected_result_id": "2"},
                      {"id": "dup", "query": "c", "expected_result_id": "3"}
                    ]}
                    """);

            assertThatThrownBy(() -> registry.load(source))
                    .isInstanceOf(DuplicateTestCaseException.class)
                    .satisfies(e -> assertThat(((DuplicateTestCaseException) e).getTestCaseId()).isEqualTo("dup"));
        }

        @Test
        @DisplayName("Should reject an empty source")
        void shouldRejectEmptySource() throws Exception {
            assertThatThrownBy(() -> registry.load(write("tests.json", "{\"tests\": []}")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("no test cases");
            assertThatThrownBy(() -> registry.load(write("empty.yaml", "")))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Should reject a blank query")
        void shouldRejectBlankQuery() throws Exception {
            final Path source = write("tests.json", """
                    [{"id": "t1", "query": "  ", "expected_result_id": "1"}]
                    """);

            assertThatThrownBy(() -> registry.load(source))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("query");
        }

        @Test
        @DisplayName("Should reject a missing expected document")
        void shouldRejectMissingExpectedDocument() throws Exception {
            final Path source = write("tests.json", """
                    [{"id": "t1", "query": "pasta"}]
                    """);

            assertThatThrownBy(() -> registry.load(source))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("expected_result_id");
        }

        @Test
        @DisplayName("Should reject a rank limit below one")
        void shouldRejectInvalidRank() throws Exception {
            final Path source = write("tests.json", """
                    [{"id": "t1", "query": "pasta", "expected_result_id": "1", "max_rank": 0}]
                    """);

            assertThatThrownBy(() -> registry.load(source))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("max_rank");
        }

        @Test
        @DisplayName("Should reject a blank category")
        void shouldRejectBlankCategory() throws Exception {
            final Path source = write("tests.json", """
                    [{"id": "t1", "query": "pasta", "expected_result_id": "1", "category": ""}]
                    """);

            assertThatThrownBy(() -> registry.load(source))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("category");
        }

        @Test
        @DisplayName("Should reject blank alternative ids")
        void shouldRejectBlankAlternatives() throws Exception {
            final Path source = write("tests.json", """
                    [{"id": "a", "query": "q", "expected_result_id": "1", "expected_result_ids": ["2", " "]}]
                    """);

            assertThatThrownBy(() -> registry.load(source))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("expected_result_ids");
        }

        @Test
        @DisplayName("Should reject a blank collection override")
        void shouldRejectBlankCollection() throws Exception {
            final Path source = write("tests.json", """
                    [{"id": "a", "query": "q", "expected_result_id": "1", "collection": ""}]
                    """);

            assertThatThrownBy(() -> registry.load(source))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("collection must not be empty");
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        private final List<TestCase> all = List.of(
                new TestCase("a", "q", "1", null, null, null),
                new TestCase("b", "q", "2", null, null, null),
                new TestCase("c", "q", "3", null, null, null));

        @Test
        @DisplayName("Should keep source order when selecting")
        void shouldKeepSourceOrder() {
            assertThat(TestCaseRegistry.select(all, List.of("c", "a")))
                    .extracting(TestCase::id)
                    .containsExactly("a", "c");
        }

        @Test
        @DisplayName("Should return everything for an empty selection")
        void shouldReturnAllForEmptySelection() {
            assertThat(TestCaseRegistry.select(all, List.of())).isEqualTo(all);
        }

        @Test
        @DisplayName("Should reject unknown ids")
        void shouldRejectUnknownIds() {
            assertThatThrownBy(() -> TestCaseRegistry.select(all, List.of("a", "zzz")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("zzz");
        }
    }
}
