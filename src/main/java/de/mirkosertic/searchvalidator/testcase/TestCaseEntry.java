package de.mirkosertic.searchvalidator.testcase;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw, unvalidated test case as it appears in a JSON or YAML source.
 * Accepts both the snake_case keys written by the dashboard's test manager and camelCase keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestCaseEntry(
        @JsonProperty("id")
        String id,

        @JsonProperty("query")
        @JsonAlias({"queryText", "query_text"})
        String queryText,

        @JsonProperty("expected_result_id")
        @JsonAlias({"expectedDocumentId", "expected_document_id"})
        String expectedDocumentId,

        @JsonProperty("expected_result_ids")
        @JsonAlias({"expectedResultIds", "alternativeDocumentIds", "alternative_document_ids"})
        List<String> alternativeDocumentIds,

        @JsonProperty("category")
        String category,

        @JsonProperty("max_rank")
        @JsonAlias({"maxAllowedRank", "max_allowed_rank"})
        Integer maxAllowedRank,

        @JsonProperty("min_score")
        @JsonAlias({"minScoreThreshold", "min_score_threshold"})
        Double minScoreThreshold,

        @JsonProperty("collection")
        String collection,

        @JsonProperty("name")
        String name,

        @JsonProperty("description")
        String description
) {
}
