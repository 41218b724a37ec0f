package org.carball.sift.output;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.sift.SiftEngine;
import org.carball.sift.TestJson;
import org.carball.sift.exception.UnsupportedContentException;
import org.carball.sift.ingest.IngestionResult;
import org.carball.sift.model.decision.SchemaDecision;
import org.carball.sift.model.index.IndexStats;
import org.carball.sift.model.index.IngestionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

public class IngestionReportTest {

    private List<IngestionResult> results;
    private IndexStats stats;
    private SchemaDecision decision;

    @BeforeEach
    void setUp() {
        decision = SiftEngine.builder().build()
                .analyzeAndDecide(TestJson.parse("[{\"id\":1,\"name\":\"a\"},{\"id\":2,\"name\":\"b\"}]"));

        IngestionResult json = IngestionResult.builder()
                .status(IngestionResult.SUCCESS)
                .filename("people.json")
                .kind(IngestionKind.JSON)
                .fileType("JSON")
                .mimeType("application/json")
                .categoryOrSchema(decision.getSchemaName())
                .location("memory://sql/" + decision.getSchemaName())
                .indexId(1L)
                .decision(decision)
                .recordsWritten(2)
                .build();
        IngestionResult media = IngestionResult.builder()
                .status(IngestionResult.SUCCESS)
                .filename("cat.jpg")
                .kind(IngestionKind.MEDIA)
                .categoryOrSchema("animals")
                .location("storage/animals/cat.jpg")
                .indexId(2L)
                .build();
        IngestionResult failure = IngestionResult.failure("bundle.zip",
                new UnsupportedContentException("bundle.zip", "application/zip"));
        results = List.of(json, media, failure);

        stats = new IndexStats(
                Map.of(IngestionKind.MEDIA, 1L, IngestionKind.DOCUMENT, 0L, IngestionKind.JSON, 1L),
                new TreeSet<>(List.of("animals")),
                new TreeSet<>(List.of(decision.getSchemaName())));
    }

    @Test
    void shouldGenerateJsonReport() throws Exception {
        // Given
        IngestionReport report = new IngestionReport(results, stats);

        // When
        JsonNode json = TestJson.mapper().readTree(report.toJson());

        // Then
        assertThat(json.has("generatedAt")).isTrue();
        assertThat(json.get("succeeded").asInt()).isEqualTo(2);
        assertThat(json.get("failed").asInt()).isEqualTo(1);
        assertThat(json.get("results")).hasSize(3);

        JsonNode first = json.get("results").get(0);
        assertThat(first.get("kind").asText()).isEqualTo("json");
        assertThat(first.get("decision").get("storageType").asText()).isEqualTo("sql");
        assertThat(first.get("decision").get("reasoning").get("fieldCount").asInt()).isEqualTo(2);
        assertThat(first.get("decision").has("descriptor")).isFalse();

        JsonNode failed = json.get("results").get(2);
        assertThat(failed.get("status").asText()).isEqualTo("error");
        assertThat(failed.get("errorCode").asText()).isEqualTo("UNSUPPORTED_CONTENT");
        assertThat(failed.has("indexId")).isFalse();

        assertThat(json.get("index").get("schemaNames").get(0).asText()).isEqualTo(decision.getSchemaName());
    }

    @Test
    void shouldGenerateMarkdownReport() {
        // Given
        IngestionReport report = new IngestionReport(results, stats);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).contains("# Ingestion Report");
        assertThat(markdown).contains("**Uploads:** 3 (2 succeeded, 1 failed)");
        assertThat(markdown).contains("## Uploads");
        assertThat(markdown).contains("| cat.jpg | ✅ success | media | animals | storage/animals/cat.jpg | 2 |");
        assertThat(markdown).contains("## Storage Decisions");
        assertThat(markdown).contains("| " + decision.getSchemaName() + " | sql | ");
        assertThat(markdown).contains("## Failures");
        assertThat(markdown).contains("- **bundle.zip** `UNSUPPORTED_CONTENT`");
        assertThat(markdown).contains("## Index Statistics");
        assertThat(markdown).contains("**Categories:** animals");
    }

    @Test
    void shouldHandleEmptyRun() {
        // Given
        IngestionReport report = new IngestionReport(List.of(), null);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).contains("_No uploads processed._");
        assertThat(markdown).doesNotContain("## Storage Decisions", "## Failures", "## Index Statistics");
    }
}
