package org.carball.sift.output;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.sift.TestJson;
import org.carball.sift.model.decision.StorageType;
import org.carball.sift.model.index.IndexEntry;
import org.carball.sift.model.index.IndexStats;
import org.carball.sift.model.index.IngestionDetails;
import org.carball.sift.model.index.IngestionKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

public class IndexReportTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T12:00:00Z");

    private final IndexReport report = new IndexReport();

    @Test
    void shouldRenderSearchResultsTable() {
        // Given
        List<IndexEntry> entries = List.of(
                IngestionDetails.json("a.json", "json_data_x", StorageType.SQL, "memory://sql/json_data_x")
                        .toEntry(2, CREATED),
                IngestionDetails.media("cat.jpg", "image/jpeg", "animals", "storage/animals/cat.jpg")
                        .toEntry(1, CREATED));

        // When
        String markdown = report.searchMarkdown(entries);

        // Then
        assertThat(markdown).startsWith("# Search Results");
        assertThat(markdown).contains("| 2 | a.json | json | json_data_x | sql | memory://sql/json_data_x | 2024-05-01T12:00:00Z |");
        assertThat(markdown).contains("| 1 | cat.jpg | media | animals | - | storage/animals/cat.jpg |");
    }

    @Test
    void shouldSayWhenNothingMatched() {
        assertThat(report.searchMarkdown(List.of())).contains("_No matching entries._");
    }

    @Test
    void shouldSerializeEntriesWithIsoTimestamps() throws Exception {
        // Given
        IndexEntry entry = IngestionDetails.media("cat.jpg", "image/jpeg", "animals", "p").toEntry(1, CREATED);

        // When
        JsonNode json = TestJson.mapper().readTree(report.toJson(List.of(entry)));

        // Then
        assertThat(json.get(0).get("createdAt").asText()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(json.get(0).get("kind").asText()).isEqualTo("media");
        assertThat(json.get(0).has("storageType")).isFalse();
    }

    @Test
    void shouldRenderStatistics() {
        // Given
        IndexStats stats = new IndexStats(
                Map.of(IngestionKind.MEDIA, 2L, IngestionKind.DOCUMENT, 1L, IngestionKind.JSON, 0L),
                new TreeSet<>(List.of("animals", "food")),
                new TreeSet<>());

        // When
        String markdown = IndexReport.statsMarkdown(stats);

        // Then
        assertThat(markdown).contains("| media | 2 |", "| document | 1 |", "| json | 0 |", "| **total** | 3 |");
        assertThat(markdown).contains("**Categories:** animals, food");
        assertThat(markdown).contains("**Schemas:** none");
    }
}
