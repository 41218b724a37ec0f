package org.carball.sift.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.model.index.IndexEntry;
import org.carball.sift.model.index.IndexStats;
import org.carball.sift.model.index.IngestionKind;

import java.util.List;

/**
 * Renders search results and index statistics.
 */
@Slf4j
public class IndexReport {

    private final ObjectMapper objectMapper;

    public IndexReport() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Error generating JSON output", e);
            throw new RuntimeException("Failed to generate JSON output", e);
        }
    }

    public String searchMarkdown(List<IndexEntry> entries) {
        StringBuilder md = new StringBuilder();
        md.append("# Search Results\n\n");
        if (entries.isEmpty()) {
            md.append("_No matching entries._\n");
            return md.toString();
        }

        md.append("| Id | File | Kind | Category / Schema | Storage | Location | Created |\n");
        md.append("|----|------|------|-------------------|---------|----------|---------|\n");
        for (IndexEntry entry : entries) {
            md.append("| ").append(entry.id())
                    .append(" | ").append(entry.filename())
                    .append(" | ").append(entry.kind().label())
                    .append(" | ").append(entry.categoryOrSchema())
                    .append(" | ").append(entry.storageType() == null ? "-" : entry.storageType().getLabel())
                    .append(" | ").append(entry.storageLocation())
                    .append(" | ").append(entry.createdAt())
                    .append(" |\n");
        }
        return md.toString();
    }

    public static String statsMarkdown(IndexStats stats) {
        StringBuilder md = new StringBuilder();
        md.append("## Index Statistics\n\n");
        md.append("| Kind | Entries |\n");
        md.append("|------|---------|\n");
        for (IngestionKind kind : IngestionKind.values()) {
            md.append("| ").append(kind.label()).append(" | ").append(stats.count(kind)).append(" |\n");
        }
        md.append("| **total** | ").append(stats.total()).append(" |\n\n");

        md.append("**Categories:** ")
                .append(stats.categories().isEmpty() ? "none" : String.join(", ", stats.categories()))
                .append("  \n");
        md.append("**Schemas:** ")
                .append(stats.schemaNames().isEmpty() ? "none" : String.join(", ", stats.schemaNames()))
                .append("\n");
        return md.toString();
    }
}
