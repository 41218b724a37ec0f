package org.carball.sift.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.ingest.IngestionResult;
import org.carball.sift.model.decision.DecisionReasoning;
import org.carball.sift.model.index.IndexStats;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Summary of one ingestion run in JSON or Markdown.
 */
@Slf4j
public class IngestionReport {

    private final List<IngestionResult> results;
    private final IndexStats stats;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public IngestionReport(List<IngestionResult> results, IndexStats stats) {
        this.results = results;
        this.stats = stats;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(new ReportData(
                    timestamp, succeeded(), failed(), results, stats));
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Ingestion Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Uploads:** ").append(results.size())
                .append(" (").append(succeeded()).append(" succeeded, ")
                .append(failed()).append(" failed)  \n\n");

        md.append("## Uploads\n\n");
        if (results.isEmpty()) {
            md.append("_No uploads processed._\n\n");
        } else {
            md.append("| File | Status | Kind | Category / Schema | Location | Index Id |\n");
            md.append("|------|--------|------|-------------------|----------|----------|\n");
            for (IngestionResult result : results) {
                md.append("| ").append(result.getFilename())
                        .append(" | ").append(result.isSuccess() ? "✅ success" : "❌ error")
                        .append(" | ").append(result.getKind() == null ? "-" : result.getKind().label())
                        .append(" | ").append(orDash(result.getCategoryOrSchema()))
                        .append(" | ").append(orDash(result.getLocation()))
                        .append(" | ").append(result.getIndexId() == null ? "-" : result.getIndexId())
                        .append(" |\n");
            }
            md.append("\n");
        }

        List<IngestionResult> decisions = results.stream()
                .filter(r -> r.getDecision() != null)
                .collect(Collectors.toList());
        if (!decisions.isEmpty()) {
            md.append("## Storage Decisions\n\n");
            md.append("| Schema | Storage | Consistency | Depth | Fields | Records |\n");
            md.append("|--------|---------|-------------|-------|--------|---------|\n");
            for (IngestionResult result : decisions) {
                DecisionReasoning reasoning = result.getDecision().getReasoning();
                md.append("| ").append(result.getDecision().getSchemaName())
                        .append(" | ").append(result.getDecision().getStorageType().getLabel())
                        .append(" | ").append(String.format("%.2f", reasoning.consistency()))
                        .append(" | ").append(reasoning.nestingDepth())
                        .append(" | ").append(reasoning.fieldCount())
                        .append(" | ").append(result.getRecordsWritten())
                        .append(" |\n");
            }
            md.append("\n");
        }

        List<IngestionResult> failures = results.stream()
                .filter(r -> !r.isSuccess())
                .collect(Collectors.toList());
        if (!failures.isEmpty()) {
            md.append("## Failures\n\n");
            for (IngestionResult failure : failures) {
                md.append("- **").append(failure.getFilename()).append("** `")
                        .append(failure.getErrorCode()).append("`: ")
                        .append(failure.getError()).append("\n");
            }
            md.append("\n");
        }

        if (stats != null) {
            md.append(IndexReport.statsMarkdown(stats));
        }

        return md.toString();
    }

    private long succeeded() {
        return results.stream().filter(IngestionResult::isSuccess).count();
    }

    private long failed() {
        return results.size() - succeeded();
    }

    private static String orDash(Object value) {
        return value == null ? "-" : value.toString();
    }

    private record ReportData(
            LocalDateTime generatedAt,
            long succeeded,
            long failed,
            List<IngestionResult> results,
            IndexStats index
    ) {}
}
