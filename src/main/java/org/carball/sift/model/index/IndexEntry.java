package org.carball.sift.model.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.carball.sift.model.decision.StorageType;

import java.time.Instant;
import java.util.Map;

/**
 * One searchable record describing an ingested item. Ids are assigned by the
 * metadata indexer and are unique and strictly increasing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexEntry(
        long id,
        String filename,
        IngestionKind kind,
        String categoryOrSchema,
        StorageType storageType,
        String storageLocation,
        String mimeType,
        String extractedText,
        Map<String, Object> metadata,
        Instant createdAt
) {}
