package org.carball.sift.model.index;

import org.carball.sift.model.decision.StorageType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The caller-supplied part of an index entry; the indexer adds the id and timestamp.
 */
public record IngestionDetails(
        String filename,
        IngestionKind kind,
        String categoryOrSchema,
        StorageType storageType,
        String storageLocation,
        String mimeType,
        String extractedText,
        Map<String, Object> metadata
) {

    public static IngestionDetails media(String filename, String mimeType, String category, String storagePath) {
        return new IngestionDetails(filename, IngestionKind.MEDIA, category, null, storagePath, mimeType, null, null);
    }

    public static IngestionDetails document(String filename, String mimeType, String category,
                                            String storagePath, String text) {
        return new IngestionDetails(filename, IngestionKind.DOCUMENT, category, null, storagePath, mimeType, text, null);
    }

    public static IngestionDetails json(String filename, String schemaName, StorageType storageType,
                                        String storageLocation) {
        return new IngestionDetails(filename, IngestionKind.JSON, schemaName, storageType, storageLocation,
                "application/json", null, null);
    }

    /**
     * A copy carrying descriptive facts about the item, such as image dimensions or the
     * shape of a JSON payload.
     */
    public IngestionDetails withMetadata(Map<String, Object> facts) {
        return new IngestionDetails(filename, kind, categoryOrSchema, storageType, storageLocation,
                mimeType, extractedText, facts == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(facts)));
    }

    public IndexEntry toEntry(long id, Instant createdAt) {
        return new IndexEntry(id, filename, kind, categoryOrSchema, storageType, storageLocation,
                mimeType, extractedText, metadata, createdAt);
    }
}
