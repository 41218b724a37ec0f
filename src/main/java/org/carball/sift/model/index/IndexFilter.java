package org.carball.sift.model.index;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Search criteria over the metadata index. Unset criteria match everything; a
 * {@code limit} of zero or less means unlimited.
 */
@Value
@Builder(toBuilder = true)
public class IndexFilter {
    public static final int DEFAULT_LIMIT = 20;

    IngestionKind kind;
    String categoryOrSchema;
    String text;
    @Builder.Default
    int limit = DEFAULT_LIMIT;

    public static IndexFilter all() {
        return IndexFilter.builder().limit(0).build();
    }

    public boolean matches(IndexEntry entry) {
        if (kind != null && entry.kind() != kind) {
            return false;
        }
        if (categoryOrSchema != null && !categoryOrSchema.equals(entry.categoryOrSchema())) {
            return false;
        }
        if (text != null && !text.isBlank()) {
            String needle = text.toLowerCase(Locale.ROOT);
            return contains(entry.filename(), needle) || contains(entry.extractedText(), needle);
        }
        return true;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
