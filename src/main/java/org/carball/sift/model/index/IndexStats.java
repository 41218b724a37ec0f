package org.carball.sift.model.index;

import java.util.Map;
import java.util.SortedSet;

public record IndexStats(
        Map<IngestionKind, Long> countsByKind,
        SortedSet<String> categories,
        SortedSet<String> schemaNames
) {

    public long count(IngestionKind kind) {
        return countsByKind.getOrDefault(kind, 0L);
    }

    public long total() {
        return countsByKind.values().stream().mapToLong(Long::longValue).sum();
    }
}
