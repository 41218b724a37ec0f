package org.carball.sift.index;

import lombok.extern.slf4j.Slf4j;
import org.carball.sift.exception.IndexPersistenceException;
import org.carball.sift.model.index.IndexEntry;
import org.carball.sift.model.index.IndexFilter;
import org.carball.sift.model.index.IndexStats;
import org.carball.sift.model.index.IngestionDetails;
import org.carball.sift.model.index.IngestionKind;
import org.carball.sift.storage.RetryPolicy;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Records one index entry per ingested item and answers searches over them.
 * <p>
 * Ids are taken from a counter seeded from the persistence layer and advanced under a
 * lock, so they are unique and strictly increasing across concurrent callers. The lock
 * covers only the increment; the write to persistence happens after it is released.
 * An id whose write ultimately fails is not reused.
 */
@Slf4j
public class MetadataIndexer {

    private final IndexPersistence persistence;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final ReentrantLock idLock = new ReentrantLock();
    private long lastId;

    public MetadataIndexer(IndexPersistence persistence) {
        this(persistence, Clock.systemUTC(), RetryPolicy.defaults());
    }

    public MetadataIndexer(IndexPersistence persistence, Clock clock, RetryPolicy retryPolicy) {
        this.persistence = persistence;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        try {
            this.lastId = persistence.nextId() - 1;
        } catch (IOException e) {
            throw new IndexPersistenceException("open", persistence.describe(), e);
        }
    }

    public long record(IngestionDetails details) {
        long id;
        idLock.lock();
        try {
            id = ++lastId;
        } finally {
            idLock.unlock();
        }

        IndexEntry entry = details.toEntry(id, clock.instant());
        retryPolicy.execute("Index entry " + id, IndexPersistenceException.class, () -> {
            append(entry);
            return entry;
        });

        log.info("Indexed {} #{} ({}: {})", entry.filename(), id, entry.kind().label(), entry.categoryOrSchema());
        return id;
    }

    /**
     * Entries matching the filter, newest first, capped at the filter's limit.
     */
    public List<IndexEntry> search(IndexFilter filter) {
        List<IndexEntry> sorted = query(filter).stream()
                .sorted(Comparator.comparingLong(IndexEntry::id).reversed())
                .collect(Collectors.toList());
        if (filter.getLimit() > 0 && sorted.size() > filter.getLimit()) {
            return List.copyOf(sorted.subList(0, filter.getLimit()));
        }
        return Collections.unmodifiableList(sorted);
    }

    public IndexStats stats() {
        Map<IngestionKind, Long> counts = new EnumMap<>(IngestionKind.class);
        for (IngestionKind kind : IngestionKind.values()) {
            counts.put(kind, 0L);
        }
        SortedSet<String> categories = new TreeSet<>();
        SortedSet<String> schemaNames = new TreeSet<>();

        for (IndexEntry entry : query(IndexFilter.all())) {
            counts.merge(entry.kind(), 1L, Long::sum);
            if (entry.categoryOrSchema() == null) {
                continue;
            }
            if (entry.kind() == IngestionKind.JSON) {
                schemaNames.add(entry.categoryOrSchema());
            } else {
                categories.add(entry.categoryOrSchema());
            }
        }

        return new IndexStats(Collections.unmodifiableMap(counts),
                Collections.unmodifiableSortedSet(categories),
                Collections.unmodifiableSortedSet(schemaNames));
    }

    private void append(IndexEntry entry) {
        try {
            persistence.append(entry);
        } catch (IOException e) {
            throw new IndexPersistenceException("append", persistence.describe(), e);
        }
    }

    private List<IndexEntry> query(IndexFilter filter) {
        try {
            return persistence.query(filter);
        } catch (IOException e) {
            throw new IndexPersistenceException("query", persistence.describe(), e);
        }
    }
}
