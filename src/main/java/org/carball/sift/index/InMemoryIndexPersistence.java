package org.carball.sift.index;

import org.carball.sift.model.index.IndexEntry;
import org.carball.sift.model.index.IndexFilter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryIndexPersistence implements IndexPersistence {

    private final List<IndexEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public long nextId() {
        return entries.stream().mapToLong(IndexEntry::id).max().orElse(0L) + 1;
    }

    @Override
    public void append(IndexEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<IndexEntry> query(IndexFilter filter) {
        return entries.stream()
                .filter(filter::matches)
                .collect(Collectors.toList());
    }

    @Override
    public String describe() {
        return "memory";
    }
}
