package org.carball.sift.index;

import org.carball.sift.model.index.IndexEntry;
import org.carball.sift.model.index.IndexFilter;

import java.io.IOException;
import java.util.List;

/**
 * Durable storage behind the metadata index.
 */
public interface IndexPersistence {

    /**
     * The id the next entry would get if none were handed out in memory: one more than
     * the largest stored id, or 1 for an empty store.
     */
    long nextId() throws IOException;

    void append(IndexEntry entry) throws IOException;

    /**
     * All stored entries matching the filter's criteria, in no particular order. The
     * filter's limit is ignored.
     */
    List<IndexEntry> query(IndexFilter filter) throws IOException;

    String describe();
}
