package org.carball.sift.exception;

import java.util.Map;

/**
 * Thrown when the metadata index cannot be read or written.
 */
public class IndexPersistenceException extends SiftException {

    public IndexPersistenceException(String operation, String location, Throwable cause) {
        super("INDEX_PERSISTENCE_FAILED", operation,
                String.format("Index store %s failed: %s", location, cause.getMessage()),
                Map.of("location", location), cause);
    }
}
