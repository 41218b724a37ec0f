package org.carball.sift.exception;

import java.util.Map;

/**
 * Thrown when a schema was applied but writing the records failed. The schema stays
 * applied so a later retry of the insert can reuse it.
 */
public class BackendInsertException extends SiftException {

    public BackendInsertException(String backend, String target, int recordCount, Throwable cause) {
        super("BACKEND_INSERT_FAILED", "insert",
                String.format("Backend %s failed to write %d record(s) into %s", backend, recordCount, target),
                Map.of("backend", backend, "target", target, "recordCount", recordCount), cause);
    }

    public BackendInsertException(String backend, String target, String details) {
        super("BACKEND_INSERT_FAILED", "insert",
                String.format("Backend %s rejected write into %s: %s", backend, target, details),
                Map.of("backend", backend, "target", target), null);
    }
}
