package org.carball.sift.exception;

import java.util.Map;

/**
 * Thrown when a storage backend cannot create the table(s) or collection for a schema.
 */
public class BackendApplyException extends SiftException {

    private final String backend;

    public BackendApplyException(String backend, String target, String details, Throwable cause) {
        super("BACKEND_APPLY_FAILED", "applySchema",
                String.format("Backend %s failed to apply %s: %s", backend, target, details),
                Map.of("backend", backend, "target", target), cause);
        this.backend = backend;
    }

    public BackendApplyException(String backend, String target, String details) {
        this(backend, target, details, null);
    }

    public static BackendApplyException exhausted(String backend, String target, int attempts,
                                                  Throwable last) {
        return new BackendApplyException(backend, target,
                "giving up after " + attempts + " attempts", last);
    }

    public String getBackend() {
        return backend;
    }
}
