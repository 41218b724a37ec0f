package org.carball.sift.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for every failure raised by the analysis, decision, storage and
 * indexing pipeline. Carries a stable error code, the operation that failed and the
 * structured context (field paths, thresholds, backend names) needed to debug it.
 */
public class SiftException extends RuntimeException {

    private final String errorCode;
    private final String operation;
    private final Map<String, Object> context;

    public SiftException(String errorCode, String operation, String message) {
        this(errorCode, operation, message, Map.of(), null);
    }

    public SiftException(String errorCode, String operation, String message,
                         Map<String, ?> context, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, message), cause);
        this.errorCode = errorCode;
        this.operation = operation;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public String getStructuredMessage() {
        return String.format("Sift Error - Code: %s, Operation: %s, Context: %s, Details: %s",
                errorCode, operation, context, getMessage());
    }
}
