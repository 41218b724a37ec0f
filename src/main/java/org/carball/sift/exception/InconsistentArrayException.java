package org.carball.sift.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a payload cannot be described structurally: arrays mixing objects with
 * scalars, roots that are not objects, or nesting deeper than the analysis ceiling.
 */
public class InconsistentArrayException extends SiftException {

    public InconsistentArrayException(String fieldPath, String details) {
        this(fieldPath, details, Map.of());
    }

    private InconsistentArrayException(String fieldPath, String details, Map<String, Object> extra) {
        super("INCONSISTENT_ARRAY", "analyze",
                String.format("Inconsistent structure at '%s': %s", displayPath(fieldPath), details),
                context(fieldPath, extra), null);
    }

    public static InconsistentArrayException mixedElements(String fieldPath) {
        return new InconsistentArrayException(fieldPath, "array mixes objects with scalar values");
    }

    public static InconsistentArrayException nonObjectRecord(String fieldPath, String actualType) {
        return new InconsistentArrayException(fieldPath,
                "expected an object or an array of objects but found " + actualType,
                Map.of("actualType", actualType));
    }

    public static InconsistentArrayException nestingLimitExceeded(String fieldPath, int limit) {
        return new InconsistentArrayException(fieldPath,
                "nesting exceeds the safety ceiling of " + limit + " levels",
                Map.of("maxAnalysisDepth", limit));
    }

    private static String displayPath(String fieldPath) {
        return fieldPath == null || fieldPath.isEmpty() ? "$" : fieldPath;
    }

    private static Map<String, Object> context(String fieldPath, Map<String, Object> extra) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("fieldPath", displayPath(fieldPath));
        context.putAll(extra);
        return context;
    }
}
