package org.carball.sift.model.structure;

import lombok.Builder;
import lombok.Value;

/**
 * Everything the analyzer learned about one field path across a batch of records.
 * <p>
 * {@code depth} is the number of {@code .}/{@code []} separators in the path, so top-level
 * fields sit at depth 0. {@code parentPath} names the object or array field that owns this
 * one and is {@code null} for top-level fields. For arrays, {@code itemType} is the widened
 * element type ({@code null} when only empty arrays were seen) and {@code integral} refers
 * to the numeric elements.
 */
@Value
@Builder
public class FieldProfile {
    String path;
    String name;
    String parentPath;
    int depth;
    FieldType inferredType;
    boolean nullable;
    ValuePattern pattern;
    boolean array;
    FieldType itemType;
    boolean integral;
    int occurrences;

    public boolean isTopLevel() {
        return parentPath == null;
    }

    public boolean isArrayOfObjects() {
        return inferredType == FieldType.ARRAY && itemType == FieldType.OBJECT;
    }

    /**
     * Arrays whose elements can be laid out as rows: objects, scalars, or scalars of
     * differing types. Arrays of arrays and arrays never seen with an element are not.
     */
    public boolean isTabularArray() {
        return inferredType == FieldType.ARRAY && itemType != null && itemType != FieldType.ARRAY;
    }

    /**
     * The path with a marker for how the field is laid out: {@code {}} for an object,
     * {@code [{}]} for a tabular array of objects, {@code []} for a tabular array of
     * scalars, nothing for a column.
     */
    public String getShapePath() {
        if (inferredType == FieldType.OBJECT) {
            return path + "{}";
        }
        if (isTabularArray()) {
            return path + (itemType == FieldType.OBJECT ? "[{}]" : "[]");
        }
        return path;
    }
}
