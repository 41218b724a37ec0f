package org.carball.sift.model.structure;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic shapes recognised in string values, in detection priority order.
 */
public enum ValuePattern {
    UUID,
    EMAIL,
    URL,
    DATETIME,
    NUMERIC_ID;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
