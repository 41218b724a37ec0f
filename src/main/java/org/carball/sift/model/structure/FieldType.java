package org.carball.sift.model.structure;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Closed set of type tags inferred for a field path.
 * <p>
 * Widening is deterministic: {@code NULL} is absorbed by any other tag (nullability is
 * tracked separately on the profile), equal tags stay as they are, and any two distinct
 * concrete tags combine to {@code MIXED}.
 */
public enum FieldType {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    OBJECT,
    ARRAY,
    MIXED;

    public static FieldType of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isObject()) {
            return OBJECT;
        }
        if (node.isArray()) {
            return ARRAY;
        }
        if (node.isBoolean()) {
            return BOOLEAN;
        }
        if (node.isNumber()) {
            return NUMBER;
        }
        return STRING;
    }

    public FieldType widen(FieldType other) {
        if (other == null || other == this || other == NULL) {
            return this;
        }
        if (this == NULL) {
            return other;
        }
        return MIXED;
    }

    public boolean isScalar() {
        return this == STRING || this == NUMBER || this == BOOLEAN || this == NULL;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
