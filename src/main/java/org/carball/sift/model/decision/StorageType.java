package org.carball.sift.model.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StorageType {
    SQL("sql"),
    NOSQL("nosql");

    private final String label;

    StorageType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static StorageType fromLabel(String label) {
        for (StorageType type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown storage type: " + label);
    }
}
