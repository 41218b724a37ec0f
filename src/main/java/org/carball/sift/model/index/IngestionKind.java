package org.carball.sift.model.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IngestionKind {
    MEDIA,
    DOCUMENT,
    JSON;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IngestionKind fromLabel(String label) {
        return IngestionKind.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
