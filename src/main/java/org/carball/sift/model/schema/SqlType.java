package org.carball.sift.model.schema;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SqlType {
    BIGINT("BIGINT"),
    NUMERIC("NUMERIC"),
    BOOLEAN("BOOLEAN"),
    TEXT("TEXT");

    private final String ddl;

    SqlType(String ddl) {
        this.ddl = ddl;
    }

    @JsonValue
    public String getDdl() {
        return ddl;
    }
}
