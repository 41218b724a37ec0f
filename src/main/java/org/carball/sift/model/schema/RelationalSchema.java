package org.carball.sift.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.carball.sift.model.decision.StorageType;

import java.util.ArrayList;
import java.util.List;

/**
 * A table plus the tables nested beneath it. The root table has no {@code parentField};
 * every nested table carries the JSON key it was derived from, whether that key held an
 * array (one-to-many) or a single object (one-to-one), and a foreign key column pointing
 * at its parent's primary key.
 * <p>
 * {@code scalarValues} marks a table synthesized for an array of scalars; its elements
 * are stored in the {@code value} column.
 */
@Value
@Builder
public class RelationalSchema implements StorageSchema {
    public static final String SYNTHETIC_KEY = "id";
    public static final String PARENT_KEY = "parent_id";
    public static final String VALUE_COLUMN = "value";

    String tableName;
    String primaryKey;
    List<Column> columns;
    List<RelationalSchema> nestedTables;
    List<Relationship> relationships;
    String parentField;
    String sourcePath;
    boolean array;
    boolean scalarValues;

    @Override
    @JsonIgnore
    public String getName() {
        return tableName;
    }

    @Override
    @JsonIgnore
    public StorageType getStorageType() {
        return StorageType.SQL;
    }

    public Column findColumn(String name) {
        return columns.stream()
                .filter(c -> c.getName().equals(name))
                .findFirst()
                .orElse(null);
    }

    @JsonIgnore
    public Column getPrimaryKeyColumn() {
        return findColumn(primaryKey);
    }

    /**
     * This table and every nested table, parents before children.
     */
    @JsonIgnore
    public List<RelationalSchema> getAllTables() {
        List<RelationalSchema> tables = new ArrayList<>();
        collect(this, tables);
        return tables;
    }

    @JsonIgnore
    public List<Relationship> getAllRelationships() {
        List<Relationship> all = new ArrayList<>();
        for (RelationalSchema table : getAllTables()) {
            all.addAll(table.getRelationships());
        }
        return all;
    }

    public RelationalSchema findTable(String name) {
        return getAllTables().stream()
                .filter(t -> t.getTableName().equalsIgnoreCase(name))
                .findFirst()
                .orElse(null);
    }

    private static void collect(RelationalSchema table, List<RelationalSchema> out) {
        out.add(table);
        for (RelationalSchema nested : table.getNestedTables()) {
            collect(nested, out);
        }
    }
}
