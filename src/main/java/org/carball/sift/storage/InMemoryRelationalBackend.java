package org.carball.sift.storage;

import lombok.extern.slf4j.Slf4j;
import org.carball.sift.exception.BackendApplyException;
import org.carball.sift.exception.BackendInsertException;
import org.carball.sift.model.decision.StorageLocation;
import org.carball.sift.model.decision.StorageType;
import org.carball.sift.model.schema.Column;
import org.carball.sift.model.schema.RelationalSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Relational backend holding tables in memory. All DDL for a schema is rendered and
 * validated before any table is created, so a schema that cannot be rendered leaves
 * nothing behind.
 */
@Slf4j
public class InMemoryRelationalBackend implements RelationalBackend {

    public static final String NAME = "memory-sql";

    private final SqlDdlRenderer ddlRenderer;
    private final ConcurrentMap<String, Table> tables = new ConcurrentHashMap<>();
    private final List<String> appliedDdl = new CopyOnWriteArrayList<>();

    public InMemoryRelationalBackend() {
        this(new SqlDdlRenderer());
    }

    public InMemoryRelationalBackend(SqlDdlRenderer ddlRenderer) {
        this.ddlRenderer = ddlRenderer;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public StorageLocation apply(RelationalSchema schema) {
        List<String> statements;
        try {
            statements = ddlRenderer.render(schema);
        } catch (IllegalStateException e) {
            throw new BackendApplyException(NAME, schema.getTableName(), e.getMessage(), e);
        }

        List<RelationalSchema> all = schema.getAllTables();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            RelationalSchema table = all.get(i);
            String ddl = statements.get(i);
            tables.computeIfAbsent(table.getTableName(), name -> {
                appliedDdl.add(ddl);
                log.info("Created table {}", name);
                return new Table(table.getColumns());
            });
            names.add(table.getTableName());
        }

        return new StorageLocation(StorageType.SQL, NAME, "memory://sql/" + schema.getTableName(),
                Collections.unmodifiableList(names), 0);
    }

    @Override
    public void insert(String tableName, List<Map<String, Object>> rows) {
        Table table = tables.get(tableName);
        if (table == null) {
            throw new BackendInsertException(NAME, tableName, "table does not exist");
        }

        for (Map<String, Object> row : rows) {
            Set<String> unknown = new TreeSet<>(row.keySet());
            unknown.removeAll(table.columns);
            if (!unknown.isEmpty()) {
                throw new BackendInsertException(NAME, tableName, "unknown column(s) " + unknown);
            }
        }

        table.insert(tableName, rows);
        log.debug("Inserted {} row(s) into {}", rows.size(), tableName);
    }

    public boolean hasTable(String tableName) {
        return tables.containsKey(tableName);
    }

    public Set<String> getTableNames() {
        return new TreeSet<>(tables.keySet());
    }

    public List<Map<String, Object>> rows(String tableName) {
        Table table = tables.get(tableName);
        return table == null ? List.of() : List.copyOf(table.rows);
    }

    public List<String> getAppliedDdl() {
        return List.copyOf(appliedDdl);
    }

    /**
     * Rows of one table. A batch is written only if none of its primary keys is missing,
     * repeated within the batch, or already stored.
     */
    private static final class Table {
        private final Set<String> columns = new LinkedHashSet<>();
        private final List<Map<String, Object>> rows = new CopyOnWriteArrayList<>();
        private final Set<Object> keys = new HashSet<>();
        private String primaryKey;

        Table(List<Column> definition) {
            for (Column column : definition) {
                columns.add(column.getName());
                if (column.isPrimaryKey()) {
                    primaryKey = column.getName();
                }
            }
        }

        synchronized void insert(String tableName, List<Map<String, Object>> batch) {
            if (primaryKey != null) {
                Set<Object> batchKeys = new HashSet<>();
                for (Map<String, Object> row : batch) {
                    Object key = row.get(primaryKey);
                    if (key == null) {
                        throw new BackendInsertException(NAME, tableName,
                                "null value for primary key " + primaryKey);
                    }
                    if (keys.contains(key) || !batchKeys.add(key)) {
                        throw new BackendInsertException(NAME, tableName,
                                "duplicate primary key " + primaryKey + "=" + key);
                    }
                }
                keys.addAll(batchKeys);
            }
            rows.addAll(batch);
        }
    }
}
