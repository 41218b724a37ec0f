package org.carball.sift.storage;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.sift.model.schema.Column;
import org.carball.sift.model.schema.RelationalSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits JSON records into rows for each table of a {@link RelationalSchema}.
 * <p>
 * Rows come back grouped by table, parent tables first, so inserting the groups in
 * iteration order never writes a child before its parent.
 */
public class RowShredder {

    private final KeyAllocator keyAllocator;

    public RowShredder(KeyAllocator keyAllocator) {
        this.keyAllocator = keyAllocator;
    }

    public Map<String, List<Map<String, Object>>> shred(RelationalSchema schema, List<JsonNode> records) {
        Map<String, List<Map<String, Object>>> rows = new LinkedHashMap<>();
        for (RelationalSchema table : schema.getAllTables()) {
            rows.put(table.getTableName(), new ArrayList<>());
        }

        for (JsonNode record : records) {
            shredObject(schema, record, null, rows);
        }
        return rows;
    }

    private void shredObject(RelationalSchema table, JsonNode object, Object parentId,
                             Map<String, List<Map<String, Object>>> rows) {
        Map<String, Object> row = new LinkedHashMap<>();
        Column primaryKey = table.getPrimaryKeyColumn();

        Object id = keyAllocator.next(table.getTableName());
        row.put(primaryKey.getName(), id);

        for (Column column : table.getColumns()) {
            if (column.isPrimaryKey()) {
                continue;
            }
            if (column.isForeignKey()) {
                row.put(column.getName(), parentId);
            } else if (column.getSourceField() != null) {
                row.put(column.getName(), toColumnValue(object.get(column.getSourceField()), column));
            }
        }
        rows.get(table.getTableName()).add(row);

        for (RelationalSchema nested : table.getNestedTables()) {
            JsonNode value = object.get(nested.getParentField());
            if (value == null || value.isNull()) {
                continue;
            }

            if (nested.isScalarValues()) {
                if (value.isArray()) {
                    shredScalars(nested, value, id, rows);
                }
            } else if (nested.isArray()) {
                if (value.isArray()) {
                    for (JsonNode element : value) {
                        if (element.isObject()) {
                            shredObject(nested, element, id, rows);
                        }
                    }
                }
            } else if (value.isObject()) {
                shredObject(nested, value, id, rows);
            }
        }
    }

    private void shredScalars(RelationalSchema table, JsonNode array, Object parentId,
                              Map<String, List<Map<String, Object>>> rows) {
        Column valueColumn = table.findColumn(RelationalSchema.VALUE_COLUMN);
        String parentColumn = foreignKeyName(table);

        for (JsonNode element : array) {
            if (element.isNull()) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(table.getPrimaryKey(), keyAllocator.next(table.getTableName()));
            row.put(parentColumn, parentId);
            row.put(valueColumn.getName(), toColumnValue(element, valueColumn));
            rows.get(table.getTableName()).add(row);
        }
    }

    private String foreignKeyName(RelationalSchema table) {
        return table.getColumns().stream()
                .filter(Column::isForeignKey)
                .map(Column::getName)
                .findFirst()
                .orElse(RelationalSchema.PARENT_KEY);
    }

    Object toColumnValue(JsonNode value, Column column) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (column.isTextualFallback()) {
            return asText(value);
        }

        switch (column.getDataType()) {
            case BIGINT:
                if (value.isIntegralNumber()) {
                    return value.canConvertToLong() ? (Object) value.longValue() : value.bigIntegerValue();
                }
                return asText(value);
            case NUMERIC:
                return value.isNumber() ? value.decimalValue() : asText(value);
            case BOOLEAN:
                return value.isBoolean() ? value.booleanValue() : asText(value);
            case TEXT:
            default:
                return asText(value);
        }
    }

    private String asText(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
