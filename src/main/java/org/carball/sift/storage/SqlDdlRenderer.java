package org.carball.sift.storage;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import org.carball.sift.model.schema.Column;
import org.carball.sift.model.schema.RelationalSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@code CREATE TABLE IF NOT EXISTS} statements for a relational schema, parent
 * tables before their children. Every statement is parsed back before it is returned.
 * <p>
 * Data columns are always nullable: a later upload with the same field paths reuses the
 * tables even if it leaves some fields out.
 */
@Slf4j
public class SqlDdlRenderer {

    public List<String> render(RelationalSchema schema) {
        List<String> statements = new ArrayList<>();
        for (RelationalSchema table : schema.getAllTables()) {
            String ddl = renderTable(table);
            validate(table.getTableName(), ddl);
            statements.add(ddl);
        }
        return statements;
    }

    public String renderTable(RelationalSchema table) {
        List<String> definitions = new ArrayList<>();
        Column foreignKey = null;

        for (Column column : table.getColumns()) {
            StringBuilder definition = new StringBuilder();
            definition.append(quote(column.getName())).append(' ').append(column.getDataType().getDdl());
            if (column.isPrimaryKey()) {
                definition.append(" NOT NULL PRIMARY KEY");
            } else if (column.isForeignKey()) {
                definition.append(" NOT NULL");
                foreignKey = column;
            }
            definitions.add(definition.toString());
        }

        if (foreignKey != null) {
            definitions.add("FOREIGN KEY (" + quote(foreignKey.getName()) + ") REFERENCES "
                    + quote(foreignKey.getReferencedTable()) + " (" + quote(foreignKey.getReferencedColumn()) + ")");
        }

        return "CREATE TABLE IF NOT EXISTS " + quote(table.getTableName())
                + " (" + String.join(", ", definitions) + ")";
    }

    private void validate(String tableName, String ddl) {
        try {
            Statement statement = CCJSqlParserUtil.parse(ddl);
            if (!(statement instanceof CreateTable)) {
                throw new IllegalStateException("DDL for " + tableName + " did not parse as CREATE TABLE: " + ddl);
            }
            log.debug("Validated DDL for {}", tableName);
        } catch (JSQLParserException e) {
            throw new IllegalStateException("Generated DDL for " + tableName + " is not valid SQL: " + ddl, e);
        }
    }

    private String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
