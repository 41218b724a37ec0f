package org.carball.sift.storage;

import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import org.carball.sift.TestJson;
import org.carball.sift.analyzer.StructureAnalyzer;
import org.carball.sift.builder.IdentifierNormalizer;
import org.carball.sift.builder.RelationalSchemaBuilder;
import org.carball.sift.model.schema.RelationalSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SqlDdlRendererTest {

    private SqlDdlRenderer renderer;
    private RelationalSchemaBuilder builder;
    private StructureAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        renderer = new SqlDdlRenderer();
        builder = new RelationalSchemaBuilder(new IdentifierNormalizer(), 32);
        analyzer = new StructureAnalyzer();
    }

    private RelationalSchema schema(String json, String name) {
        return builder.build(analyzer.analyze(TestJson.parse(json)), name);
    }

    @Test
    void shouldRenderFlatTable() {
        // Given
        RelationalSchema schema = schema("[{\"id\":1,\"name\":\"a\",\"score\":1.5,\"active\":true}]", "people");

        // When
        List<String> ddl = renderer.render(schema);

        // Then
        assertThat(ddl).containsExactly(
                "CREATE TABLE IF NOT EXISTS \"people\" (\"id\" BIGINT NOT NULL PRIMARY KEY, "
                        + "\"id_2\" BIGINT, \"name\" TEXT, \"score\" NUMERIC, \"active\" BOOLEAN)");
    }

    @Test
    void shouldRenderChildTablesAfterParentsWithForeignKeys() {
        // Given
        RelationalSchema schema = schema("{\"user\":{\"tags\":[\"x\"]}}", "root");

        // When
        List<String> ddl = renderer.render(schema);

        // Then
        assertThat(ddl).hasSize(3);
        assertThat(ddl.get(0)).startsWith("CREATE TABLE IF NOT EXISTS \"root\" ");
        assertThat(ddl.get(1)).isEqualTo(
                "CREATE TABLE IF NOT EXISTS \"root_user\" (\"id\" BIGINT NOT NULL PRIMARY KEY, "
                        + "\"parent_id\" BIGINT NOT NULL, "
                        + "FOREIGN KEY (\"parent_id\") REFERENCES \"root\" (\"id\"))");
        assertThat(ddl.get(2)).contains("\"value\" TEXT", "REFERENCES \"root_user\" (\"id\")");
    }

    @Test
    void shouldNeverMarkDataColumnsNotNull() {
        // Given
        RelationalSchema schema = schema("[{\"a\":1,\"b\":\"x\"},{\"a\":2,\"b\":\"y\"}]", "t");

        // When
        String ddl = renderer.renderTable(schema);

        // Then
        assertThat(ddl).contains("\"a\" BIGINT,", "\"b\" TEXT)");
    }

    @Test
    void renderedStatementsShouldParseAsCreateTable() throws Exception {
        // Given
        RelationalSchema schema = schema(
                "[{\"id\":\"k1\",\"orders\":[{\"sku\":\"A\",\"qty\":2}],\"meta\":{\"v\":[1,\"x\"]}}]", "shop");

        // When
        List<String> ddl = renderer.render(schema);

        // Then
        assertThat(ddl).hasSize(schema.getAllTables().size());
        for (int i = 0; i < ddl.size(); i++) {
            Statement statement = CCJSqlParserUtil.parse(ddl.get(i));
            assertThat(statement).isInstanceOf(CreateTable.class);
            assertThat(((CreateTable) statement).getTable().getName())
                    .contains(schema.getAllTables().get(i).getTableName());
        }
    }
}
