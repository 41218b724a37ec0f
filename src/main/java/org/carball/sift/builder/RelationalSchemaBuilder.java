package org.carball.sift.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.sift.exception.InconsistentArrayException;
import org.carball.sift.model.schema.Column;
import org.carball.sift.model.schema.RelationalSchema;
import org.carball.sift.model.schema.Relationship;
import org.carball.sift.model.schema.RelationshipType;
import org.carball.sift.model.schema.SqlType;
import org.carball.sift.model.structure.FieldProfile;
import org.carball.sift.model.structure.FieldType;
import org.carball.sift.model.structure.StructuralDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a structural descriptor onto a root table plus nested tables.
 * <p>
 * Objects and arrays of objects become child tables; arrays of scalars become child
 * tables with a single {@code value} column. Every table has a synthetic primary key named
 * {@code id}, and every child table has a {@code parent_id} column referencing its
 * parent's key. A source field named {@code id} is an ordinary column ({@code id_2}), so
 * the layout depends only on the shape paths of the descriptor.
 * Fields whose type is {@code mixed}, arrays of arrays, and arrays that were only ever
 * empty are stored as text.
 */
@Slf4j
public class RelationalSchemaBuilder {

    private final IdentifierNormalizer normalizer;
    private final SqlTypeMapper typeMapper;
    private final int maxDepth;

    public RelationalSchemaBuilder(IdentifierNormalizer normalizer, int maxDepth) {
        this.normalizer = normalizer;
        this.typeMapper = new SqlTypeMapper();
        this.maxDepth = maxDepth;
    }

    public RelationalSchema build(StructuralDescriptor descriptor, String baseName) {
        IdentifierNormalizer.NameScope tableNames = normalizer.scope();
        RelationalSchema root = buildTable(descriptor, tableNames.claim(baseName), null, null,
                tableNames, 0);
        log.debug("Built relational schema {} with {} table(s)", root.getTableName(),
                root.getAllTables().size());
        return root;
    }

    private RelationalSchema buildTable(StructuralDescriptor descriptor,
                                        String tableName,
                                        FieldProfile sourceField,
                                        ParentKey parentKey,
                                        IdentifierNormalizer.NameScope tableNames,
                                        int depth) {
        String sourcePath = sourceField == null ? null : sourceField.getPath();
        if (depth > maxDepth) {
            throw InconsistentArrayException.nestingLimitExceeded(sourcePath, maxDepth);
        }

        List<FieldProfile> children = sourceField == null
                ? descriptor.getTopLevelFields()
                : descriptor.childrenOf(sourcePath);
        boolean scalarValues = sourceField != null && sourceField.getInferredType() == FieldType.ARRAY
                && sourceField.getItemType() != FieldType.OBJECT;

        IdentifierNormalizer.NameScope columnNames = normalizer.scope();
        List<Column> columns = new ArrayList<>();
        List<RelationalSchema> nestedTables = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();

        Column primaryKey = Column.builder()
                .name(columnNames.claim(RelationalSchema.SYNTHETIC_KEY))
                .dataType(SqlType.BIGINT)
                .primaryKey(true)
                .build();
        columns.add(primaryKey);

        // Foreign key to the parent table
        if (parentKey != null) {
            columns.add(Column.builder()
                    .name(columnNames.claim(RelationalSchema.PARENT_KEY))
                    .dataType(parentKey.dataType())
                    .foreignKey(true)
                    .referencedTable(parentKey.table())
                    .referencedColumn(parentKey.column())
                    .build());
        }

        if (scalarValues) {
            boolean mixed = sourceField.getItemType() == FieldType.MIXED;
            columns.add(Column.builder()
                    .name(columnNames.claim(RelationalSchema.VALUE_COLUMN))
                    .sourcePath(sourcePath)
                    .dataType(typeMapper.mapElements(sourceField))
                    .sourceType(sourceField.getItemType())
                    .pattern(sourceField.getPattern())
                    .textualFallback(mixed)
                    .build());
        }

        // Names are claimed in path order, independent of key order in the records.
        ParentKey reference = new ParentKey(tableName, primaryKey.getName(), primaryKey.getDataType());
        Map<String, RelationalSchema> nestedByPath = new HashMap<>();
        Map<String, Column> columnsByPath = new HashMap<>();
        List<FieldProfile> sorted = new ArrayList<>(children);
        sorted.sort(Comparator.comparing(FieldProfile::getPath));
        for (FieldProfile child : sorted) {
            if (child.getInferredType() == FieldType.OBJECT || child.isTabularArray()) {
                String nestedName = tableNames.claim(tableName + "_" + normalizer.normalize(child.getName()));
                nestedByPath.put(child.getPath(), buildTable(descriptor, nestedName, child, reference,
                        tableNames, depth + 1));
            } else {
                columnsByPath.put(child.getPath(), dataColumn(child, columnNames.claim(child.getName())));
            }
        }

        for (FieldProfile child : children) {
            RelationalSchema nested = nestedByPath.get(child.getPath());
            if (nested == null) {
                columns.add(columnsByPath.get(child.getPath()));
                continue;
            }
            nestedTables.add(nested);
            relationships.add(Relationship.builder()
                    .name("fk_" + nested.getTableName())
                    .type(child.getInferredType() == FieldType.ARRAY
                            ? RelationshipType.ONE_TO_MANY : RelationshipType.ONE_TO_ONE)
                    .fromTable(nested.getTableName())
                    .fromColumn(RelationalSchema.PARENT_KEY)
                    .toTable(tableName)
                    .toColumn(primaryKey.getName())
                    .field(child.getPath())
                    .build());
        }

        return RelationalSchema.builder()
                .tableName(tableName)
                .primaryKey(primaryKey.getName())
                .columns(Collections.unmodifiableList(columns))
                .nestedTables(Collections.unmodifiableList(nestedTables))
                .relationships(Collections.unmodifiableList(relationships))
                .parentField(sourceField == null ? null : sourceField.getName())
                .sourcePath(sourcePath)
                .array(sourceField != null && sourceField.getInferredType() == FieldType.ARRAY)
                .scalarValues(scalarValues)
                .build();
    }

    private record ParentKey(String table, String column, SqlType dataType) {}

    private Column dataColumn(FieldProfile field, String columnName) {
        FieldType type = field.getInferredType();
        boolean textual = type == FieldType.MIXED || type == FieldType.ARRAY || type == FieldType.OBJECT;
        return Column.builder()
                .name(columnName)
                .sourceField(field.getName())
                .sourcePath(field.getPath())
                .dataType(textual ? SqlType.TEXT : typeMapper.map(field))
                .sourceType(type)
                .nullable(field.isNullable() || type == FieldType.NULL)
                .pattern(field.getPattern())
                .textualFallback(textual)
                .build();
    }
}
