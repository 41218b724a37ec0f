package org.carball.sift.model.schema;

import lombok.Builder;
import lombok.Value;
import org.carball.sift.model.structure.FieldType;
import org.carball.sift.model.structure.ValuePattern;

/**
 * One column of a synthesized table. {@code sourceField} is the JSON key the column is
 * read from; it is {@code null} for synthetic key columns. {@code pattern} is descriptive
 * only and never affects {@code dataType}.
 */
@Value
@Builder
public class Column {
    String name;
    String sourceField;
    String sourcePath;
    SqlType dataType;
    FieldType sourceType;
    boolean nullable;
    boolean primaryKey;
    boolean foreignKey;
    String referencedTable;
    String referencedColumn;
    ValuePattern pattern;
    boolean textualFallback;
}
