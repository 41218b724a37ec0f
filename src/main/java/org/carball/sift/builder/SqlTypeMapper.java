package org.carball.sift.builder;

import org.carball.sift.model.schema.SqlType;
import org.carball.sift.model.structure.FieldProfile;
import org.carball.sift.model.structure.FieldType;

public class SqlTypeMapper {

    public SqlType map(FieldProfile field) {
        return map(field.getInferredType(), field.isIntegral());
    }

    public SqlType mapElements(FieldProfile arrayField) {
        return map(arrayField.getItemType(), arrayField.isIntegral());
    }

    public SqlType map(FieldType type, boolean integral) {
        if (type == null) {
            return SqlType.TEXT;
        }
        switch (type) {
            case NUMBER:
                return integral ? SqlType.BIGINT : SqlType.NUMERIC;
            case BOOLEAN:
                return SqlType.BOOLEAN;
            case STRING:
            default:
                // null-only, mixed and structural values are kept as text
                return SqlType.TEXT;
        }
    }
}
