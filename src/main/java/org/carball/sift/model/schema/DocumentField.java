package org.carball.sift.model.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.carball.sift.model.structure.FieldType;

import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentField {
    FieldType type;
    boolean nested;
    FieldType itemType;
    Map<String, DocumentField> fields;
    String sourcePath;
}
