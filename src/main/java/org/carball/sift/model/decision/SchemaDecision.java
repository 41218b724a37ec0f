package org.carball.sift.model.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.carball.sift.model.schema.DocumentSchema;
import org.carball.sift.model.schema.RelationalSchema;
import org.carball.sift.model.schema.StorageSchema;
import org.carball.sift.model.structure.StructuralDescriptor;

@Value
@Builder
public class SchemaDecision {
    StorageType storageType;
    String schemaName;
    StorageSchema schema;
    DecisionReasoning reasoning;
    @JsonIgnore
    StructuralDescriptor descriptor;

    @JsonIgnore
    public RelationalSchema getRelationalSchema() {
        if (storageType != StorageType.SQL) {
            throw new IllegalStateException("Decision " + schemaName + " routes to " + storageType.getLabel());
        }
        return (RelationalSchema) schema;
    }

    @JsonIgnore
    public DocumentSchema getDocumentSchema() {
        if (storageType != StorageType.NOSQL) {
            throw new IllegalStateException("Decision " + schemaName + " routes to " + storageType.getLabel());
        }
        return (DocumentSchema) schema;
    }
}
