package org.carball.sift.builder;

import org.carball.sift.config.DecisionThresholds;
import org.carball.sift.model.decision.StorageType;
import org.carball.sift.model.schema.StorageSchema;
import org.carball.sift.model.structure.StructuralDescriptor;

/**
 * Builds the schema for whichever backend a descriptor was routed to.
 */
public class SchemaBuilder {

    private final RelationalSchemaBuilder relationalBuilder;
    private final DocumentSchemaBuilder documentBuilder;

    public SchemaBuilder() {
        this(new IdentifierNormalizer(), DecisionThresholds.defaults().getMaxAnalysisDepth());
    }

    public SchemaBuilder(IdentifierNormalizer normalizer, int maxDepth) {
        this.relationalBuilder = new RelationalSchemaBuilder(normalizer, maxDepth);
        this.documentBuilder = new DocumentSchemaBuilder(normalizer, maxDepth);
    }

    public static final String DEFAULT_NAME = "json_data";

    public StorageSchema build(StructuralDescriptor descriptor, StorageType storageType) {
        return build(descriptor, storageType, DEFAULT_NAME);
    }

    public StorageSchema build(StructuralDescriptor descriptor, StorageType storageType, String name) {
        switch (storageType) {
            case SQL:
                return relationalBuilder.build(descriptor, name);
            case NOSQL:
                return documentBuilder.build(descriptor, name);
            default:
                throw new IllegalArgumentException("Unsupported storage type: " + storageType);
        }
    }
}
