package org.carball.sift.decision;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.sift.analyzer.StructureAnalyzer;
import org.carball.sift.builder.SchemaBuilder;
import org.carball.sift.config.DecisionThresholds;
import org.carball.sift.model.decision.DecisionReasoning;
import org.carball.sift.model.decision.SchemaDecision;
import org.carball.sift.model.decision.StorageType;
import org.carball.sift.model.schema.StorageSchema;
import org.carball.sift.model.structure.StructuralDescriptor;

import java.util.List;

/**
 * Routes records to the relational or the document backend and builds the matching
 * schema.
 * <p>
 * A descriptor goes to SQL only when all three hold: its consistency is at least the
 * threshold, its nesting depth is at most the depth limit, and its field count is at most
 * the field limit. Everything else goes to the document store. The inputs of that rule
 * are kept on the decision.
 */
@Slf4j
public class StorageDecisionEngine {

    private final StructureAnalyzer analyzer;
    private final SchemaBuilder schemaBuilder;
    private final SchemaNameRegistry nameRegistry;
    private final DecisionThresholds thresholds;

    public StorageDecisionEngine(StructureAnalyzer analyzer,
                                 SchemaBuilder schemaBuilder,
                                 SchemaNameRegistry nameRegistry,
                                 DecisionThresholds thresholds) {
        this.analyzer = analyzer;
        this.schemaBuilder = schemaBuilder;
        this.nameRegistry = nameRegistry;
        this.thresholds = thresholds;
    }

    public SchemaDecision decide(List<JsonNode> records) {
        return decide(analyzer.analyze(records));
    }

    public SchemaDecision decide(JsonNode payload) {
        return decide(analyzer.analyze(payload));
    }

    public SchemaDecision decide(StructuralDescriptor descriptor) {
        StorageType storageType = chooseStorageType(descriptor);
        String schemaName = nameRegistry.assign(descriptor.getShapePaths());
        StorageSchema schema = schemaBuilder.build(descriptor, storageType, schemaName);

        DecisionReasoning reasoning = new DecisionReasoning(
                descriptor.getConsistency(),
                descriptor.getNestingDepth(),
                descriptor.getFieldCount());

        log.info("Routed {} record(s) to {} as {} (consistency={}, depth={}, fields={})",
                descriptor.getRecordCount(), storageType.getLabel(), schemaName,
                reasoning.consistency(), reasoning.nestingDepth(), reasoning.fieldCount());

        return SchemaDecision.builder()
                .storageType(storageType)
                .schemaName(schemaName)
                .schema(schema)
                .reasoning(reasoning)
                .descriptor(descriptor)
                .build();
    }

    public StorageType chooseStorageType(StructuralDescriptor descriptor) {
        return chooseStorageType(new DecisionReasoning(
                descriptor.getConsistency(),
                descriptor.getNestingDepth(),
                descriptor.getFieldCount()));
    }

    /**
     * Applies the routing rule to previously recorded reasoning inputs.
     */
    public StorageType chooseStorageType(DecisionReasoning reasoning) {
        boolean consistentEnough = reasoning.consistency() >= thresholds.getSqlConsistencyThreshold();
        boolean shallowEnough = reasoning.nestingDepth() <= thresholds.getSqlMaxNestingDepth();
        boolean narrowEnough = reasoning.fieldCount() <= thresholds.getSqlMaxFieldCount();

        if (consistentEnough && shallowEnough && narrowEnough) {
            return StorageType.SQL;
        }

        log.debug("Not relational: consistency ok={}, depth ok={}, fields ok={}",
                consistentEnough, shallowEnough, narrowEnough);
        return StorageType.NOSQL;
    }

    public DecisionThresholds getThresholds() {
        return thresholds;
    }
}
