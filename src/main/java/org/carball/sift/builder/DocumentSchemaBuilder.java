package org.carball.sift.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.sift.exception.InconsistentArrayException;
import org.carball.sift.model.schema.DocumentField;
import org.carball.sift.model.schema.DocumentSchema;
import org.carball.sift.model.structure.FieldProfile;
import org.carball.sift.model.structure.FieldType;
import org.carball.sift.model.structure.StructuralDescriptor;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a structural descriptor directly onto a document field tree.
 */
@Slf4j
public class DocumentSchemaBuilder {

    private final IdentifierNormalizer normalizer;
    private final int maxDepth;

    public DocumentSchemaBuilder(IdentifierNormalizer normalizer, int maxDepth) {
        this.normalizer = normalizer;
        this.maxDepth = maxDepth;
    }

    public DocumentSchema build(StructuralDescriptor descriptor, String baseName) {
        Map<String, DocumentField> structure = buildFields(descriptor, descriptor.getTopLevelFields(), 0);
        DocumentSchema schema = DocumentSchema.builder()
                .collectionName(normalizer.sanitizeCollection(baseName))
                .fieldStructure(structure)
                .build();
        log.debug("Built document schema {} with {} top-level field(s)",
                schema.getCollectionName(), structure.size());
        return schema;
    }

    private Map<String, DocumentField> buildFields(StructuralDescriptor descriptor,
                                                   List<FieldProfile> fields,
                                                   int depth) {
        Map<String, DocumentField> structure = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();

        for (FieldProfile field : fields) {
            if (depth > maxDepth) {
                throw InconsistentArrayException.nestingLimitExceeded(field.getPath(), maxDepth);
            }
            String name = uniqueName(normalizer.sanitizeDocumentField(field.getName()), used);
            structure.put(name, toDocumentField(descriptor, field, depth));
        }
        return Collections.unmodifiableMap(structure);
    }

    private DocumentField toDocumentField(StructuralDescriptor descriptor, FieldProfile field, int depth) {
        FieldType type = field.getInferredType();
        List<FieldProfile> children = descriptor.childrenOf(field.getPath());

        DocumentField.DocumentFieldBuilder builder = DocumentField.builder()
                .type(type)
                .sourcePath(field.getPath());

        switch (type) {
            case OBJECT:
                return builder.nested(true)
                        .fields(buildFields(descriptor, children, depth + 1))
                        .build();
            case ARRAY:
                FieldType itemType = field.getItemType() == null ? FieldType.MIXED : field.getItemType();
                if (itemType == FieldType.OBJECT) {
                    return builder.nested(true)
                            .itemType(itemType)
                            .fields(buildFields(descriptor, children, depth + 1))
                            .build();
                }
                return builder.itemType(itemType).build();
            case MIXED:
                // kept as-is; any object shape it sometimes takes is still described
                builder.itemType(FieldType.MIXED);
                if (!children.isEmpty()) {
                    builder.nested(true).fields(buildFields(descriptor, children, depth + 1));
                }
                return builder.build();
            default:
                return builder.build();
        }
    }

    private String uniqueName(String name, Set<String> used) {
        String unique = name;
        int suffix = 2;
        while (!used.add(unique)) {
            unique = name + "_" + suffix++;
        }
        return unique;
    }
}
