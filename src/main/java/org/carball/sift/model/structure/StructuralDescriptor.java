package org.carball.sift.model.structure;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Shape summary of one record or a batch of records. Field profiles are kept in
 * first-seen order so that everything derived from a descriptor is deterministic for a
 * given input order.
 */
@Value
@Builder
public class StructuralDescriptor {
    int fieldCount;
    int nestingDepth;
    Map<String, FieldProfile> fields;
    double consistency;
    boolean arrayRoot;
    int recordCount;

    public FieldProfile field(String path) {
        return fields.get(path);
    }

    @JsonIgnore
    public List<FieldProfile> getTopLevelFields() {
        return fields.values().stream()
                .filter(FieldProfile::isTopLevel)
                .collect(Collectors.toList());
    }

    public List<FieldProfile> childrenOf(String parentPath) {
        return fields.values().stream()
                .filter(f -> Objects.equals(f.getParentPath(), parentPath))
                .collect(Collectors.toList());
    }

    /**
     * Sorted field paths, each carrying its layout marker, so two batches get the same
     * fingerprint only when they map onto the same tables and columns.
     */
    @JsonIgnore
    public List<String> getShapePaths() {
        return fields.values().stream()
                .map(FieldProfile::getShapePath)
                .sorted()
                .collect(Collectors.toList());
    }
}
