package org.carball.sift.model.schema;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Relationship {
    String name;
    RelationshipType type;
    String fromTable;
    String fromColumn;
    String toTable;
    String toColumn;
    String field;
}
