package org.carball.sift.model.schema;

public enum RelationshipType {
    ONE_TO_ONE,
    ONE_TO_MANY
}
