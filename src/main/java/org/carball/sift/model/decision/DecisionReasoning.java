package org.carball.sift.model.decision;

/**
 * The exact inputs the storage decision was computed from.
 */
public record DecisionReasoning(
        double consistency,
        int nestingDepth,
        int fieldCount
) {}
