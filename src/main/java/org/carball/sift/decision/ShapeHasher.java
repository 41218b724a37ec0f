package org.carball.sift.decision;

import org.carball.sift.util.Digests;

import java.util.List;

/**
 * Fingerprints a sorted field-path set. Implementations must be pure and return at least
 * 20 lowercase hex characters.
 */
@FunctionalInterface
public interface ShapeHasher {

    String hash(List<String> sortedPaths);

    static ShapeHasher sha256() {
        return paths -> Digests.sha256Hex(String.join("\n", paths));
    }
}
