package org.carball.sift.decision;

import lombok.extern.slf4j.Slf4j;
import org.carball.sift.exception.SchemaNameCollisionException;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps shape fingerprints to schema names and remembers which field paths each name was
 * given to, so a hash collision is noticed instead of merging two shapes.
 * <p>
 * Names are {@code json_data_} plus the first 12 hex characters of the fingerprint. If
 * that name already belongs to a different path set the next 8 characters are appended;
 * if that is taken too, {@link SchemaNameCollisionException} is thrown. Registration is
 * lock-free, so concurrent uploads of the same shape agree on the name.
 */
@Slf4j
public class SchemaNameRegistry {

    public static final String PREFIX = "json_data_";
    private static final int NAME_HASH_LENGTH = 12;
    private static final int SUFFIX_HASH_LENGTH = 8;

    private final ShapeHasher hasher;
    private final ConcurrentMap<String, List<String>> pathsByName = new ConcurrentHashMap<>();

    public SchemaNameRegistry() {
        this(ShapeHasher.sha256());
    }

    public SchemaNameRegistry(ShapeHasher hasher) {
        this.hasher = hasher;
    }

    public String assign(List<String> sortedPaths) {
        List<String> paths = List.copyOf(sortedPaths);
        String fingerprint = hasher.hash(paths);
        if (fingerprint == null || fingerprint.length() < NAME_HASH_LENGTH + SUFFIX_HASH_LENGTH) {
            throw new IllegalStateException("Shape fingerprint too short: " + fingerprint);
        }

        String name = PREFIX + fingerprint.substring(0, NAME_HASH_LENGTH);
        List<String> registered = pathsByName.putIfAbsent(name, paths);
        if (registered == null || registered.equals(paths)) {
            return name;
        }

        String disambiguated = name + "_"
                + fingerprint.substring(NAME_HASH_LENGTH, NAME_HASH_LENGTH + SUFFIX_HASH_LENGTH);
        log.warn("Schema name {} already bound to another shape, using {}", name, disambiguated);

        List<String> registeredAlternate = pathsByName.putIfAbsent(disambiguated, paths);
        if (registeredAlternate == null || registeredAlternate.equals(paths)) {
            return disambiguated;
        }
        throw new SchemaNameCollisionException(disambiguated, registeredAlternate, paths);
    }

    public List<String> pathsFor(String schemaName) {
        return pathsByName.get(schemaName);
    }

    public int size() {
        return pathsByName.size();
    }

    public void reset() {
        pathsByName.clear();
    }
}
