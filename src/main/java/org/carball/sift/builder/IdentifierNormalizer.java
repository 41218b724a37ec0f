package org.carball.sift.builder;

import org.carball.sift.util.Digests;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Turns JSON keys into backend-safe identifiers.
 * <p>
 * Relational names are lower-cased, every character outside {@code [a-z0-9]} becomes
 * {@code _}, and names longer than the backend limit are truncated. When a truncated
 * name would clash with one already handed out in the same {@link NameScope}, its tail is
 * replaced with an 8-character content hash. Any other clash gets a numeric suffix.
 */
public class IdentifierNormalizer {

    public static final int DEFAULT_MAX_LENGTH = 63;
    private static final int MAX_COLLECTION_LENGTH = 120;
    private static final int HASH_LENGTH = 8;

    private final int maxLength;

    public IdentifierNormalizer() {
        this(DEFAULT_MAX_LENGTH);
    }

    public IdentifierNormalizer(int maxLength) {
        if (maxLength <= HASH_LENGTH + 1) {
            throw new IllegalArgumentException("Identifier length limit too small: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    /**
     * Applies the naming convention without truncation.
     */
    public String normalize(String raw) {
        String name = raw == null ? "" : raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
        if (name.isEmpty()) {
            return "_";
        }
        if (Character.isDigit(name.charAt(0))) {
            name = "_" + name;
        }
        return name;
    }

    /**
     * Removes characters document stores reject in field names.
     */
    public String sanitizeDocumentField(String raw) {
        String name = raw == null ? "" : raw.replace(".", "").replace("\0", "");
        while (name.startsWith("$")) {
            name = name.substring(1);
        }
        return name.isEmpty() ? "_" : name;
    }

    public String sanitizeCollection(String raw) {
        String name = raw == null ? "" : raw;
        while (name.startsWith("system.")) {
            name = name.substring("system.".length());
        }
        name = name.replaceAll("[^A-Za-z0-9_-]", "");
        if (name.isEmpty()) {
            name = "collection";
        }
        return name.length() > MAX_COLLECTION_LENGTH ? name.substring(0, MAX_COLLECTION_LENGTH) : name;
    }

    public NameScope scope() {
        return new NameScope();
    }

    /**
     * Hands out unique identifiers within one namespace, such as the columns of a table
     * or the tables of a schema.
     */
    public final class NameScope {
        private final Set<String> used = new HashSet<>();

        public String claim(String raw) {
            String base = normalize(raw);
            String candidate = base;

            if (base.length() > maxLength) {
                candidate = base.substring(0, maxLength);
                if (used.contains(candidate)) {
                    candidate = base.substring(0, maxLength - HASH_LENGTH - 1)
                            + "_" + Digests.sha256Hex(base).substring(0, HASH_LENGTH);
                }
            }

            String unique = candidate;
            int suffix = 2;
            while (used.contains(unique)) {
                String tail = "_" + suffix++;
                String head = candidate.length() + tail.length() > maxLength
                        ? candidate.substring(0, maxLength - tail.length())
                        : candidate;
                unique = head + tail;
            }

            used.add(unique);
            return unique;
        }

        public boolean isClaimed(String name) {
            return used.contains(name);
        }
    }
}
