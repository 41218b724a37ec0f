package org.carball.sift.media;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the first vocabulary term contained in a piece of text, ignoring case.
 * Terms are tried in vocabulary order.
 */
public class KeywordCategoryMatcher {

    private final List<String> vocabulary;

    public KeywordCategoryMatcher(List<String> vocabulary) {
        this.vocabulary = List.copyOf(vocabulary);
    }

    public Optional<String> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        for (String term : vocabulary) {
            if (haystack.contains(term.toLowerCase(Locale.ROOT))) {
                return Optional.of(term);
            }
        }
        return Optional.empty();
    }

    public boolean contains(String term) {
        return term != null && vocabulary.stream().anyMatch(t -> t.equalsIgnoreCase(term));
    }
}
