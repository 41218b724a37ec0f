package org.carball.sift.media;

import java.util.Optional;

public class FilenameKeywordStrategy implements CategoryStrategy {

    private final KeywordCategoryMatcher matcher;

    public FilenameKeywordStrategy(KeywordCategoryMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public String getName() {
        return "filename";
    }

    @Override
    public Optional<String> resolve(byte[] content, String filename) {
        return matcher.match(filename);
    }
}
