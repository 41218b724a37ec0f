package org.carball.sift.media;

import lombok.extern.slf4j.Slf4j;
import org.carball.sift.config.SiftConfig;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a media upload's category by trying each strategy in order and taking the
 * first answer. When none answers the category is {@value #UNCATEGORIZED}.
 */
@Slf4j
public class MediaCategoryResolver {

    public static final String UNCATEGORIZED = "uncategorized";

    private final List<CategoryStrategy> strategies;

    public MediaCategoryResolver(List<CategoryStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Classifier first, then filename keywords.
     */
    public static MediaCategoryResolver forClassifier(MediaClassifier classifier, SiftConfig config) {
        KeywordCategoryMatcher vocabulary = new KeywordCategoryMatcher(config.getCategoryVocabulary());
        return new MediaCategoryResolver(List.of(
                new ClassifierCategoryStrategy(classifier, config.getMediaCategoryConfidenceFloor(),
                        config.getLabelToCategoryMap(), vocabulary),
                new FilenameKeywordStrategy(vocabulary)));
    }

    public String resolve(byte[] content, String filename) {
        for (CategoryStrategy strategy : strategies) {
            Optional<String> category = strategy.resolve(content, filename);
            if (category.isPresent()) {
                log.debug("Category '{}' for {} from {}", category.get(), filename, strategy.getName());
                return category.get();
            }
        }
        log.debug("No category for {}", filename);
        return UNCATEGORIZED;
    }
}
