package org.carball.sift.media;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.sift.config.SiftConfig;
import org.carball.sift.model.media.Classification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class MediaCategoryResolverTest {

    private static final byte[] IMAGE = {(byte) 0x89, 'P', 'N', 'G'};

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;
    private SiftConfig config;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ClassifierCategoryStrategy.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
        config = SiftConfig.defaults();
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    private MediaCategoryResolver resolver(MediaClassifier classifier) {
        return MediaCategoryResolver.forClassifier(classifier, config);
    }

    @Test
    void shouldMapClassifierLabelToCategory() {
        // When
        String category = resolver(content -> new Classification("Tabby", 0.92)).resolve(IMAGE, "IMG_0001.jpg");

        // Then
        assertThat(category).isEqualTo("animals");
    }

    @Test
    void shouldAcceptLabelThatIsAlreadyACategory() {
        // When
        String category = resolver(content -> new Classification("sports", 0.8)).resolve(IMAGE, "IMG_0001.jpg");

        // Then
        assertThat(category).isEqualTo("sports");
    }

    @Test
    void shouldPreferClassifierOverFilename() {
        // When
        String category = resolver(content -> new Classification("tabby", 0.9)).resolve(IMAGE, "food_trip.jpg");

        // Then
        assertThat(category).isEqualTo("animals");
    }

    @Test
    void shouldFallBackToFilenameBelowConfidenceFloor() {
        // When
        String category = resolver(content -> new Classification("tabby", 0.19)).resolve(IMAGE, "travel_2024.jpg");

        // Then
        assertThat(category).isEqualTo("travel");
    }

    @Test
    void shouldAcceptConfidenceEqualToFloor() {
        // When
        String category = resolver(content -> new Classification("tabby", 0.20)).resolve(IMAGE, "IMG_0001.jpg");

        // Then
        assertThat(category).isEqualTo("animals");
    }

    @Test
    void shouldFallBackWhenClassifierUnavailable() {
        // When
        String fromFilename = resolver(MediaClassifier.unavailable()).resolve(IMAGE, "Food-Festival.png");
        String nothing = resolver(MediaClassifier.unavailable()).resolve(IMAGE, "IMG_0001.jpg");

        // Then
        assertThat(fromFilename).isEqualTo("food");
        assertThat(nothing).isEqualTo(MediaCategoryResolver.UNCATEGORIZED);
        assertThat(logAppender.list.stream().anyMatch(log ->
                log.getLevel() == Level.WARN &&
                log.getFormattedMessage().contains("Classifier failed for IMG_0001.jpg, falling back")))
                .isTrue();
    }

    @Test
    void shouldFallBackWhenClassifierThrowsUnchecked() {
        // When
        String category = resolver(content -> {
            throw new IllegalStateException("model crashed");
        }).resolve(IMAGE, "medical_scan.png");

        // Then
        assertThat(category).isEqualTo("medical");
    }

    @Test
    void shouldIgnoreUnmappedLabels() {
        // When
        String category = resolver(content -> new Classification("spaceship", 0.99)).resolve(IMAGE, "IMG_0001.jpg");

        // Then
        assertThat(category).isEqualTo(MediaCategoryResolver.UNCATEGORIZED);
    }

    @Test
    void shouldUseConfiguredVocabularyAndLabels() {
        // Given
        config.setCategoryVocabulary(List.of("pets", "meals"));
        config.setLabelToCategoryMap(Map.of("Beagle", "pets"));

        // When
        String mapped = resolver(content -> new Classification("beagle", 0.5)).resolve(IMAGE, "x.jpg");
        String byName = resolver(MediaClassifier.unavailable()).resolve(IMAGE, "sunday-meals.jpg");

        // Then
        assertThat(mapped).isEqualTo("pets");
        assertThat(byName).isEqualTo("meals");
    }

    @Test
    void shouldStopAtFirstStrategyThatAnswers() {
        // Given
        AtomicInteger secondCalls = new AtomicInteger();
        CategoryStrategy first = new CategoryStrategy() {
            @Override
            public String getName() {
                return "first";
            }

            @Override
            public Optional<String> resolve(byte[] content, String filename) {
                return Optional.of("nature");
            }
        };
        CategoryStrategy second = new CategoryStrategy() {
            @Override
            public String getName() {
                return "second";
            }

            @Override
            public Optional<String> resolve(byte[] content, String filename) {
                secondCalls.incrementAndGet();
                return Optional.of("art");
            }
        };

        // When
        String category = new MediaCategoryResolver(List.of(first, second)).resolve(IMAGE, "x.jpg");

        // Then
        assertThat(category).isEqualTo("nature");
        assertThat(secondCalls).hasValue(0);
    }
}
