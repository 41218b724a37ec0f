package org.carball.sift.media;

import org.carball.sift.model.media.Classification;

import java.io.IOException;

/**
 * Black-box image or video classifier.
 */
@FunctionalInterface
public interface MediaClassifier {

    Classification classify(byte[] content) throws IOException;

    /**
     * A classifier that always fails, for deployments without a model. Every resolution
     * then falls through to the filename.
     */
    static MediaClassifier unavailable() {
        return content -> {
            throw new IOException("No media classifier configured");
        };
    }
}
