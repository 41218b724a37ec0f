package org.carball.sift.media;

import org.carball.sift.model.media.ExtractedText;

import java.io.IOException;

/**
 * Black-box document text and metadata extractor.
 */
@FunctionalInterface
public interface TextExtractor {

    ExtractedText extract(byte[] content, String mimeType) throws IOException;
}
