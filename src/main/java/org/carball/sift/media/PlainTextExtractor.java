package org.carball.sift.media;

import org.carball.sift.model.media.ExtractedText;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Reads {@code text/*} documents as UTF-8. Binary formats need a real extractor.
 */
public class PlainTextExtractor implements TextExtractor {

    @Override
    public ExtractedText extract(byte[] content, String mimeType) throws IOException {
        if (mimeType == null || !mimeType.startsWith("text/")) {
            throw new IOException("Cannot extract text from " + mimeType);
        }
        String text = new String(content, StandardCharsets.UTF_8);
        return new ExtractedText(text, Map.of(
                "encoding", "UTF-8",
                "file_size", String.valueOf(content.length)));
    }
}
