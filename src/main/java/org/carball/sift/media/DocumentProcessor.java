package org.carball.sift.media;

import lombok.extern.slf4j.Slf4j;
import org.carball.sift.model.media.ExtractedText;
import org.carball.sift.model.media.ProcessedDocument;

import java.io.IOException;
import java.util.Optional;

/**
 * Extracts a document's text, summarizes it and picks a category: a keyword in the
 * filename, else a keyword in the text, else {@value MediaCategoryResolver#UNCATEGORIZED}.
 * Extraction failures leave the text empty rather than failing the upload.
 */
@Slf4j
public class DocumentProcessor {

    public static final int PREVIEW_LENGTH = 500;

    private final TextExtractor extractor;
    private final KeywordCategoryMatcher matcher;

    public DocumentProcessor(TextExtractor extractor, KeywordCategoryMatcher matcher) {
        this.extractor = extractor;
        this.matcher = matcher;
    }

    public ProcessedDocument process(byte[] content, String filename, String mimeType) {
        ExtractedText extracted = extract(content, filename, mimeType);
        String text = extracted.text() == null ? "" : extracted.text();

        String category = matcher.match(filename)
                .or(() -> matcher.match(text))
                .orElse(MediaCategoryResolver.UNCATEGORIZED);

        return new ProcessedDocument(
                text,
                extracted.properties(),
                category,
                countWords(text),
                text.length(),
                countLines(text),
                preview(text));
    }

    private ExtractedText extract(byte[] content, String filename, String mimeType) {
        try {
            ExtractedText extracted = extractor.extract(content, mimeType);
            return Optional.ofNullable(extracted).orElse(ExtractedText.empty());
        } catch (IOException | RuntimeException e) {
            log.warn("Text extraction failed for {} ({}): {}", filename, mimeType, e.getMessage());
            return ExtractedText.empty();
        }
    }

    private int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private int countLines(String text) {
        return text.isEmpty() ? 0 : text.split("\\R", -1).length;
    }

    private String preview(String text) {
        if (text.length() <= PREVIEW_LENGTH) {
            return text;
        }
        return text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
