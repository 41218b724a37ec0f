package org.carball.sift.model.media;

import java.util.Map;

public record ProcessedDocument(
        String text,
        Map<String, String> properties,
        String category,
        int wordCount,
        int charCount,
        int lineCount,
        String preview
) {}
