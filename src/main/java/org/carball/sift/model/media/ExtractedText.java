package org.carball.sift.model.media;

import java.util.Map;

public record ExtractedText(String text, Map<String, String> properties) {

    public static ExtractedText empty() {
        return new ExtractedText("", Map.of());
    }
}
