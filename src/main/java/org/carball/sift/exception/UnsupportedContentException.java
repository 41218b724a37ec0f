package org.carball.sift.exception;

import java.util.Map;

/**
 * Thrown when an upload's content type is not routable, or its JSON body cannot be parsed.
 */
public class UnsupportedContentException extends SiftException {

    public UnsupportedContentException(String filename, String mimeType) {
        super("UNSUPPORTED_CONTENT", "route",
                String.format("Unsupported file type %s for %s", mimeType, filename),
                Map.of("filename", filename, "mimeType", mimeType), null);
    }

    public UnsupportedContentException(String filename, String details, Throwable cause) {
        super("UNSUPPORTED_CONTENT", "parse",
                String.format("Invalid JSON in %s: %s", filename, details),
                Map.of("filename", filename), cause);
    }
}
