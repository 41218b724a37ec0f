package org.carball.sift.exception;

import java.util.Map;

/**
 * Thrown when structure analysis is asked to analyze zero records.
 */
public class EmptyInputException extends SiftException {

    public EmptyInputException(String source) {
        super("EMPTY_INPUT", "analyze", "No records to analyze in " + source,
                Map.of("source", source), null);
    }
}
