package org.carball.sift.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.sift.model.structure.ValuePattern;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies string values into semantic patterns. Checks run in a fixed priority order
 * and the first match wins. Patterns are descriptive only.
 */
public class PatternDetector {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private static final Pattern URL_PATTERN = Pattern.compile(
            "^https?://\\S+$", Pattern.CASE_INSENSITIVE);

    private static final Pattern DATETIME_PATTERN = Pattern.compile(
            "^\\d{4}-\\d{2}-\\d{2}([T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?(Z|[+-]\\d{2}:?\\d{2})?)?$");

    private static final Pattern NUMERIC_ID_PATTERN = Pattern.compile("^-?\\d+$");

    public Optional<ValuePattern> detect(JsonNode value) {
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        return detect(value.textValue());
    }

    public Optional<ValuePattern> detect(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }

        if (UUID_PATTERN.matcher(value).matches()) {
            return Optional.of(ValuePattern.UUID);
        }
        if (EMAIL_PATTERN.matcher(value).matches()) {
            return Optional.of(ValuePattern.EMAIL);
        }
        if (URL_PATTERN.matcher(value).matches()) {
            return Optional.of(ValuePattern.URL);
        }
        if (DATETIME_PATTERN.matcher(value).matches() && isCalendarDate(value.substring(0, 10))) {
            return Optional.of(ValuePattern.DATETIME);
        }
        if (NUMERIC_ID_PATTERN.matcher(value).matches()) {
            return Optional.of(ValuePattern.NUMERIC_ID);
        }
        return Optional.empty();
    }

    private boolean isCalendarDate(String date) {
        try {
            LocalDate.parse(date);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
