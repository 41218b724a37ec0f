package org.carball.sift.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
