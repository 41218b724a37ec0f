package org.carball.sift.media;

import java.util.Optional;

/**
 * One link in the media category chain. Returns empty to let the next strategy try.
 */
public interface CategoryStrategy {

    String getName();

    Optional<String> resolve(byte[] content, String filename);
}
