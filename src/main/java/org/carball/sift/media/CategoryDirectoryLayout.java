package org.carball.sift.media;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Stores files under {@code <root>/<category>/<filename>}. An existing file is never
 * replaced; the new one gets a numeric suffix before its extension instead.
 */
@Slf4j
public class CategoryDirectoryLayout {

    private static final int MAX_SUFFIX = 10_000;

    private final Path root;

    public CategoryDirectoryLayout(Path root) {
        this.root = root;
    }

    public Path store(String category, String filename, byte[] content) throws IOException {
        Path directory = root.resolve(safeSegment(category));
        Files.createDirectories(directory);

        String name = safeSegment(filename);
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";

        for (int suffix = 0; suffix < MAX_SUFFIX; suffix++) {
            Path target = directory.resolve(suffix == 0 ? name : stem + "_" + suffix + extension);
            try {
                Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.debug("Stored {} at {}", filename, target);
                return target;
            } catch (FileAlreadyExistsException e) {
                log.debug("{} exists, trying next suffix", target);
            }
        }
        throw new IOException("No free file name for " + filename + " in " + directory);
    }

    public Path getRoot() {
        return root;
    }

    // strips directory components so uploads cannot escape the root
    private String safeSegment(String raw) {
        String name = raw == null ? "" : raw.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            return "unnamed";
        }
        return name;
    }
}
