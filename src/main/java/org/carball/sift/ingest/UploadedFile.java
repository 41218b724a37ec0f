package org.carball.sift.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One uploaded item: its original name, the content type the client declared (may be
 * {@code null}) and its bytes.
 */
public record UploadedFile(String filename, String declaredType, byte[] content) {

    public static UploadedFile fromPath(Path path) throws IOException {
        return new UploadedFile(path.getFileName().toString(), null, Files.readAllBytes(path));
    }
}
