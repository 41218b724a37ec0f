package org.carball.sift.media;

import lombok.extern.slf4j.Slf4j;
import org.carball.sift.model.media.ImageMetadata;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads width, height and format from an image header without decoding the pixels.
 * Content no installed reader recognizes yields an empty result.
 */
@Slf4j
public class ImageMetadataReader {

    public Optional<ImageMetadata> read(byte[] content) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            if (input == null) {
                return Optional.empty();
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                log.debug("No image reader for {} byte(s) of content", content.length);
                return Optional.empty();
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return Optional.of(new ImageMetadata(reader.getWidth(0), reader.getHeight(0),
                        reader.getFormatName().toUpperCase(Locale.ROOT)));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            // decoders reject truncated headers with either kind
            log.warn("Could not read image header: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
