package org.carball.sift.model.media;

/**
 * Header facts of an image; {@code format} is the decoder's format name in upper case.
 */
public record ImageMetadata(int width, int height, String format) {

    public String dimensions() {
        return width + "x" + height;
    }
}
