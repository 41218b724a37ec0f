package org.carball.sift.ingest;

import org.carball.sift.model.index.IngestionKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

public class MimeTypeDetectorTest {

    private final MimeTypeDetector detector = new MimeTypeDetector();

    @Test
    void declaredTypeShouldWinAndLoseParameters() {
        assertThat(detector.detect("data.txt", "Application/JSON; charset=utf-8", new byte[0]))
                .isEqualTo("application/json");
    }

    @Test
    void shouldIgnoreGenericDeclaredType() {
        assertThat(detector.detect("photo.JPG", "application/octet-stream", new byte[0]))
                .isEqualTo("image/jpeg");
    }

    @Test
    void shouldDetectFromExtension() {
        assertThat(detector.detect("clip.mov", null, new byte[0])).isEqualTo("video/quicktime");
        assertThat(detector.detect("report.docx", null, new byte[0]))
                .isEqualTo("application/vnd.openxmlformats-officedocument.wordprocessingml.document");
        assertThat(detector.detect("notes.txt", "", new byte[0])).isEqualTo("text/plain");
    }

    @Test
    void shouldSniffLeadingBytes() {
        assertThat(detector.detect("upload", null, new byte[]{(byte) 0x89, 'P', 'N', 'G', 0x0D})).isEqualTo("image/png");
        assertThat(detector.detect("upload", null, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0})).isEqualTo("image/jpeg");
        assertThat(detector.detect("upload", null, "GIF89a".getBytes(StandardCharsets.US_ASCII))).isEqualTo("image/gif");
        assertThat(detector.detect("upload", null, "%PDF-1.7".getBytes(StandardCharsets.US_ASCII))).isEqualTo("application/pdf");
        assertThat(detector.detect("upload", null, "  \n [1,2]".getBytes(StandardCharsets.US_ASCII))).isEqualTo("application/json");
        assertThat(detector.detect("upload", null, "plain words".getBytes(StandardCharsets.US_ASCII)))
                .isEqualTo(MimeTypeDetector.OCTET_STREAM);
        assertThat(detector.detect("upload", null, new byte[0])).isEqualTo(MimeTypeDetector.OCTET_STREAM);
    }

    @Test
    void shouldRouteContentTypesToPipelines() {
        assertThat(detector.route("image/webp")).contains(IngestionKind.MEDIA);
        assertThat(detector.route("video/mp4")).contains(IngestionKind.MEDIA);
        assertThat(detector.route("application/json")).contains(IngestionKind.JSON);
        assertThat(detector.route("application/geo+json")).contains(IngestionKind.JSON);
        assertThat(detector.route("application/pdf")).contains(IngestionKind.DOCUMENT);
        assertThat(detector.route("application/msword")).contains(IngestionKind.DOCUMENT);
        assertThat(detector.route("text/plain")).contains(IngestionKind.DOCUMENT);
    }

    @Test
    void shouldNotRouteUnsupportedTypes() {
        assertThat(detector.route("application/zip")).isEmpty();
        assertThat(detector.route("text/html")).isEmpty();
        assertThat(detector.route(MimeTypeDetector.OCTET_STREAM)).isEmpty();
        assertThat(detector.route(null)).isEmpty();
    }
}
