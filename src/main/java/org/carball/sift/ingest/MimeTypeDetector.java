package org.carball.sift.ingest;

import org.carball.sift.model.index.IngestionKind;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Determines an upload's content type and which pipeline handles it. The declared type
 * wins when present, then the file extension, then the leading bytes.
 */
public class MimeTypeDetector {

    public static final String OCTET_STREAM = "application/octet-stream";
    public static final String JSON = "application/json";

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("avi", "video/x-msvideo"),
            Map.entry("mkv", "video/x-matroska"),
            Map.entry("webm", "video/webm"),
            Map.entry("json", JSON),
            Map.entry("pdf", "application/pdf"),
            Map.entry("doc", "application/msword"),
            Map.entry("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
            Map.entry("txt", "text/plain")
    );

    public String detect(String filename, String declaredType, byte[] content) {
        if (declaredType != null && !declaredType.isBlank() && !OCTET_STREAM.equalsIgnoreCase(declaredType.trim())) {
            return stripParameters(declaredType);
        }

        String fromExtension = EXTENSIONS.get(extension(filename));
        if (fromExtension != null) {
            return fromExtension;
        }

        return sniff(content);
    }

    public Optional<IngestionKind> route(String mimeType) {
        if (mimeType == null) {
            return Optional.empty();
        }
        String type = mimeType.toLowerCase(Locale.ROOT);
        if (type.startsWith("image/") || type.startsWith("video/")) {
            return Optional.of(IngestionKind.MEDIA);
        }
        if (type.equals(JSON) || type.endsWith("+json")) {
            return Optional.of(IngestionKind.JSON);
        }
        if (type.equals("application/pdf")
                || type.equals("application/msword")
                || type.equals(EXTENSIONS.get("docx"))
                || type.equals("text/plain")) {
            return Optional.of(IngestionKind.DOCUMENT);
        }
        return Optional.empty();
    }

    private String sniff(byte[] content) {
        if (content == null || content.length == 0) {
            return OCTET_STREAM;
        }
        if (startsWith(content, 0x89, 'P', 'N', 'G')) {
            return "image/png";
        }
        if (startsWith(content, 0xFF, 0xD8, 0xFF)) {
            return "image/jpeg";
        }
        if (startsWith(content, 'G', 'I', 'F', '8')) {
            return "image/gif";
        }
        if (startsWith(content, '%', 'P', 'D', 'F')) {
            return "application/pdf";
        }
        for (byte b : content) {
            if (!Character.isWhitespace(b)) {
                return b == '{' || b == '[' ? JSON : OCTET_STREAM;
            }
        }
        return OCTET_STREAM;
    }

    private boolean startsWith(byte[] content, int... prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((content[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private String extension(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private String stripParameters(String declaredType) {
        int semicolon = declaredType.indexOf(';');
        String type = semicolon < 0 ? declaredType : declaredType.substring(0, semicolon);
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
