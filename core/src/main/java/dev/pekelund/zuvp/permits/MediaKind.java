package dev.pekelund.zuvp.permits;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of submitted document, resolved from the file extension.
 */
public enum MediaKind {

    PDF("application/pdf", List.of("pdf")),
    IMAGE("image/png", List.of("png", "jpg", "jpeg")),
    DOCX("application/vnd.openxmlformats-officedocument.wordprocessingml.document", List.of("docx")),
    TEXT("text/plain", List.of("txt"));

    private final String defaultMimeType;
    private final List<String> extensions;

    MediaKind(String defaultMimeType, List<String> extensions) {
        this.defaultMimeType = defaultMimeType;
        this.extensions = extensions;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Resolves the MIME type for a file of this kind. Images report JPEG or PNG depending on the extension.
     */
    public String mimeType(String fileName) {
        if (this == IMAGE && fileName != null) {
            String extension = extensionOf(fileName);
            if ("jpg".equals(extension) || "jpeg".equals(extension)) {
                return "image/jpeg";
            }
        }
        return defaultMimeType;
    }

    public static Optional<MediaKind> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String extension = extensionOf(fileName);
        for (MediaKind kind : values()) {
            if (kind.extensions.contains(extension)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
