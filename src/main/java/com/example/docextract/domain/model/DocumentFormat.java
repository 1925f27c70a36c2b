package com.example.docextract.domain.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Domain enumeration of the document formats the extractor understands.
 * Each format knows its file extension and how positions inside it are named (page or slide).
 */
public enum DocumentFormat {
    PDF("pdf", "page"),
    DOCX("docx", "page"),
    PPTX("pptx", "slide");

    private final String extension;
    private final String locationLabel;

    DocumentFormat(String extension, String locationLabel) {
        this.extension = extension;
        this.locationLabel = locationLabel;
    }

    public String extension() {
        return extension;
    }

    /**
     * @return {@code page} for paginated formats, {@code slide} for presentations
     */
    public String locationLabel() {
        return locationLabel;
    }

	/**
	 * Resolves the format from the extension of a file name.
	 *
	 * @param fileName file name or path string, may be {@code null}
	 * @return matching format or empty when the extension is missing or unknown
	 */
    public static Optional<DocumentFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String suffix = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (DocumentFormat format : values()) {
            if (format.extension.equals(suffix)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

	/**
	 * Resolves the format from the file name component of a path.
	 *
	 * @param path path to inspect
	 * @return matching format or empty when unknown
	 */
    public static Optional<DocumentFormat> fromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        return fromFileName(path.getFileName().toString());
    }
}
