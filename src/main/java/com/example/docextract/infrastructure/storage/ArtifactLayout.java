package com.example.docextract.infrastructure.storage;

import com.example.docextract.domain.model.DocumentMetadata;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.infrastructure.exception.StorageWriteException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Naming scheme of the on-disk output:
 * {@code <root>/<FORMAT>/<data-type>/<document-name>/<artifact>}.
 */
final class ArtifactLayout {

    static final String TEXT = "text";
    static final String LINKS = "links";
    static final String IMAGES = "images";
    static final String TABLES = "tables";
    static final String METADATA = "metadata";

    private final Path root;

    ArtifactLayout(Path root) {
        this.root = root;
    }

    Path directory(DocumentMetadata metadata, String dataType) {
        return root.resolve(metadata.format().name())
                .resolve(dataType)
                .resolve(safeName(metadata.documentName()));
    }

    static String pageFileName(int location) {
        return String.format("page-%03d.txt", location);
    }

    static String imageFileName(ExtractedImage image) {
        return String.format("image-%03d-page-%03d.%s", image.sequence(), image.location(), image.fileExtension());
    }

    static String tableFileName(ExtractedTable table) {
        return String.format("table-%03d-page-%03d.csv", table.sequence(), table.location());
    }

    Path imagePath(DocumentMetadata metadata, ExtractedImage image) {
        return directory(metadata, IMAGES).resolve(imageFileName(image));
    }

    Path writeImage(DocumentMetadata metadata, ExtractedImage image) {
        Path target = imagePath(metadata, image);
        write(target, image.data());
        return target;
    }

    void writeText(Path target, String content) {
        write(target, content.getBytes(StandardCharsets.UTF_8));
    }

    void write(Path target, byte[] content) {
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException ex) {
            throw new StorageWriteException("Unable to write " + target, ex);
        }
    }

    /**
     * Keeps letters, digits, dot, dash and underscore; anything else becomes an underscore.
     */
    static String safeName(String name) {
        String cleaned = name.replaceAll("[^\\p{L}\\p{N}._-]", "_");
        return cleaned.isBlank() || cleaned.chars().allMatch(ch -> ch == '.') ? "document" : cleaned;
    }
}
