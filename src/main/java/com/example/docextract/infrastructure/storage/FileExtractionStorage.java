package com.example.docextract.infrastructure.storage;

import com.example.docextract.config.ExtractorProperties;
import com.example.docextract.domain.model.DocumentMetadata;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.Hyperlink;
import com.example.docextract.domain.model.StorageBackend;
import com.example.docextract.domain.model.StorageReceipt;
import com.example.docextract.domain.model.TextBlock;
import com.example.docextract.infrastructure.exception.StorageWriteException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes extraction results below a root directory, one folder per data type and document:
 * {@code <root>/<FORMAT>/{text,links,images,tables,metadata}/<document-name>/}.
 * Empty collections produce no files. Existing artifacts with the same name are overwritten.
 */
public class FileExtractionStorage implements ExtractionStorage {

    private static final Logger log = LoggerFactory.getLogger(FileExtractionStorage.class);
    private static final List<String> LINK_HEADER = List.of("text", "url", "page");

    private final Path outputRoot;
    private final ArtifactLayout layout;
    private final ObjectMapper objectMapper;

    /**
     * @param storage      storage settings; only the output root is used
     * @param objectMapper mapper used for {@code metadata.json}
     */
    public FileExtractionStorage(ExtractorProperties.Storage storage, ObjectMapper objectMapper) {
        this.outputRoot = storage.outputRootPath();
        this.layout = new ArtifactLayout(outputRoot);
        this.objectMapper = objectMapper;
    }

    @Override
    public StorageReceipt save(ExtractionResult result) {
        DocumentMetadata metadata = result.metadata();
        writeText(metadata, result.textBlocks());
        writeLinks(metadata, result.links());
        for (ExtractedImage image : result.images()) {
            layout.writeImage(metadata, image);
        }
        for (ExtractedTable table : result.tables()) {
            Path target = layout.directory(metadata, ArtifactLayout.TABLES).resolve(ArtifactLayout.tableFileName(table));
            layout.writeText(target, CsvFormatter.format(table.rows()));
        }
        writeMetadata(metadata);

        Path documentRoot = outputRoot.resolve(metadata.format().name()).toAbsolutePath();
        log.info("Stored {} ({} text blocks, {} links, {} images, {} tables) under {}",
                metadata.fileName(), result.textBlocks().size(), result.links().size(),
                result.images().size(), result.tables().size(), documentRoot);
        return new StorageReceipt(StorageBackend.FILE, documentRoot.toString());
    }

    private void writeText(DocumentMetadata metadata, List<TextBlock> blocks) {
        if (blocks.isEmpty()) {
            return;
        }
        Path directory = layout.directory(metadata, ArtifactLayout.TEXT);
        Map<Integer, List<String>> byLocation = new TreeMap<>();
        List<String> all = new ArrayList<>(blocks.size());
        for (TextBlock block : blocks) {
            byLocation.computeIfAbsent(block.location(), ignored -> new ArrayList<>()).add(block.content());
            all.add(block.content());
        }
        byLocation.forEach((location, contents) ->
                layout.writeText(directory.resolve(ArtifactLayout.pageFileName(location)), String.join("\n", contents)));
        layout.writeText(directory.resolve("document.txt"), String.join("\n", all));
    }

    private void writeLinks(DocumentMetadata metadata, List<Hyperlink> links) {
        if (links.isEmpty()) {
            return;
        }
        List<List<String>> rows = new ArrayList<>(links.size() + 1);
        rows.add(LINK_HEADER);
        for (Hyperlink link : links) {
            rows.add(List.of(link.text(), link.url(), Integer.toString(link.location())));
        }
        Path target = layout.directory(metadata, ArtifactLayout.LINKS).resolve("links.csv");
        layout.writeText(target, CsvFormatter.format(rows));
    }

    private void writeMetadata(DocumentMetadata metadata) {
        Path target = layout.directory(metadata, ArtifactLayout.METADATA).resolve("metadata.json");
        try {
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(MetadataDocument.of(metadata));
            layout.write(target, json);
        } catch (JsonProcessingException ex) {
            throw new StorageWriteException("Unable to serialize metadata of " + metadata.fileName(), ex);
        }
    }

    /**
     * JSON shape of {@code metadata.json}. Timestamps are ISO-8601 strings.
     */
    record MetadataDocument(
            String format,
            String sourcePath,
            String fileName,
            long fileSizeBytes,
            String title,
            String author,
            String lastModifiedBy,
            String createdAt,
            String modifiedAt,
            int pageCount
    ) {

        static MetadataDocument of(DocumentMetadata metadata) {
            return new MetadataDocument(
                    metadata.format().name(),
                    metadata.sourcePath(),
                    metadata.fileName(),
                    metadata.fileSizeBytes(),
                    metadata.title(),
                    metadata.author(),
                    metadata.lastModifiedBy(),
                    isoOrNull(metadata.createdAt()),
                    isoOrNull(metadata.modifiedAt()),
                    metadata.pageCount()
            );
        }

        private static String isoOrNull(Instant instant) {
            return instant != null ? instant.toString() : null;
        }
    }
}
