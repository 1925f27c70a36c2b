package com.example.docextract.infrastructure.storage;

import com.example.docextract.config.ExtractorProperties;
import com.example.docextract.domain.model.DocumentMetadata;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.Hyperlink;
import com.example.docextract.domain.model.ImageStorageMode;
import com.example.docextract.domain.model.StorageBackend;
import com.example.docextract.domain.model.StorageReceipt;
import com.example.docextract.domain.model.TextBlock;
import com.example.docextract.infrastructure.exception.StorageConnectionException;
import com.example.docextract.infrastructure.exception.StorageException;
import com.example.docextract.infrastructure.exception.StorageIntegrityException;
import com.example.docextract.infrastructure.exception.StorageWriteException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Stores extraction results in a relational database, one transaction per document.
 * The schema is created on first use from {@code classpath:schema/schema-<platform>.sql}.
 * Every call inserts a new document row under a fresh UUID.
 */
public class JdbcExtractionStorage implements ExtractionStorage {

    private static final Logger log = LoggerFactory.getLogger(JdbcExtractionStorage.class);

    private static final String INSERT_DOCUMENT = """
            INSERT INTO documents (id, path, format, size, title, author, last_modified_by,
                                   created_at, modified_at, page_count, extracted_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String INSERT_TEXT_BLOCK =
            "INSERT INTO text_blocks (document_id, page, content, style, heading, font_size) VALUES (?, ?, ?, ?, ?, ?)";
    private static final String INSERT_LINK =
            "INSERT INTO links (document_id, page, text, url) VALUES (?, ?, ?, ?)";
    private static final String INSERT_IMAGE =
            "INSERT INTO images (document_id, page, sequence, width, height, format, data, path) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String INSERT_TABLE =
            "INSERT INTO tables (document_id, page, sequence, row_count, col_count, data) VALUES (?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ImageStorageMode imageMode;
    private final String schemaLocation;
    private final ArtifactLayout imageLayout;
    private final ObjectMapper objectMapper;
    private volatile boolean schemaReady;

    public JdbcExtractionStorage(JdbcTemplate jdbcTemplate,
                                 PlatformTransactionManager transactionManager,
                                 ExtractorProperties.Storage storage,
                                 ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.imageMode = storage.getImageMode();
        this.schemaLocation = "schema/schema-" + storage.getDatabasePlatform() + ".sql";
        this.imageLayout = new ArtifactLayout(storage.outputRootPath());
        this.objectMapper = objectMapper;
    }

    /**
     * @return receipt whose location is the generated document id
     * @throws StorageConnectionException when no connection or transaction can be obtained
     * @throws StorageIntegrityException  when a constraint rejects a row; nothing is kept
     * @throws StorageWriteException      for any other write failure; nothing is kept
     */
    @Override
    public StorageReceipt save(ExtractionResult result) {
        String documentId = UUID.randomUUID().toString();
        List<Path> writtenImages = new ArrayList<>();
        try {
            ensureSchema();
            transactionTemplate.executeWithoutResult(status -> insertAll(documentId, result, writtenImages));
        } catch (RuntimeException ex) {
            discard(writtenImages);
            throw translate(ex, result);
        }
        log.info("Stored {} in the database as document {}", result.metadata().fileName(), documentId);
        return new StorageReceipt(StorageBackend.DATABASE, documentId);
    }

    private static RuntimeException translate(RuntimeException failure, ExtractionResult result) {
        if (failure instanceof StorageException) {
            return failure;
        }
        if (failure instanceof DataIntegrityViolationException) {
            return new StorageIntegrityException("Constraint violated while storing " + result.metadata().fileName(), failure);
        }
        if (failure instanceof DataAccessException || failure instanceof TransactionException) {
            if (isConnectionFailure(failure)) {
                return new StorageConnectionException("Database is unreachable", failure);
            }
            return new StorageWriteException("Unable to store " + result.metadata().fileName(), failure);
        }
        return failure;
    }

    /**
     * Removes the image files a failed save created. Files that already existed are left in place
     * because an earlier stored document may point at them.
     */
    private static void discard(List<Path> writtenImages) {
        for (Path image : writtenImages) {
            try {
                Files.deleteIfExists(image);
            } catch (IOException ex) {
                log.warn("Unable to remove image {} after a failed save", image, ex);
            }
        }
    }

    /**
     * Script execution wraps connection failures, so the whole cause chain is inspected.
     */
    private static boolean isConnectionFailure(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof CannotGetJdbcConnectionException
                    || current instanceof CannotCreateTransactionException
                    || current instanceof SQLTransientConnectionException
                    || current instanceof SQLNonTransientConnectionException) {
                return true;
            }
        }
        return false;
    }

    private void ensureSchema() {
        if (schemaReady) {
            return;
        }
        synchronized (this) {
            if (schemaReady) {
                return;
            }
            DataSource dataSource = jdbcTemplate.getDataSource();
            if (dataSource == null) {
                throw new StorageConnectionException("JdbcTemplate has no DataSource", null);
            }
            ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(schemaLocation));
            populator.execute(dataSource);
            log.info("Database schema initialised from {}", schemaLocation);
            schemaReady = true;
        }
    }

    private void insertAll(String documentId, ExtractionResult result, List<Path> writtenImages) {
        DocumentMetadata metadata = result.metadata();
        jdbcTemplate.update(INSERT_DOCUMENT,
                documentId,
                metadata.sourcePath(),
                metadata.format().name(),
                metadata.fileSizeBytes(),
                metadata.title(),
                metadata.author(),
                metadata.lastModifiedBy(),
                timestamp(metadata.createdAt()),
                timestamp(metadata.modifiedAt()),
                metadata.pageCount(),
                Timestamp.from(Instant.now()));

        List<Object[]> textRows = new ArrayList<>();
        for (TextBlock block : result.textBlocks()) {
            textRows.add(new Object[]{documentId, block.location(), block.content(), block.style(), block.heading(), block.fontSize()});
        }
        batch(INSERT_TEXT_BLOCK, textRows);

        List<Object[]> linkRows = new ArrayList<>();
        for (Hyperlink link : result.links()) {
            linkRows.add(new Object[]{documentId, link.location(), link.text(), link.url()});
        }
        batch(INSERT_LINK, linkRows);

        for (ExtractedImage image : result.images()) {
            byte[] data = null;
            String path = null;
            if (imageMode == ImageStorageMode.PATH) {
                boolean replacing = Files.exists(imageLayout.imagePath(metadata, image));
                Path written = imageLayout.writeImage(metadata, image);
                if (!replacing) {
                    writtenImages.add(written);
                }
                path = written.toAbsolutePath().toString();
            } else {
                data = image.data();
            }
            jdbcTemplate.update(INSERT_IMAGE, documentId, image.location(), image.sequence(),
                    image.width(), image.height(), image.format(), data, path);
        }

        List<Object[]> tableRows = new ArrayList<>();
        for (ExtractedTable table : result.tables()) {
            tableRows.add(new Object[]{documentId, table.location(), table.sequence(),
                    table.rowCount(), table.columnCount(), toJson(table)});
        }
        batch(INSERT_TABLE, tableRows);
    }

    private void batch(String sql, List<Object[]> rows) {
        if (!rows.isEmpty()) {
            jdbcTemplate.batchUpdate(sql, rows);
        }
    }

    private String toJson(ExtractedTable table) {
        try {
            return objectMapper.writeValueAsString(table.rows());
        } catch (JsonProcessingException ex) {
            throw new StorageWriteException("Unable to serialize table " + table.sequence(), ex);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
