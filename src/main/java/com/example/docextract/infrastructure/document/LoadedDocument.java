package com.example.docextract.infrastructure.document;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.DocumentMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;

/**
 * An opened document: the metadata read at load time plus the parsing library's handle
 * ({@code PDDocument}, {@code XWPFDocument} or {@code XMLSlideShow}).
 * Owned by a single pipeline run and closed once extraction finishes.
 */
public final class LoadedDocument implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadedDocument.class);

    private final DocumentMetadata metadata;
    private final Closeable handle;
    private boolean closed;

    public LoadedDocument(DocumentMetadata metadata, Closeable handle) {
        if (metadata == null || handle == null) {
            throw new IllegalArgumentException("metadata and handle are required");
        }
        this.metadata = metadata;
        this.handle = handle;
    }

    public DocumentMetadata metadata() {
        return metadata;
    }

    public DocumentFormat format() {
        return metadata.format();
    }

    /**
     * Returns the library handle typed for the calling extractor.
     *
     * @param type expected handle type
     * @param <T>  handle type
     * @return the handle
     * @throws IllegalArgumentException when the document was opened by a different library
     * @throws IllegalStateException    when the document is already closed
     */
    public <T> T unwrap(Class<T> type) {
        if (closed) {
            throw new IllegalStateException("Document already closed: " + metadata.fileName());
        }
        if (!type.isInstance(handle)) {
            throw new IllegalArgumentException("Expected a " + type.getSimpleName() + " handle for "
                    + metadata.fileName() + " but found " + handle.getClass().getSimpleName());
        }
        return type.cast(handle);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            handle.close();
        } catch (IOException ex) {
            log.warn("Failed to release {} cleanly", metadata.fileName(), ex);
        }
    }

    /**
     * Closes a freshly opened handle when building the {@link LoadedDocument} failed,
     * attaching any close failure to the original exception.
     *
     * @param handle  handle to release
     * @param failure exception that aborted the load
     */
    public static void releaseAfterFailure(Closeable handle, Exception failure) {
        try {
            handle.close();
        } catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }
}
