package com.example.docextract.config;

import com.example.docextract.domain.model.ImageStorageMode;
import com.example.docextract.domain.model.StorageBackend;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings under the {@code extractor} prefix.
 * Database connection parameters live under {@code spring.datasource}.
 */
@ConfigurationProperties(prefix = "extractor")
public class ExtractorProperties {

    private final Storage storage = new Storage();
    private final Batch batch = new Batch();

    public Storage getStorage() {
        return storage;
    }

    public Batch getBatch() {
        return batch;
    }

    public static class Storage {

        /**
         * Backend that persists extraction results.
         */
        private StorageBackend backend = StorageBackend.FILE;

        /**
         * Root directory of the file backend; also receives images in {@code path} image mode.
         */
        private String outputRoot = "output";

        /**
         * Whether the database backend stores image bytes or file paths.
         */
        private ImageStorageMode imageMode = ImageStorageMode.BLOB;

        /**
         * Suffix of the schema script under {@code classpath:schema/}.
         */
        private String databasePlatform = "mysql";

        public StorageBackend getBackend() {
            return backend;
        }

        public void setBackend(StorageBackend backend) {
            this.backend = backend;
        }

        public String getOutputRoot() {
            return outputRoot;
        }

        public void setOutputRoot(String outputRoot) {
            this.outputRoot = outputRoot;
        }

        public Path outputRootPath() {
            return Path.of(outputRoot);
        }

        public ImageStorageMode getImageMode() {
            return imageMode;
        }

        public void setImageMode(ImageStorageMode imageMode) {
            this.imageMode = imageMode;
        }

        public String getDatabasePlatform() {
            return databasePlatform;
        }

        public void setDatabasePlatform(String databasePlatform) {
            this.databasePlatform = databasePlatform;
        }
    }

    public static class Batch {

        /**
         * Runs the batch extraction at startup and exits with its status.
         */
        private boolean enabled;

        /**
         * Files or directories to process; directories are scanned one level deep.
         */
        private List<String> inputs = new ArrayList<>();

        /**
         * Logs a readable summary of every extracted document.
         */
        private boolean showData;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getInputs() {
            return inputs;
        }

        public void setInputs(List<String> inputs) {
            this.inputs = inputs;
        }

        public boolean isShowData() {
            return showData;
        }

        public void setShowData(boolean showData) {
            this.showData = showData;
        }
    }
}
