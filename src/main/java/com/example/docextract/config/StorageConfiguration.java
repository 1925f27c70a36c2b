package com.example.docextract.config;

import com.example.docextract.infrastructure.storage.ExtractionStorage;
import com.example.docextract.infrastructure.storage.FileExtractionStorage;
import com.example.docextract.infrastructure.storage.JdbcExtractionStorage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Selects the {@link ExtractionStorage} implementation from {@code extractor.storage.backend}.
 * JDBC infrastructure is only resolved when the database backend is chosen, so the file backend
 * runs without a reachable database.
 */
@Configuration
@EnableConfigurationProperties(ExtractorProperties.class)
public class StorageConfiguration {

    @Bean
    public ExtractionStorage extractionStorage(ExtractorProperties properties,
                                               ObjectMapper objectMapper,
                                               ObjectProvider<JdbcTemplate> jdbcTemplate,
                                               ObjectProvider<PlatformTransactionManager> transactionManager) {
        ExtractorProperties.Storage storage = properties.getStorage();
        return switch (storage.getBackend()) {
            case FILE -> new FileExtractionStorage(storage, objectMapper);
            case DATABASE -> new JdbcExtractionStorage(
                    jdbcTemplate.getObject(), transactionManager.getObject(), storage, objectMapper);
        };
    }
}
