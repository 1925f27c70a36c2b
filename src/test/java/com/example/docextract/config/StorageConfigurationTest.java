package com.example.docextract.config;

import com.example.docextract.domain.model.ImageStorageMode;
import com.example.docextract.infrastructure.storage.ExtractionStorage;
import com.example.docextract.infrastructure.storage.FileExtractionStorage;
import com.example.docextract.infrastructure.storage.JdbcExtractionStorage;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class StorageConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    JacksonAutoConfiguration.class,
                    DataSourceAutoConfiguration.class,
                    JdbcTemplateAutoConfiguration.class,
                    DataSourceTransactionManagerAutoConfiguration.class))
            .withUserConfiguration(StorageConfiguration.class);

    @Test
    void fileBackendIsTheDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ExtractionStorage.class);
            assertThat(context.getBean(ExtractionStorage.class)).isInstanceOf(FileExtractionStorage.class);
            ExtractorProperties properties = context.getBean(ExtractorProperties.class);
            assertThat(properties.getStorage().getOutputRoot()).isEqualTo("output");
            assertThat(properties.getStorage().getImageMode()).isEqualTo(ImageStorageMode.BLOB);
        });
    }

    @Test
    void databaseBackendUsesJdbc() {
        contextRunner
                .withPropertyValues(
                        "spring.datasource.url=jdbc:h2:mem:storage-config;DB_CLOSE_DELAY=-1",
                        "extractor.storage.backend=database",
                        "extractor.storage.image-mode=path",
                        "extractor.storage.database-platform=h2")
                .run(context -> {
                    assertThat(context.getBean(ExtractionStorage.class)).isInstanceOf(JdbcExtractionStorage.class);
                    assertThat(context.getBean(ExtractorProperties.class).getStorage().getImageMode())
                            .isEqualTo(ImageStorageMode.PATH);
                });
    }

    @Test
    void batchInputsBindFromProperties() {
        contextRunner
                .withPropertyValues("extractor.batch.inputs=docs,extra/b.pdf", "extractor.batch.show-data=true")
                .run(context -> {
                    ExtractorProperties.Batch batch = context.getBean(ExtractorProperties.class).getBatch();
                    assertThat(batch.getInputs()).containsExactly("docs", "extra/b.pdf");
                    assertThat(batch.isShowData()).isTrue();
                    assertThat(batch.isEnabled()).isFalse();
                });
    }
}
