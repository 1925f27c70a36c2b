package com.example.docextract;

import com.example.docextract.application.service.UploadedDocumentService;
import com.example.docextract.infrastructure.storage.ExtractionStorage;
import com.example.docextract.infrastructure.storage.FileExtractionStorage;
import com.example.docextract.interfaces.cli.ExtractionCommandLineRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class DocExtractApplicationTests {

	@Autowired
	private ApplicationContext context;

	/**
	 * Ensures the application context loads with the file backend and without the batch runner.
	 */
	@Test
	void contextLoads() {
		assertThat(context.getBean(ExtractionStorage.class)).isInstanceOf(FileExtractionStorage.class);
		assertThat(context.getBean(UploadedDocumentService.class)).isNotNull();
		assertThat(context.getBeanProvider(ExtractionCommandLineRunner.class).getIfAvailable()).isNull();
	}

}
