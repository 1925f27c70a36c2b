package com.example.docextract;

import com.example.docextract.interfaces.cli.ExtractionCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Application entry point.
 * Serves the HTTP API by default; with {@code extractor.batch.enabled=true} it processes the given
 * documents once and exits with the batch status.
 */
@SpringBootApplication
public class DocExtractApplication {

	/**
	 * Boots the Spring container. In batch mode the JVM exits with the runner's exit code.
	 *
	 * @param args optional command line arguments; non-option arguments are batch inputs
	 */
	public static void main(String[] args) {
		ConfigurableApplicationContext context = SpringApplication.run(DocExtractApplication.class, args);
		if (context.getBeanProvider(ExtractionCommandLineRunner.class).getIfAvailable() != null) {
			System.exit(SpringApplication.exit(context));
		}
	}

}
