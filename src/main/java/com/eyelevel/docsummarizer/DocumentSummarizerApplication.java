package com.eyelevel.docsummarizer;

import com.eyelevel.docsummarizer.config.SummarizerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;

/**
 * The main entry point for the Document Summarizer Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.processing" properties to
 *     {@link SummarizerProperties}.</li>
 *     <li>{@link EnableRetry}: activates Spring Retry for the remote summarization backends.</li>
 * </ul>
 * Pipeline runs are dispatched onto the explicit job worker pool defined in
 * {@link com.eyelevel.docsummarizer.config.TaskExecutorConfig}.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = SummarizerProperties.class)
@EnableRetry
public class DocumentSummarizerApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("Starting DocumentSummarizerApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DocumentSummarizerApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DocumentSummarizer"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - API docs:   http://localhost:{}/swagger-ui.html", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
