package com.eyelevel.docsummarizer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Document Summarizer API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                This API summarizes PDF documents and extracts named entities from them.
                                Each uploaded document becomes a job that runs through an ordered pipeline:
                                text extraction, entity extraction and summarization.

                                Key features include:
                                * **Asynchronous Processing:** Jobs run on a background worker pool and can be polled for progress.
                                * **Synchronous Processing:** A blocking endpoint runs the same pipeline and returns the final record.
                                * **Multiple Backends:** Summaries come from OpenAI, Hugging Face or a local extractive summarizer.
                                * **Job Lifecycle Management:** Jobs can be started, cancelled, listed and deleted.

                                **Note:** A failed job is still a successful status read; the failing stage and error are reported in the body.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
