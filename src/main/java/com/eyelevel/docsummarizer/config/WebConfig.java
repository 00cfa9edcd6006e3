package com.eyelevel.docsummarizer.config;

import com.eyelevel.docsummarizer.model.EntityType;
import com.eyelevel.docsummarizer.model.LlmBackend;
import com.eyelevel.docsummarizer.model.SummaryMode;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

/**
 * Web settings: global CORS and request-parameter conversion for the option enums, which accept
 * both their wire value ("bullets", "hf") and their constant name.
 */
@Slf4j
@Configuration
public class WebConfig {

    @Value("${app.cors.allowed-origins}")
    private String[] allowedOrigins;

    @Bean
    public WebMvcConfigurer summarizerWebConfigurer() {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(@NonNull CorsRegistry registry) {
                log.info("CORS allowed origins: {}", Arrays.toString(allowedOrigins));
                registry.addMapping("/**")
                        .allowedOriginPatterns(allowedOrigins)
                        .allowedMethods("*")
                        .allowedHeaders("*")
                        .allowCredentials(true)
                        .maxAge(3600);
            }

            @Override
            public void addFormatters(@NonNull FormatterRegistry registry) {
                registerOptionConverters(registry);
            }
        };
    }

    public static void registerOptionConverters(final FormatterRegistry registry) {
        registry.addConverter(String.class, SummaryMode.class, SummaryMode::fromValue);
        registry.addConverter(String.class, LlmBackend.class, LlmBackend::fromValue);
        registry.addConverter(String.class, EntityType.class, EntityType::fromValue);
    }
}
