package com.eyelevel.docsummarizer.summarization.config;

import com.eyelevel.docsummarizer.common.apiclient.authentication.Authentication;
import com.eyelevel.docsummarizer.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.docsummarizer.config.SummarizerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClients and credentials for the remote summarization services.
 */
@Configuration
public class SummarizationClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 2 * 1024 * 1024;

    @Bean("openAiWebClient")
    public WebClient openAiWebClient(final WebClient.Builder builder, final SummarizerProperties properties) {
        return builder.clone()
                      .baseUrl(properties.getSummarization().getOpenai().getBaseUrl())
                      .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                      .build();
    }

    @Bean("openAiAuthentication")
    public Authentication openAiAuthentication(final SummarizerProperties properties) {
        return new BearerTokenAuthentication(properties.getSummarization().getOpenai().getApiKey());
    }

    @Bean("huggingFaceWebClient")
    public WebClient huggingFaceWebClient(final WebClient.Builder builder, final SummarizerProperties properties) {
        return builder.clone()
                      .baseUrl(properties.getSummarization().getHuggingface().getBaseUrl())
                      .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                      .build();
    }

    @Bean("huggingFaceAuthentication")
    public Authentication huggingFaceAuthentication(final SummarizerProperties properties) {
        return new BearerTokenAuthentication(properties.getSummarization().getHuggingface().getApiKey());
    }
}
