package com.eyelevel.docsummarizer.summarization.openai;

import com.eyelevel.docsummarizer.common.apiclient.ApiClient;
import com.eyelevel.docsummarizer.common.apiclient.authentication.Authentication;
import com.eyelevel.docsummarizer.common.apiclient.model.ApiRequest;
import com.eyelevel.docsummarizer.common.apiclient.model.ApiResponse;
import com.eyelevel.docsummarizer.common.json.JsonParser;
import com.eyelevel.docsummarizer.config.SummarizerProperties;
import com.eyelevel.docsummarizer.dto.openai.ChatCompletionRequest;
import com.eyelevel.docsummarizer.dto.openai.ChatCompletionResponse;
import com.eyelevel.docsummarizer.dto.openai.ChatMessage;
import com.eyelevel.docsummarizer.exception.SummarizationException;
import com.eyelevel.docsummarizer.exception.apiclient.BadGatewayException;
import com.eyelevel.docsummarizer.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.docsummarizer.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.docsummarizer.exception.apiclient.TooManyRequestsException;
import com.eyelevel.docsummarizer.model.LlmBackend;
import com.eyelevel.docsummarizer.model.SummaryMode;
import com.eyelevel.docsummarizer.summarization.SummarizationBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Summarizes through the OpenAI chat completions API. Transient HTTP failures (429, 502, 503, 504 and
 * connection errors) are retried with a fixed back-off.
 */
@Slf4j
@Service("openAiSummarizationBackend")
public class OpenAiSummarizationBackend extends ApiClient implements SummarizationBackend {

    static final String SYSTEM_PROMPT = "You are a helpful assistant that summarizes documents accurately and concisely.";
    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final SummarizerProperties.Summarization.OpenAi settings;
    private final JsonParser jsonParser;

    public OpenAiSummarizationBackend(@Qualifier("openAiWebClient") final WebClient webClient,
                                      @Qualifier("openAiAuthentication") final Authentication authentication,
                                      @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                                      final SummarizerProperties properties) {
        super(webClient, authentication, properties.getSummarization().getOpenai().getTimeout());
        this.settings = properties.getSummarization().getOpenai();
        this.jsonParser = jsonParser;
    }

    @Override
    public LlmBackend backend() {
        return LlmBackend.OPENAI;
    }

    @Override
    public String modelName() {
        return settings.getModel();
    }

    @Override
    @Retryable(retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class,
            TooManyRequestsException.class, BadGatewayException.class},
            maxAttemptsExpression = "#{${app.processing.summarization.openai.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.summarization.openai.retry.delay-ms}}"),
            listeners = {"summarizationRetryListener"})
    public String summarize(final String text, final SummaryMode mode) {
        if (text == null || text.isBlank()) {
            throw new SummarizationException("Cannot summarize empty text");
        }
        if (!authentication.isConfigured()) {
            throw new SummarizationException("OpenAI API key is not configured");
        }
        log.info("Requesting {} summary from OpenAI model {} for {} characters.", mode, settings.getModel(),
                 text.length());

        final ChatCompletionRequest request = new ChatCompletionRequest(settings.getModel(),
                List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(buildPrompt(text, mode))),
                settings.getTemperature(), maxTokens(mode));
        final ApiResponse apiResponse = call(ApiRequest.builder()
                                                       .method(HttpMethod.POST)
                                                       .path(COMPLETIONS_PATH)
                                                       .body(request)
                                                       .contentType(MediaType.APPLICATION_JSON)
                                                       .acceptMediaType(MediaType.APPLICATION_JSON)
                                                       .build());

        final ChatCompletionResponse response = jsonParser.parseObject(apiResponse.getData(),
                                                                       ChatCompletionResponse.class);
        if (response.choices() == null || response.choices().isEmpty() || response.choices().get(0).message() == null) {
            throw new SummarizationException("OpenAI returned no completion choices");
        }
        return response.choices().get(0).message().content().strip();
    }

    @Recover
    public String recover(final RuntimeException e, final String text, final SummaryMode mode) {
        if (e instanceof SummarizationException summarizationException) {
            throw summarizationException;
        }
        log.error("OpenAI summarization failed for mode {}: {}", mode, e.getMessage());
        throw new SummarizationException("OpenAI API error: " + e.getMessage(), e);
    }

    @Override
    public Map<String, Object> modelInfo() {
        return Map.of("backend", backend().getValue(), "model", modelName(), "provider", "OpenAI",
                      "configured", authentication.isConfigured());
    }

    static String buildPrompt(final String text, final SummaryMode mode) {
        final String instruction = switch (mode) {
            case BRIEF -> "Provide a brief 2-3 sentence summary highlighting ONLY the key points.";
            case DETAILED -> "Provide a detailed summary covering all important aspects of the document.";
            case BULLET_POINTS -> "Provide a summary in bullet points, highlighting the main points.";
        };
        return "Summarize the following document:\n\n" + text + "\n\n" + instruction;
    }

    static int maxTokens(final SummaryMode mode) {
        return switch (mode) {
            case BRIEF -> 150;
            case DETAILED -> 500;
            case BULLET_POINTS -> 300;
        };
    }
}
