package com.eyelevel.docsummarizer.summarization.huggingface;

import com.eyelevel.docsummarizer.common.apiclient.ApiClient;
import com.eyelevel.docsummarizer.common.apiclient.authentication.Authentication;
import com.eyelevel.docsummarizer.common.apiclient.model.ApiRequest;
import com.eyelevel.docsummarizer.common.apiclient.model.ApiResponse;
import com.eyelevel.docsummarizer.common.json.JsonParser;
import com.eyelevel.docsummarizer.config.SummarizerProperties;
import com.eyelevel.docsummarizer.dto.huggingface.SummarizationOutput;
import com.eyelevel.docsummarizer.dto.huggingface.SummarizationRequest;
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

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Summarizes through the Hugging Face inference API with a BART-style summarization model. The model
 * has a short context window, so input is truncated to {@code maxInputChars}. A 503 while the model is
 * loading is retried like any other transient failure.
 */
@Slf4j
@Service("huggingFaceSummarizationBackend")
public class HuggingFaceSummarizationBackend extends ApiClient implements SummarizationBackend {

    private static final String MODELS_PATH = "/models/";

    private final SummarizerProperties.Summarization.HuggingFace settings;
    private final JsonParser jsonParser;

    public HuggingFaceSummarizationBackend(@Qualifier("huggingFaceWebClient") final WebClient webClient,
                                           @Qualifier("huggingFaceAuthentication") final Authentication authentication,
                                           @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                                           final SummarizerProperties properties) {
        super(webClient, authentication, properties.getSummarization().getHuggingface().getTimeout());
        this.settings = properties.getSummarization().getHuggingface();
        this.jsonParser = jsonParser;
    }

    @Override
    public LlmBackend backend() {
        return LlmBackend.HUGGINGFACE;
    }

    @Override
    public String modelName() {
        return settings.getModel();
    }

    @Override
    @Retryable(retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class,
            TooManyRequestsException.class, BadGatewayException.class},
            maxAttemptsExpression = "#{${app.processing.summarization.huggingface.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.summarization.huggingface.retry.delay-ms}}"),
            listeners = {"summarizationRetryListener"})
    public String summarize(final String text, final SummaryMode mode) {
        if (text == null || text.isBlank()) {
            throw new SummarizationException("Cannot summarize empty text");
        }
        final String input = text.length() > settings.getMaxInputChars()
                ? text.substring(0, settings.getMaxInputChars())
                : text;
        final LengthRange range = LengthRange.of(mode);
        log.info("Requesting {} summary from Hugging Face model {} for {} characters (truncated from {}).", mode,
                 settings.getModel(), input.length(), text.length());

        final ApiResponse apiResponse = call(ApiRequest.builder()
                                                       .method(HttpMethod.POST)
                                                       .path(MODELS_PATH + settings.getModel())
                                                       .body(new SummarizationRequest(input,
                                                               new SummarizationRequest.Parameters(range.min(),
                                                                       range.max(), false)))
                                                       .contentType(MediaType.APPLICATION_JSON)
                                                       .acceptMediaType(MediaType.APPLICATION_JSON)
                                                       .build());

        final SummarizationOutput[] outputs = jsonParser.parseObject(apiResponse.getData(),
                                                                     SummarizationOutput[].class);
        if (outputs.length == 0 || outputs[0].summaryText() == null) {
            throw new SummarizationException("Hugging Face returned no summary");
        }
        final String summary = outputs[0].summaryText().strip();
        return mode == SummaryMode.BULLET_POINTS ? formatAsBullets(summary) : summary;
    }

    @Recover
    public String recover(final RuntimeException e, final String text, final SummaryMode mode) {
        if (e instanceof SummarizationException summarizationException) {
            throw summarizationException;
        }
        log.error("Hugging Face summarization failed for mode {}: {}", mode, e.getMessage());
        throw new SummarizationException("Hugging Face error: " + e.getMessage(), e);
    }

    @Override
    public Map<String, Object> modelInfo() {
        return Map.of("backend", backend().getValue(), "model", modelName(), "provider", "Hugging Face",
                      "configured", authentication.isConfigured());
    }

    static String formatAsBullets(final String summary) {
        final String[] sentences = Arrays.stream(summary.split("\\."))
                                         .map(String::strip)
                                         .filter(sentence -> !sentence.isEmpty())
                                         .toArray(String[]::new);
        if (sentences.length <= 1) {
            return "• " + summary;
        }
        return Arrays.stream(sentences).map(sentence -> "• " + sentence + ".").collect(Collectors.joining("\n"));
    }

    /**
     * Token bounds passed to the model per summary mode.
     */
    record LengthRange(int min, int max) {

        static LengthRange of(final SummaryMode mode) {
            return switch (mode) {
                case BRIEF -> new LengthRange(30, 60);
                case DETAILED -> new LengthRange(100, 200);
                case BULLET_POINTS -> new LengthRange(50, 100);
            };
        }
    }
}
