package com.eyelevel.docsummarizer.summarization.huggingface;

import com.eyelevel.docsummarizer.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.docsummarizer.common.json.jackson.JacksonJsonParser;
import com.eyelevel.docsummarizer.config.SummarizerProperties;
import com.eyelevel.docsummarizer.exception.SummarizationException;
import com.eyelevel.docsummarizer.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.docsummarizer.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.docsummarizer.model.SummaryMode;
import com.eyelevel.docsummarizer.support.ScriptedExchangeFunction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HuggingFaceSummarizationBackendTest {

    private ScriptedExchangeFunction exchange;
    private HuggingFaceSummarizationBackend backend;

    @BeforeEach
    void setUp() {
        exchange = new ScriptedExchangeFunction();
        backend = new HuggingFaceSummarizationBackend(exchange.webClient("https://hf.test"),
                                                      new BearerTokenAuthentication("hf_test"),
                                                      new JacksonJsonParser(new ObjectMapper()),
                                                      new SummarizerProperties());
    }

    @Test
    @DisplayName("Calls the configured model and returns its summary")
    void summarize() {
        // given
        exchange.reply(HttpStatus.OK, "[{\"summary_text\":\" Revenue grew. Costs fell. \"}]");

        // when
        final String summary = backend.summarize("Quarterly report text.", SummaryMode.BRIEF);

        // then
        assertThat(summary).isEqualTo("Revenue grew. Costs fell.");
        final ClientRequest request = exchange.requests().get(0);
        assertThat(request.url().getPath()).isEqualTo("/models/facebook/bart-large-cnn");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer hf_test");
    }

    @Test
    @DisplayName("Bullet mode turns each sentence into a bullet")
    void bulletMode() {
        exchange.reply(HttpStatus.OK, "[{\"summary_text\":\"Revenue grew. Costs fell.\"}]");

        final String summary = backend.summarize("Quarterly report text.", SummaryMode.BULLET_POINTS);

        assertThat(summary).isEqualTo("• Revenue grew.\n• Costs fell.");
    }

    @Test
    @DisplayName("An empty model answer is a summarization failure")
    void emptyAnswer() {
        exchange.reply(HttpStatus.OK, "[]");

        assertThatThrownBy(() -> backend.summarize("text", SummaryMode.BRIEF))
                .isInstanceOf(SummarizationException.class)
                .hasMessage("Hugging Face returned no summary");
    }

    @Test
    @DisplayName("A model that is still loading reports the service as unavailable")
    void modelLoading() {
        exchange.reply(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"Model is currently loading\"}");

        assertThatThrownBy(() -> backend.summarize("text", SummaryMode.BRIEF))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("currently loading");
    }

    @Test
    @DisplayName("Exhausted calls are reported as summarization failures")
    void recover() {
        assertThatThrownBy(() -> backend.recover(new GatewayTimeoutException("Request timed out after 120s"), "text",
                                                 SummaryMode.DETAILED))
                .isInstanceOf(SummarizationException.class)
                .hasMessage("Hugging Face error: Request timed out after 120s");
    }

    @Test
    @DisplayName("A single sentence becomes a single bullet")
    void singleSentenceBullet() {
        assertThat(HuggingFaceSummarizationBackend.formatAsBullets("Only one point"))
                .isEqualTo("• Only one point");
    }
}
