package com.eyelevel.docsummarizer.summarization.openai;

import com.eyelevel.docsummarizer.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.docsummarizer.common.json.jackson.JacksonJsonParser;
import com.eyelevel.docsummarizer.config.SummarizerProperties;
import com.eyelevel.docsummarizer.exception.SummarizationException;
import com.eyelevel.docsummarizer.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.docsummarizer.exception.apiclient.TooManyRequestsException;
import com.eyelevel.docsummarizer.exception.apiclient.UnauthorizedException;
import com.eyelevel.docsummarizer.model.SummaryMode;
import com.eyelevel.docsummarizer.support.ScriptedExchangeFunction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiSummarizationBackendTest {

    private static final String COMPLETION = """
            {"id":"chatcmpl-1","model":"gpt-3.5-turbo","choices":[
              {"index":0,"message":{"role":"assistant","content":"  The contract renews yearly.  "},
               "finish_reason":"stop"}]}
            """;

    private ScriptedExchangeFunction exchange;
    private SummarizerProperties properties;

    @BeforeEach
    void setUp() {
        exchange = new ScriptedExchangeFunction();
        properties = new SummarizerProperties();
    }

    private OpenAiSummarizationBackend backend(final String apiKey) {
        return new OpenAiSummarizationBackend(exchange.webClient("https://api.openai.test/v1"),
                                              new BearerTokenAuthentication(apiKey),
                                              new JacksonJsonParser(new ObjectMapper()), properties);
    }

    @Test
    @DisplayName("Posts a chat completion with the bearer key and returns the trimmed answer")
    void summarize() {
        // given
        exchange.reply(HttpStatus.OK, COMPLETION);

        // when
        final String summary = backend("sk-test").summarize("Some contract text.", SummaryMode.BRIEF);

        // then
        assertThat(summary).isEqualTo("The contract renews yearly.");
        final ClientRequest request = exchange.requests().get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("https://api.openai.test/v1/chat/completions");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
    }

    @Test
    @DisplayName("A missing API key fails before any request is sent")
    void missingApiKey() {
        assertThatThrownBy(() -> backend("").summarize("text", SummaryMode.BRIEF))
                .isInstanceOf(SummarizationException.class)
                .hasMessage("OpenAI API key is not configured");
        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    @DisplayName("Empty text is rejected")
    void emptyText() {
        assertThatThrownBy(() -> backend("sk-test").summarize("  ", SummaryMode.BRIEF))
                .isInstanceOf(SummarizationException.class)
                .hasMessage("Cannot summarize empty text");
    }

    @Test
    @DisplayName("HTTP errors surface as status-specific exceptions")
    void httpErrors() {
        exchange.reply(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"rate limited\"}");
        assertThatThrownBy(() -> backend("sk-test").summarize("text", SummaryMode.BRIEF))
                .isInstanceOf(TooManyRequestsException.class);

        exchange.reply(HttpStatus.UNAUTHORIZED, "{\"error\":\"bad key\"}");
        assertThatThrownBy(() -> backend("sk-test").summarize("text", SummaryMode.BRIEF))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessageContaining("bad key");
    }

    @Test
    @DisplayName("Exhausted calls are reported as summarization failures")
    void recover() {
        final OpenAiSummarizationBackend backend = backend("sk-test");

        assertThatThrownBy(() -> backend.recover(new ServiceUnavailableException("overloaded"), "text",
                                                 SummaryMode.BRIEF))
                .isInstanceOf(SummarizationException.class)
                .hasMessage("OpenAI API error: overloaded");
        assertThatThrownBy(() -> backend.recover(new SummarizationException("Cannot summarize empty text"), "",
                                                 SummaryMode.BRIEF))
                .hasMessage("Cannot summarize empty text");
    }

    @Test
    @DisplayName("The prompt and token budget follow the summary mode")
    void promptPerMode() {
        assertThat(OpenAiSummarizationBackend.buildPrompt("DOC", SummaryMode.BRIEF))
                .startsWith("Summarize the following document:\n\nDOC\n\n")
                .endsWith("Provide a brief 2-3 sentence summary highlighting ONLY the key points.");
        assertThat(OpenAiSummarizationBackend.buildPrompt("DOC", SummaryMode.BULLET_POINTS)).contains("bullet points");
        assertThat(OpenAiSummarizationBackend.maxTokens(SummaryMode.BRIEF)).isEqualTo(150);
        assertThat(OpenAiSummarizationBackend.maxTokens(SummaryMode.DETAILED)).isEqualTo(500);
        assertThat(OpenAiSummarizationBackend.maxTokens(SummaryMode.BULLET_POINTS)).isEqualTo(300);
    }
}
