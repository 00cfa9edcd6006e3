package com.eyelevel.docsummarizer.config;

import com.eyelevel.docsummarizer.model.LlmBackend;
import com.eyelevel.docsummarizer.model.SummaryMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. This provides centralized control over document intake, the job
 * worker pool and the summarization backends.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class SummarizerProperties {

    /**
     * Upper bound a client may request for {@code maxPages}.
     */
    private int maxPagesLimit = 10;
    private int defaultMaxPages = 3;
    private SummaryMode defaultSummaryMode = SummaryMode.BRIEF;
    private LlmBackend defaultLlmBackend = LlmBackend.LOCAL;
    private boolean entityExtractionEnabled = true;
    private boolean tableExtractionEnabled = true;
    private Storage storage = new Storage();
    private Executor executor = new Executor();
    private Summarization summarization = new Summarization();

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Storage {
        private String uploadDir = System.getProperty("java.io.tmpdir") + "/document-summarizer-uploads";
        private long maxFileSizeBytes = 10L * 1024 * 1024;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
        private String threadNamePrefix = "job-worker-";
    }

    @Data
    public static class Summarization {
        private OpenAi openai = new OpenAi();
        private HuggingFace huggingface = new HuggingFace();
        private Local local = new Local();

        @Data
        public static class OpenAi {
            private String baseUrl = "https://api.openai.com/v1";
            private String apiKey;
            private String model = "gpt-3.5-turbo";
            private double temperature = 0.3;
            private Duration timeout = Duration.ofSeconds(60);
            private RetryConfig retry = new RetryConfig();
        }

        @Data
        public static class HuggingFace {
            private String baseUrl = "https://api-inference.huggingface.co";
            private String apiKey;
            private String model = "facebook/bart-large-cnn";
            private int maxInputChars = 4000;
            private Duration timeout = Duration.ofSeconds(120);
            private RetryConfig retry = new RetryConfig();
        }

        @Data
        public static class Local {
            private int briefSentences = 3;
            private int detailedSentences = 8;
            private int bulletSentences = 5;
        }
    }
}
