package com.eyelevel.docsummarizer.summarization;

import com.eyelevel.docsummarizer.model.LlmBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Looks up the {@link SummarizationBackend} registered for an {@link LlmBackend}.
 */
@Slf4j
@Service
public class SummarizationBackendFactory {

    private final List<SummarizationBackend> backends;

    public SummarizationBackendFactory(final List<SummarizationBackend> backends) {
        this.backends = backends;
        log.info("SummarizationBackendFactory initialized with {} available backends: {}", backends.size(),
                 availableBackends());
    }

    public Optional<SummarizationBackend> getBackend(final LlmBackend backend) {
        final Optional<SummarizationBackend> match = backends.stream()
                                                             .filter(candidate -> candidate.backend() == backend)
                                                             .findFirst();
        log.debug("Searching for summarization backend '{}'. Found: {}", backend,
                  match.map(SummarizationBackend::modelName).orElse("None"));
        return match;
    }

    public List<LlmBackend> availableBackends() {
        return backends.stream().map(SummarizationBackend::backend).toList();
    }
}
