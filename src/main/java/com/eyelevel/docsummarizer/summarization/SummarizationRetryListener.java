package com.eyelevel.docsummarizer.summarization;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs every failed attempt of a remote summarization call before Spring Retry backs off.
 */
@Slf4j
@Component("summarizationRetryListener")
public class SummarizationRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Remote summarization call '{}' failed on attempt {}. Error: {}",
                 context.getAttribute(RetryContext.NAME), context.getRetryCount(), throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null && context.getRetryCount() > 1) {
            log.error("Remote summarization call '{}' gave up after {} attempts.",
                      context.getAttribute(RetryContext.NAME), context.getRetryCount());
        }
    }
}
