package com.eyelevel.docsummarizer.common.apiclient.authentication.impl;

import com.eyelevel.docsummarizer.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Sends a static API key as an {@code Authorization: Bearer} header, the scheme used by both the
 * OpenAI and the Hugging Face inference APIs.
 */
@Slf4j
public record BearerTokenAuthentication(String token) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (!isConfigured()) {
            log.warn("No API token configured; sending request without an Authorization header.");
            return;
        }
        log.debug("Applying bearer token authentication.");
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(token);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication[token=" + (isConfigured() ? "****" : "<none>") + "]";
    }
}
