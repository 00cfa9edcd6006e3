package com.eyelevel.docsummarizer.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * An outbound call to a remote summarization service: method, path relative to the client's base URL,
 * optional path variables, headers and body.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    private final String path;

    /**
     * Values for {@code {placeholders}} in the path, e.g. the Hugging Face model id.
     */
    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Mutable so that authentication can be applied just before the call is sent.
     */
    private final Map<String, String> headers = new HashMap<>();

    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;
}
