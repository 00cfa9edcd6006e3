package com.eyelevel.docsummarizer.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Raw successful response of a remote call. The body is kept as bytes and decoded by the caller,
 * which knows the expected payload type.
 */
@Builder
@Getter
public class ApiResponse {

    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    private final int statusCode;

    private final Instant timestamp;
}
