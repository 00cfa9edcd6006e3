package com.eyelevel.docsummarizer.common.apiclient;

import com.eyelevel.docsummarizer.common.apiclient.authentication.Authentication;
import com.eyelevel.docsummarizer.common.apiclient.model.ApiRequest;
import com.eyelevel.docsummarizer.common.apiclient.model.ApiResponse;
import com.eyelevel.docsummarizer.exception.apiclient.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Base class for the blocking HTTP clients of the remote summarization services. It sends an
 * {@link ApiRequest} through a pre-configured {@link WebClient}, applies the {@link Authentication},
 * and translates every failure into an {@link ApiException} subclass keyed by HTTP status so that
 * callers can decide what is worth retrying.
 */
@Slf4j
public abstract class ApiClient {

    protected final WebClient webClient;
    protected final Authentication authentication;
    private final Duration timeout;

    protected ApiClient(final WebClient webClient, final Authentication authentication, final Duration timeout) {
        this.webClient = webClient;
        this.authentication = authentication;
        this.timeout = timeout;
    }

    /**
     * Executes the request and blocks for the response.
     *
     * @param apiRequest The request to send.
     * @return The successful response.
     * @throws ApiException for any non-2xx status, connection failure or timeout.
     */
    protected ApiResponse call(@NonNull final ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            final WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            final ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                           .timeout(timeout)
                                                           .onErrorMap(this::mapException)
                                                           .block();
            log.debug("Received response with status {}", apiResponse != null ? apiResponse.getStatusCode() : null);
            return apiResponse;
        } catch (ApiException e) {
            log.warn("API call to {} failed with status {}: {}", apiRequest.getPath(), e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected exception during API call to {}", apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    private RuntimeException mapException(final Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        log.debug("Mapping exception: {}", error.getMessage());
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        } else if (error instanceof WebClientRequestException || error instanceof ConnectException
                   || error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        } else if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out after " + timeout.toSeconds() + "s");
        } else if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(final ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod())
                        .uri(uriBuilder -> uriBuilder.path(apiRequest.getPath())
                                                     .build(Optional.ofNullable(apiRequest.getPathVariables())
                                                                    .orElse(Collections.emptyMap())));
    }

    private void configureHeaders(final ApiRequest apiRequest, final WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());
        apiRequest.getHeaders().forEach(requestBodySpec::header);
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(final ApiRequest apiRequest, final WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        final MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(final ClientResponse response) {
        final int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            final MediaType contentType = response.headers().contentType().orElse(null);
            return response.bodyToMono(byte[].class)
                           .defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder()
                                                   .data(data)
                                                   .contentType(contentType)
                                                   .statusCode(statusCode)
                                                   .timestamp(Instant.now())
                                                   .build());
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    private ApiException createException(final String body, final int statusCode) {
        final String message = body == null || body.isBlank() ? "Remote service returned HTTP " + statusCode : body;
        return switch (statusCode) {
            case 400 -> new BadRequestException(message);
            case 401 -> new UnauthorizedException(message);
            case 403 -> new ForbiddenException(message);
            case 404 -> new NotFoundException(message);
            case 409 -> new ConflictException(message);
            case 429 -> new TooManyRequestsException(message);
            case 500 -> new InternalServerException(message);
            case 502 -> new BadGatewayException(message);
            case 503 -> new ServiceUnavailableException(message);
            case 504 -> new GatewayTimeoutException(message);
            default -> new ApiException(message, statusCode);
        };
    }
}
