package com.eyelevel.labmigrator.common.apiclient;

import com.eyelevel.labmigrator.common.apiclient.authentication.Authentication;
import com.eyelevel.labmigrator.common.apiclient.model.ApiRequest;
import com.eyelevel.labmigrator.common.apiclient.model.ApiResponse;
import com.eyelevel.labmigrator.common.apiclient.model.HeaderConfig;
import com.eyelevel.labmigrator.exception.apiclient.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.*;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstract base class for the Labfolder and eLabFTW API clients, providing common functionality for making
 * blocking API calls, handling responses, and mapping errors to the {@link ApiException} hierarchy.
 * Subclasses configure the {@link WebClient}, {@link Authentication}, and {@link HeaderConfig}.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;

    /**
     * Executes an API call based on the provided {@link ApiRequest}. This method configures the
     * request, applies authentication and headers, sends the request, handles the response, and maps
     * any exceptions.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return The API response. Never null; an empty body is returned as an empty byte array.
     *
     * @throws ApiException If there is an error during the API call.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse).timeout(DEFAULT_TIMEOUT)
                                                     .onErrorMap(this::mapException).block();
            if (apiResponse == null) {
                throw new ApiException("Empty response for " + apiRequest.getMethod() + " " + apiRequest.getPath(),
                                       HttpStatus.INTERNAL_SERVER_ERROR.value());
            }
            log.trace("Received apiResponse with status {}", apiResponse.getStatusCode());
            return apiResponse;

        } catch (ApiException e) {
            log.debug("API call {} {} failed with status {}", apiRequest.getMethod(), apiRequest.getPath(),
                      e.getStatusCode());
            throw e;
        } catch (Exception e) {
            log.error("Exception during API call {} {}", apiRequest.getMethod(), apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    /**
     * Maps exceptions to specific custom exceptions based on the type of exception and, for {@link
     * WebClientResponseException}, the HTTP status code.
     */
    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            String responseBody = webClientError.getResponseBodyAsString();
            int statusCode = webClientError.getStatusCode().value();
            log.warn("exception : {} with body {} ", statusCode, responseBody);
            return createException(responseBody, statusCode);

        } else if (error instanceof WebClientRequestException || error instanceof ConnectException ||
                   error instanceof java.net.UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());

        } else if (error instanceof java.util.concurrent.TimeoutException) {
            return new GatewayTimeoutException("Request timed out: " + error.getMessage());

        } else if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());

        } else {
            return new ApiException("Internal API client error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
    }

    /**
     * Configures the WebClient request by setting the HTTP method and URI. Query parameters and path
     * variables are added to the URI.
     */
    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());

            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));

            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    /**
     * Configures the headers for the WebClient request. Authentication headers, custom headers from
     * {@link HeaderConfig}, and headers from the {@link ApiRequest} are applied.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }

        Optional.ofNullable(apiRequest.getHeaders()).ifPresent(headers -> headers.forEach(requestBodySpec::header));

        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    /**
     * Configures the request body. JSON is the default content type; multipart bodies must be passed as a
     * {@code MultiValueMap} together with {@link MediaType#MULTIPART_FORM_DATA}.
     */
    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }

        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    /**
     * Handles the {@link ClientResponse}. A 2xx response is turned into an {@link ApiResponse}, anything else
     * into the matching {@link ApiException}.
     */
    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        Instant timestamp = Instant.now();
        HttpHeaders headers = response.headers().asHttpHeaders();
        MediaType acceptType = headers.getContentType();
        int statusCode = response.statusCode().value();

        if (response.statusCode().is2xxSuccessful()) {
            return handleSuccessResponse(response, headers, acceptType, statusCode, timestamp);
        } else {
            log.warn("Response was NOT successful, statusCode {}", statusCode);
            return handleErrorResponse(response, statusCode);
        }
    }

    private Mono<ApiResponse> handleSuccessResponse(ClientResponse response, HttpHeaders headers, MediaType acceptType,
                                                    int statusCode, Instant timestamp) {
        // 201 Created answers from eLabFTW carry no body, only a Location header
        return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0]).map(data -> ApiResponse.builder()
                .data(data)
                .acceptType(acceptType)
                .headers(headers)
                .statusCode(statusCode)
                .timestamp(timestamp)
                .build()).onErrorMap(error -> {
            log.error("Error processing successful response body", error);
            return new ApiException("Error processing response: " + error.getMessage(), statusCode);
        });
    }

    private Mono<ApiResponse> handleErrorResponse(ClientResponse response, int statusCode) {
        return response.bodyToMono(String.class).defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    /**
     * Creates an appropriate {@link ApiException} based on the provided HTTP status code and error
     * message.
     */
    private ApiException createException(String body, int statusCode) {
        ApiException exception = switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 401 -> new UnauthorizedException(body);
            case 403 -> new ForbiddenException(body);
            case 404 -> new NotFoundException(body);
            case 409 -> new ConflictException(body);
            case 429 -> new TooManyRequestsException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
        log.debug("Api request failing with {}: {}", statusCode, exception.getMessage());
        return exception;
    }
}
