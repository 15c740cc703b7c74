package com.example.intake.exception;

import org.springframework.http.HttpStatusCode;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

/**
 * Non-2xx response from a remote collaborator (OCR service, patient registry).
 */
public class ApiException extends RuntimeException {

    private final String serviceName;
    private final HttpStatusCode statusCode;
    private final String responseBody;

    public ApiException(String serviceName, HttpStatusCode statusCode, String message, @Nullable String responseBody) {
        super(message + " (" + serviceName + " answered " + statusCode.value() + ")");
        this.serviceName = serviceName;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * For {@code WebClient.ResponseSpec#onStatus}: reads the error body and signals it as an {@code ApiException}.
     */
    public static Mono<Throwable> fromResponse(String serviceName, String message, ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new ApiException(serviceName, response.statusCode(), message, body));
    }

    public boolean isServerError() {
        return statusCode.is5xxServerError();
    }

    public String getServiceName() {
        return serviceName;
    }

    public HttpStatusCode getStatusCode() {
        return statusCode;
    }

    @Nullable
    public String getResponseBody() {
        return responseBody;
    }
}
