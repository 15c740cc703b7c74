package com.example.intake.exception;

import com.example.intake.observability.filter.CorrelationIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Renders every unhandled error as an {@link ErrorResponse}. Storage and registry failures get
 * their own status codes; anything unrecognized is a 500 without internal detail.
 */
@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    private final Clock clock;

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer,
            Clock clock) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
        this.clock = clock;
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();
        ErrorMapping mapping = map(error, path);

        ErrorResponse body = new ErrorResponse(
                Instant.now(clock),
                mapping.status().value(),
                mapping.code(),
                mapping.message(),
                path,
                (String) request.attribute(CorrelationIdFilter.CORRELATION_ID_KEY).orElse(null));

        return ServerResponse.status(mapping.status())
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }

    private static ErrorMapping map(Throwable error, String path) {
        if (error instanceof QuotaExceededException quota) {
            log.error("Storage quota exceeded: path={}, key={}, used={}, limit={}",
                    path, quota.getKey(), quota.getUsedBytes(), quota.getLimitBytes());
            return new ErrorMapping(HttpStatus.INSUFFICIENT_STORAGE, "storage_quota_exceeded",
                    "Storage is full. Remove old documents and try again.");
        }
        if (error instanceof StoreCapacityException capacity) {
            log.error("Store rejected write: path={}, key={}, error={}", path, capacity.getKey(), capacity.getMessage());
            return new ErrorMapping(HttpStatus.INSUFFICIENT_STORAGE, "storage_quota_exceeded",
                    "Storage is full. Remove old documents and try again.");
        }
        if (error instanceof PatientRegistryUnavailableException registry) {
            log.error("Patient registry unavailable: path={}, failures={}", path, registry.getSourceFailures());
            return new ErrorMapping(HttpStatus.SERVICE_UNAVAILABLE, "registry_unavailable",
                    "Patient registry unavailable");
        }
        if (error instanceof ExtractionFailedException extraction) {
            log.warn("Extraction failed outside a batch: path={}, error={}", path, extraction.getMessage());
            return new ErrorMapping(HttpStatus.UNPROCESSABLE_ENTITY, "extraction_failed",
                    "No text could be extracted from the document");
        }
        if (error instanceof ApiException api) {
            log.error("Remote service error: service={}, status={}, path={}",
                    api.getServiceName(), api.getStatusCode(), path);
            return new ErrorMapping(HttpStatus.BAD_GATEWAY, "external_service_error",
                    "External service unavailable");
        }
        if (error instanceof WebExchangeBindException binding) {
            String fieldErrors = binding.getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining(", "));
            log.warn("Validation failed: path={}, errors={}", path, fieldErrors);
            return new ErrorMapping(HttpStatus.BAD_REQUEST, "validation_error", "Validation failed: " + fieldErrors);
        }
        if (error instanceof ServerWebInputException input) {
            log.warn("Unreadable request: path={}, reason={}", path, input.getReason());
            return new ErrorMapping(HttpStatus.BAD_REQUEST, "invalid_request",
                    input.getReason() != null ? input.getReason() : "Malformed request");
        }
        if (error instanceof ResponseStatusException statusError) {
            HttpStatus status = HttpStatus.resolve(statusError.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }
            log.warn("Request rejected: path={}, status={}, reason={}", path, status, statusError.getReason());
            return new ErrorMapping(status, "request_error",
                    statusError.getReason() != null ? statusError.getReason() : status.getReasonPhrase());
        }
        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", path, error.getMessage());
            return new ErrorMapping(HttpStatus.BAD_REQUEST, "invalid_argument", "Invalid request parameter");
        }

        log.error("Unhandled error: path={}, error={}", path, error.getMessage(), error);
        return new ErrorMapping(HttpStatus.INTERNAL_SERVER_ERROR, "server_error", "An unexpected error occurred");
    }

    private record ErrorMapping(HttpStatus status, String code, String message) {}
}
