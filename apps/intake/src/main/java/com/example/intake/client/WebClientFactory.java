package com.example.intake.client;

import com.example.intake.config.properties.OcrProperties;
import com.example.intake.config.properties.RegistryProperties;
import com.example.intake.observability.filter.CorrelationIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Slf4j
@Component
public class WebClientFactory {

    // OCR responses carry full page text
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    private final WebClient.Builder baseBuilder;
    private final OcrProperties ocrProperties;
    private final RegistryProperties registryProperties;

    public WebClientFactory(
            WebClient.Builder webClientBuilder,
            OcrProperties ocrProperties,
            RegistryProperties registryProperties) {
        this.ocrProperties = ocrProperties;
        this.registryProperties = registryProperties;
        this.baseBuilder = webClientBuilder.clone()
                .filter(correlationIdFilter())
                .filter(loggingFilter())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE));
    }

    public WebClient ocrClient() {
        return baseBuilder.clone()
                .baseUrl(ocrProperties.baseUrl())
                .build();
    }

    public WebClient patientRegistryClient() {
        return baseBuilder.clone()
                .baseUrl(registryProperties.baseUrl())
                .build();
    }

    /**
     * Forwards the inbound request's correlation id to the OCR service and the registry.
     */
    private ExchangeFilterFunction correlationIdFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> Mono.deferContextual(context ->
                Mono.just(context.<String>getOrEmpty(CorrelationIdFilter.CORRELATION_ID_KEY)
                        .map(correlationId -> ClientRequest.from(clientRequest)
                                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, correlationId)
                                .build())
                        .orElse(clientRequest))));
    }

    private ExchangeFilterFunction loggingFilter() {
        return (clientRequest, next) -> {
            log.debug("Request: {} {}", clientRequest.method(), clientRequest.url());
            return next.exchange(clientRequest)
                    .doOnNext(response -> log.debug("Response: {} {} -> {}",
                            clientRequest.method(), clientRequest.url(), response.statusCode().value()));
        };
    }
}
