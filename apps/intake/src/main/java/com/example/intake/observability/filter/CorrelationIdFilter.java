package com.example.intake.observability.filter;

import com.example.intake.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * Gives every request a correlation id, taken from {@code X-Correlation-Id} when the caller sends
 * a safe one. The id is published as a response header, an exchange attribute (read by the error
 * handler), a Reactor context entry and an MDC entry for the request's log lines.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = resolve(exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER));
        String route = exchange.getRequest().getMethod().name() + " "
                + StringSanitizer.forLog(exchange.getRequest().getPath().value());

        exchange.getAttributes().put(CORRELATION_ID_KEY, correlationId);
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    log.debug("Request started: {}", route);
                })
                .doFinally(signalType -> {
                    log.debug("Request finished: {} ({}, status {})",
                            route, signalType, exchange.getResponse().getStatusCode());
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }

    static String resolve(@Nullable String supplied) {
        if (supplied != null && StringSanitizer.isValidSafeId(supplied.trim())) {
            return supplied.trim();
        }
        return UUID.randomUUID().toString();
    }
}
