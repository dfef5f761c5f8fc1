package com.apitools.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.net.ConnectException;
import java.time.Duration;
import java.util.Set;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

/**
 * Creates the {@link WebClient} used to proxy tool calls upstream.
 */
@Configuration
public class HttpClientFactory {

    static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    private static final Set<HttpMethod> IDEMPOTENT_METHODS = Set.of(HttpMethod.GET, HttpMethod.HEAD,
            HttpMethod.OPTIONS, HttpMethod.PUT, HttpMethod.DELETE);

    /**
     * A WebClient that retries transport failures with exponential backoff starting at 500ms.
     * Upstream error statuses are returned to the caller unchanged and never retried.
     *
     * @param maxAttempts Total attempts per request, including the first one.
     */
    @Bean
    public WebClient webClient(@Value("${apitools.http.max-attempts:3}") int maxAttempts) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2))
                .retryOnException(HttpClientFactory::isRetryable)
                .build();

        Retry retry = RetryRegistry.of(config).retry("openapi-tools-proxy");

        return WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .filter((request, next) -> next.exchange(request)
                        .transform(RetryOperator.of(retry)))
                .build();
    }

    /**
     * Refused connections are always retried, other transport failures only for idempotent methods.
     */
    static boolean isRetryable(Throwable error) {
        if (!(error instanceof WebClientRequestException requestError)) {
            return false;
        }
        for (Throwable cause = requestError.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof ConnectException) {
                return true;
            }
        }
        return IDEMPOTENT_METHODS.contains(requestError.getMethod());
    }
}
