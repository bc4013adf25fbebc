package com.apitool.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * A Spring configuration class responsible for creating the HTTP client beans.
 * <p>
 * Two clients are kept apart on purpose: registered tools are called exactly once per
 * invocation, while the OAuth gateway may be retried.
 */
@Configuration
public class HttpClientFactory {

    /**
     * Creates the WebClient used to call registered tools.
     * <p>
     * It applies the connect and response timeouts from {@code tool-engine.http} and has no
     * retry filter, so a failed call surfaces to the caller as-is.
     *
     * @param properties The engine settings.
     * @return A {@link WebClient} for tool traffic.
     */
    @Bean
    public WebClient toolWebClient(ToolEngineProperties properties) {
        ToolEngineProperties.Http http = properties.getHttp();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis())
                .responseTimeout(http.getResponseTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(http.getMaxInMemorySize()))
                .build();
    }

    /**
     * Creates the WebClient used to ask the OAuth gateway for a user's authorization status.
     * <p>
     * Requests answered with HTTP 429 (Too Many Requests) or 503 (Service Unavailable) are retried
     * with an exponential backoff that starts at {@code tool-engine.oauth.retry.initial-backoff}
     * and doubles on each attempt, up to {@code tool-engine.oauth.retry.max-attempts} attempts.
     *
     * @param properties The engine settings.
     * @return A {@link WebClient} for gateway traffic.
     */
    @Bean
    public WebClient gatewayWebClient(ToolEngineProperties properties) {
        ToolEngineProperties.Retry retrySettings = properties.getOauth().getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retrySettings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(retrySettings.getInitialBackoff(), 2))
                .retryOnException(e -> e instanceof WebClientResponseException.ServiceUnavailable
                        || e instanceof WebClientResponseException.TooManyRequests)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        Retry retry = registry.retry("oauth-gateway");

        return WebClient.builder()
                .filter((request, next) -> next.exchange(request)
                        .flatMap(response -> isRetryable(response.statusCode())
                                ? response.createException().flatMap(Mono::<ClientResponse>error)
                                : Mono.just(response))
                        .transform(RetryOperator.of(retry)))
                .build();
    }

    private static boolean isRetryable(HttpStatusCode status) {
        return status.value() == HttpStatus.SERVICE_UNAVAILABLE.value()
                || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }
}
