package com.civilworks.carbon.service.ingest;

import com.civilworks.carbon.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Blocking GET with bounded retries.
 *
 * <p>Transport failures (connection refused, DNS, timeout, reset) are retried after waiting
 * {@code backoffBase * attempt} seconds. When the last attempt fails a
 * {@link FetchExhaustedException} is thrown. An HTTP response of any status is returned
 * as-is; deciding what a 4xx/5xx means is the caller's job.
 */
@Component
public class RetryingFetcher {
    private static final Logger log = LoggerFactory.getLogger(RetryingFetcher.class);

    private final WebClient client;
    private final Sleeper sleeper;
    private final Duration timeout;
    private final int maxAttempts;
    private final long backoffBaseSeconds;

    public RetryingFetcher(@Qualifier("noticesClient") WebClient client, AppProperties appProperties, Sleeper sleeper) {
        this.client = client;
        this.sleeper = sleeper;
        this.timeout = Duration.ofSeconds(appProperties.getFetch().getTimeoutSeconds());
        this.maxAttempts = Math.max(1, appProperties.getFetch().getMaxAttempts());
        this.backoffBaseSeconds = Math.max(0, appProperties.getFetch().getBackoffBaseSeconds());
    }

    public FetchResponse fetch(String url, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        if (params != null) {
            for (Map.Entry<String, ?> e : params.entrySet()) {
                builder.queryParam(e.getKey(), e.getValue());
            }
        }
        return fetch(builder.encode().build().toUri());
    }

    public FetchResponse fetch(URI uri) {
        for (int attempt = 1; ; attempt++) {
            try {
                return client.get()
                        .uri(uri)
                        .exchangeToMono(resp -> resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new FetchResponse(resp.statusCode().value(), body)))
                        .timeout(timeout)
                        .block();
            } catch (RuntimeException e) {
                Throwable cause = Exceptions.unwrap(e);
                if (!isTransportFailure(cause)) {
                    throw e;
                }
                log.warn("Network error ({}/{}) fetching {}: {}", attempt, maxAttempts, uri, cause.toString());
                if (attempt >= maxAttempts) {
                    throw new FetchExhaustedException(uri, maxAttempts, cause);
                }
                sleeper.sleep(Duration.ofSeconds(backoffBaseSeconds * attempt));
            }
        }
    }

    static boolean isTransportFailure(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof WebClientRequestException || c instanceof TimeoutException || c instanceof IOException) {
                return true;
            }
            if (c.getCause() == c) break;
        }
        return false;
    }
}
