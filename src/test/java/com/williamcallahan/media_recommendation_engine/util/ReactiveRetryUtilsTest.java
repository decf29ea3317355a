package com.williamcallahan.media_recommendation_engine.util;

import com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReactiveRetryUtilsTest {

    private static final RetryPolicy THREE_ATTEMPTS = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 0.0);

    @Test
    void withPolicy_transientFailureThenSuccess_emitsValue() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> attempts.incrementAndGet() < 3
            ? Mono.error(status(502))
            : Mono.just("ok"));

        StepVerifier.create(ReactiveRetryUtils.withPolicy(call, THREE_ATTEMPTS, "TMDB", "discover"))
            .expectNext("ok")
            .verifyComplete();

        assertThat(attempts).hasValue(3);
    }

    @Test
    void withPolicy_exhaustedRetries_failsWithUpstreamUnavailable() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(status(503));
        });

        StepVerifier.create(ReactiveRetryUtils.withPolicy(call, THREE_ATTEMPTS, "MDBList", "rating"))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("gave up after 3 attempts"))
            .verify(Duration.ofSeconds(5));

        assertThat(attempts).hasValue(3);
    }

    @Test
    void withPolicy_clientErrorIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(status(429));
        });

        StepVerifier.create(ReactiveRetryUtils.withPolicy(call, THREE_ATTEMPTS, "TMDB", "keywords"))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("HTTP 429")
                .hasCauseInstanceOf(WebClientResponseException.class))
            .verify();

        assertThat(attempts).hasValue(1);
    }

    @Test
    void isRetryable_coversServerErrorsAndTransportFailures() {
        assertThat(ReactiveRetryUtils.isRetryable(status(500))).isTrue();
        assertThat(ReactiveRetryUtils.isRetryable(new IOException("reset"))).isTrue();
        assertThat(ReactiveRetryUtils.isRetryable(new TimeoutException())).isTrue();
        assertThat(ReactiveRetryUtils.isRetryable(status(400))).isFalse();
        assertThat(ReactiveRetryUtils.isRetryable(new IllegalStateException())).isFalse();
    }

    private static WebClientResponseException status(int code) {
        return new WebClientResponseException(code, "status " + code, HttpHeaders.EMPTY, new byte[0], null);
    }
}
