/**
 * Generic call-with-policy helper for reactive upstream calls
 *
 * @author William Callahan
 *
 * Features:
 * - Applies a {@link RetryPolicy} as a Reactor exponential backoff with jitter
 * - Retries only transient failures: 5xx responses, connection errors, I/O errors and timeouts
 * - Converts exhausted or non-retryable failures into {@link UpstreamUnavailableException}
 * - 404 handling stays with the caller, where "unknown item" has a meaning
 */

package com.williamcallahan.media_recommendation_engine.util;

import com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

public final class ReactiveRetryUtils {

    private static final Logger logger = LoggerFactory.getLogger(ReactiveRetryUtils.class);

    private ReactiveRetryUtils() {
    }

    /**
     * Subscribes to {@code call} under {@code policy}. The returned Mono either emits the
     * call's value or fails with {@link UpstreamUnavailableException}.
     *
     * @param call the upstream call, resubscribed on every attempt
     * @param policy retry budget
     * @param upstream upstream service name, for logs and the exception
     * @param operation operation name, for logs and the exception
     */
    public static <T> Mono<T> withPolicy(Mono<T> call, RetryPolicy policy, String upstream, String operation) {
        Mono<T> attempted = call;
        if (policy.maxRetries() > 0) {
            attempted = call.retryWhen(Retry.backoff(policy.maxRetries(), policy.initialBackoff())
                .maxBackoff(policy.maxBackoff())
                .jitter(policy.jitter())
                .filter(ReactiveRetryUtils::isRetryable)
                .doBeforeRetry(signal -> logger.debug("[{}] Retrying {} (attempt {}/{}) after: {}",
                    upstream, operation, signal.totalRetries() + 2, policy.maxAttempts(),
                    signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> new UpstreamUnavailableException(upstream, operation,
                    "gave up after " + policy.maxAttempts() + " attempts", signal.failure())));
        }
        return attempted.onErrorMap(e -> !(e instanceof UpstreamUnavailableException),
            e -> new UpstreamUnavailableException(upstream, operation, describe(e), e));
    }

    /**
     * Transient failures worth another attempt
     */
    public static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError();
        }
        if (throwable instanceof RequestNotPermitted) {
            return false;
        }
        return throwable instanceof WebClientRequestException
            || throwable instanceof IOException
            || throwable instanceof TimeoutException;
    }

    public static boolean isNotFound(Throwable throwable) {
        return throwable instanceof WebClientResponseException.NotFound;
    }

    private static String describe(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            return "HTTP " + responseException.getStatusCode().value();
        }
        if (throwable instanceof RequestNotPermitted) {
            return "rate limit exceeded";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
