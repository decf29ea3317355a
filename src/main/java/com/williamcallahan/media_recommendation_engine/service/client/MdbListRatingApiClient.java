/**
 * Rating client for the MDBList API
 *
 * @author William Callahan
 *
 * Features:
 * - Looks up a discovery candidate by its TMDB id
 * - Extracts one rating on a 0-10 scale from the first usable source
 * - Returns the IMDb id as the canonical identifier
 * - Unknown items yield an empty lookup, not a failure
 * - Rate limited through the "mdblist" Resilience4j limiter
 */
package com.williamcallahan.media_recommendation_engine.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import com.williamcallahan.media_recommendation_engine.model.RatingLookup;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.util.ExternalApiLogger;
import com.williamcallahan.media_recommendation_engine.util.ReactiveRetryUtils;
import com.williamcallahan.media_recommendation_engine.util.RetryPolicy;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

@Service
@Slf4j
public class MdbListRatingApiClient implements RatingApiClient {

    static final String API_NAME = "MDBList";
    private static final String OPERATION = "rating";

    private final WebClient webClient;
    private final RetryPolicy retryPolicy;
    private final MetricsService metricsService;
    private final String baseUrl;
    private final String defaultApiKey;

    public MdbListRatingApiClient(WebClient.Builder webClientBuilder,
                                  RecommendationProperties properties,
                                  @Qualifier("ratingRetryPolicy") RetryPolicy retryPolicy,
                                  MetricsService metricsService) {
        this.webClient = webClientBuilder.build();
        this.retryPolicy = retryPolicy;
        this.metricsService = metricsService;
        this.baseUrl = properties.getUpstream().getRating().getBaseUrl();
        this.defaultApiKey = properties.getUpstream().getRating().getApiKey();
    }

    @Override
    public boolean isConfigured(String apiKey) {
        return effectiveKey(apiKey) != null;
    }

    @Override
    @RateLimiter(name = "mdblist")
    public Mono<RatingLookup> fetchRating(MediaType mediaType, String externalId, String apiKey) {
        String key = effectiveKey(apiKey);
        if (key == null) {
            ExternalApiLogger.logSkipped(log, API_NAME, "no API key configured");
            return Mono.just(RatingLookup.empty(externalId));
        }
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
            .path("/")
            .queryParam("apikey", key)
            .queryParam("tm", externalId)
            .queryParam("m", mediaType.getRatingType())
            .encode()
            .build()
            .toUri();

        Mono<JsonNode> call = webClient.get()
            .uri(uri)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .doOnSubscribe(s -> ExternalApiLogger.logApiCallAttempt(log, API_NAME, OPERATION, externalId))
            .onErrorResume(ReactiveRetryUtils::isNotFound, e -> Mono.empty());

        Timer.Sample sample = metricsService.startUpstreamTimer();
        return ReactiveRetryUtils.withPolicy(call, retryPolicy, API_NAME, OPERATION)
            .flatMap(body -> parse(body, externalId))
            .defaultIfEmpty(RatingLookup.empty(externalId))
            .doOnSuccess(lookup -> {
                metricsService.stopUpstreamTimer(sample, API_NAME, OPERATION, "success");
                ExternalApiLogger.logApiCallSuccess(log, API_NAME, OPERATION, externalId,
                    lookup != null && lookup.rating() != null ? 1 : 0);
            })
            .doOnError(e -> {
                metricsService.stopUpstreamTimer(sample, API_NAME, OPERATION, "failure");
                ExternalApiLogger.logApiCallFailure(log, API_NAME, OPERATION, externalId, e.getMessage());
            });
    }

    private Mono<RatingLookup> parse(JsonNode body, String externalId) {
        String imdbId = body.path("imdbid").asText(body.path("ids").path("imdb").asText(""));
        if (body.has("error") && imdbId.isEmpty()) {
            String error = body.path("error").asText("");
            if (error.toLowerCase().contains("api key") || error.toLowerCase().contains("limit")) {
                return Mono.error(new UpstreamUnavailableException(API_NAME, OPERATION, error));
            }
            return Mono.just(RatingLookup.empty(externalId));
        }
        if (body.has("response") && !body.path("response").asBoolean(true) && imdbId.isEmpty()) {
            return Mono.just(RatingLookup.empty(externalId));
        }
        return Mono.just(new RatingLookup(externalId, extractRating(body), imdbId.startsWith("tt") ? imdbId : null));
    }

    /**
     * Takes the first usable rating in order of preference and normalizes it to 0-10.
     * Zero values count as missing.
     */
    static Double extractRating(JsonNode body) {
        double score = body.path("score").asDouble(0.0);
        if (score > 0) {
            return clamp(score / 10.0);
        }
        for (JsonNode rating : body.path("ratings")) {
            if ("imdb".equalsIgnoreCase(rating.path("source").asText()) && rating.path("value").asDouble(0.0) > 0) {
                return clamp(rating.path("value").asDouble());
            }
        }
        double imdb = body.path("imdbrating").asDouble(0.0);
        if (imdb > 0) {
            return clamp(imdb);
        }
        double tomatoes = body.path("tomatoesrating").asDouble(0.0);
        if (tomatoes > 0) {
            return clamp(tomatoes / 10.0);
        }
        double metacritic = body.path("metacriticrating").asDouble(0.0);
        if (metacritic > 0) {
            return clamp(metacritic / 10.0);
        }
        return null;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(10.0, value));
    }

    private String effectiveKey(String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey;
        }
        return defaultApiKey != null && !defaultApiKey.isBlank() ? defaultApiKey : null;
    }
}
