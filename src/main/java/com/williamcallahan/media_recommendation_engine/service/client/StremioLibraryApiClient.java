/**
 * Library client for the Stremio datastore API
 *
 * @author William Callahan
 *
 * Features:
 * - Fetches the user's full library collection in a single POST
 * - Keeps only movie and series items with IMDb-style ids
 * - Derives loved and watched flags from the item state
 * - Rate limited through the "stremio" Resilience4j limiter
 * - Retries transient failures with the library retry policy
 */
package com.williamcallahan.media_recommendation_engine.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException;
import com.williamcallahan.media_recommendation_engine.model.LibraryItem;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
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
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class StremioLibraryApiClient implements LibraryApiClient {

    static final String API_NAME = "Stremio";
    private static final String OPERATION = "datastoreGet";

    private final WebClient webClient;
    private final RetryPolicy retryPolicy;
    private final MetricsService metricsService;
    private final String baseUrl;

    public StremioLibraryApiClient(WebClient.Builder webClientBuilder,
                                   RecommendationProperties properties,
                                   @Qualifier("libraryRetryPolicy") RetryPolicy retryPolicy,
                                   MetricsService metricsService) {
        this.webClient = webClientBuilder.build();
        this.retryPolicy = retryPolicy;
        this.metricsService = metricsService;
        this.baseUrl = properties.getUpstream().getLibrary().getBaseUrl();
    }

    @Override
    @RateLimiter(name = "stremio")
    public Mono<List<LibraryItem>> fetchLibrary(String authKey) {
        if (authKey == null || authKey.isBlank()) {
            return Mono.error(new IllegalArgumentException("Library credential must not be blank"));
        }
        Map<String, Object> payload = Map.of(
            "authKey", authKey,
            "collection", "libraryItem",
            "all", true
        );
        Mono<JsonNode> call = webClient.post()
            .uri(baseUrl + "/" + OPERATION)
            .contentType(org.springframework.http.MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .doOnSubscribe(s -> ExternalApiLogger.logApiCallAttempt(log, API_NAME, OPERATION, "library"));

        Timer.Sample sample = metricsService.startUpstreamTimer();
        return ReactiveRetryUtils.withPolicy(call, retryPolicy, API_NAME, OPERATION)
            .flatMap(this::parseLibrary)
            .defaultIfEmpty(List.of())
            .doOnSuccess(items -> {
                metricsService.stopUpstreamTimer(sample, API_NAME, OPERATION, "success");
                ExternalApiLogger.logApiCallSuccess(log, API_NAME, OPERATION, "library", items.size());
            })
            .doOnError(e -> {
                metricsService.stopUpstreamTimer(sample, API_NAME, OPERATION, "failure");
                ExternalApiLogger.logApiCallFailure(log, API_NAME, OPERATION, "library", e.getMessage());
            });
    }

    private Mono<List<LibraryItem>> parseLibrary(JsonNode body) {
        JsonNode error = body.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.isObject() ? error.path("message").asText("unknown error") : error.asText();
            return Mono.error(new UpstreamUnavailableException(API_NAME, OPERATION, "service returned error: " + message));
        }
        JsonNode items = body.has("result") ? body.path("result") : body.path("items");
        List<LibraryItem> library = new ArrayList<>();
        if (!items.isArray()) {
            return Mono.just(library);
        }
        for (JsonNode item : items) {
            parseItem(item).ifPresent(library::add);
        }
        return Mono.just(library);
    }

    Optional<LibraryItem> parseItem(JsonNode item) {
        String id = item.path("_id").asText("");
        if (!id.startsWith("tt")) {
            return Optional.empty();
        }
        if (item.path("removed").asBoolean(false) || item.path("temp").asBoolean(false)) {
            return Optional.empty();
        }
        Optional<MediaType> mediaType = MediaType.fromCatalogType(item.path("type").asText(null));
        if (mediaType.isEmpty()) {
            return Optional.empty();
        }
        JsonNode state = item.path("state");
        boolean loved = item.path("loved").asBoolean(false) || item.path("isFavorite").asBoolean(false);
        boolean watched = state.path("flaggedWatched").asInt(0) > 0
            || state.path("timesWatched").asInt(0) > 0
            || state.path("overallTimeWatched").asLong(0) > 0
            || state.path("watched").asBoolean(false);
        Instant lastWatched = parseInstant(state.path("lastWatched").asText(null));
        if (lastWatched == null) {
            lastWatched = parseInstant(item.path("lastWatched").asText(null));
        }
        String title = item.path("name").asText(id);
        return Optional.of(new LibraryItem(id, mediaType.get(), title, lastWatched, loved, watched));
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable library timestamp '{}'", value);
            return null;
        }
    }
}
