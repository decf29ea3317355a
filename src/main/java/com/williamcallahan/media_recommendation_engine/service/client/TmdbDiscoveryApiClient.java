/**
 * Discovery client for The Movie Database (TMDB) v3 API
 *
 * @author William Callahan
 *
 * Features:
 * - Resolves IMDb-style ids to TMDB ids through the find endpoint
 * - Keyword lookup and vote-band filtered keyword discovery
 * - Recommendations endpoint as the generic similar-items fallback
 * - External id lookup for the primary-source canonical identifier
 * - Popular lists for the popular fallback row
 * - 404 means an unknown item and yields an empty result
 * - Rate limited through the "tmdb" Resilience4j limiter
 */
package com.williamcallahan.media_recommendation_engine.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.model.DiscoveryCandidate;
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
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class TmdbDiscoveryApiClient implements DiscoveryApiClient {

    static final String API_NAME = "TMDB";

    private final WebClient webClient;
    private final RetryPolicy retryPolicy;
    private final MetricsService metricsService;
    private final String baseUrl;
    private final String defaultApiKey;

    public TmdbDiscoveryApiClient(WebClient.Builder webClientBuilder,
                                  RecommendationProperties properties,
                                  @Qualifier("discoveryRetryPolicy") RetryPolicy retryPolicy,
                                  MetricsService metricsService) {
        this.webClient = webClientBuilder.build();
        this.retryPolicy = retryPolicy;
        this.metricsService = metricsService;
        this.baseUrl = properties.getUpstream().getDiscovery().getBaseUrl();
        this.defaultApiKey = properties.getUpstream().getDiscovery().getApiKey();
    }

    @Override
    public boolean isConfigured(String apiKey) {
        return effectiveKey(apiKey) != null;
    }

    @Override
    @RateLimiter(name = "tmdb")
    public Mono<String> resolveId(MediaType mediaType, String externalId, String apiKey) {
        if (externalId == null || externalId.isBlank()) {
            return Mono.empty();
        }
        if (!externalId.startsWith("tt")) {
            return Mono.just(externalId);
        }
        URI uri = uri(apiKey, "find", externalId)
            .queryParam("external_source", "imdb_id")
            .encode().build().toUri();
        String resultsField = mediaType == MediaType.MOVIE ? "movie_results" : "tv_results";
        return get(uri, "find", externalId, body -> {
            JsonNode first = body.path(resultsField).path(0);
            return first.hasNonNull("id") ? first.path("id").asText() : null;
        });
    }

    @Override
    @RateLimiter(name = "tmdb")
    public Mono<List<Long>> fetchKeywords(MediaType mediaType, String id, String apiKey) {
        URI uri = uri(apiKey, mediaType.getDiscoveryPath(), id, "keywords").encode().build().toUri();
        // movies list keywords under "keywords", series under "results"
        String field = mediaType == MediaType.MOVIE ? "keywords" : "results";
        return get(uri, "keywords", id, body -> {
            List<Long> keywordIds = new ArrayList<>();
            for (JsonNode keyword : body.path(field)) {
                if (keyword.hasNonNull("id")) {
                    keywordIds.add(keyword.path("id").asLong());
                }
            }
            return keywordIds;
        }).defaultIfEmpty(List.of());
    }

    @Override
    @RateLimiter(name = "tmdb")
    public Mono<List<DiscoveryCandidate>> discoverByKeywords(MediaType mediaType, List<Long> keywordIds,
                                                             DiscoveryFilter filter, String apiKey) {
        if (keywordIds == null || keywordIds.isEmpty()) {
            return Mono.just(List.of());
        }
        String withKeywords = keywordIds.stream().map(String::valueOf).collect(Collectors.joining("|"));
        URI uri = uri(apiKey, "discover", mediaType.getDiscoveryPath())
            .queryParam("with_keywords", withKeywords)
            .queryParam("vote_count.gte", filter.minVoteCount())
            .queryParam("vote_count.lte", filter.maxVoteCount())
            .queryParam("vote_average.gte", filter.minVoteAverage())
            .queryParam("sort_by", "vote_average.desc")
            .encode()
            .build().toUri();
        Set<Long> keywordSet = new LinkedHashSet<>(keywordIds);
        return get(uri, "discover", withKeywords, body -> parseResults(body, mediaType, keywordSet))
            .defaultIfEmpty(List.of());
    }

    @Override
    @RateLimiter(name = "tmdb")
    public Mono<List<DiscoveryCandidate>> fetchSimilar(MediaType mediaType, String id, String apiKey) {
        URI uri = uri(apiKey, mediaType.getDiscoveryPath(), id, "recommendations").encode().build().toUri();
        return get(uri, "recommendations", id, body -> parseResults(body, mediaType, Set.of()))
            .defaultIfEmpty(List.of());
    }

    @Override
    @RateLimiter(name = "tmdb")
    public Mono<String> fetchExternalId(MediaType mediaType, String id, String apiKey) {
        URI uri = uri(apiKey, mediaType.getDiscoveryPath(), id, "external_ids").encode().build().toUri();
        return get(uri, "external_ids", id, body -> {
            String imdbId = body.path("imdb_id").asText("");
            return imdbId.startsWith("tt") ? imdbId : null;
        });
    }

    @Override
    @RateLimiter(name = "tmdb")
    public Mono<List<DiscoveryCandidate>> fetchPopular(MediaType mediaType, String apiKey) {
        URI uri = uri(apiKey, mediaType.getDiscoveryPath(), "popular").encode().build().toUri();
        return get(uri, "popular", mediaType.getDiscoveryPath(), body -> parseResults(body, mediaType, Set.of()))
            .defaultIfEmpty(List.of());
    }

    private UriComponentsBuilder uri(String apiKey, String... pathSegments) {
        return UriComponentsBuilder.fromUriString(baseUrl)
            .pathSegment(pathSegments)
            .queryParam("api_key", effectiveKey(apiKey));
    }

    private String effectiveKey(String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey;
        }
        return defaultApiKey != null && !defaultApiKey.isBlank() ? defaultApiKey : null;
    }

    private <T> Mono<T> get(URI uri, String operation, String subject, Function<JsonNode, T> parser) {
        Mono<JsonNode> call = webClient.get()
            .uri(uri)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .doOnSubscribe(s -> ExternalApiLogger.logApiCallAttempt(log, API_NAME, operation, subject))
            .onErrorResume(ReactiveRetryUtils::isNotFound, e -> {
                log.debug("{} {} returned 404 for '{}'", API_NAME, operation, subject);
                return Mono.empty();
            });

        Timer.Sample sample = metricsService.startUpstreamTimer();
        return ReactiveRetryUtils.withPolicy(call, retryPolicy, API_NAME, operation)
            .flatMap(body -> Mono.justOrEmpty(parser.apply(body)))
            .doOnSuccess(result -> {
                metricsService.stopUpstreamTimer(sample, API_NAME, operation, "success");
                ExternalApiLogger.logApiCallSuccess(log, API_NAME, operation, subject, resultCount(result));
            })
            .doOnError(e -> {
                metricsService.stopUpstreamTimer(sample, API_NAME, operation, "failure");
                ExternalApiLogger.logApiCallFailure(log, API_NAME, operation, subject, e.getMessage());
            });
    }

    private static int resultCount(Object result) {
        if (result == null) {
            return 0;
        }
        return result instanceof List<?> list ? list.size() : 1;
    }

    static List<DiscoveryCandidate> parseResults(JsonNode body, MediaType mediaType, Set<Long> keywordSet) {
        List<DiscoveryCandidate> candidates = new ArrayList<>();
        for (JsonNode result : body.path("results")) {
            if (!result.hasNonNull("id")) {
                continue;
            }
            String title = mediaType == MediaType.MOVIE
                ? result.path("title").asText(null)
                : result.path("name").asText(null);
            if (title == null || title.isBlank()) {
                title = result.path("original_title").asText(result.path("original_name").asText(""));
            }
            String releaseDate = mediaType == MediaType.MOVIE
                ? result.path("release_date").asText(null)
                : result.path("first_air_date").asText(null);
            candidates.add(new DiscoveryCandidate(
                result.path("id").asText(),
                mediaType,
                title,
                result.path("vote_average").asDouble(0.0),
                result.path("vote_count").asInt(0),
                keywordSet,
                textOrNull(result, "poster_path"),
                textOrNull(result, "backdrop_path"),
                textOrNull(result, "overview"),
                releaseDate == null || releaseDate.isBlank() ? null : releaseDate
            ));
        }
        return candidates;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
