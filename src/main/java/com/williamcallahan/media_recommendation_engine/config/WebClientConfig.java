/**
 * Configuration for WebClient
 * - Defines the shared WebClient builder used by every upstream client
 * - Sets up default timeouts and connection settings
 *
 * @author William Callahan
 */
package com.williamcallahan.media_recommendation_engine.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    @Value("${app.http.connect-timeout-ms:3000}")
    private int connectTimeoutMs;

    @Value("${app.http.response-timeout-ms:4000}")
    private long responseTimeoutMs;

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection, read, write and response timeouts sit below the request deadline
     *   so a hung upstream surfaces as a retryable timeout
     * - Raises the in-memory buffer for large discovery payloads
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(responseTimeoutMs, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(responseTimeoutMs, TimeUnit.MILLISECONDS))
            )
            .responseTimeout(Duration.ofMillis(responseTimeoutMs));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(4 * 1024 * 1024)) // 4MB, library payloads can be large
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
