/**
 * Main application class for the media recommendation engine
 *
 * @author William Callahan
 *
 * Features:
 * - Hosts the recommendation pipeline, its cache and the background warmer
 * - Enables scheduling for cache warming
 * - Enables Spring Retry for the Redis retry template
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.media_recommendation_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableRetry
public class MediaRecommendationEngineApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(MediaRecommendationEngineApplication.class, args);
    }
}
