package com.williamcallahan.media_recommendation_engine.config;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Resolved Redis connection target. A {@code REDIS_SERVER} URL wins over discrete host/port settings.
 *
 * @param host Redis host
 * @param port Redis port
 * @param password password from the URL user info or the explicit setting, null when none
 * @param ssl whether to connect over TLS ({@code rediss://} or the explicit flag)
 */
public record RedisConnectionSettings(String host, int port, String password, boolean ssl) {

    static final int DEFAULT_PORT = 6379;

    /**
     * @throws IllegalStateException when {@code url} is set but not a valid URI
     */
    public static RedisConnectionSettings resolve(String url, String host, int port, String password, boolean ssl) {
        if (url == null || url.isBlank()) {
            return new RedisConnectionSettings(host, port, blankToNull(password), ssl);
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid Redis URL: " + mask(url), e);
        }
        if (uri.getHost() == null) {
            throw new IllegalStateException("Redis URL has no host: " + mask(url));
        }
        String urlPassword = null;
        if (uri.getUserInfo() != null) {
            String[] userInfo = uri.getUserInfo().split(":", 2);
            urlPassword = userInfo.length > 1 ? userInfo[1] : null;
        }
        return new RedisConnectionSettings(
            uri.getHost(),
            uri.getPort() != -1 ? uri.getPort() : DEFAULT_PORT,
            urlPassword != null ? blankToNull(urlPassword) : blankToNull(password),
            ssl || "rediss".equalsIgnoreCase(uri.getScheme()));
    }

    public boolean hasPassword() {
        return password != null;
    }

    /**
     * Replaces the user info of a Redis URL so it can be logged
     */
    static String mask(String url) {
        int at = url.indexOf('@');
        int scheme = url.indexOf("://");
        if (at > 0 && scheme > 0 && at > scheme) {
            return url.substring(0, scheme + 3) + "******" + url.substring(at);
        }
        return url;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public String toString() {
        return "RedisConnectionSettings[host=" + host + ", port=" + port + ", ssl=" + ssl
            + ", passwordProvided=" + hasPassword() + "]";
    }
}
