package org.hastats.migrations.sink.influx;

import java.net.URI;
import java.time.Duration;

import org.hastats.migrations.pipeline.ir.SeriesTier;

import lombok.Builder;

/**
 * Where and how to write: server, credentials and the bucket for each series tier.
 */
@Builder
public record InfluxConnectionContext(
    URI uri,
    String token,
    String org,
    String recentBucket,
    String historicalBucket,
    Duration timeout
) {

    public InfluxConnectionContext {
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("InfluxDB URL must be absolute, got " + uri);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("Unexpected protocol " + uri.getScheme());
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(30);
        }
    }

    /** Short-term rows go to the recent bucket, long-term rows to the historical one. */
    public String bucketFor(SeriesTier tier) {
        return switch (tier) {
            case SHORT_TERM -> recentBucket;
            case LONG_TERM -> historicalBucket;
        };
    }

    public boolean isSecure() {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    /** Base URL without a trailing slash. */
    public String baseUrl() {
        String url = uri.toString();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
