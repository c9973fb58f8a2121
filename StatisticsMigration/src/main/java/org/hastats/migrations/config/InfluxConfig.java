package org.hastats.migrations.config;

import java.net.URI;
import java.time.Duration;

import org.hastats.migrations.sink.influx.InfluxConnectionContext;

import lombok.Builder;

@Builder(toBuilder = true)
public record InfluxConfig(
    String url,
    String token,
    String org,
    String recentBucket,
    String historicalBucket,
    int timeoutSeconds
) {

    public static final String DEFAULT_URL = "http://localhost:8086";
    public static final String DEFAULT_RECENT_BUCKET = "homeassistant-recent";
    public static final String DEFAULT_HISTORICAL_BUCKET = "homeassistant-historical";

    public static InfluxConfig defaults() {
        return new InfluxConfig(DEFAULT_URL, null, null, DEFAULT_RECENT_BUCKET, DEFAULT_HISTORICAL_BUCKET, 30);
    }

    public InfluxConnectionContext toConnectionContext() {
        return InfluxConnectionContext.builder()
            .uri(URI.create(url))
            .token(token)
            .org(org)
            .recentBucket(recentBucket)
            .historicalBucket(historicalBucket)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .build();
    }
}
