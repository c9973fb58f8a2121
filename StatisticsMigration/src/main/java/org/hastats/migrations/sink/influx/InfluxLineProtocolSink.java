package org.hastats.migrations.sink.influx;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.hastats.migrations.pipeline.error.MigrationException;
import org.hastats.migrations.pipeline.error.SinkAuthenticationException;
import org.hastats.migrations.pipeline.error.SinkWriteException;
import org.hastats.migrations.pipeline.ir.SeriesTier;
import org.hastats.migrations.pipeline.ir.SinkPoint;
import org.hastats.migrations.pipeline.sink.PointSink;
import org.hastats.migrations.pipeline.sink.WriteResult;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Writes points to the InfluxDB 2.x write API, one HTTP request per batch.
 *
 * InfluxDB overwrites a point with the same measurement, tag set and timestamp, so replaying
 * a batch after a crash is harmless. Credential rejections are fatal; throttling, server errors
 * and connection failures are reported as retryable; any other rejection is not retried.
 */
@Slf4j
public class InfluxLineProtocolSink implements PointSink {

    private static final String USER_AGENT = "StatisticsMigration-1.0";
    private static final String LINE_PROTOCOL_CONTENT_TYPE = "text/plain; charset=utf-8";
    private static final int MAX_CONNECTIONS = 2;

    private final InfluxConnectionContext connectionContext;
    private final ConnectionProvider connectionProvider;
    private final HttpClient client;

    public InfluxLineProtocolSink(InfluxConnectionContext connectionContext) {
        this.connectionContext = connectionContext;
        this.connectionProvider = ConnectionProvider.create("InfluxLineProtocolSink", MAX_CONNECTIONS);
        var httpClient = HttpClient.create(connectionProvider)
            .baseUrl(connectionContext.baseUrl())
            .responseTimeout(connectionContext.timeout())
            .keepAlive(true);
        this.client = connectionContext.isSecure() ? httpClient.secure() : httpClient;
    }

    @Override
    public Mono<WriteResult> writeBatch(SeriesTier tier, List<SinkPoint> batch) {
        if (batch.isEmpty()) {
            return Mono.just(new WriteResult(tier, 0, Duration.ZERO));
        }
        String bucket = connectionContext.bucketFor(tier);
        return Mono.defer(() -> {
            long started = System.nanoTime();
            byte[] body = LineProtocolEncoder.encode(batch).getBytes(StandardCharsets.UTF_8);
            return post(writePath(bucket), body)
                .onErrorMap(e -> !(e instanceof MigrationException),
                    e -> new SinkWriteException("Write of " + batch.size() + " points to bucket " + bucket
                        + " failed: " + e.getMessage(), e))
                .flatMap(response -> toResult(response, tier, bucket, batch.size(), started));
        });
    }

    String writePath(String bucket) {
        return "/api/v2/write?org=" + urlEncode(connectionContext.org())
            + "&bucket=" + urlEncode(bucket)
            + "&precision=ms";
    }

    private Mono<HttpResponse> post(String path, byte[] body) {
        return client
            .headers(h -> h
                .add(HttpHeaderNames.AUTHORIZATION, "Token " + connectionContext.token())
                .add(HttpHeaderNames.CONTENT_TYPE, LINE_PROTOCOL_CONTENT_TYPE)
                .add(HttpHeaderNames.USER_AGENT, USER_AGENT))
            .request(HttpMethod.POST)
            .uri(path)
            .send(Mono.fromCallable(() -> Unpooled.wrappedBuffer(body)))
            .responseSingle(
                (response, bytes) -> bytes.asString()
                    .singleOptional()
                    .map(bodyOp -> new HttpResponse(
                        response.status().code(),
                        response.status().reasonPhrase(),
                        extractHeaders(response.responseHeaders()),
                        bodyOp.orElse(null)
                    ))
            );
    }

    private Mono<WriteResult> toResult(HttpResponse response, SeriesTier tier, String bucket, int points, long started) {
        if (response.isSuccess()) {
            var elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.atDebug().setMessage("Wrote {} points to {} in {} ms")
                .addArgument(points)
                .addArgument(bucket)
                .addArgument(elapsed::toMillis)
                .log();
            return Mono.just(new WriteResult(tier, points, elapsed));
        }
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            return Mono.error(new SinkAuthenticationException(
                "InfluxDB rejected the credentials for org " + connectionContext.org() + ": " + response.describe()));
        }
        return Mono.error(new SinkWriteException(
            "Write of " + points + " points to bucket " + bucket + " was rejected: " + response.describe(), status));
    }

    @Override
    public void close() {
        connectionProvider.dispose();
    }

    private static Map<String, String> extractHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(
                e -> e.getKey().toLowerCase(),
                Map.Entry::getValue,
                (v1, v2) -> v1 + "," + v2
            ));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
