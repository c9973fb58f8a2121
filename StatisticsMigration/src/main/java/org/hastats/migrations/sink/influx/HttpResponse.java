package org.hastats.migrations.sink.influx;

import java.util.Map;

/**
 * Status line, headers and body of a completed HTTP exchange. Header names are kept lower-case.
 */
public record HttpResponse(
    int statusCode,
    String statusText,
    Map<String, String> headers,
    String body
) {

    /** InfluxDB repeats the reason for a rejected write in this header. */
    static final String INFLUX_ERROR_HEADER = "x-influxdb-error";

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase());
    }

    /**
     * Status line followed by the server's reason: the {@code X-Influxdb-Error} header when present,
     * otherwise the response body.
     */
    public String describe() {
        String text = "HTTP " + statusCode + " " + statusText;
        String reason = header(INFLUX_ERROR_HEADER);
        if (reason == null || reason.isBlank()) {
            reason = body;
        }
        return reason == null || reason.isBlank() ? text : text + ": " + reason.strip();
    }
}
