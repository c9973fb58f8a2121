package org.hastats.migrations.sink.influx;

import java.util.List;
import java.util.Map;

import org.hastats.migrations.pipeline.ir.SinkPoint;

/**
 * Renders points as InfluxDB line protocol with millisecond timestamps:
 * {@code measurement,tag=value,... field=1.5 1700000000000}.
 */
public final class LineProtocolEncoder {

    private LineProtocolEncoder() {}

    public static String encode(List<SinkPoint> points) {
        var sb = new StringBuilder(points.size() * 160);
        for (SinkPoint point : points) {
            appendLine(sb, point);
            sb.append('\n');
        }
        return sb.toString();
    }

    static void appendLine(StringBuilder sb, SinkPoint point) {
        sb.append(escapeMeasurement(point.measurement()));
        for (Map.Entry<String, String> tag : point.tags().entrySet()) {
            if (tag.getValue() == null || tag.getValue().isEmpty()) {
                continue;
            }
            sb.append(',').append(escapeKey(tag.getKey())).append('=').append(escapeKey(tag.getValue()));
        }
        char separator = ' ';
        for (Map.Entry<String, Double> field : point.fields().entrySet()) {
            sb.append(separator).append(escapeKey(field.getKey())).append('=').append(formatFloat(field.getValue()));
            separator = ',';
        }
        sb.append(' ').append(toEpochMillis(point.timestamp()));
    }

    public static long toEpochMillis(double epochSeconds) {
        return Math.round(epochSeconds * 1000.0);
    }

    /** Measurements escape commas and spaces. */
    static String escapeMeasurement(String value) {
        return escape(value, false);
    }

    /** Tag keys, tag values and field keys additionally escape equals signs. */
    static String escapeKey(String value) {
        return escape(value, true);
    }

    static String formatFloat(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value) + ".0";
        }
        return Double.toString(value);
    }

    private static String escape(String value, boolean escapeEquals) {
        var sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case ',', ' ' -> sb.append('\\').append(c);
                case '=' -> {
                    if (escapeEquals) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
                case '\n', '\r', '\t' -> sb.append("\\ ");
                case '\\' -> {
                    // a backslash must not swallow the separator or escape that follows it
                    boolean last = i == value.length() - 1;
                    if (last || isEscaped(value.charAt(i + 1), escapeEquals)) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isEscaped(char c, boolean escapeEquals) {
        return switch (c) {
            case ',', ' ', '\n', '\r', '\t' -> true;
            case '=' -> escapeEquals;
            default -> false;
        };
    }
}
